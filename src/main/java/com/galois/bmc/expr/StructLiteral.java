package com.galois.bmc.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/**
 * A struct value given by one operand per component, in declaration order.
 */
public final class StructLiteral extends Expr {
    private final List<Expr> values;

    StructLiteral(Type type, List<Expr> values) {
        super(type);
        if (type.isStruct()) {
            List<Type.Component> comps = type.components();
            if (comps.size() != values.size())
                throw new IllegalArgumentException(
                    "struct literal expects " + comps.size() + " values, got " + values.size());
            for (int i = 0; i != values.size(); ++i) {
                if (!comps.get(i).getType().equals(values.get(i).type()))
                    throw new IllegalArgumentException(
                        "struct literal value for " + comps.get(i).getName()
                        + " has type " + values.get(i).type());
            }
        } else if (!type.isStructTag()) {
            throw new IllegalArgumentException("struct literal expects a struct type, got " + type);
        }
        this.values = Collections.unmodifiableList(new ArrayList<Expr>(values));
    }

    public List<Expr> operands() {
        return values;
    }

    public Expr withOperands(List<Expr> ops) {
        return new StructLiteral(type(), ops);
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitStructLiteral(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        StringBuilder b = new StringBuilder("{ ");
        for (int i = 0; i != values.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(values.get(i));
        }
        return b.append(" }").toString();
    }
}
