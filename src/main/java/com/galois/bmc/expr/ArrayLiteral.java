package com.galois.bmc.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/** An array given by all of its elements. */
public final class ArrayLiteral extends Expr {
    private final List<Expr> values;

    ArrayLiteral(Type type, List<Expr> values) {
        super(type);
        if (!type.isArray())
            throw new IllegalArgumentException("array literal expects an array type, got " + type);
        long n = type.constantArraySize();
        if (n != values.size())
            throw new IllegalArgumentException(
                "array literal of type " + type + " given " + values.size() + " elements");
        Type elem = type.arrayElementType();
        for (Expr e : values) {
            if (!elem.equals(e.type()))
                throw new IllegalArgumentException("array literal element has type " + e.type()
                                                   + ", expected " + elem);
        }
        this.values = Collections.unmodifiableList(new ArrayList<Expr>(values));
    }

    public List<Expr> operands() {
        return values;
    }

    public Expr withOperands(List<Expr> ops) {
        return new ArrayLiteral(type(), ops);
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitArrayLiteral(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        StringBuilder b = new StringBuilder("[ ");
        for (int i = 0; i != values.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(values.get(i));
        }
        return b.append(" ]").toString();
    }
}
