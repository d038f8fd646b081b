package com.galois.bmc.expr;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/** An array whose elements all equal one value. */
public final class ArrayOf extends Expr {
    private final Expr value;

    ArrayOf(Type type, Expr value) {
        super(type);
        if (!type.isArray())
            throw new IllegalArgumentException("array_of expects an array type, got " + type);
        if (!type.arrayElementType().equals(value.type()))
            throw new IllegalArgumentException("array_of value has type " + value.type()
                                               + ", expected " + type.arrayElementType());
        this.value = value;
    }

    public Expr getValue() {
        return value;
    }

    public List<Expr> operands() {
        return Collections.singletonList(value);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 1, "array_of");
        return new ArrayOf(type(), ops.get(0));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitArrayOf(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        return "array_of(" + value + ")";
    }
}
