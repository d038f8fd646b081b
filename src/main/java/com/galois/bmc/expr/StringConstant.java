package com.galois.bmc.expr;

import java.util.List;

import com.galois.bmc.Type;

/** A string literal, used to label input and output annotations. */
public final class StringConstant extends Expr {
    private final String value;

    public StringConstant(String value) {
        super(Type.STRING);
        if (value == null) throw new NullPointerException("value");
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 0, "constant");
        return this;
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitStringConstant(this);
    }

    boolean sameAttributes(Expr o) {
        return value.equals(((StringConstant) o).value);
    }

    int attributesHash() {
        return value.hashCode();
    }

    public String toString() {
        return "\"" + value + "\"";
    }
}
