package com.galois.bmc.expr;

import java.util.List;

import com.galois.bmc.Type;

/** One of the two Boolean constants. */
public final class BoolConstant extends Expr {
    private final boolean value;

    public static final BoolConstant TRUE = new BoolConstant(true);
    public static final BoolConstant FALSE = new BoolConstant(false);

    private BoolConstant(boolean value) {
        super(Type.BOOL);
        this.value = value;
    }

    public static BoolConstant of(boolean b) {
        return b ? TRUE : FALSE;
    }

    public boolean getValue() {
        return value;
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 0, "constant");
        return this;
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitBoolConstant(this);
    }

    boolean sameAttributes(Expr o) {
        return value == ((BoolConstant) o).value;
    }

    int attributesHash() {
        return value ? 1231 : 1237;
    }

    public String toString() {
        return value ? "true" : "false";
    }
}
