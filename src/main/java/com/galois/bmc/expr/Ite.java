package com.galois.bmc.expr;

import java.util.Arrays;
import java.util.List;

/** If-then-else over values of the same type. */
public final class Ite extends Expr {
    private final Expr cond;
    private final Expr thenExpr;
    private final Expr elseExpr;

    Ite(Expr cond, Expr thenExpr, Expr elseExpr) {
        super(thenExpr.type());
        if (!cond.type().isBool())
            throw new IllegalArgumentException("ite expects Boolean condition.");
        if (!thenExpr.type().equals(elseExpr.type()))
            throw new IllegalArgumentException(
                "ite expects branches of the same type, got "
                + thenExpr.type() + " and " + elseExpr.type() + ".");
        this.cond = cond;
        this.thenExpr = thenExpr;
        this.elseExpr = elseExpr;
    }

    public Expr getCond() {
        return cond;
    }

    public Expr getThen() {
        return thenExpr;
    }

    public Expr getElse() {
        return elseExpr;
    }

    public List<Expr> operands() {
        return Arrays.asList(cond, thenExpr, elseExpr);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 3, "ite");
        return new Ite(ops.get(0), ops.get(1), ops.get(2));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitIte(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        return "ite(" + cond + ", " + thenExpr + ", " + elseExpr + ")";
    }
}
