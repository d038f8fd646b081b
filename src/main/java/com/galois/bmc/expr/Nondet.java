package com.galois.bmc.expr;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import com.galois.bmc.Type;

/**
 * A nondeterministic choice of a value of the given type.  Every evaluation
 * during symbolic execution yields a fresh unconstrained value.  Two
 * <code>Nondet</code> expressions are equal only if they were created by the
 * same call.
 */
public final class Nondet extends Expr {
    private static final AtomicInteger counter = new AtomicInteger();
    private final int id;

    public Nondet(Type type) {
        super(type);
        this.id = counter.incrementAndGet();
    }

    public boolean isConstant() {
        return false;
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 0, "nondet");
        return this;
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitNondet(this);
    }

    boolean sameAttributes(Expr o) {
        return id == ((Nondet) o).id;
    }

    int attributesHash() {
        return id;
    }

    public String toString() {
        return "nondet(" + type() + ")";
    }
}
