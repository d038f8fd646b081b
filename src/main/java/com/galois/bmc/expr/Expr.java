package com.galois.bmc.expr;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.Typed;

/**
 * Base class of all expressions appearing in goto programs and in the SSA
 * equation.
 *
 * <p>
 * Expressions are immutable and compared structurally.  New expressions
 * should normally be built with {@link Exprs}, which checks operand types.
 */
public abstract class Expr implements Typed {
    private final Type type;
    private int hash;
    private int size = -1;

    Expr(Type type) {
        if (type == null) throw new NullPointerException("type");
        this.type = type;
    }

    public final Type type() {
        return type;
    }

    /**
     * Return the operands of this expression in a fixed order.
     */
    public List<Expr> operands() {
        return Collections.<Expr>emptyList();
    }

    /**
     * Return a copy of this expression with new operands.  The operand count
     * must match {@link #operands()}.
     */
    public abstract Expr withOperands(List<Expr> ops);

    public abstract <R> R accept(ExprVisitor<R> v);

    public boolean isTrue() {
        return this == BoolConstant.TRUE;
    }

    public boolean isFalse() {
        return this == BoolConstant.FALSE;
    }

    /**
     * Whether this expression contains no symbols and no nondeterministic
     * choices.
     */
    public boolean isConstant() {
        for (Expr e : operands()) {
            if (!e.isConstant()) return false;
        }
        return true;
    }

    /**
     * Number of nodes in the expression tree, saturating at
     * <code>Integer.MAX_VALUE</code>.
     */
    public final int size() {
        if (size < 0) {
            long s = 1;
            for (Expr e : operands()) {
                s += e.size();
            }
            size = (int) Math.min(s, Integer.MAX_VALUE);
        }
        return size;
    }

    /**
     * Compare the attributes of this node that are not operands or the type.
     * The argument always has the same class as <code>this</code>.
     */
    abstract boolean sameAttributes(Expr other);

    abstract int attributesHash();

    public final boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || o.getClass() != getClass()) return false;
        Expr other = (Expr) o;
        return hashCode() == other.hashCode()
            && type.equals(other.type)
            && sameAttributes(other)
            && operands().equals(other.operands());
    }

    public final int hashCode() {
        if (hash == 0) {
            int h = getClass().getName().hashCode();
            h = 31 * h + type.hashCode();
            h = 31 * h + attributesHash();
            h = 31 * h + operands().hashCode();
            hash = (h == 0) ? 1 : h;
        }
        return hash;
    }

    static void checkArity(List<Expr> ops, int n, String what) {
        if (ops.size() != n) {
            throw new IllegalArgumentException(
                what + " expects " + n + " operands, got " + ops.size() + ".");
        }
    }
}
