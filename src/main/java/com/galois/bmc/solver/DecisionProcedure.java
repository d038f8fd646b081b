package com.galois.bmc.solver;

import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Symbol;

/**
 * An incremental decision procedure for quantifier-free formulas over
 * Booleans, bitvectors, arrays and structs.
 *
 * <p>
 * Formulas are added with {@link #setToTrue} and {@link #setToFalse}.
 * {@link #handle} binds a formula to a fresh Boolean literal whose value can
 * be read back from the model after a satisfiable {@link #solve}.
 * {@link #push} and {@link #pop} delimit scopes of formulas that can be
 * retracted.
 */
public interface DecisionProcedure extends AutoCloseable {
    enum Result {
        SATISFIABLE,
        UNSATISFIABLE,
        /** The procedure ran out of time or memory. */
        RESOURCE_EXHAUSTED,
        ERROR
    }

    void setToTrue(Expr e);

    void setToFalse(Expr e);

    /**
     * Return a Boolean symbol constrained to be equivalent to <code>e</code>.
     */
    Symbol handle(Expr e);

    Result solve();

    /**
     * Value of <code>e</code> in the model of the last satisfiable
     * {@link #solve}, as a constant of the type of <code>e</code>, or
     * <code>null</code> if the value cannot be represented.
     */
    Expr getValue(Expr e);

    /**
     * Explanation of the last <code>RESOURCE_EXHAUSTED</code> or
     * <code>ERROR</code> result, or <code>null</code>.
     */
    String getReasonUnknown();

    void push();

    void pop();

    String getDescription();

    /** Number of times {@link #solve} was called. */
    int getSolverCallCount();

    void close();
}
