package com.galois.bmc.checker;

import java.util.LinkedHashMap;
import java.util.Map;

import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;

/**
 * Hands an equation to a decision procedure.
 *
 * <p>
 * Definitions and constraints are asserted directly.  Assumptions are
 * accumulated into one literal, and each assertion is bound to a literal
 * for <code>assumptions ==&gt; (guard ==&gt; cond)</code>, so an assertion
 * only counts as violated on executions that satisfy every earlier
 * assumption.
 */
final class EquationConverter {
    private EquationConverter() {}

    /**
     * Convert <code>eq</code> into <code>dp</code> and return the literal of
     * each assertion step, in equation order.
     */
    static Map<SsaStep, Expr> convert(Equation eq, DecisionProcedure dp) {
        Map<SsaStep, Expr> handles = new LinkedHashMap<SsaStep, Expr>();
        Expr assumption = Exprs.TRUE;
        for (SsaStep s : eq) {
            switch (s.getKind()) {
            case ASSIGNMENT:
            case SHARED_WRITE:
            case CONSTRAINT:
                if (!s.getCondExpr().isTrue()) dp.setToTrue(s.getCondExpr());
                break;
            case ASSUME:
                if (s.getCondExpr().isTrue()) break;
                assumption = assumption.isTrue()
                    ? dp.handle(s.getCondExpr())
                    : dp.handle(Exprs.and(assumption, s.getCondExpr()));
                break;
            case ASSERT:
                if (s.getCondExpr().isTrue()) {
                    handles.put(s, Exprs.TRUE);
                } else if (assumption.isTrue()) {
                    handles.put(s, dp.handle(s.getCondExpr()));
                } else {
                    handles.put(s, dp.handle(Exprs.implies(assumption, s.getCondExpr())));
                }
                break;
            default:
                break;
            }
        }
        return handles;
    }
}
