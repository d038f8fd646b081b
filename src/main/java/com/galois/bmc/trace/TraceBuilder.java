package com.galois.bmc.trace;

import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.expr.Expr;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;
import com.galois.bmc.symex.SsaStepPredicate;

/**
 * Builds counterexample traces from an equation and the model of a
 * satisfiable decision procedure.
 */
public final class TraceBuilder {
    private TraceBuilder() {}

    /**
     * Walk <code>eq</code> in order and keep the steps live in the model.
     * The trace ends at the first assertion matched by
     * <code>failing</code> whose condition is false in the model.
     *
     * @throws IllegalArgumentException if no matched assertion is violated.
     */
    public static GotoTrace build(Equation eq, DecisionProcedure dp, SsaStepPredicate failing) {
        List<TraceStep> steps = new ArrayList<TraceStep>();
        for (SsaStep s : eq) {
            if (!isTrue(dp, s.getGuard())) continue;

            switch (s.getKind()) {
            case CONSTRAINT:
                break;
            case ASSIGNMENT:
            case SHARED_WRITE:
            case SHARED_READ:
                steps.add(step(s, lhsOf(s), dp.getValue(s.getSsaLhs()), noValues()));
                break;
            case DECL:
                steps.add(step(s, lhsOf(s), null, noValues()));
                break;
            case ASSERT:
            case ASSUME:
            case GOTO: {
                Expr v = s.getCond() == null ? null : dp.getValue(s.getCond());
                steps.add(step(s, null, v, noValues()));
                if (s.isAssert() && failing.matches(s) && v != null && v.isFalse()) {
                    return new GotoTrace(s.getPropertyId(), steps);
                }
                break;
            }
            case INPUT:
            case OUTPUT: {
                List<Expr> vals = new ArrayList<Expr>();
                for (Expr a : s.getIoArgs()) {
                    vals.add(dp.getValue(a));
                }
                steps.add(step(s, null, null, vals));
                break;
            }
            default:
                steps.add(step(s, null, null, noValues()));
            }
        }
        throw new IllegalArgumentException("No violated assertion matches the failing property.");
    }

    private static boolean isTrue(DecisionProcedure dp, Expr e) {
        if (e.isTrue()) return true;
        if (e.isFalse()) return false;
        Expr v = dp.getValue(e);
        return v != null && v.isTrue();
    }

    private static Expr lhsOf(SsaStep s) {
        return s.getOriginalLhs() != null ? s.getOriginalLhs() : s.getSsaLhs();
    }

    private static List<Expr> noValues() {
        return new ArrayList<Expr>();
    }

    private static TraceStep step(SsaStep s, Expr lhs, Expr value, List<Expr> io) {
        String comment = s.getComment();
        if (comment == null && s.isAssert()) comment = s.getPropertyId();
        return new TraceStep(s.getKind(), s.getPosition(), s.getThread(), lhs, value,
                             comment, io, s.isHidden());
    }
}
