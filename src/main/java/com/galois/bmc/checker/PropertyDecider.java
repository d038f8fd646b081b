package com.galois.bmc.checker;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Simplifier;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;
import com.galois.bmc.symex.SsaStepPredicate;

/**
 * Decides the undecided properties of an equation with a decision procedure.
 *
 * <p>
 * Each cycle is <code>prepare</code>, then exactly one <code>solve</code>,
 * then <code>run</code> to map the verdict back onto the properties.  A
 * property has one goal: the negation of the conjunction of the literals
 * of its assertion steps.  A satisfiable goal means the property fails.
 */
public class PropertyDecider {
    private static final class Goal {
        final List<Expr> instances = new ArrayList<Expr>();
        Expr condition = null;
    }

    private final Equation equation;
    private final DecisionProcedure dp;
    private final Map<String, Goal> goals = new LinkedHashMap<String, Goal>();
    private Map<SsaStep, Expr> handles = null;
    private boolean prepared = false;
    private long lastRuntimeNanos = 0;

    public PropertyDecider(Equation equation, DecisionProcedure dp) {
        this.equation = equation;
        this.dp = dp;
    }

    public Equation getEquation() {
        return equation;
    }

    public DecisionProcedure getDecisionProcedure() {
        return dp;
    }

    /**
     * Create goals for the properties of the equation that are
     * <code>UNKNOWN</code>.  Properties in any other status are left alone.
     * The equation is converted on the first call.
     *
     * @return time spent, in nanoseconds.
     */
    public long prepare(Properties properties) {
        long start = System.nanoTime();
        if (handles == null) {
            handles = EquationConverter.convert(equation, dp);
        }

        for (Map.Entry<SsaStep, Expr> e : handles.entrySet()) {
            String id = e.getKey().getPropertyId();
            PropertyInfo p = properties.get(id);
            if (p == null || p.getStatus() != PropertyStatus.UNKNOWN) continue;
            Goal g = goals.get(id);
            if (g == null) {
                g = new Goal();
                goals.put(id, g);
            }
            if (g.condition == null) g.instances.add(e.getValue());
        }

        for (Goal g : goals.values()) {
            if (g.condition != null) continue;
            Expr c = Simplifier.simplify(Exprs.not(Exprs.and(g.instances)));
            g.condition = c.isConstant() ? c : dp.handle(c);
        }

        prepared = true;
        return System.nanoTime() - start;
    }

    /**
     * Assert that at least one goal of a property that is still
     * <code>UNKNOWN</code> holds.  Call inside a solver scope so the
     * constraint can be retracted.
     */
    public void addConstraintFromGoals(Properties properties) {
        List<Expr> disjuncts = new ArrayList<Expr>();
        for (Map.Entry<String, Goal> e : goals.entrySet()) {
            PropertyInfo p = properties.get(e.getKey());
            if (p.getStatus() != PropertyStatus.UNKNOWN) continue;
            if (e.getValue().condition.isFalse()) continue;
            disjuncts.add(e.getValue().condition);
        }
        dp.setToTrue(Exprs.or(disjuncts));
    }

    /**
     * Call the decision procedure.
     *
     * @throws IllegalStateException unless {@link #prepare} was called
     *   since the last call.
     */
    public DecisionProcedure.Result solve() {
        if (!prepared) {
            throw new IllegalStateException("solve() requires a preceding prepare().");
        }
        prepared = false;
        long start = System.nanoTime();
        DecisionProcedure.Result r = dp.solve();
        lastRuntimeNanos = System.nanoTime() - start;
        return r;
    }

    /** Time taken by the last {@link #solve}, in nanoseconds. */
    public long getLastRuntimeNanos() {
        return lastRuntimeNanos;
    }

    /**
     * Update the properties from the verdict of the last {@link #solve}.
     * On <code>SATISFIABLE</code>, each <code>UNKNOWN</code> property whose
     * goal holds in the model fails.  On <code>UNSATISFIABLE</code> with
     * <code>setPass</code>, every <code>UNKNOWN</code> property with a goal
     * passes.  Any other verdict changes nothing.
     *
     * @return the properties whose status changed.
     */
    public Set<String> run(DecisionProcedure.Result result, Properties properties, boolean setPass) {
        Set<String> updated = new LinkedHashSet<String>();
        switch (result) {
        case SATISFIABLE:
            for (Map.Entry<String, Goal> e : goals.entrySet()) {
                PropertyInfo p = properties.get(e.getKey());
                if (p.getStatus() != PropertyStatus.UNKNOWN) continue;
                if (holds(e.getValue().condition)) {
                    p.setStatus(PropertyStatus.FAIL);
                    updated.add(p.getId());
                }
            }
            break;
        case UNSATISFIABLE:
            if (!setPass) break;
            for (String id : goals.keySet()) {
                PropertyInfo p = properties.get(id);
                if (p.getStatus() == PropertyStatus.UNKNOWN) {
                    p.setStatus(PropertyStatus.PASS);
                    updated.add(id);
                }
            }
            break;
        default:
            break;
        }
        return updated;
    }

    private boolean holds(Expr condition) {
        if (condition.isConstant()) return condition.isTrue();
        Expr v = dp.getValue(condition);
        return v != null && v.isTrue();
    }

    /**
     * Predicate matching the assertion steps of <code>propertyId</code>, for
     * building its counterexample.
     */
    public static SsaStepPredicate matchesFailingProperty(final String propertyId) {
        return new SsaStepPredicate() {
            public boolean matches(SsaStep s) {
                return s.isAssert() && propertyId.equals(s.getPropertyId());
            }
        };
    }
}
