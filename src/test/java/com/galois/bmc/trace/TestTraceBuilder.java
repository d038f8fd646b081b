package com.galois.bmc.trace;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.bmc.Type;
import com.galois.bmc.cfg.InternalPosition;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;
import com.galois.bmc.symex.SsaStepKind;
import com.galois.bmc.symex.SsaStepPredicate;

public class TestTraceBuilder {
    static final Type U8 = Type.unsignedbv(8);
    static final Position POS = new InternalPosition("main");

    /** A fixed model given as a map from expressions to values. */
    static class FixedModel implements DecisionProcedure {
        final Map<Expr, Expr> values = new HashMap<Expr, Expr>();

        public void setToTrue(Expr e) {
            throw new UnsupportedOperationException();
        }

        public void setToFalse(Expr e) {
            throw new UnsupportedOperationException();
        }

        public Symbol handle(Expr e) {
            throw new UnsupportedOperationException();
        }

        public Result solve() {
            return Result.SATISFIABLE;
        }

        public Expr getValue(Expr e) {
            if (e.isConstant()) return e;
            return values.get(e);
        }

        public String getReasonUnknown() {
            return null;
        }

        public void push() {}

        public void pop() {}

        public String getDescription() {
            return "fixed";
        }

        public int getSolverCallCount() {
            return 0;
        }

        public void close() {}
    }

    Symbol x = new Symbol("x", U8).withVersion(1);
    Symbol y = new Symbol("y", U8).withVersion(1);
    Symbol g = new Symbol("g", Type.BOOL).withVersion(1);
    Expr violated = Exprs.ne(x, Exprs.constant(U8, 7));
    Equation eq;
    FixedModel model;

    static SsaStepPredicate property(final String id) {
        return new SsaStepPredicate() {
            public boolean matches(SsaStep s) {
                return s.isAssert() && id.equals(s.getPropertyId());
            }
        };
    }

    @Before
    public void setUp() {
        eq = new Equation(Arrays.asList(
            SsaStep.builder(SsaStepKind.ASSIGNMENT).ssaLhs(x).originalLhs(x.level0())
                .rhs(new Symbol("n", U8).withVersion(1)).position(POS).build(),
            SsaStep.builder(SsaStepKind.ASSIGNMENT).ssaLhs(y).originalLhs(y.level0())
                .rhs(Exprs.constant(U8, 1)).guard(g).position(POS).build(),
            SsaStep.builder(SsaStepKind.CONSTRAINT).cond(Exprs.TRUE).position(POS).build(),
            SsaStep.builder(SsaStepKind.LOCATION).hidden(true).position(POS).build(),
            SsaStep.builder(SsaStepKind.ASSERT).cond(violated).propertyId("main.p")
                .comment("x is not 7").position(POS).build(),
            SsaStep.builder(SsaStepKind.ASSIGNMENT).ssaLhs(y.withVersion(2))
                .rhs(Exprs.constant(U8, 2)).position(POS).build()));
        model = new FixedModel();
        model.values.put(x, Exprs.constant(U8, 7));
        model.values.put(g, Exprs.FALSE);
        model.values.put(violated, Exprs.FALSE);
    }

    @Test
    public void testTraceEndsAtViolatedAssertion() {
        GotoTrace t = TraceBuilder.build(eq, model, property("main.p"));
        Assert.assertEquals("main.p", t.getPropertyId());
        Assert.assertEquals(3, t.getSteps().size());

        TraceStep first = t.getSteps().get(0);
        Assert.assertEquals(SsaStepKind.ASSIGNMENT, first.getKind());
        Assert.assertEquals(x.level0(), first.getLhs());
        Assert.assertEquals(Exprs.constant(U8, 7), first.getValue());

        Assert.assertTrue(t.getSteps().get(1).isHidden());
        TraceStep failed = t.getFailedStep();
        Assert.assertEquals(SsaStepKind.ASSERT, failed.getKind());
        Assert.assertTrue(failed.getValue().isFalse());
        Assert.assertEquals("x is not 7", failed.getComment());
    }

    @Test
    public void testHiddenStepsAreNotPrinted() {
        GotoTrace t = TraceBuilder.build(eq, model, property("main.p"));
        Assert.assertFalse(t.toString().contains("LOCATION"));
        Assert.assertTrue(t.toString().contains("x is not 7"));
    }

    @Test
    public void testTraceRep() {
        Protos.Trace rep = TraceBuilder.build(eq, model, property("main.p")).getTraceRep();
        Assert.assertEquals("main.p", rep.getPropertyId());
        Assert.assertEquals(3, rep.getStepCount());
        Assert.assertEquals(Protos.TraceStepKind.AssignmentStep, rep.getStep(0).getKind());
        Assert.assertEquals(Protos.TraceStepKind.AssertionStep, rep.getStep(2).getKind());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testNoViolation() {
        model.values.put(violated, Exprs.TRUE);
        TraceBuilder.build(eq, model, property("main.p"));
    }
}
