package com.galois.bmc.checker;

import java.util.Arrays;
import java.util.Collections;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.Bmc;
import com.galois.bmc.BmcMessage;
import com.galois.bmc.BmcOptions;
import com.galois.bmc.SolverErrorMessage;
import com.galois.bmc.SolverResourceExhaustedMessage;
import com.galois.bmc.SymbolTableBuilder;
import com.galois.bmc.Type;
import com.galois.bmc.VerificationResult;
import com.galois.bmc.cfg.GotoFunction;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.cfg.GotoProgram;
import com.galois.bmc.cfg.Label;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.solver.DecisionProcedure.Result;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.GotoSymex;
import com.galois.bmc.symex.SsaStep;

public class TestAllPropertiesVerifier {
    static final Type U8 = Type.unsignedbv(8);

    static GotoModel model(GotoFunction... fs) {
        return new GotoModel(new SymbolTableBuilder().build(), Arrays.asList(fs));
    }

    /** <code>x = 5; assert(x == 5);</code> */
    static GotoFunction constantMain() {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.constant(U8, 5));
        p.assertCond(Exprs.eq(x, Exprs.constant(U8, 5)), "main.const", "x is five");
        return p.build();
    }

    /** <code>x = nondet; assert(x != 7); assert(x != 9);</code> */
    static GotoFunction symbolicMain() {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.nondet(U8));
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 7)), "main.not7", "x is not 7");
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 9)), "main.not9", "x is not 9");
        return p.build();
    }

    static AllPropertiesVerifier verifier(GotoModel m, ScriptedDecisionProcedure dp) {
        AllPropertiesVerifier v = new AllPropertiesVerifier(m, new BmcOptions(), dp);
        v.getChecker().setBuildTraces(false);
        return v;
    }

    @Test
    public void testConstantTruePropertyNeedsNoSolver() {
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure();
        Properties ps = verifier(model(constantMain()), dp).run();
        PropertyInfo p = ps.get("main.const");
        Assert.assertEquals(PropertyStatus.PASS, p.getStatus());
        Assert.assertFalse(p.isNotDisproved());
        Assert.assertEquals(0, dp.calls);
    }

    @Test
    public void testUnsatisfiableGoalsPass() {
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.UNSATISFIABLE);
        Properties ps = verifier(model(symbolicMain()), dp).run();
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.not7").getStatus());
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.not9").getStatus());
        Assert.assertFalse(ps.get("main.not7").isNotDisproved());
        Assert.assertEquals(1, dp.calls);
        Assert.assertEquals(0, dp.depth);
    }

    @Test
    public void testSatisfiableGoalsFail() {
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.SATISFIABLE);
        AllPropertiesVerifier v = verifier(model(symbolicMain()), dp);
        Properties ps = v.run();
        Assert.assertEquals(PropertyStatus.FAIL, ps.get("main.not7").getStatus());
        Assert.assertEquals(PropertyStatus.FAIL, ps.get("main.not9").getStatus());
        Assert.assertNull(ps.get("main.not7").getTrace());
        Assert.assertEquals(1, dp.calls);
        Assert.assertEquals(0, dp.depth);
        Assert.assertFalse(v.getChecker().isInconclusive());
    }

    @Test
    public void testResourceExhaustionIsInconclusive() {
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.RESOURCE_EXHAUSTED);
        AllPropertiesVerifier v = verifier(model(symbolicMain()), dp);
        Properties ps = v.run();
        PropertyInfo p = ps.get("main.not7");
        Assert.assertEquals(PropertyStatus.UNKNOWN, p.getStatus());
        Assert.assertFalse(p.isNotDisproved());
        Assert.assertEquals("decision procedure gave up: scripted", p.getReason());
        Assert.assertTrue(v.getChecker().isInconclusive());
        boolean found = false;
        for (BmcMessage m : v.getChecker().getMessages()) {
            if (m instanceof SolverResourceExhaustedMessage) found = true;
        }
        Assert.assertTrue(found);
        Assert.assertEquals(0, dp.depth);
    }

    @Test
    public void testSolverErrorIsInconclusive() {
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.ERROR);
        AllPropertiesVerifier v = verifier(model(symbolicMain()), dp);
        Properties ps = v.run();
        Assert.assertEquals(PropertyStatus.UNKNOWN, ps.get("main.not9").getStatus());
        boolean found = false;
        for (BmcMessage m : v.getChecker().getMessages()) {
            if (m instanceof SolverErrorMessage) found = true;
        }
        Assert.assertTrue(found);
    }

    @Test
    public void testUnreachedPropertyPasses() {
        GotoProgram unused = new GotoProgram("unused");
        unused.assertCond(Exprs.FALSE, "unused.never", "never called");
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure();
        Properties ps = verifier(model(constantMain(), unused.build()), dp).run();
        Assert.assertEquals(PropertyStatus.PASS, ps.get("unused.never").getStatus());
        Assert.assertEquals(0, dp.calls);
    }

    @Test
    public void testAbandonedPathLeavesPropertyNotChecked() {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.constant(U8, 1));
        p.assign(x, Exprs.constant(U8, 2));
        p.assertCond(Exprs.eq(x, Exprs.constant(U8, 2)), "main.late", "x is two");
        BmcOptions o = new BmcOptions();
        o.setDepth(2);

        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure();
        Properties ps = new AllPropertiesVerifier(model(p.build()), o, dp).run();
        PropertyInfo late = ps.get("main.late");
        Assert.assertEquals(PropertyStatus.NOT_CHECKED, late.getStatus());
        Assert.assertNotNull(late.getReason());
    }

    /**
     * <code>x = nondet; if (x &lt; 5) goto L; skip; L: assert(x != 7);
     * assert(1);</code> with a complexity limit that abandons the
     * <code>x &gt;= 5</code> side.
     */
    static GotoModel branchBeyondComplexityLimit(BmcOptions o) {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.nondet(U8));
        Label l = p.newLabel();
        p.gotoIf(Exprs.lt(x, Exprs.constant(U8, 5)), l);
        p.skip();
        p.place(l);
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 7)), "main.not7", "x is not 7");
        p.assertCond(Exprs.TRUE, "main.true", "always");
        o.setComplexityLimit(1);
        return model(p.build());
    }

    @Test
    public void testAbandonedPathKeepsPropertiesUnknown() {
        BmcOptions o = new BmcOptions();
        GotoModel m = branchBeyondComplexityLimit(o);
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.UNSATISFIABLE);
        AllPropertiesVerifier v = new AllPropertiesVerifier(m, o, dp);
        Properties ps = v.run();

        Assert.assertTrue(v.getChecker().getSymexResult().hasAbandonedPaths());
        String why = v.getChecker().getSymexResult().getAbandonReason();
        for (String id : Arrays.asList("main.not7", "main.true")) {
            PropertyInfo p = ps.get(id);
            Assert.assertEquals(id, PropertyStatus.UNKNOWN, p.getStatus());
            Assert.assertFalse(p.isNotDisproved());
            Assert.assertEquals(why, p.getReason());
        }
        Assert.assertTrue(v.getChecker().isInconclusive());
        Assert.assertEquals(1, dp.calls);
        Assert.assertEquals(0, dp.depth);
    }

    @Test
    public void testAbandonedPathStillFindsFailures() {
        BmcOptions o = new BmcOptions();
        GotoModel m = branchBeyondComplexityLimit(o);
        ScriptedDecisionProcedure dp =
            new ScriptedDecisionProcedure(Result.SATISFIABLE, Result.UNSATISFIABLE);
        AllPropertiesVerifier v = new AllPropertiesVerifier(m, o, dp);
        v.getChecker().setBuildTraces(false);
        Properties ps = v.run();
        Assert.assertEquals(PropertyStatus.FAIL, ps.get("main.not7").getStatus());
        Assert.assertEquals(PropertyStatus.UNKNOWN, ps.get("main.true").getStatus());
        Assert.assertEquals(2, dp.calls);
    }

    @Test
    public void testInconclusiveRunIsNotSuccess() {
        BmcOptions o = new BmcOptions();
        GotoModel m = branchBeyondComplexityLimit(o);
        VerificationResult r = new Bmc(m, o, new ScriptedDecisionProcedure(Result.UNSATISFIABLE)).run();
        Assert.assertTrue(r.isInconclusive());
        Assert.assertFalse(r.isSuccess());
        Assert.assertEquals(PropertyStatus.UNKNOWN, r.getStatus("main.not7"));
    }

    @Test
    public void testMixedProperties() {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.nondet(U8));
        p.assertCond(Exprs.eq(x, x), "main.trivial", "x equals itself");
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 7)), "main.not7", "x is not 7");

        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.UNSATISFIABLE);
        VerificationResult r = new Bmc(model(p.build()), new BmcOptions(), dp).run();
        Assert.assertEquals(PropertyStatus.PASS, r.getStatus("main.trivial"));
        Assert.assertEquals(PropertyStatus.PASS, r.getStatus("main.not7"));
        Assert.assertTrue(r.isSuccess());
        Assert.assertFalse(r.isInconclusive());
        Assert.assertFalse(dp.closed);
        Assert.assertEquals(1, dp.calls);
    }

    @Test(expected=IllegalArgumentException.class)
    public void testUnknownPropertyId() {
        VerificationResult r = new Bmc(model(constantMain()), new BmcOptions(),
                                       new ScriptedDecisionProcedure()).run();
        r.getStatus("main.missing");
    }

    @Test(expected=IllegalStateException.class)
    public void testSolveRequiresPrepare() {
        Equation empty = new Equation(Collections.<SsaStep>emptyList());
        new PropertyDecider(empty, new ScriptedDecisionProcedure(Result.UNSATISFIABLE)).solve();
    }

    @Test
    public void testPrepareOnlyTakesUnknownProperties() {
        GotoModel m = model(symbolicMain());
        Equation eq = new GotoSymex(m, new BmcOptions()).run().getEquation();
        Properties ps = Properties.fromModel(m);
        ps.get("main.not7").setStatus(PropertyStatus.UNKNOWN);

        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.SATISFIABLE);
        PropertyDecider d = new PropertyDecider(eq, dp);
        d.prepare(ps);
        Assert.assertEquals(PropertyStatus.NOT_CHECKED, ps.get("main.not9").getStatus());

        dp.push();
        d.addConstraintFromGoals(ps);
        Assert.assertEquals(Collections.singleton("main.not7"),
                            d.run(d.solve(), ps, true));
        dp.pop();
        Assert.assertEquals(PropertyStatus.FAIL, ps.get("main.not7").getStatus());
        Assert.assertEquals(PropertyStatus.NOT_CHECKED, ps.get("main.not9").getStatus());
    }
}
