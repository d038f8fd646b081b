package com.galois.bmc.checker;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.BmcOptions;
import com.galois.bmc.SymbolTableBuilder;
import com.galois.bmc.Type;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.cfg.GotoProgram;
import com.galois.bmc.cfg.Label;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.solver.DecisionProcedure.Result;

public class TestIncrementalLoopChecker {
    static final Type U8 = Type.unsignedbv(8);

    /**
     * <pre>
     * x = nondet;
     * assert(x != 3);                 main.early
     * i = 0;
     * while (i &lt; 3) {
     *   i = i + 1;
     *   assert(x != i);               main.inloop
     * }
     * assert(x != 9);                 main.after
     * </pre>
     */
    static GotoModel threeIterations() {
        Symbol x = new Symbol("x", U8);
        Symbol i = new Symbol("i", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.nondet(U8));
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 3)), "main.early", "x is not 3");
        p.assign(i, Exprs.constant(U8, 0));
        Label head = p.newLabel();
        Label exit = p.newLabel();
        p.place(head);
        p.gotoIf(Exprs.not(Exprs.lt(i, Exprs.constant(U8, 3))), exit);
        p.assign(i, Exprs.plus(i, Exprs.constant(U8, 1)));
        p.assertCond(Exprs.ne(x, i), "main.inloop", "x is not i");
        p.jump(head);
        p.place(exit);
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 9)), "main.after", "x is not 9");
        return new GotoModel(new SymbolTableBuilder().build(), Arrays.asList(p.build()));
    }

    static BmcOptions incremental() {
        BmcOptions o = new BmcOptions();
        o.setIncrementalLoop("main.0");
        return o;
    }

    static ScriptedDecisionProcedure unsat(int n) {
        Result[] script = new Result[n];
        Arrays.fill(script, Result.UNSATISFIABLE);
        return new ScriptedDecisionProcedure(script);
    }

    static IncrementalLoopChecker checker(BmcOptions o, ScriptedDecisionProcedure dp) {
        IncrementalLoopChecker c = new IncrementalLoopChecker(threeIterations(), o, dp);
        c.setBuildTraces(false);
        return c;
    }

    @Test
    public void testLoopIsUnwoundUntilItCompletes() {
        ScriptedDecisionProcedure dp = unsat(10);
        IncrementalLoopChecker c = checker(incremental(), dp);
        Properties ps = c.run();

        // Cut at bounds 1 to 3, left normally at bound 4.
        Assert.assertEquals(4, c.getLastBound());
        Assert.assertEquals(4, dp.calls);
        Assert.assertEquals(0, dp.depth);
        Assert.assertFalse(c.isInconclusive());
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.inloop").getStatus());
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.after").getStatus());
        Assert.assertFalse(ps.get("main.after").isNotDisproved());
    }

    @Test
    public void testRefutedGoalsDoNotPassWhileTheLoopIsCut() {
        ScriptedDecisionProcedure dp = unsat(1);
        BmcOptions o = incremental();
        o.setUnwindMax(1);
        IncrementalLoopChecker c = checker(o, dp);
        Properties ps = c.run();

        // The last bound is checked like an ordinary bounded run.
        Assert.assertEquals(1, c.getLastBound());
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.inloop").getStatus());

        dp = new ScriptedDecisionProcedure(Result.UNSATISFIABLE, Result.SATISFIABLE);
        o = incremental();
        o.setUnwindMax(3);
        c = checker(o, dp);
        ps = c.run();
        Assert.assertEquals(2, c.getLastBound());
        Assert.assertEquals(2, dp.calls);
        Assert.assertEquals(PropertyStatus.FAIL, ps.get("main.inloop").getStatus());
        Assert.assertEquals(PropertyStatus.FAIL, ps.get("main.after").getStatus());
    }

    @Test
    public void testUnwindMinIsTheFirstBound() {
        ScriptedDecisionProcedure dp = unsat(10);
        BmcOptions o = incremental();
        o.setUnwindMin(3);
        IncrementalLoopChecker c = checker(o, dp);
        c.run();
        Assert.assertEquals(4, c.getLastBound());
        Assert.assertEquals(2, dp.calls);
        Assert.assertEquals(0, dp.depth);
    }

    @Test
    public void testPropertiesBeforeUnwindMinAreIgnored() {
        ScriptedDecisionProcedure dp = unsat(10);
        BmcOptions o = incremental();
        o.setUnwindMin(1);
        o.setIgnorePropertiesBeforeUnwindMin(true);
        IncrementalLoopChecker c = checker(o, dp);
        Properties ps = c.run();

        PropertyInfo early = ps.get("main.early");
        Assert.assertEquals(PropertyStatus.NOT_CHECKED, early.getStatus());
        Assert.assertTrue(early.getReason(), early.getReason().contains("main.0"));
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.inloop").getStatus());
        Assert.assertEquals(PropertyStatus.PASS, ps.get("main.after").getStatus());
        Assert.assertTrue(c.getLastChecker().getSymexResult().getIgnoredProperties()
                          .contains("main.early"));
    }

    @Test
    public void testSolverGivingUpStopsTheUnwinding() {
        ScriptedDecisionProcedure dp = new ScriptedDecisionProcedure(Result.RESOURCE_EXHAUSTED);
        IncrementalLoopChecker c = checker(incremental(), dp);
        Properties ps = c.run();
        Assert.assertEquals(1, c.getLastBound());
        Assert.assertTrue(c.isInconclusive());
        Assert.assertEquals(0, dp.depth);
        PropertyInfo p = ps.get("main.early");
        Assert.assertEquals(PropertyStatus.UNKNOWN, p.getStatus());
        Assert.assertEquals("decision procedure gave up: scripted", p.getReason());
        for (PropertyInfo q : ps) {
            Assert.assertNotEquals(q.getId(), PropertyStatus.PASS, q.getStatus());
        }
    }

    @Test(expected=IllegalArgumentException.class)
    public void testUnknownLoopIsRejected() {
        BmcOptions o = new BmcOptions();
        o.setIncrementalLoop("main.7");
        new IncrementalLoopChecker(threeIterations(), o, unsat(1));
    }

    @Test(expected=IllegalArgumentException.class)
    public void testUnwindMinAboveUnwindMaxIsRejected() {
        BmcOptions o = incremental();
        o.setUnwindMin(5);
        o.setUnwindMax(2);
        new IncrementalLoopChecker(threeIterations(), o, unsat(1));
    }
}
