package com.galois.bmc.solver;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Assume;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.ExternalResource;

import com.galois.bmc.Bmc;
import com.galois.bmc.BmcOptions;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.SymbolTableBuilder;
import com.galois.bmc.Type;
import com.galois.bmc.VerificationResult;
import com.galois.bmc.cfg.GotoFunction;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.cfg.GotoProgram;
import com.galois.bmc.cfg.Label;
import com.galois.bmc.checker.PropertyInfo;
import com.galois.bmc.checker.PropertyStatus;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Simplifier;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.symex.SsaStepKind;
import com.galois.bmc.trace.GotoTrace;
import com.galois.bmc.trace.TraceStep;

/**
 * Runs against the native Z3 library; skipped where it cannot be loaded.
 */
public class TestZ3DecisionProcedure {
    static final Type U8 = Type.unsignedbv(8);

    private final List<Z3DecisionProcedure> opened = new ArrayList<Z3DecisionProcedure>();

    @Rule
    public ExternalResource z3Resource = new ExternalResource() {
            @Override
            protected void before() throws Throwable {
                try {
                    new Z3DecisionProcedure(new SymbolTableBuilder().build()).close();
                } catch (LinkageError e) {
                    Assume.assumeNoException("native Z3 library not available", e);
                }
            }

            @Override
            protected void after() {
                for (Z3DecisionProcedure z : opened) {
                    z.close();
                }
            }
        };

    private Z3DecisionProcedure open(SymbolTable ns) {
        Z3DecisionProcedure z = new Z3DecisionProcedure(ns);
        opened.add(z);
        return z;
    }

    static GotoModel model(SymbolTable ns, GotoProgram... ps) {
        List<GotoFunction> fs = new ArrayList<GotoFunction>();
        for (GotoProgram p : ps) {
            fs.add(p.build());
        }
        return new GotoModel(ns, fs);
    }

    @Test
    public void testModelValues() {
        DecisionProcedure z = open(new SymbolTableBuilder().build());
        Symbol x = new Symbol("x", U8).withVersion(1);
        Symbol y = new Symbol("y", U8).withVersion(1);
        z.setToTrue(Exprs.eq(x, Exprs.constant(U8, 3)));
        z.setToTrue(Exprs.eq(y, Exprs.plus(x, Exprs.constant(U8, 255))));
        Assert.assertEquals(DecisionProcedure.Result.SATISFIABLE, z.solve());
        Assert.assertEquals(Exprs.constant(U8, 3), z.getValue(x));
        Assert.assertEquals(Exprs.constant(U8, 2), z.getValue(y));
        Assert.assertNull(z.getReasonUnknown());
        Assert.assertEquals(1, z.getSolverCallCount());
    }

    @Test
    public void testScopes() {
        DecisionProcedure z = open(new SymbolTableBuilder().build());
        Symbol x = new Symbol("x", U8).withVersion(1);
        z.setToTrue(Exprs.lt(x, Exprs.constant(U8, 4)));
        z.push();
        z.setToFalse(Exprs.lt(x, Exprs.constant(U8, 10)));
        Assert.assertEquals(DecisionProcedure.Result.UNSATISFIABLE, z.solve());
        z.pop();
        Assert.assertEquals(DecisionProcedure.Result.SATISFIABLE, z.solve());
    }

    @Test
    public void testHandles() {
        DecisionProcedure z = open(new SymbolTableBuilder().build());
        Symbol x = new Symbol("x", U8).withVersion(1);
        Symbol h = z.handle(Exprs.eq(x, Exprs.constant(U8, 9)));
        Assert.assertTrue(h.type().isBool());
        z.setToTrue(h);
        Assert.assertEquals(DecisionProcedure.Result.SATISFIABLE, z.solve());
        Assert.assertEquals(Exprs.constant(U8, 9), z.getValue(x));
        Assert.assertTrue(z.getValue(h).isTrue());
    }

    @Test
    public void testArrayStoresAndEquality() {
        DecisionProcedure z = open(new SymbolTableBuilder().build());
        Type arr = Type.array(U8, 4);
        Symbol a = new Symbol("a", arr).withVersion(1);
        Symbol b = new Symbol("b", arr).withVersion(1);
        Symbol c = new Symbol("c", arr).withVersion(1);
        z.setToTrue(Exprs.eq(a, Exprs.arrayOf(arr, Exprs.constant(U8, 1))));
        z.setToTrue(Exprs.eq(b, Exprs.indexUpdate(a, Exprs.constant(Exprs.indexType(a), 2),
                                                  Exprs.constant(U8, 9))));
        z.setToTrue(Exprs.eq(c, b));
        Assert.assertEquals(DecisionProcedure.Result.SATISFIABLE, z.solve());
        Assert.assertEquals(Exprs.constant(U8, 9), z.getValue(Exprs.index(c, 2)));
        Assert.assertEquals(Exprs.constant(U8, 1), z.getValue(Exprs.index(c, 3)));

        z.push();
        z.setToTrue(Exprs.ne(c, Exprs.indexUpdate(a, Exprs.constant(Exprs.indexType(a), 2),
                                                   Exprs.constant(U8, 9))));
        Assert.assertEquals(DecisionProcedure.Result.UNSATISFIABLE, z.solve());
        z.pop();
    }

    @Test
    public void testStructValuesAreDecoded() {
        SymbolTableBuilder b = new SymbolTableBuilder();
        Type tag = b.addStruct("pair", Type.struct(new Type.Component("a", U8),
                                                   new Type.Component("b", Type.BOOL)));
        SymbolTable ns = b.build();
        DecisionProcedure z = open(ns);
        Symbol s = new Symbol("s", tag).withVersion(1);
        z.setToTrue(Exprs.eq(Exprs.member(ns, s, "a"), Exprs.constant(U8, 5)));
        z.setToTrue(Exprs.member(ns, s, "b"));
        Assert.assertEquals(DecisionProcedure.Result.SATISFIABLE, z.solve());
        Expr v = z.getValue(s);
        Simplifier simplifier = new Simplifier(ns);
        Assert.assertEquals(Exprs.constant(U8, 5), simplifier.transform(Exprs.member(ns, v, "a")));
        Assert.assertTrue(simplifier.transform(Exprs.member(ns, v, "b")).isTrue());
    }

    @Test
    public void testFailingAssertionHasTrace() {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.setLine("main.c", 3);
        p.assign(x, Exprs.nondet(U8));
        p.setLine("main.c", 4);
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 7)), "main.not7", "x is not 7");

        VerificationResult r = new Bmc(model(new SymbolTableBuilder().build(), p),
                                       new BmcOptions()).run();
        PropertyInfo info = r.getProperty("main.not7");
        Assert.assertEquals(PropertyStatus.FAIL, info.getStatus());
        Assert.assertFalse(r.isSuccess());

        GotoTrace t = info.getTrace();
        Assert.assertNotNull(t);
        Assert.assertEquals("main.not7", t.getPropertyId());
        Assert.assertEquals(SsaStepKind.ASSERT, t.getFailedStep().getKind());
        boolean assigned = false;
        for (TraceStep s : t.getSteps()) {
            if (s.getKind() == SsaStepKind.ASSIGNMENT && x.equals(s.getLhs())) {
                Assert.assertEquals(Exprs.constant(U8, 7), s.getValue());
                assigned = true;
            }
        }
        Assert.assertTrue(assigned);
    }

    @Test
    public void testAssumptionsRestrictAssertions() {
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.nondet(U8));
        p.assume(Exprs.lt(x, Exprs.constant(U8, 10)));
        p.assertCond(Exprs.lt(x, Exprs.constant(U8, 20)), "main.small", "x is small");

        VerificationResult r = new Bmc(model(new SymbolTableBuilder().build(), p),
                                       new BmcOptions()).run();
        Assert.assertEquals(PropertyStatus.PASS, r.getStatus("main.small"));
        Assert.assertFalse(r.getProperty("main.small").isNotDisproved());
        Assert.assertTrue(r.isSuccess());
    }

    /** <code>for (i = 0; i &lt; 3; ++i);</code> */
    static GotoProgram threeIterations() {
        Symbol i = new Symbol("i", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(i, Exprs.constant(U8, 0));
        Label head = p.newLabel();
        Label exit = p.newLabel();
        p.place(head);
        p.gotoIf(Exprs.not(Exprs.lt(i, Exprs.constant(U8, 3))), exit);
        p.assign(i, Exprs.plus(i, Exprs.constant(U8, 1)));
        p.jump(head);
        p.place(exit);
        p.skip();
        return p;
    }

    @Test
    public void testUnwindingAssertion() {
        BmcOptions o = new BmcOptions();
        o.setUnwindingAssertions(true);
        o.setUnwindMax(3);
        VerificationResult r = new Bmc(model(new SymbolTableBuilder().build(), threeIterations()), o).run();
        Assert.assertEquals(PropertyStatus.FAIL, r.getStatus("main.unwind.0"));

        o.setUnwindMax(4);
        r = new Bmc(model(new SymbolTableBuilder().build(), threeIterations()), o).run();
        Assert.assertNull(r.getProperty("main.unwind.0"));
        Assert.assertTrue(r.isSuccess());
    }

    @Test
    public void testAbandonedCounterexampleIsNotReportedAsPass() {
        // x = 7 violates the assertion, but only on the abandoned x >= 5 side.
        Symbol x = new Symbol("x", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(x, Exprs.nondet(U8));
        Label l = p.newLabel();
        p.gotoIf(Exprs.lt(x, Exprs.constant(U8, 5)), l);
        p.skip();
        p.place(l);
        p.assertCond(Exprs.ne(x, Exprs.constant(U8, 7)), "main.not7", "x is not 7");
        BmcOptions o = new BmcOptions();
        o.setComplexityLimit(1);

        VerificationResult r = new Bmc(model(new SymbolTableBuilder().build(), p), o).run();
        PropertyInfo info = r.getProperty("main.not7");
        Assert.assertEquals(PropertyStatus.UNKNOWN, info.getStatus());
        Assert.assertFalse(info.isNotDisproved());
        Assert.assertNotNull(info.getReason());
        Assert.assertTrue(r.isInconclusive());
        Assert.assertFalse(r.isSuccess());
    }

    /** <code>i = 0; while (i &lt; 5) { i = i + 1; assert(i != bad); }</code> */
    static GotoProgram countTo5(long bad) {
        Symbol i = new Symbol("i", U8);
        GotoProgram p = new GotoProgram("main");
        p.assign(i, Exprs.constant(U8, 0));
        Label head = p.newLabel();
        Label exit = p.newLabel();
        p.place(head);
        p.gotoIf(Exprs.not(Exprs.lt(i, Exprs.constant(U8, 5))), exit);
        p.assign(i, Exprs.plus(i, Exprs.constant(U8, 1)));
        p.assertCond(Exprs.ne(i, Exprs.constant(U8, bad)), "main.bad", "i is not bad");
        p.jump(head);
        p.place(exit);
        p.skip();
        return p;
    }

    @Test
    public void testIncrementalLoopFindsLateFailure() {
        BmcOptions o = new BmcOptions();
        o.setIncrementalLoop("main.0");
        o.setUnwindMax(10);
        VerificationResult r = new Bmc(model(new SymbolTableBuilder().build(), countTo5(3)), o).run();
        Assert.assertEquals(PropertyStatus.FAIL, r.getStatus("main.bad"));
        Assert.assertFalse(r.isInconclusive());

        r = new Bmc(model(new SymbolTableBuilder().build(), countTo5(7)), o).run();
        Assert.assertEquals(PropertyStatus.PASS, r.getStatus("main.bad"));
        Assert.assertTrue(r.isSuccess());
    }

    @Test
    public void testIncrementalLoopStopsAtUnwindMax() {
        // The failure at the fourth iteration lies beyond the last bound.
        BmcOptions o = new BmcOptions();
        o.setIncrementalLoop("main.0");
        o.setUnwindMax(3);
        VerificationResult r = new Bmc(model(new SymbolTableBuilder().build(), countTo5(4)), o).run();
        Assert.assertEquals(PropertyStatus.PASS, r.getStatus("main.bad"));

        o.setUnwindingAssertions(true);
        r = new Bmc(model(new SymbolTableBuilder().build(), countTo5(4)), o).run();
        Assert.assertEquals(PropertyStatus.FAIL, r.getStatus("main.unwind.0"));
        Assert.assertFalse(r.isSuccess());
    }

    /**
     * <pre>
     * worker: g = 1;
     * main:   start_thread(worker); r = g; assert(property);
     * </pre>
     */
    static GotoModel racyModel(Expr property) {
        SymbolTableBuilder b = new SymbolTableBuilder();
        b.addGlobal("g", U8, Exprs.constant(U8, 0));
        Symbol g = new Symbol("g", U8);
        GotoProgram w = new GotoProgram("worker");
        w.assign(g, Exprs.constant(U8, 1));
        GotoProgram p = new GotoProgram("main");
        p.startThread(new Symbol("worker", Type.code(new Type[0], Type.EMPTY)));
        p.assign(new Symbol("r", U8), g);
        p.assertCond(property, "main.race", "value read from g");
        return model(b.build(), p, w);
    }

    @Test
    public void testMemoryModelAllowsBothInterleavings() {
        Symbol r = new Symbol("r", U8);
        Expr readsInitial = Exprs.eq(r, Exprs.constant(U8, 0));
        Expr readsSomeWrite = Exprs.or(readsInitial, Exprs.eq(r, Exprs.constant(U8, 1)));
        for (Protos.MemoryModel mm : Protos.MemoryModel.values()) {
            BmcOptions o = new BmcOptions();
            o.setMemoryModel(mm);

            // The worker's write may be read even though it runs later.
            VerificationResult racy = new Bmc(racyModel(readsInitial), o).run();
            Assert.assertEquals(mm.toString(), PropertyStatus.FAIL, racy.getStatus("main.race"));

            // Every read is served by the initial value or the worker's write.
            VerificationResult served = new Bmc(racyModel(readsSomeWrite), o).run();
            Assert.assertEquals(mm.toString(), PropertyStatus.PASS, served.getStatus("main.race"));
        }
    }
}
