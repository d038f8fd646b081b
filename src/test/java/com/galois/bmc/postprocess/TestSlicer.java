package com.galois.bmc.postprocess;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.bmc.SliceInvariantViolation;
import com.galois.bmc.Type;
import com.galois.bmc.cfg.InternalPosition;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;
import com.galois.bmc.symex.SsaStepKind;

public class TestSlicer {
    static final Type U8 = Type.unsignedbv(8);
    static final Position POS = new InternalPosition("main");

    Symbol x = new Symbol("x", U8).withVersion(1);
    Symbol y = new Symbol("y", U8).withVersion(1);
    Symbol z = new Symbol("z", U8).withVersion(1);
    Symbol w = new Symbol("w", U8).withVersion(1);
    Equation eq;

    static SsaStep assign(Symbol lhs, Expr rhs) {
        return SsaStep.builder(SsaStepKind.ASSIGNMENT).ssaLhs(lhs).rhs(rhs).position(POS).build();
    }

    static SsaStep check(String id, Expr cond) {
        return SsaStep.builder(SsaStepKind.ASSERT).cond(cond).propertyId(id).position(POS).build();
    }

    @Before
    public void setUp() {
        eq = new Equation(Arrays.asList(
            assign(x, new Symbol("n", U8).withVersion(1)),
            assign(y, new Symbol("n", U8).withVersion(2)),
            assign(z, Exprs.plus(x, Exprs.constant(U8, 1))),
            check("p1", Exprs.gt(z, Exprs.constant(U8, 0))),
            check("p2", Exprs.gt(y, Exprs.constant(U8, 0))),
            check("p3", Exprs.TRUE),
            assign(w, y)));
    }

    static Set<String> ids(String... ids) {
        return new HashSet<String>(Arrays.asList(ids));
    }

    @Test
    public void testKeepsDependenciesOfUndecidedProperties() {
        SliceResult r = new Slicer().slice(eq, ids("p1", "p3"));
        Equation s = r.getEquation();
        Assert.assertEquals(3, s.size());
        Assert.assertSame(eq.get(0), s.get(0));
        Assert.assertSame(eq.get(2), s.get(1));
        Assert.assertSame(eq.get(3), s.get(2));
        Assert.assertEquals(4, r.getRemoved());
        Assert.assertEquals(1, r.getDroppedAssertions());
        Assert.assertEquals(3, s.rootIndex(2));
    }

    @Test
    public void testSliceIsIdempotent() {
        Set<String> undecided = ids("p1", "p2");
        Equation once = new Slicer().slice(eq, undecided).getEquation();
        SliceResult twice = new Slicer().slice(once, undecided);
        Assert.assertEquals(once.getSteps(), twice.getEquation().getSteps());
        Assert.assertEquals(0, twice.getRemoved());
    }

    @Test
    public void testNothingUndecidedKeepsNothing() {
        SliceResult r = new Slicer().slice(eq, Collections.<String>emptySet());
        Assert.assertEquals(0, r.getEquation().size());
    }

    @Test
    public void testAssumptionsBeforeLastAssertionAreKept() {
        Equation e = new Equation(Arrays.asList(
            SsaStep.builder(SsaStepKind.ASSUME).cond(Exprs.lt(x, Exprs.constant(U8, 9)))
                .position(POS).build(),
            assign(x, new Symbol("n", U8).withVersion(1)),
            check("p1", Exprs.gt(x, Exprs.constant(U8, 0))),
            SsaStep.builder(SsaStepKind.ASSUME).cond(Exprs.lt(y, Exprs.constant(U8, 9)))
                .position(POS).build()));
        Equation s = new Slicer().slice(e, ids("p1")).getEquation();
        Assert.assertEquals(3, s.size());
        Assert.assertEquals(SsaStepKind.ASSUME, s.get(0).getKind());
        Assert.assertEquals(SsaStepKind.ASSERT, s.get(2).getKind());
    }

    @Test(expected=SliceInvariantViolation.class)
    public void testMissingDefinitionIsDetected() {
        BitSet keep = new BitSet();
        keep.set(3);
        new Slicer().check(eq, eq.slice(keep), ids("p1"));
    }

    @Test(expected=SliceInvariantViolation.class)
    public void testMissingAssertionIsDetected() {
        BitSet keep = new BitSet();
        keep.set(0);
        keep.set(2);
        new Slicer().check(eq, eq.slice(keep), ids("p1"));
    }
}
