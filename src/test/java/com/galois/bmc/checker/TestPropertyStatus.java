package com.galois.bmc.checker;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.Type;
import com.galois.bmc.cfg.InternalPosition;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;
import com.galois.bmc.symex.SsaStepKind;

public class TestPropertyStatus {
    static PropertyInfo property(String id, PropertyStatus s) {
        return new PropertyInfo(id, "property " + id, new InternalPosition("main"), s);
    }

    static SsaStep assertion(String id, boolean constantTrue) {
        Symbol x = new Symbol("x", Type.unsignedbv(8)).withVersion(1);
        return SsaStep.builder(SsaStepKind.ASSERT)
            .cond(constantTrue ? Exprs.TRUE : Exprs.gt(x, Exprs.constant(Type.unsignedbv(8), 3)))
            .propertyId(id).comment("check " + id)
            .position(new InternalPosition("main")).build();
    }

    @Test
    public void testTransitions() {
        for (PropertyStatus s : PropertyStatus.values()) {
            Assert.assertTrue(PropertyStatus.NOT_CHECKED.canBecome(s));
            Assert.assertTrue(s.canBecome(s));
        }
        Assert.assertTrue(PropertyStatus.UNKNOWN.canBecome(PropertyStatus.PASS));
        Assert.assertTrue(PropertyStatus.UNKNOWN.canBecome(PropertyStatus.FAIL));
        Assert.assertFalse(PropertyStatus.UNKNOWN.canBecome(PropertyStatus.NOT_CHECKED));
        Assert.assertFalse(PropertyStatus.PASS.canBecome(PropertyStatus.FAIL));
        Assert.assertFalse(PropertyStatus.FAIL.canBecome(PropertyStatus.PASS));
        Assert.assertFalse(PropertyStatus.FAIL.canBecome(PropertyStatus.UNKNOWN));
    }

    @Test
    public void testDecidedStatusIsFinal() {
        PropertyInfo p = property("p", PropertyStatus.UNKNOWN);
        p.setStatus(PropertyStatus.FAIL);
        try {
            p.setStatus(PropertyStatus.PASS);
            Assert.fail("FAIL must be final");
        } catch (InvalidStatusTransitionException e) {
            Assert.assertEquals("p", e.getPropertyId());
            Assert.assertEquals(PropertyStatus.FAIL, e.getFrom());
            Assert.assertEquals(PropertyStatus.PASS, e.getTo());
        }
        Assert.assertEquals(PropertyStatus.FAIL, p.getStatus());
    }

    @Test
    public void testCodes() {
        for (PropertyStatus s : PropertyStatus.values()) {
            Assert.assertEquals(s, PropertyStatus.fromCode(s.getCode()));
        }
        Assert.assertEquals(Protos.PropertyStatusCode.Pass, PropertyStatus.PASS.getCode());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testDuplicateProperty() {
        Properties ps = new Properties();
        ps.add(property("p", PropertyStatus.NOT_CHECKED));
        ps.add(property("p", PropertyStatus.NOT_CHECKED));
    }

    @Test
    public void testStatusFromEquation() {
        Properties ps = new Properties();
        ps.add(property("a", PropertyStatus.NOT_CHECKED));
        ps.add(property("b", PropertyStatus.NOT_CHECKED));
        ps.add(property("c", PropertyStatus.NOT_CHECKED));
        Equation eq = new Equation(Arrays.asList(
            assertion("a", true),
            assertion("b", true),
            assertion("b", false),
            assertion("main.unwind.0", false)));

        int passed = BmcUtil.updatePropertiesStatusFromEquation(ps, eq);
        Assert.assertEquals(1, passed);
        Assert.assertEquals(PropertyStatus.PASS, ps.get("a").getStatus());
        Assert.assertEquals(PropertyStatus.UNKNOWN, ps.get("b").getStatus());
        Assert.assertEquals(PropertyStatus.NOT_CHECKED, ps.get("c").getStatus());
        Assert.assertEquals(PropertyStatus.UNKNOWN, ps.get("main.unwind.0").getStatus());
        Assert.assertEquals("check main.unwind.0", ps.get("main.unwind.0").getDescription());
        Assert.assertEquals(4, ps.size());
    }

    @Test
    public void testNotCheckedSweep() {
        Properties ps = new Properties();
        ps.add(property("a", PropertyStatus.NOT_CHECKED));
        BmcUtil.updateStatusOfNotCheckedProperties(ps, null);
        Assert.assertEquals(PropertyStatus.PASS, ps.get("a").getStatus());

        Properties qs = new Properties();
        qs.add(property("a", PropertyStatus.NOT_CHECKED));
        BmcUtil.updateStatusOfNotCheckedProperties(qs, "depth limit 2 exceeded");
        Assert.assertEquals(PropertyStatus.NOT_CHECKED, qs.get("a").getStatus());
        Assert.assertEquals("depth limit 2 exceeded", qs.get("a").getReason());
    }

    @Test
    public void testUnknownSweep() {
        Properties ps = new Properties();
        ps.add(property("a", PropertyStatus.UNKNOWN));
        ps.add(property("b", PropertyStatus.FAIL));
        Assert.assertEquals(1, BmcUtil.updateStatusOfUnknownProperties(ps, false, null));
        Assert.assertEquals(PropertyStatus.PASS, ps.get("a").getStatus());
        Assert.assertTrue(ps.get("a").isNotDisproved());
        Assert.assertFalse(ps.get("b").isNotDisproved());

        Properties qs = new Properties();
        qs.add(property("a", PropertyStatus.UNKNOWN));
        Assert.assertEquals(0, BmcUtil.updateStatusOfUnknownProperties(qs, true, "timeout"));
        Assert.assertEquals(PropertyStatus.UNKNOWN, qs.get("a").getStatus());
        Assert.assertFalse(qs.get("a").isNotDisproved());
        Assert.assertEquals("timeout", qs.get("a").getReason());
    }

    @Test
    public void testUndecided() {
        Properties ps = new Properties();
        ps.add(property("a", PropertyStatus.UNKNOWN));
        ps.add(property("b", PropertyStatus.PASS));
        ps.add(property("c", PropertyStatus.NOT_CHECKED));
        Assert.assertEquals(2, ps.undecided().size());
        Assert.assertTrue(ps.hasUnknown());
        Assert.assertEquals(PropertyStatus.PASS, ps.statusMap().get("b"));
    }
}
