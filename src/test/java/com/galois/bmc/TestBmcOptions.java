package com.galois.bmc;

import java.util.Properties;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.proto.Protos;

public class TestBmcOptions {
    @Test
    public void testDefaults() {
        BmcOptions o = new BmcOptions();
        Assert.assertEquals(0, o.getUnwindMax());
        Assert.assertEquals(0, o.getLoopBound("main.0"));
        Assert.assertTrue(o.isSliceFormula());
        Assert.assertFalse(o.isPartialLoops());
        Assert.assertFalse(o.isUnwindingAssertions());
        Assert.assertEquals(64, o.getMaxFieldSensitivityArraySize());
        Assert.assertEquals(Protos.MemoryModel.SequentialConsistency, o.getMemoryModel());
        Assert.assertEquals(Protos.PathStrategy.DepthFirst, o.getPathStrategy());
    }

    @Test
    public void testLoopBounds() {
        BmcOptions o = new BmcOptions();
        o.setUnwindMax(5);
        o.setLoopBound("main.1", 2);
        o.setLoopBound("main.1", 3);
        Assert.assertEquals(3, o.getLoopBound("main.1"));
        Assert.assertEquals(5, o.getLoopBound("main.0"));
        Assert.assertEquals(1, o.getRep().getUnwindsetCount());
    }

    @Test
    public void testFromProperties() {
        Properties p = new Properties();
        p.setProperty("unwind-max", "10");
        p.setProperty("unwindset", "main.0:4, f:2");
        p.setProperty("memory-model", "pso");
        p.setProperty("slice-formula", "false");
        p.setProperty("unwinding-assertions", "");
        p.setProperty("paths", "fifo");
        p.setProperty("no-array-field-sensitivity", "true");
        p.setProperty("solver-timeout", "2000");
        p.setProperty("not-an-option", "whatever");

        BmcOptions o = BmcOptions.fromProperties(p);
        Assert.assertEquals(10, o.getUnwindMax());
        Assert.assertEquals(4, o.getLoopBound("main.0"));
        Assert.assertEquals(2, o.getLoopBound("f"));
        Assert.assertEquals(Protos.MemoryModel.PartialStoreOrder, o.getMemoryModel());
        Assert.assertFalse(o.isSliceFormula());
        Assert.assertTrue(o.isUnwindingAssertions());
        Assert.assertEquals(Protos.PathStrategy.BreadthFirst, o.getPathStrategy());
        Assert.assertEquals(0, o.getMaxFieldSensitivityArraySize());
        Assert.assertEquals(2000, o.getSolverTimeoutMs());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testBadNumber() {
        new BmcOptions().set("unwind-max", "ten");
    }

    @Test(expected=IllegalArgumentException.class)
    public void testNegativeNumber() {
        new BmcOptions().set("depth", "-1");
    }

    @Test(expected=IllegalArgumentException.class)
    public void testBadUnwindset() {
        new BmcOptions().set("unwindset", "main.0");
    }

    @Test
    public void testRepRoundTrip() {
        BmcOptions o = new BmcOptions();
        o.setPartialLoops(true);
        o.setDepth(7);
        BmcOptions copy = new BmcOptions(o.getRep());
        Assert.assertTrue(copy.isPartialLoops());
        Assert.assertEquals(7, copy.getDepth());
    }

    @Test
    public void testIncrementalLoopOptions() {
        Properties p = new Properties();
        p.setProperty("incremental-loop", "main.0");
        p.setProperty("unwind-min", "2");
        p.setProperty("unwind-max", "6");
        p.setProperty("ignore-properties-before-unwind-min", "");
        BmcOptions o = BmcOptions.fromProperties(p);
        Assert.assertTrue(o.isIncrementalLoop());
        Assert.assertEquals("main.0", o.getIncrementalLoop());
        Assert.assertEquals(2, o.getUnwindMin());
        Assert.assertEquals(6, o.getUnwindMax());
        Assert.assertTrue(o.isIgnorePropertiesBeforeUnwindMin());

        BmcOptions step = o.copy();
        step.setLoopBound("main.0", 3);
        Assert.assertEquals(3, step.getLoopBound("main.0"));
        Assert.assertEquals(6, o.getLoopBound("main.0"));

        Assert.assertFalse(new BmcOptions().isIncrementalLoop());
        Assert.assertEquals(0, new BmcOptions().getUnwindMin());
    }

    @Test(expected=IllegalArgumentException.class)
    public void testIncrementalLoopNeedsId() {
        new BmcOptions().set("incremental-loop", "");
    }
}
