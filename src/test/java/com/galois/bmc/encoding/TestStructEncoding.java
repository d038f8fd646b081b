package com.galois.bmc.encoding;

import java.math.BigInteger;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.SymbolTableBuilder;
import com.galois.bmc.Type;
import com.galois.bmc.UnknownTypeTagException;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.StructLiteral;

public class TestStructEncoding {
    Type fooBar;
    Type tag;
    SymbolTable ns;
    StructEncoding enc;

    @Before
    public void setUp() {
        fooBar = Type.struct(new Type.Component("foo", Type.unsignedbv(8)),
                             new Type.Component("bar", Type.signedbv(16)));
        SymbolTableBuilder b = new SymbolTableBuilder();
        tag = b.addStruct("foo_bar", fooBar);
        b.addStruct("empty", Type.struct());
        ns = b.build();
        enc = new StructEncoding(ns);
    }

    @Test
    public void testStructOfTwoFields() {
        Assert.assertEquals(Type.bv(24), enc.encode(fooBar));
        Assert.assertEquals(Type.bv(24), enc.encode(tag));
    }

    @Test
    public void testArrayOfStructs() {
        Assert.assertEquals(Type.array(Type.bv(24), 5), enc.encode(Type.array(fooBar, 5)));
        Assert.assertEquals(Type.array(Type.bv(24), 5), enc.encode(Type.array(tag, 5)));
    }

    @Test
    public void testNestedArrayOfStructs() {
        Type t = Type.array(Type.array(fooBar, 4), 2);
        Type expected = Type.array(Type.array(Type.bv(24), 4), 2);
        Assert.assertEquals(expected, enc.encode(t));
    }

    @Test
    public void testNonAggregatesAreUnchanged() {
        Type[] ts = { Type.BOOL, Type.unsignedbv(7), Type.signedbv(64),
                      Type.array(Type.unsignedbv(8), 3),
                      Type.array(Type.array(Type.BOOL, 2), 2) };
        for (Type t : ts) {
            Assert.assertEquals(t, enc.encode(t));
            Assert.assertEquals(t, enc.encode(enc.encode(t)));
            Assert.assertFalse(enc.needsEncoding(t));
        }
    }

    @Test
    public void testEncodingIsIdempotent() {
        Type t = Type.array(tag, 3);
        Assert.assertEquals(enc.encode(t), enc.encode(enc.encode(t)));
    }

    @Test
    public void testWidthIsSumOfFieldWidths() {
        Type inner = Type.struct(new Type.Component("flag", Type.BOOL),
                                 new Type.Component("pair", fooBar),
                                 new Type.Component("arr", Type.array(Type.unsignedbv(4), 3)));
        Assert.assertEquals(1 + 24 + 12, enc.width(inner));
        Assert.assertEquals(Type.bv(37), enc.encode(inner));
    }

    @Test
    public void testLayoutOffsets() {
        StructLayout l = enc.layout(tag);
        Assert.assertEquals(24, l.getWidth());
        Assert.assertEquals(2, l.getFields().size());
        Assert.assertEquals(0, l.getField("foo").getOffset());
        Assert.assertEquals(8, l.getField("foo").getWidth());
        Assert.assertEquals(8, l.getField("bar").getOffset());
        Assert.assertEquals(1, l.getField("bar").getByteOffset());
        Assert.assertNull(l.getField("baz"));
    }

    @Test
    public void testEmptyStructHasZeroWidth() {
        Assert.assertEquals(Type.bv(0), enc.encode(Type.structTag("empty")));
        Assert.assertEquals(0, enc.layout(Type.structTag("empty")).getWidth());
    }

    @Test(expected=UnknownTypeTagException.class)
    public void testUnknownTag() {
        enc.encode(Type.structTag("missing"));
    }

    @Test
    public void testEncodingsAreCached() {
        EncodingCache cache = new EncodingCache();
        StructEncoding e = new StructEncoding(ns, cache);
        e.encode(tag);
        int n = cache.size();
        Assert.assertTrue(n > 0);
        e.encode(tag);
        Assert.assertEquals(n, cache.size());
    }

    @Test
    public void testDecodeStructConstant() {
        // bar = -2 in the high 16 bits, foo = 5 in the low 8 bits
        BigInteger bits = BigInteger.valueOf(0xfffe).shiftLeft(8).or(BigInteger.valueOf(5));
        Expr v = enc.decode(tag, Exprs.constant(Type.bv(24), bits));
        Assert.assertTrue(v instanceof StructLiteral);
        Expr expected = Exprs.structLiteral(ns, tag, Arrays.<Expr>asList(
            Exprs.constant(Type.unsignedbv(8), 5),
            Exprs.constant(Type.signedbv(16), -2)));
        Assert.assertEquals(expected, v);
    }
}
