package com.galois.bmc.expr;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.SymbolTableBuilder;
import com.galois.bmc.Type;

public class TestSimplifier {
    static final Type U8 = Type.unsignedbv(8);
    static final Type S8 = Type.signedbv(8);

    Symbol p = new Symbol("p", Type.BOOL);
    Symbol q = new Symbol("q", Type.BOOL);
    Symbol x = new Symbol("x", U8);

    @Test
    public void testBooleanIdentities() {
        Assert.assertEquals(q, Simplifier.simplify(Exprs.and(Exprs.TRUE, q)));
        Assert.assertEquals(Exprs.FALSE, Simplifier.simplify(Exprs.and(p, Exprs.not(p))));
        Assert.assertEquals(Exprs.TRUE, Simplifier.simplify(Exprs.or(Exprs.not(p), p)));
        Assert.assertEquals(Exprs.TRUE, Simplifier.simplify(Exprs.implies(Exprs.FALSE, q)));
        Assert.assertEquals(Exprs.not(p), Simplifier.simplify(Exprs.implies(p, Exprs.FALSE)));
        Assert.assertEquals(p, Simplifier.simplify(Exprs.not(Exprs.not(p))));
    }

    @Test
    public void testConstantFolding() {
        Expr e = Exprs.plus(Exprs.constant(U8, 250), Exprs.constant(U8, 10));
        Assert.assertEquals(Exprs.constant(U8, 4), Simplifier.simplify(e));

        Expr lt = Exprs.lt(Exprs.constant(S8, -1), Exprs.constant(S8, 1));
        Assert.assertEquals(Exprs.TRUE, Simplifier.simplify(lt));

        Expr ult = Exprs.lt(Exprs.constant(U8, 255), Exprs.constant(U8, 1));
        Assert.assertEquals(Exprs.FALSE, Simplifier.simplify(ult));
    }

    @Test
    public void testDivisionByZeroIsKept() {
        Expr e = Exprs.div(Exprs.constant(U8, 3), Exprs.constant(U8, 0));
        Expr r = Simplifier.simplify(e);
        Assert.assertTrue(r instanceof BinaryExpr);
        Assert.assertFalse(r instanceof BvConstant);
    }

    @Test
    public void testArithmeticIdentities() {
        Assert.assertEquals(x, Simplifier.simplify(Exprs.plus(x, Exprs.constant(U8, 0))));
        Assert.assertEquals(x, Simplifier.simplify(Exprs.mult(Exprs.constant(U8, 1), x)));
        Assert.assertEquals(Exprs.constant(U8, 0),
                            Simplifier.simplify(Exprs.bitAnd(x, Exprs.constant(U8, 0))));
        Assert.assertEquals(Exprs.TRUE, Simplifier.simplify(Exprs.le(x, x)));
    }

    @Test
    public void testIte() {
        Expr a = Exprs.constant(U8, 1);
        Expr b = Exprs.constant(U8, 2);
        Assert.assertEquals(a, Simplifier.simplify(Exprs.ite(Exprs.TRUE, a, b)));
        Assert.assertEquals(a, Simplifier.simplify(Exprs.ite(p, a, a)));
        Assert.assertEquals(p, Simplifier.simplify(Exprs.ite(p, Exprs.TRUE, Exprs.FALSE)));
    }

    @Test
    public void testEqualityOfConstants() {
        Assert.assertEquals(Exprs.TRUE, Simplifier.simplify(Exprs.eq(Exprs.constant(U8, 7),
                                                                     Exprs.constant(U8, 7))));
        Assert.assertEquals(Exprs.FALSE, Simplifier.simplify(Exprs.ne(Exprs.constant(U8, 7),
                                                                      Exprs.constant(U8, 7))));
    }

    @Test
    public void testMemberOfLiteral() {
        Type st = Type.struct(new Type.Component("a", U8), new Type.Component("b", Type.BOOL));
        SymbolTableBuilder b = new SymbolTableBuilder();
        Type tag = b.addStruct("s", st);
        SymbolTable ns = b.build();
        Expr lit = Exprs.structLiteral(ns, tag, Arrays.<Expr>asList(x, q));
        Assert.assertEquals(x, new Simplifier(ns).transform(Exprs.member(ns, lit, "a")));
    }

    @Test
    public void testCollectSymbols() {
        Expr e = Exprs.and(p, Exprs.or(q, Exprs.eq(x, Exprs.constant(U8, 3))));
        Assert.assertEquals(3, SymbolCollector.collect(e).size());
        Assert.assertTrue(SymbolCollector.collect(e).contains(x));
    }
}
