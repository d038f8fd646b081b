package com.galois.bmc.cfg;

import java.util.ArrayList;
import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;

import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.SymbolTableBuilder;
import com.galois.bmc.Type;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;

public class TestInstructions {
    static final Type U8 = Type.unsignedbv(8);
    static final Type U16 = Type.unsignedbv(16);
    static final Position POS = new SourcePosition("main", "test.c", 3, 1);

    @Test
    public void testMismatchedAssignmentPassesCheckButFailsValidate() {
        SymbolTable ns = new SymbolTableBuilder().build();
        Assign a = new Assign(POS, new Symbol("x", U8), Exprs.constant(U16, 1));

        Assert.assertTrue(a.check().isValid());

        ValidationResult r = a.validate(ns);
        Assert.assertFalse(r.isValid());
        Assert.assertTrue(r.hasError(ValidationError.Kind.TYPE_MISMATCH));
        Assert.assertEquals(POS, r.getErrors().get(0).getPosition());
    }

    @Test
    public void testAssignToNonLvalue() {
        Expr sum = Exprs.plus(new Symbol("x", U8), Exprs.constant(U8, 1));
        Assign a = new Assign(POS, sum, Exprs.constant(U8, 2));
        ValidationResult r = a.check();
        Assert.assertTrue(r.hasError(ValidationError.Kind.OPERAND_KIND));
    }

    @Test(expected=StructuralInvariantViolation.class)
    public void testAssignWithoutRhs() {
        new Assign(POS, new Symbol("x", U8), null);
    }

    @Test(expected=StructuralInvariantViolation.class)
    public void testDeadRequiresSymbol() {
        new Dead(POS, Exprs.constant(U8, 0));
    }

    @Test(expected=StructuralInvariantViolation.class)
    public void testOutputRequiresExpressions() {
        new Output(POS, Exprs.string("x"), new ArrayList<Expr>());
    }

    @Test(expected=StructuralInvariantViolation.class)
    public void testInputRequiresStringDescription() {
        new Input(POS, Exprs.constant(U8, 0), Arrays.<Expr>asList(new Symbol("x", U8)));
    }

    @Test
    public void testFunctionCallArity() {
        Type fType = Type.code(new Type[] { U8 }, U8);
        FunctionCall c = new FunctionCall(POS, null, new Symbol("f", fType),
                                          new ArrayList<Expr>());
        Assert.assertTrue(c.check().hasError(ValidationError.Kind.ARITY));
    }

    @Test
    public void testFunctionCallReturnType() {
        Type fType = Type.code(new Type[] { U8 }, U8);
        SymbolTable ns = new SymbolTableBuilder().addFunction("f", fType).build();
        FunctionCall c = new FunctionCall(POS, new Symbol("r", U16), new Symbol("f", fType),
                                          Arrays.<Expr>asList(Exprs.constant(U8, 1)));
        Assert.assertTrue(c.check().isValid());
        Assert.assertTrue(c.validate(ns).hasError(ValidationError.Kind.TYPE_MISMATCH));
    }

    @Test
    public void testValidateFullReportsUnknownSymbols() {
        SymbolTableBuilder b = new SymbolTableBuilder();
        b.addGlobal("g", U8, Exprs.constant(U8, 0));
        SymbolTable ns = b.build();

        Assign good = new Assign(POS, new Symbol("g", U8), Exprs.constant(U8, 1));
        Assert.assertTrue(good.validateFull(ns).isValid());

        Assign bad = new Assign(POS, new Symbol("g", U8), new Symbol("h", U8));
        Assert.assertTrue(bad.validate(ns).isValid());
        Assert.assertTrue(bad.validateFull(ns).hasError(ValidationError.Kind.UNKNOWN_SYMBOL));
    }

    @Test(expected=StructuralInvariantViolation.class)
    public void testThrowIfInvalid() {
        SymbolTable ns = new SymbolTableBuilder().build();
        new Assign(POS, new Symbol("x", U8), Exprs.constant(U16, 1)).validate(ns).throwIfInvalid();
    }

    @Test
    public void testLoopsAreNumberedByBackEdge() {
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
        Label again = p.newLabel();
        p.place(again);
        p.gotoIf(Exprs.lt(i, Exprs.constant(U8, 5)), again);
        GotoFunction f = p.build();

        Assert.assertEquals(2, f.getLoops().size());
        Loop first = f.getLoops().get(0);
        Assert.assertEquals("main.0", first.getId());
        Assert.assertEquals(1, first.getHead());
        Assert.assertEquals(3, first.getBackEdge());
        Assert.assertTrue(first.contains(2));
        Assert.assertFalse(first.contains(4));
        Assert.assertEquals("main.1", f.getLoops().get(1).getId());
        Assert.assertSame(first, f.loopAt(3));
        Assert.assertNull(f.loopAt(1));
    }

    @Test(expected=IllegalStateException.class)
    public void testUnplacedLabel() {
        GotoProgram p = new GotoProgram("main");
        p.jump(p.newLabel());
        p.build();
    }

    @Test
    public void testReturnTypeIsValidated() {
        SymbolTable ns = new SymbolTableBuilder().build();
        GotoFunction f = new GotoFunction("f", new ArrayList<Symbol>(), U8,
                                          Arrays.<Instruction>asList(new Return(POS, Exprs.constant(U16, 0))));
        Assert.assertTrue(f.validate(ns, false).hasError(ValidationError.Kind.TYPE_MISMATCH));
    }
}
