package com.galois.bmc.solver;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.ArraySort;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.BoolSort;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Sort;

import com.galois.bmc.Type;
import com.galois.bmc.expr.ArrayLiteral;
import com.galois.bmc.expr.ArrayOf;
import com.galois.bmc.expr.BinaryExpr;
import com.galois.bmc.expr.BoolConstant;
import com.galois.bmc.expr.BvConstant;
import com.galois.bmc.expr.Concat;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.ExprVisitor;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Extract;
import com.galois.bmc.expr.Index;
import com.galois.bmc.expr.IndexUpdate;
import com.galois.bmc.expr.Ite;
import com.galois.bmc.expr.Member;
import com.galois.bmc.expr.MemberUpdate;
import com.galois.bmc.expr.Nondet;
import com.galois.bmc.expr.StringConstant;
import com.galois.bmc.expr.StructLiteral;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.expr.Typecast;
import com.galois.bmc.expr.UnaryExpr;

/**
 * Translates struct-free expressions into Z3 terms.
 *
 * <p>
 * Booleans map to Z3 Booleans, bitvectors of any signedness to Z3
 * bitvectors and arrays to Z3 arrays indexed by bitvectors of the width of
 * the array's size type.  Z3 has no zero-width bitvectors; they are
 * represented by the one-bit constant zero.
 */
final class Z3Converter implements ExprVisitor<com.microsoft.z3.Expr<?>> {
    private final Context ctx;
    private final Map<String, com.microsoft.z3.Expr<?>> symbols =
        new HashMap<String, com.microsoft.z3.Expr<?>>();

    Z3Converter(Context ctx) {
        this.ctx = ctx;
    }

    com.microsoft.z3.Expr<?> convert(Expr e) {
        return e.accept(this);
    }

    BoolExpr convertBool(Expr e) {
        if (!e.type().isBool()) {
            throw new IllegalArgumentException("Expected a Boolean expression, got " + e.type());
        }
        return (BoolExpr) convert(e);
    }

    private static int z3Width(long width) {
        if (width > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Bitvector width " + width + " is too large.");
        }
        return width == 0 ? 1 : (int) width;
    }

    Sort sort(Type t) {
        if (t.isBool()) return ctx.mkBoolSort();
        if (t.isBitvector()) return ctx.mkBitVecSort(z3Width(t.width()));
        if (t.isArray()) {
            return ctx.mkArraySort(indexSort(t), sort(t.arrayElementType()));
        }
        throw new IllegalArgumentException("Type " + t + " has no solver representation.");
    }

    private BitVecSort indexSort(Type arrayType) {
        return ctx.mkBitVecSort(z3Width(arrayType.arraySize().type().width()));
    }

    private BitVecExpr zeroWidth() {
        return ctx.mkBV(0, 1);
    }

    /**
     * Resize a bitvector term from type <code>from</code> to
     * <code>width</code> bits, extending by sign for signed types.
     */
    private BitVecExpr resize(BitVecExpr x, Type from, long width) {
        int have = z3Width(from.width());
        int want = z3Width(width);
        if (from.width() == 0 || width == 0) {
            if (width == 0) return zeroWidth();
            return ctx.mkBV(0, want);
        }
        if (have == want) return x;
        if (have > want) return ctx.mkExtract(want - 1, 0, x);
        if (from.isSigned()) return ctx.mkSignExt(want - have, x);
        return ctx.mkZeroExt(want - have, x);
    }

    private BitVecExpr indexTerm(Expr array, Expr index) {
        long w = array.type().arraySize().type().width();
        return resize((BitVecExpr) convert(index), index.type(), w);
    }

    /** Equality of two terms of the same sort. */
    private BoolExpr eq(com.microsoft.z3.Expr<?> l, com.microsoft.z3.Expr<?> r) {
        if (l instanceof BoolExpr) return ctx.mkEq((BoolExpr) l, (BoolExpr) r);
        if (l instanceof BitVecExpr) return ctx.mkEq((BitVecExpr) l, (BitVecExpr) r);
        return (BoolExpr) eqDecl(l).apply(l, r);
    }

    /** The equality declaration over the sort of <code>x</code>. */
    private <R extends Sort> FuncDecl<BoolSort> eqDecl(com.microsoft.z3.Expr<R> x) {
        return ctx.mkEq(x, x).getFuncDecl();
    }

    private com.microsoft.z3.Expr<?> select(com.microsoft.z3.Expr<?> array, BitVecExpr index) {
        return selectDecl((ArrayExpr<?, ?>) array).apply(array, index);
    }

    private com.microsoft.z3.Expr<?> store(com.microsoft.z3.Expr<?> array, BitVecExpr index,
                                           com.microsoft.z3.Expr<?> value) {
        return storeDecl((ArrayExpr<?, ?>) array).apply(array, index, value);
    }

    /** The <code>select</code> declaration of the sort of <code>a</code>. */
    private <D extends Sort, R extends Sort> FuncDecl<R> selectDecl(ArrayExpr<D, R> a) {
        ArraySort<D, R> s = a.getSort();
        return ctx.mkSelect(a, ctx.mkConst("bmc::index", s.getDomain())).getFuncDecl();
    }

    /** The <code>store</code> declaration of the sort of <code>a</code>. */
    private <D extends Sort, R extends Sort> FuncDecl<ArraySort<D, R>> storeDecl(ArrayExpr<D, R> a) {
        ArraySort<D, R> s = a.getSort();
        return ctx.mkStore(a, ctx.mkConst("bmc::index", s.getDomain()),
                           ctx.mkConst("bmc::element", s.getRange())).getFuncDecl();
    }

    public com.microsoft.z3.Expr<?> visitSymbol(Symbol e) {
        String id = e.getIdentifier();
        com.microsoft.z3.Expr<?> c = symbols.get(id);
        if (c == null) {
            c = ctx.mkConst(id, sort(e.type()));
            symbols.put(id, c);
        }
        return c;
    }

    public com.microsoft.z3.Expr<?> visitBoolConstant(BoolConstant e) {
        return ctx.mkBool(e.getValue());
    }

    public com.microsoft.z3.Expr<?> visitBvConstant(BvConstant e) {
        if (e.type().width() == 0) return zeroWidth();
        return ctx.mkBV(e.getValue().toString(), z3Width(e.type().width()));
    }

    public com.microsoft.z3.Expr<?> visitStringConstant(StringConstant e) {
        throw new IllegalArgumentException("String constants have no solver representation: " + e);
    }

    public com.microsoft.z3.Expr<?> visitNondet(Nondet e) {
        return ctx.mkFreshConst("nondet", sort(e.type()));
    }

    public com.microsoft.z3.Expr<?> visitUnary(UnaryExpr e) {
        com.microsoft.z3.Expr<?> x = convert(e.getOperand());
        switch (e.getOp()) {
        case NOT:
            return ctx.mkNot((BoolExpr) x);
        case NEG:
            return ctx.mkBVNeg((BitVecExpr) x);
        default:
            return ctx.mkBVNot((BitVecExpr) x);
        }
    }

    public com.microsoft.z3.Expr<?> visitBinary(BinaryExpr e) {
        com.microsoft.z3.Expr<?> l = convert(e.getLhs());
        com.microsoft.z3.Expr<?> r = convert(e.getRhs());
        boolean signed = e.getLhs().type().isSigned();
        switch (e.getOp()) {
        case AND:
            return ctx.mkAnd((BoolExpr) l, (BoolExpr) r);
        case OR:
            return ctx.mkOr((BoolExpr) l, (BoolExpr) r);
        case IMPLIES:
            return ctx.mkImplies((BoolExpr) l, (BoolExpr) r);
        case XOR:
            return ctx.mkXor((BoolExpr) l, (BoolExpr) r);
        case EQ:
            return eq(l, r);
        case NE:
            return ctx.mkNot(eq(l, r));
        default:
            break;
        }
        BitVecExpr a = (BitVecExpr) l;
        BitVecExpr b = (BitVecExpr) r;
        switch (e.getOp()) {
        case LT:
            return signed ? ctx.mkBVSLT(a, b) : ctx.mkBVULT(a, b);
        case LE:
            return signed ? ctx.mkBVSLE(a, b) : ctx.mkBVULE(a, b);
        case GT:
            return signed ? ctx.mkBVSGT(a, b) : ctx.mkBVUGT(a, b);
        case GE:
            return signed ? ctx.mkBVSGE(a, b) : ctx.mkBVUGE(a, b);
        case PLUS:
            return ctx.mkBVAdd(a, b);
        case MINUS:
            return ctx.mkBVSub(a, b);
        case MULT:
            return ctx.mkBVMul(a, b);
        case DIV:
            return signed ? ctx.mkBVSDiv(a, b) : ctx.mkBVUDiv(a, b);
        case MOD:
            return signed ? ctx.mkBVSRem(a, b) : ctx.mkBVURem(a, b);
        case BITAND:
            return ctx.mkBVAND(a, b);
        case BITOR:
            return ctx.mkBVOR(a, b);
        case BITXOR:
            return ctx.mkBVXOR(a, b);
        case SHL:
            return ctx.mkBVSHL(a, resize(b, e.getRhs().type(), e.getLhs().type().width()));
        case SHR:
            b = resize(b, e.getRhs().type(), e.getLhs().type().width());
            return signed ? ctx.mkBVASHR(a, b) : ctx.mkBVLSHR(a, b);
        default:
            throw new IllegalArgumentException("Unsupported operator " + e.getOp());
        }
    }

    public com.microsoft.z3.Expr<?> visitIte(Ite e) {
        return ctx.<Sort>mkITE((BoolExpr) convert(e.getCond()), convert(e.getThen()), convert(e.getElse()));
    }

    public com.microsoft.z3.Expr<?> visitMember(Member e) {
        throw new IllegalArgumentException("Struct member selection must be lowered: " + e);
    }

    public com.microsoft.z3.Expr<?> visitMemberUpdate(MemberUpdate e) {
        throw new IllegalArgumentException("Struct update must be lowered: " + e);
    }

    public com.microsoft.z3.Expr<?> visitStructLiteral(StructLiteral e) {
        throw new IllegalArgumentException("Struct literal must be lowered: " + e);
    }

    public com.microsoft.z3.Expr<?> visitIndex(Index e) {
        return select(convert(e.getArray()), indexTerm(e.getArray(), e.getIndex()));
    }

    public com.microsoft.z3.Expr<?> visitIndexUpdate(IndexUpdate e) {
        return store(convert(e.getArray()), indexTerm(e.getArray(), e.getIndex()),
                     convert(e.getValue()));
    }

    public com.microsoft.z3.Expr<?> visitArrayLiteral(ArrayLiteral e) {
        List<Expr> elems = e.operands();
        Type t = e.type();
        long w = t.arraySize().type().width();
        if (elems.isEmpty()) {
            return ctx.mkConstArray(indexSort(t), ctx.mkFreshConst("elem", sort(t.arrayElementType())));
        }
        com.microsoft.z3.Expr<?> r = ctx.mkConstArray(indexSort(t), convert(elems.get(0)));
        for (int i = 1; i < elems.size(); ++i) {
            BitVecExpr idx = resize(ctx.mkBV(i, 64), Type.unsignedbv(64), w);
            r = store(r, idx, convert(elems.get(i)));
        }
        return r;
    }

    public com.microsoft.z3.Expr<?> visitArrayOf(ArrayOf e) {
        return ctx.mkConstArray(indexSort(e.type()), convert(e.getValue()));
    }

    public com.microsoft.z3.Expr<?> visitTypecast(Typecast e) {
        Type from = e.getOperand().type();
        Type to = e.type();
        com.microsoft.z3.Expr<?> x = convert(e.getOperand());
        if (from.isBool() && to.isBool()) return x;
        if (from.isBool()) {
            int w = z3Width(to.width());
            return ctx.mkITE((BoolExpr) x, ctx.mkBV(to.width() == 0 ? 0 : 1, w), ctx.mkBV(0, w));
        }
        if (to.isBool()) {
            return ctx.mkNot(ctx.mkEq((BitVecExpr) x, ctx.mkBV(0, z3Width(from.width()))));
        }
        return resize((BitVecExpr) x, from, to.width());
    }

    public com.microsoft.z3.Expr<?> visitExtract(Extract e) {
        if (e.getWidth() == 0) return zeroWidth();
        BitVecExpr x = (BitVecExpr) convert(e.getOperand());
        long hi = e.getLow() + e.getWidth() - 1;
        return ctx.mkExtract((int) hi, (int) e.getLow(), x);
    }

    public com.microsoft.z3.Expr<?> visitConcat(Concat e) {
        BitVecExpr r = null;
        for (Expr p : e.operands()) {
            if (p.type().width() == 0) continue;
            BitVecExpr x = (BitVecExpr) convert(p);
            r = r == null ? x : ctx.mkConcat(r, x);
        }
        return r == null ? zeroWidth() : r;
    }

    /**
     * Read the value of a converted term of type <code>t</code> back from
     * a model.  Arrays are read element by element up to
     * <code>maxElements</code>; larger arrays and arrays of symbolic size
     * yield <code>null</code>.
     */
    Expr valueOf(Model m, com.microsoft.z3.Expr<?> term, Type t, long maxElements) {
        if (t.isBool()) {
            com.microsoft.z3.Expr<?> v = m.eval(term, true);
            if (v.isTrue()) return Exprs.TRUE;
            if (v.isFalse()) return Exprs.FALSE;
            return null;
        }
        if (t.isBitvector()) {
            if (t.width() == 0) return Exprs.constant(t, 0);
            com.microsoft.z3.Expr<?> v = m.eval(term, true);
            if (v instanceof BitVecNum) {
                BigInteger b = ((BitVecNum) v).getBigInteger();
                return Exprs.constant(t, b);
            }
            return null;
        }
        if (t.isArray()) {
            long n = t.constantArraySize();
            if (n < 0 || n > maxElements) return null;
            long w = t.arraySize().type().width();
            List<Expr> elems = new ArrayList<Expr>();
            for (long i = 0; i != n; ++i) {
                BitVecExpr idx = resize(ctx.mkBV(i, 64), Type.unsignedbv(64), w);
                Expr v = valueOf(m, select(term, idx), t.arrayElementType(), maxElements);
                if (v == null) return null;
                elems.add(v);
            }
            return Exprs.arrayLiteral(t, elems);
        }
        return null;
    }
}
