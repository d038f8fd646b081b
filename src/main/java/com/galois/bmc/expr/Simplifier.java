package com.galois.bmc.expr;

import java.math.BigInteger;
import java.util.List;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;

/**
 * Local algebraic simplification: constant folding, Boolean identities,
 * if-then-else with constant or equal branches, and selection from literals
 * and functional updates.
 *
 * <p>
 * The simplifier never changes the type of an expression.  Struct tags are
 * resolved through the symbol table given at construction; without one,
 * members of tagged literals are left alone.
 */
public class Simplifier extends ExprTransformer {
    private final SymbolTable ns;

    public Simplifier() {
        this(null);
    }

    public Simplifier(SymbolTable ns) {
        this.ns = ns;
    }

    /** Simplify without a symbol table. */
    public static Expr simplify(Expr e) {
        return new Simplifier().transform(e);
    }

    public Expr visitUnary(UnaryExpr e) {
        Expr t = transformOperands(e);
        if (!(t instanceof UnaryExpr)) return t;
        UnaryExpr u = (UnaryExpr) t;
        Expr x = u.getOperand();
        switch (u.getOp()) {
        case NOT:
            if (x instanceof BoolConstant)
                return BoolConstant.of(!((BoolConstant) x).getValue());
            if (x instanceof UnaryExpr && ((UnaryExpr) x).getOp() == UnaryExpr.Op.NOT)
                return ((UnaryExpr) x).getOperand();
            return u;
        case NEG:
            if (x instanceof BvConstant)
                return new BvConstant(x.type(), ((BvConstant) x).getSignedValue().negate());
            return u;
        default:
            if (x instanceof BvConstant)
                return new BvConstant(x.type(), ((BvConstant) x).getValue().not());
            return u;
        }
    }

    private static boolean isNegationOf(Expr a, Expr b) {
        return (a instanceof UnaryExpr
                && ((UnaryExpr) a).getOp() == UnaryExpr.Op.NOT
                && ((UnaryExpr) a).getOperand().equals(b))
            || (b instanceof UnaryExpr
                && ((UnaryExpr) b).getOp() == UnaryExpr.Op.NOT
                && ((UnaryExpr) b).getOperand().equals(a));
    }

    private static boolean isScalarConstant(Expr e) {
        return e instanceof BoolConstant
            || e instanceof BvConstant
            || e instanceof StringConstant;
    }

    private Expr not(Expr x) {
        return transform(Exprs.not(x));
    }

    public Expr visitBinary(BinaryExpr e) {
        Expr t = transformOperands(e);
        if (!(t instanceof BinaryExpr)) return t;
        BinaryExpr b = (BinaryExpr) t;
        Expr l = b.getLhs();
        Expr r = b.getRhs();
        switch (b.getOp()) {
        case AND:
            if (l.isFalse() || r.isFalse()) return BoolConstant.FALSE;
            if (l.isTrue()) return r;
            if (r.isTrue()) return l;
            if (l.equals(r)) return l;
            if (isNegationOf(l, r)) return BoolConstant.FALSE;
            return b;
        case OR:
            if (l.isTrue() || r.isTrue()) return BoolConstant.TRUE;
            if (l.isFalse()) return r;
            if (r.isFalse()) return l;
            if (l.equals(r)) return l;
            if (isNegationOf(l, r)) return BoolConstant.TRUE;
            return b;
        case IMPLIES:
            if (l.isFalse() || r.isTrue()) return BoolConstant.TRUE;
            if (l.isTrue()) return r;
            if (r.isFalse()) return not(l);
            if (l.equals(r)) return BoolConstant.TRUE;
            return b;
        case XOR:
            if (l.isFalse()) return r;
            if (r.isFalse()) return l;
            if (l.isTrue()) return not(r);
            if (r.isTrue()) return not(l);
            if (l.equals(r)) return BoolConstant.FALSE;
            return b;
        case EQ:
            if (l.equals(r) && !(l instanceof Nondet)) return BoolConstant.TRUE;
            if (isScalarConstant(l) && isScalarConstant(r)) return BoolConstant.FALSE;
            if (l.type().isBool()) {
                if (l.isTrue()) return r;
                if (r.isTrue()) return l;
                if (l.isFalse()) return not(r);
                if (r.isFalse()) return not(l);
            }
            return b;
        case NE:
            return not(Exprs.eq(l, r));
        default:
            break;
        }

        if (l instanceof BvConstant && r instanceof BvConstant) {
            return fold(b.getOp(), (BvConstant) l, (BvConstant) r);
        }
        return identities(b, l, r);
    }

    private static Expr identities(BinaryExpr b, Expr l, Expr r) {
        boolean rZero = r instanceof BvConstant && ((BvConstant) r).isZero();
        boolean lZero = l instanceof BvConstant && ((BvConstant) l).isZero();
        switch (b.getOp()) {
        case LT:
        case GT:
            return l.equals(r) ? BoolConstant.FALSE : b;
        case LE:
        case GE:
            return l.equals(r) ? BoolConstant.TRUE : b;
        case PLUS:
        case BITOR:
        case BITXOR:
            if (rZero) return l;
            if (lZero) return r;
            return b;
        case MINUS:
        case SHL:
        case SHR:
            return rZero ? l : b;
        case MULT:
        case BITAND:
            if (rZero) return r;
            if (lZero) return l;
            if (b.getOp() == BinaryExpr.Op.MULT) {
                if (isOne(r)) return l;
                if (isOne(l)) return r;
            }
            return b;
        default:
            return b;
        }
    }

    private static boolean isOne(Expr e) {
        return e instanceof BvConstant && ((BvConstant) e).getValue().equals(BigInteger.ONE);
    }

    private static Expr fold(BinaryExpr.Op op, BvConstant l, BvConstant r) {
        Type t = l.type();
        BigInteger a = l.getSignedValue();
        BigInteger c = r.getSignedValue();
        long width = t.width();
        switch (op) {
        case LT: return BoolConstant.of(a.compareTo(c) < 0);
        case LE: return BoolConstant.of(a.compareTo(c) <= 0);
        case GT: return BoolConstant.of(a.compareTo(c) > 0);
        case GE: return BoolConstant.of(a.compareTo(c) >= 0);
        case PLUS: return new BvConstant(t, a.add(c));
        case MINUS: return new BvConstant(t, a.subtract(c));
        case MULT: return new BvConstant(t, a.multiply(c));
        case DIV:
            if (c.signum() == 0) return Exprs.div(l, r);
            return new BvConstant(t, a.divide(c));
        case MOD:
            if (c.signum() == 0) return Exprs.mod(l, r);
            return new BvConstant(t, a.remainder(c));
        case BITAND: return new BvConstant(t, l.getValue().and(r.getValue()));
        case BITOR: return new BvConstant(t, l.getValue().or(r.getValue()));
        case BITXOR: return new BvConstant(t, l.getValue().xor(r.getValue()));
        case SHL: {
            int n = shiftAmount(r, width);
            return new BvConstant(t, n >= width ? BigInteger.ZERO : l.getValue().shiftLeft(n));
        }
        case SHR: {
            int n = shiftAmount(r, width);
            return new BvConstant(t, a.shiftRight(n));
        }
        default:
            throw new IllegalStateException("Unexpected operator " + op);
        }
    }

    private static int shiftAmount(BvConstant r, long width) {
        BigInteger n = r.getValue();
        if (n.compareTo(BigInteger.valueOf(width)) > 0) return (int) width;
        return n.intValue();
    }

    public Expr visitIte(Ite e) {
        Expr t = transformOperands(e);
        if (!(t instanceof Ite)) return t;
        Ite i = (Ite) t;
        if (i.getCond().isTrue()) return i.getThen();
        if (i.getCond().isFalse()) return i.getElse();
        if (i.getThen().equals(i.getElse())) return i.getThen();
        if (i.type().isBool()) {
            if (i.getThen().isTrue() && i.getElse().isFalse()) return i.getCond();
            if (i.getThen().isFalse() && i.getElse().isTrue()) return not(i.getCond());
        }
        return i;
    }

    private Type resolve(Type t) {
        if (t.isStructTag()) {
            return ns == null ? null : ns.follow(t);
        }
        return t;
    }

    public Expr visitMember(Member e) {
        Expr t = transformOperands(e);
        if (!(t instanceof Member)) return t;
        Member m = (Member) t;
        Expr c = m.getCompound();
        if (c instanceof StructLiteral) {
            Type st = resolve(c.type());
            if (st != null) {
                int i = st.componentIndex(m.getComponentName());
                if (i >= 0) return c.operands().get(i);
            }
        } else if (c instanceof MemberUpdate) {
            MemberUpdate u = (MemberUpdate) c;
            if (u.getComponentName().equals(m.getComponentName())) {
                return u.getValue();
            }
            return transform(new Member(u.getCompound(), m.getComponentName(), m.type()));
        } else if (c instanceof Ite) {
            Ite i = (Ite) c;
            return transform(Exprs.ite(i.getCond(),
                                       new Member(i.getThen(), m.getComponentName(), m.type()),
                                       new Member(i.getElse(), m.getComponentName(), m.type())));
        }
        return m;
    }

    public Expr visitIndex(Index e) {
        Expr t = transformOperands(e);
        if (!(t instanceof Index)) return t;
        Index x = (Index) t;
        Expr a = x.getArray();
        Expr i = x.getIndex();
        if (a instanceof ArrayOf) {
            return ((ArrayOf) a).getValue();
        }
        if (a instanceof ArrayLiteral && i instanceof BvConstant) {
            BigInteger k = ((BvConstant) i).getSignedValue();
            List<Expr> values = a.operands();
            if (k.signum() >= 0 && k.compareTo(BigInteger.valueOf(values.size())) < 0) {
                return values.get(k.intValue());
            }
            return x;
        }
        if (a instanceof IndexUpdate) {
            IndexUpdate u = (IndexUpdate) a;
            if (u.getIndex().equals(i)) {
                return u.getValue();
            }
            if (u.getIndex() instanceof BvConstant && i instanceof BvConstant) {
                return transform(new Index(u.getArray(), i));
            }
        }
        return x;
    }

    public Expr visitTypecast(Typecast e) {
        Expr t = transformOperands(e);
        if (!(t instanceof Typecast)) return t;
        Typecast c = (Typecast) t;
        Expr x = c.getOperand();
        Type to = c.type();
        if (x.type().equals(to)) return x;
        if (x instanceof BoolConstant) {
            boolean v = ((BoolConstant) x).getValue();
            if (to.isBool()) return x;
            return new BvConstant(to, v ? 1 : 0);
        }
        if (x instanceof BvConstant) {
            BvConstant k = (BvConstant) x;
            if (to.isBool()) return BoolConstant.of(!k.isZero());
            return new BvConstant(to, k.getSignedValue());
        }
        return c;
    }

    public Expr visitExtract(Extract e) {
        Expr t = transformOperands(e);
        if (!(t instanceof Extract)) return t;
        Extract x = (Extract) t;
        Expr op = x.getOperand();
        long w = x.getWidth();
        if (op instanceof BvConstant) {
            BigInteger v = ((BvConstant) op).getValue().shiftRight((int) x.getLow());
            return new BvConstant(x.type(), v);
        }
        if (x.getLow() == 0 && w == op.type().width() && op.type().equals(x.type())) {
            return op;
        }
        if (op instanceof Concat) {
            // Locate the part covering exactly the extracted bits.
            List<Expr> parts = op.operands();
            long low = 0;
            for (int i = parts.size() - 1; i >= 0; --i) {
                Expr p = parts.get(i);
                long pw = p.type().width();
                if (low == x.getLow() && pw == w) {
                    return transform(Exprs.typecast(p, x.type()));
                }
                if (x.getLow() >= low && x.getLow() + w <= low + pw) {
                    return transform(new Extract(p, x.getLow() - low, w));
                }
                low += pw;
            }
        }
        return x;
    }

    public Expr visitConcat(Concat e) {
        Expr t = transformOperands(e);
        if (!(t instanceof Concat)) return t;
        BigInteger v = BigInteger.ZERO;
        for (Expr p : t.operands()) {
            if (!(p instanceof BvConstant)) return t;
            v = v.shiftLeft((int) p.type().width()).or(((BvConstant) p).getValue());
        }
        return new BvConstant(t.type(), v);
    }
}
