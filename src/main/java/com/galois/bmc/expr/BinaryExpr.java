package com.galois.bmc.expr;

import java.util.Arrays;
import java.util.List;

import com.galois.bmc.Type;

/** Application of a binary operator. */
public final class BinaryExpr extends Expr {
    public enum Op {
        AND("&&", Kind.LOGICAL),
        OR("||", Kind.LOGICAL),
        IMPLIES("==>", Kind.LOGICAL),
        XOR("^^", Kind.LOGICAL),
        EQ("==", Kind.EQUALITY),
        NE("!=", Kind.EQUALITY),
        LT("<", Kind.RELATION),
        LE("<=", Kind.RELATION),
        GT(">", Kind.RELATION),
        GE(">=", Kind.RELATION),
        PLUS("+", Kind.ARITHMETIC),
        MINUS("-", Kind.ARITHMETIC),
        MULT("*", Kind.ARITHMETIC),
        DIV("/", Kind.ARITHMETIC),
        MOD("%", Kind.ARITHMETIC),
        BITAND("&", Kind.ARITHMETIC),
        BITOR("|", Kind.ARITHMETIC),
        BITXOR("^", Kind.ARITHMETIC),
        SHL("<<", Kind.ARITHMETIC),
        SHR(">>", Kind.ARITHMETIC);

        private final String symbol;
        private final Kind kind;

        Op(String symbol, Kind kind) {
            this.symbol = symbol;
            this.kind = kind;
        }

        public String getSymbol() {
            return symbol;
        }

        public Kind getKind() {
            return kind;
        }
    }

    /** Operand and result typing discipline of an operator. */
    public enum Kind {
        /** Boolean operands, Boolean result. */
        LOGICAL,
        /** Operands of any equal type, Boolean result. */
        EQUALITY,
        /** Bitvector operands of equal type, Boolean result. */
        RELATION,
        /** Bitvector operands of equal type, result of the same type. */
        ARITHMETIC
    }

    private final Op op;
    private final Expr lhs;
    private final Expr rhs;

    BinaryExpr(Op op, Expr lhs, Expr rhs) {
        super(resultType(op, lhs, rhs));
        this.op = op;
        this.lhs = lhs;
        this.rhs = rhs;
    }

    private static Type resultType(Op op, Expr lhs, Expr rhs) {
        switch (op.getKind()) {
        case LOGICAL:
            if (!lhs.type().isBool() || !rhs.type().isBool())
                throw new IllegalArgumentException(op.getSymbol() + " expects Boolean arguments.");
            return Type.BOOL;
        case EQUALITY:
            if (!lhs.type().equals(rhs.type()))
                throw new IllegalArgumentException(
                    op.getSymbol() + " expects arguments of the same type, got "
                    + lhs.type() + " and " + rhs.type() + ".");
            return Type.BOOL;
        case RELATION:
            checkBitvectors(op, lhs, rhs);
            return Type.BOOL;
        default:
            checkBitvectors(op, lhs, rhs);
            return lhs.type();
        }
    }

    private static void checkBitvectors(Op op, Expr lhs, Expr rhs) {
        if (!lhs.type().isBitvector())
            throw new IllegalArgumentException(op.getSymbol() + " expects bitvector arguments.");
        if (!lhs.type().equals(rhs.type()))
            throw new IllegalArgumentException(
                op.getSymbol() + " expects arguments of the same type, got "
                + lhs.type() + " and " + rhs.type() + ".");
    }

    public Op getOp() {
        return op;
    }

    public Expr getLhs() {
        return lhs;
    }

    public Expr getRhs() {
        return rhs;
    }

    public List<Expr> operands() {
        return Arrays.asList(lhs, rhs);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 2, op.getSymbol());
        return new BinaryExpr(op, ops.get(0), ops.get(1));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitBinary(this);
    }

    boolean sameAttributes(Expr o) {
        return op == ((BinaryExpr) o).op;
    }

    int attributesHash() {
        return op.hashCode();
    }

    public String toString() {
        return "(" + lhs + " " + op.getSymbol() + " " + rhs + ")";
    }
}
