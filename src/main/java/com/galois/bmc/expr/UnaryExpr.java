package com.galois.bmc.expr;

import java.util.Collections;
import java.util.List;

/** Application of a unary operator. */
public final class UnaryExpr extends Expr {
    public enum Op {
        /** Boolean negation. */
        NOT("!"),
        /** Arithmetic negation. */
        NEG("-"),
        /** Bitwise complement. */
        BITNOT("~");

        private final String symbol;

        Op(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }
    }

    private final Op op;
    private final Expr operand;

    UnaryExpr(Op op, Expr operand) {
        super(operand.type());
        this.op = op;
        this.operand = operand;
        if (op == Op.NOT) {
            if (!operand.type().isBool())
                throw new IllegalArgumentException("! expects a Boolean argument.");
        } else if (!operand.type().isBitvector()) {
            throw new IllegalArgumentException(op.getSymbol() + " expects a bitvector argument.");
        }
    }

    public Op getOp() {
        return op;
    }

    public Expr getOperand() {
        return operand;
    }

    public List<Expr> operands() {
        return Collections.singletonList(operand);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 1, op.getSymbol());
        return new UnaryExpr(op, ops.get(0));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitUnary(this);
    }

    boolean sameAttributes(Expr o) {
        return op == ((UnaryExpr) o).op;
    }

    int attributesHash() {
        return op.hashCode();
    }

    public String toString() {
        return op.getSymbol() + operand;
    }
}
