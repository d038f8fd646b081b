package com.galois.bmc.expr;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/**
 * The bits <code>[low, low + width)</code> of a bitvector, counting from the
 * least significant bit.  The result is a raw bitvector.
 */
public final class Extract extends Expr {
    private final Expr operand;
    private final long low;

    Extract(Expr operand, long low, long width) {
        super(Type.bv(width));
        if (!operand.type().isBitvector())
            throw new IllegalArgumentException("extract expects a bitvector argument, got " + operand.type());
        if (low < 0 || low + width > operand.type().width())
            throw new IllegalArgumentException(
                "extract of bits [" + low + ", " + (low + width) + ") out of range for " + operand.type());
        this.operand = operand;
        this.low = low;
    }

    public Expr getOperand() {
        return operand;
    }

    public long getLow() {
        return low;
    }

    public long getWidth() {
        return type().width();
    }

    public List<Expr> operands() {
        return Collections.singletonList(operand);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 1, "extract");
        return new Extract(ops.get(0), low, getWidth());
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitExtract(this);
    }

    boolean sameAttributes(Expr o) {
        return low == ((Extract) o).low;
    }

    int attributesHash() {
        return (int) (low ^ (low >>> 32));
    }

    public String toString() {
        return "extract(" + operand + ", " + low + ", " + getWidth() + ")";
    }
}
