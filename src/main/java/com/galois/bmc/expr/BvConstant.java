package com.galois.bmc.expr;

import java.math.BigInteger;
import java.util.List;

import com.galois.bmc.Type;

/**
 * A bitvector constant.  The stored value is always reduced modulo
 * <code>2^width</code>, so it is non-negative; use {@link #getSignedValue()}
 * for the two's complement reading.
 */
public final class BvConstant extends Expr {
    private final BigInteger value;

    public BvConstant(Type type, BigInteger value) {
        super(type);
        if (!type.isBitvector()) {
            throw new IllegalArgumentException("Bitvector constant needs a bitvector type, got " + type);
        }
        this.value = normalize(type.width(), value);
    }

    public BvConstant(Type type, long value) {
        this(type, BigInteger.valueOf(value));
    }

    static BigInteger normalize(long width, BigInteger v) {
        if (width == 0) return BigInteger.ZERO;
        BigInteger mod = BigInteger.ONE.shiftLeft((int) width);
        return v.mod(mod);
    }

    /** Unsigned value of the bits. */
    public BigInteger getValue() {
        return value;
    }

    /**
     * Value under the interpretation of this constant's type: two's
     * complement for signed bitvectors, unsigned otherwise.
     */
    public BigInteger getSignedValue() {
        if (!type().isSigned()) return value;
        long w = type().width();
        if (w > 0 && value.testBit((int) w - 1)) {
            return value.subtract(BigInteger.ONE.shiftLeft((int) w));
        }
        return value;
    }

    public boolean isZero() {
        return value.signum() == 0;
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 0, "constant");
        return this;
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitBvConstant(this);
    }

    boolean sameAttributes(Expr o) {
        return value.equals(((BvConstant) o).value);
    }

    int attributesHash() {
        return value.hashCode();
    }

    public String toString() {
        return getSignedValue().toString();
    }
}
