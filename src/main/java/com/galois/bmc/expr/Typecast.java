package com.galois.bmc.expr;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/**
 * Conversion between Boolean and bitvector types.  Bitvectors are
 * sign-extended when the source is signed and zero-extended otherwise;
 * narrowing keeps the low bits.
 */
public final class Typecast extends Expr {
    private final Expr operand;

    Typecast(Expr operand, Type type) {
        super(type);
        Type from = operand.type();
        boolean ok = from.equals(type)
            || ((from.isBitvector() || from.isBool()) && (type.isBitvector() || type.isBool()));
        if (!ok)
            throw new IllegalArgumentException("Cannot cast " + from + " to " + type);
        this.operand = operand;
    }

    public Expr getOperand() {
        return operand;
    }

    public List<Expr> operands() {
        return Collections.singletonList(operand);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 1, "typecast");
        return new Typecast(ops.get(0), type());
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitTypecast(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        return "(" + type() + ")" + operand;
    }
}
