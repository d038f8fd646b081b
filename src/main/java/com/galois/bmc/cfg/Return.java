package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.expr.Expr;

/**
 * Leave the current function, optionally with a value.
 */
public final class Return extends Instruction {
    private final Expr value;

    public Return(Position pos, Expr value) {
        super(pos);
        this.value = value;
    }

    /** The returned value, or <code>null</code>. */
    public Expr getValue() {
        return value;
    }

    public InstructionKind getKind() {
        return InstructionKind.RETURN;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitReturn(this);
    }

    public List<Expr> operands() {
        if (value == null) return Collections.<Expr>emptyList();
        return Collections.singletonList(value);
    }

    public String toString() {
        return value == null ? "return" : "return " + value;
    }
}
