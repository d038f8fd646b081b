package com.galois.bmc.cfg;

import java.util.List;

import com.galois.bmc.expr.Expr;

/**
 * Records that the listed expressions were read from the environment.
 */
public final class Input extends IoInstruction {
    public Input(Position pos, Expr description, List<Expr> expressions) {
        super(pos, description, expressions);
    }

    public InstructionKind getKind() {
        return InstructionKind.INPUT;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitInput(this);
    }
}
