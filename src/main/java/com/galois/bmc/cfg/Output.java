package com.galois.bmc.cfg;

import java.util.List;

import com.galois.bmc.expr.Expr;

/**
 * Records that the listed expressions were written to the environment.
 */
public final class Output extends IoInstruction {
    public Output(Position pos, Expr description, List<Expr> expressions) {
        super(pos, description, expressions);
    }

    public InstructionKind getKind() {
        return InstructionKind.OUTPUT;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitOutput(this);
    }
}
