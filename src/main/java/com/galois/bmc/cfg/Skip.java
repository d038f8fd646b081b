package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.expr.Expr;

/** No-op; also serves as a jump target and location marker. */
public final class Skip extends Instruction {
    public Skip(Position pos) {
        super(pos);
    }

    public InstructionKind getKind() {
        return InstructionKind.SKIP;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitSkip(this);
    }

    public List<Expr> operands() {
        return Collections.<Expr>emptyList();
    }

    public String toString() {
        return "skip";
    }
}
