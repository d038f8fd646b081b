package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;

/**
 * Jump to the instruction at <code>target</code> when the condition holds,
 * and fall through otherwise.  A jump to an earlier or the same index is a
 * loop back-edge.
 */
public final class Goto extends Instruction {
    private final Expr cond;
    private final int target;

    public Goto(Position pos, Expr cond, int target) {
        super(pos);
        this.cond = cond == null ? Exprs.TRUE : cond;
        if (target < 0) {
            throw new StructuralInvariantViolation("goto target must not be negative");
        }
        this.target = target;
    }

    public Expr getCondition() {
        return cond;
    }

    public int getTarget() {
        return target;
    }

    public boolean isUnconditional() {
        return cond.isTrue();
    }

    /**
     * Whether this goto, located at <code>index</code>, jumps backwards.
     */
    public boolean isBackwards(int index) {
        return target <= index;
    }

    public InstructionKind getKind() {
        return InstructionKind.GOTO;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitGoto(this);
    }

    public List<Expr> operands() {
        return Collections.singletonList(cond);
    }

    public ValidationResult check() {
        ValidationResult r = super.check();
        checkBoolean(cond, "goto condition", r);
        return r;
    }

    public String toString() {
        return (isUnconditional() ? "" : "if " + cond + " ") + "goto " + target;
    }
}
