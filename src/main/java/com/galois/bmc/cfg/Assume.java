package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.expr.Expr;

/**
 * Restricts execution to states satisfying a condition.
 */
public final class Assume extends Instruction {
    private final Expr cond;

    public Assume(Position pos, Expr cond) {
        super(pos);
        this.cond = require(cond, "assumption");
    }

    public Expr getCondition() {
        return cond;
    }

    public Assume withCondition(Expr cond) {
        return new Assume(getPosition(), cond);
    }

    public InstructionKind getKind() {
        return InstructionKind.ASSUME;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitAssume(this);
    }

    public List<Expr> operands() {
        return Collections.singletonList(cond);
    }

    public ValidationResult check() {
        ValidationResult r = super.check();
        checkBoolean(cond, "assumption", r);
        return r;
    }

    public String toString() {
        return "assume " + cond;
    }
}
