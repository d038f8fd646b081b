package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.expr.Expr;

/**
 * A safety property: the condition must hold whenever the instruction is
 * reached.
 */
public final class Assert extends Instruction {
    private final Expr cond;
    private final String propertyId;
    private final String description;

    public Assert(Position pos, Expr cond, String propertyId, String description) {
        super(pos);
        this.cond = require(cond, "asserted condition");
        this.propertyId = require(propertyId, "property identifier");
        this.description = description == null ? "assertion" : description;
    }

    public Expr getCondition() {
        return cond;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public String getDescription() {
        return description;
    }

    public Assert withCondition(Expr cond) {
        return new Assert(getPosition(), cond, propertyId, description);
    }

    public InstructionKind getKind() {
        return InstructionKind.ASSERT;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitAssert(this);
    }

    public List<Expr> operands() {
        return Collections.singletonList(cond);
    }

    public ValidationResult check() {
        ValidationResult r = super.check();
        checkBoolean(cond, "asserted condition", r);
        return r;
    }

    public String toString() {
        return "assert " + cond + " [" + propertyId + "]";
    }
}
