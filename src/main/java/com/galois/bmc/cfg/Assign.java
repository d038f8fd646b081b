package com.galois.bmc.cfg;

import java.util.Arrays;
import java.util.List;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.expr.Expr;

/**
 * Assignment of a value to an lvalue.
 */
public final class Assign extends Instruction {
    private final Expr lhs;
    private final Expr rhs;

    public Assign(Position pos, Expr lhs, Expr rhs) {
        super(pos);
        this.lhs = require(lhs, "assignment target");
        this.rhs = require(rhs, "assigned value");
    }

    public Expr getLhs() {
        return lhs;
    }

    public Expr getRhs() {
        return rhs;
    }

    public Assign withLhs(Expr lhs) {
        return new Assign(getPosition(), lhs, rhs);
    }

    public Assign withRhs(Expr rhs) {
        return new Assign(getPosition(), lhs, rhs);
    }

    public InstructionKind getKind() {
        return InstructionKind.ASSIGN;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitAssign(this);
    }

    public List<Expr> operands() {
        return Arrays.asList(lhs, rhs);
    }

    public ValidationResult check() {
        ValidationResult r = super.check();
        checkLvalue(lhs, "assignment target", r);
        return r;
    }

    public ValidationResult validate(SymbolTable ns) {
        ValidationResult r = check();
        if (!lhs.type().equals(rhs.type())) {
            r.add(ValidationError.Kind.TYPE_MISMATCH, getPosition(),
                  "assignment target has type " + lhs.type()
                  + " but the assigned value has type " + rhs.type());
        }
        return r;
    }

    public String toString() {
        return lhs + " := " + rhs;
    }
}
