package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Symbol;

/**
 * Marks the end of the lifetime of a local variable.
 */
public final class Dead extends Instruction {
    private final Symbol symbol;

    public Dead(Position pos, Expr symbol) {
        super(pos);
        require(symbol, "dead variable");
        if (!(symbol instanceof Symbol)) {
            throw new StructuralInvariantViolation("dead expects a symbol, got " + symbol);
        }
        this.symbol = (Symbol) symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public InstructionKind getKind() {
        return InstructionKind.DEAD;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitDead(this);
    }

    public List<Expr> operands() {
        return Collections.<Expr>singletonList(symbol);
    }

    public String toString() {
        return "dead " + symbol;
    }
}
