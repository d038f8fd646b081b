package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Symbol;

/**
 * Declaration of a local variable.  The variable holds an unconstrained
 * value until it is assigned.
 */
public final class Decl extends Instruction {
    private final Symbol symbol;

    public Decl(Position pos, Expr symbol) {
        super(pos);
        require(symbol, "declared variable");
        if (!(symbol instanceof Symbol)) {
            throw new StructuralInvariantViolation("declaration expects a symbol, got " + symbol);
        }
        this.symbol = (Symbol) symbol;
    }

    public Symbol getSymbol() {
        return symbol;
    }

    public InstructionKind getKind() {
        return InstructionKind.DECL;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitDecl(this);
    }

    public List<Expr> operands() {
        return Collections.<Expr>singletonList(symbol);
    }

    public String toString() {
        return "decl " + symbol;
    }
}
