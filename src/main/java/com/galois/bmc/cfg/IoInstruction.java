package com.galois.bmc.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.StringConstant;

/**
 * Common form of input and output annotations: a string description
 * followed by at least one expression.
 */
public abstract class IoInstruction extends Instruction {
    private final StringConstant description;
    private final List<Expr> expressions;

    IoInstruction(Position pos, Expr description, List<Expr> expressions) {
        super(pos);
        require(description, "description");
        if (!(description instanceof StringConstant)) {
            throw new StructuralInvariantViolation(
                getKind() + " description must be a string constant, got " + description);
        }
        require(expressions, "expression list");
        if (expressions.isEmpty()) {
            throw new StructuralInvariantViolation(getKind() + " expects at least one expression");
        }
        for (Expr e : expressions) {
            require(e, "expression");
        }
        this.description = (StringConstant) description;
        this.expressions = Collections.unmodifiableList(new ArrayList<Expr>(expressions));
    }

    public String getDescription() {
        return description.getValue();
    }

    public List<Expr> getExpressions() {
        return expressions;
    }

    public List<Expr> operands() {
        List<Expr> r = new ArrayList<Expr>();
        r.add(description);
        r.addAll(expressions);
        return r;
    }

    public String toString() {
        return getKind().toString().toLowerCase() + " " + description + " " + expressions;
    }
}
