package com.galois.bmc.cfg;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Symbol;

/**
 * Spawn a thread running a function without arguments.
 */
public final class StartThread extends Instruction {
    private final Expr function;

    public StartThread(Position pos, Expr function) {
        super(pos);
        this.function = require(function, "thread function");
    }

    public Expr getFunction() {
        return function;
    }

    public String getFunctionName() {
        return ((Symbol) function).getName();
    }

    public InstructionKind getKind() {
        return InstructionKind.START_THREAD;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitStartThread(this);
    }

    public List<Expr> operands() {
        return Collections.singletonList(function);
    }

    public ValidationResult check() {
        ValidationResult r = super.check();
        if (!(function instanceof Symbol)) {
            r.add(ValidationError.Kind.OPERAND_KIND, getPosition(),
                  "thread function must be a symbol, got " + function);
        }
        if (!function.type().isCode() || function.type().getCodeParameterCount() != 0) {
            r.add(ValidationError.Kind.OPERAND_KIND, getPosition(),
                  "thread function must have code type without parameters, got " + function.type());
        }
        return r;
    }

    public String toString() {
        return "start_thread " + function;
    }
}
