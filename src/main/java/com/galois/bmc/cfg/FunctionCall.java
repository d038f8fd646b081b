package com.galois.bmc.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.SymbolDefinition;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Symbol;

/**
 * Call of a function, optionally assigning the returned value.
 */
public final class FunctionCall extends Instruction {
    private final Expr lhs;
    private final Expr function;
    private final List<Expr> arguments;

    /**
     * @param pos position of the call.
     * @param lhs target of the returned value, or <code>null</code>.
     * @param function the called function.
     * @param arguments the actual arguments.
     */
    public FunctionCall(Position pos, Expr lhs, Expr function, List<Expr> arguments) {
        super(pos);
        this.lhs = lhs;
        this.function = require(function, "called function");
        require(arguments, "argument list");
        for (Expr a : arguments) {
            require(a, "argument");
        }
        this.arguments = Collections.unmodifiableList(new ArrayList<Expr>(arguments));
    }

    public Expr getLhs() {
        return lhs;
    }

    public Expr getFunction() {
        return function;
    }

    /**
     * Name of the called function.
     */
    public String getFunctionName() {
        return ((Symbol) function).getName();
    }

    public List<Expr> getArguments() {
        return arguments;
    }

    public FunctionCall withArguments(List<Expr> args) {
        return new FunctionCall(getPosition(), lhs, function, args);
    }

    public InstructionKind getKind() {
        return InstructionKind.FUNCTION_CALL;
    }

    public <R> R accept(InstructionVisitor<R> v) {
        return v.visitFunctionCall(this);
    }

    public List<Expr> operands() {
        List<Expr> r = new ArrayList<Expr>();
        if (lhs != null) r.add(lhs);
        r.add(function);
        r.addAll(arguments);
        return r;
    }

    public ValidationResult check() {
        ValidationResult r = super.check();
        if (lhs != null) {
            checkLvalue(lhs, "call target", r);
        }
        if (!(function instanceof Symbol)) {
            r.add(ValidationError.Kind.OPERAND_KIND, getPosition(),
                  "called function must be a symbol, got " + function);
        }
        Type t = function.type();
        if (!t.isCode()) {
            r.add(ValidationError.Kind.OPERAND_KIND, getPosition(),
                  "called function must have code type, got " + t);
        } else if (t.getCodeParameterCount() != arguments.size()) {
            r.add(ValidationError.Kind.ARITY, getPosition(),
                  "function expects " + t.getCodeParameterCount()
                  + " arguments, got " + arguments.size());
        }
        return r;
    }

    public ValidationResult validate(SymbolTable ns) {
        ValidationResult r = check();
        Type t = function.type();
        if (!t.isCode()) return r;
        if (lhs != null && !lhs.type().equals(t.getCodeReturnType())) {
            r.add(ValidationError.Kind.TYPE_MISMATCH, getPosition(),
                  "call target has type " + lhs.type()
                  + " but the function returns " + t.getCodeReturnType());
        }
        int n = Math.min(arguments.size(), t.getCodeParameterCount());
        for (int i = 0; i != n; ++i) {
            if (!arguments.get(i).type().equals(t.getCodeParameterType(i))) {
                r.add(ValidationError.Kind.TYPE_MISMATCH, getPosition(),
                      "argument " + i + " has type " + arguments.get(i).type()
                      + " but parameter has type " + t.getCodeParameterType(i));
            }
        }
        if (function instanceof Symbol) {
            SymbolDefinition def = ns.lookup(((Symbol) function).getName());
            if (def != null && !def.type().equals(t)) {
                r.add(ValidationError.Kind.TYPE_MISMATCH, getPosition(),
                      "function " + def.getName() + " declared with type " + def.type());
            }
        }
        return r;
    }

    public String toString() {
        return (lhs == null ? "" : lhs + " := ") + function + arguments;
    }
}
