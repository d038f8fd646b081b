package com.galois.bmc.cfg;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.galois.bmc.SymbolTable;

/**
 * A complete goto program: the symbol table, the functions and the name of
 * the entry point.
 */
public final class GotoModel {
    public static final String DEFAULT_ENTRY = "main";

    private final SymbolTable symbolTable;
    private final Map<String, GotoFunction> functions;
    private final String entryPoint;

    public GotoModel(SymbolTable symbolTable, Collection<GotoFunction> functions, String entryPoint) {
        this.symbolTable = symbolTable;
        Map<String, GotoFunction> m = new LinkedHashMap<String, GotoFunction>();
        for (GotoFunction f : functions) {
            if (m.put(f.getName(), f) != null) {
                throw new IllegalArgumentException("Duplicate function: " + f.getName());
            }
        }
        this.functions = Collections.unmodifiableMap(m);
        if (!m.containsKey(entryPoint)) {
            throw new IllegalArgumentException("Entry point " + entryPoint + " is not defined.");
        }
        this.entryPoint = entryPoint;
    }

    public GotoModel(SymbolTable symbolTable, Collection<GotoFunction> functions) {
        this(symbolTable, functions, DEFAULT_ENTRY);
    }

    public SymbolTable getSymbolTable() {
        return symbolTable;
    }

    public Map<String, GotoFunction> getFunctions() {
        return functions;
    }

    /** Return the named function or <code>null</code>. */
    public GotoFunction getFunction(String name) {
        return functions.get(name);
    }

    /** Return the loop with the given id, or <code>null</code>. */
    public Loop findLoop(String loopId) {
        for (GotoFunction f : functions.values()) {
            for (Loop l : f.getLoops()) {
                if (l.getId().equals(loopId)) return l;
            }
        }
        return null;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public GotoFunction getEntryFunction() {
        return functions.get(entryPoint);
    }

    /**
     * Whether any function spawns a thread.
     */
    public boolean hasConcurrency() {
        for (GotoFunction f : functions.values()) {
            for (Instruction i : f.getBody()) {
                if (i.getKind() == InstructionKind.START_THREAD) return true;
            }
        }
        return false;
    }

    /**
     * Validate all functions.
     *
     * @param full whether nested expressions are validated too.
     */
    public ValidationResult validate(boolean full) {
        ValidationResult r = new ValidationResult();
        for (GotoFunction f : functions.values()) {
            r.addAll(f.validate(symbolTable, full));
        }
        return r;
    }
}
