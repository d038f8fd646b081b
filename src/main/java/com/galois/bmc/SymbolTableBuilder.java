package com.galois.bmc;

import java.util.LinkedHashMap;
import java.util.Map;

import com.galois.bmc.expr.Expr;

/**
 * Collects symbols while a program is being translated.  Once translation is
 * complete, {@link #build()} hands an immutable {@link SymbolTable} to the
 * downstream components.
 */
public final class SymbolTableBuilder {
    private final Map<String, Type> types = new LinkedHashMap<String, Type>();
    private final Map<String, SymbolDefinition> symbols = new LinkedHashMap<String, SymbolDefinition>();
    private boolean finalized = false;

    private void checkOpen() {
        if (finalized) {
            throw new IllegalStateException("Symbol table has already been finalized.");
        }
    }

    /**
     * Register a struct type under a tag.
     *
     * @param tag the tag name.
     * @param type a struct type.
     * @return the tag type referring to the definition.
     */
    public Type addStruct(String tag, Type type) {
        checkOpen();
        if (!type.isStruct()) {
            throw new IllegalArgumentException("Tag " + tag + " must name a struct type.");
        }
        if (types.containsKey(tag)) {
            throw new IllegalArgumentException("Duplicate type tag: " + tag);
        }
        types.put(tag, type);
        return Type.structTag(tag);
    }

    public SymbolTableBuilder add(SymbolDefinition def) {
        checkOpen();
        if (symbols.containsKey(def.getName())) {
            throw new IllegalArgumentException("Duplicate symbol: " + def.getName());
        }
        symbols.put(def.getName(), def);
        return this;
    }

    /**
     * Add a shared global variable.
     */
    public SymbolTableBuilder addGlobal(String name, Type type, Expr value) {
        return add(new SymbolDefinition(name, type, true, false, value));
    }

    /**
     * Add a thread-local global variable.
     */
    public SymbolTableBuilder addThreadLocal(String name, Type type, Expr value) {
        return add(new SymbolDefinition(name, type, true, true, value));
    }

    /**
     * Add a local variable or parameter.
     */
    public SymbolTableBuilder addLocal(String name, Type type) {
        return add(new SymbolDefinition(name, type, false, false, null));
    }

    public SymbolTableBuilder addFunction(String name, Type codeType) {
        if (!codeType.isCode()) {
            throw new IllegalArgumentException("Function " + name + " must have code type.");
        }
        return add(new SymbolDefinition(name, codeType, true, false, null));
    }

    public boolean contains(String name) {
        return symbols.containsKey(name);
    }

    /**
     * Produce the immutable symbol table.  The builder cannot be used
     * afterwards.
     */
    public SymbolTable build() {
        checkOpen();
        finalized = true;
        return new SymbolTable(types, symbols);
    }
}
