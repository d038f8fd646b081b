package com.galois.bmc;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An immutable mapping from names to symbols and from tags to struct types.
 * Instances are produced by {@link SymbolTableBuilder#build()}.
 */
public final class SymbolTable {
    private final Map<String, Type> types;
    private final Map<String, SymbolDefinition> symbols;

    SymbolTable(Map<String, Type> types, Map<String, SymbolDefinition> symbols) {
        this.types = Collections.unmodifiableMap(new LinkedHashMap<String, Type>(types));
        this.symbols = Collections.unmodifiableMap(new LinkedHashMap<String, SymbolDefinition>(symbols));
    }

    /**
     * Return the struct type registered under <code>tag</code>.
     *
     * @throws UnknownTypeTagException if the tag is not defined.
     */
    public Type lookupTag(String tag) {
        Type t = types.get(tag);
        if (t == null) {
            throw new UnknownTypeTagException(tag);
        }
        return t;
    }

    public boolean hasTag(String tag) {
        return types.containsKey(tag);
    }

    /**
     * Resolve struct tags until a type that is not a tag is reached.
     */
    public Type follow(Type t) {
        int steps = 0;
        while (t.isStructTag()) {
            t = lookupTag(t.tag());
            if (++steps > types.size()) {
                throw new BmcFailedException("Cyclic type tag: " + t);
            }
        }
        return t;
    }

    /**
     * Return the symbol with the given name or <code>null</code>.
     */
    public SymbolDefinition lookup(String name) {
        return symbols.get(name);
    }

    public Collection<SymbolDefinition> getSymbols() {
        return symbols.values();
    }

    public Map<String, Type> getTypes() {
        return types;
    }
}
