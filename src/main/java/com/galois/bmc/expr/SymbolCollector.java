package com.galois.bmc.expr;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Collects the symbols occurring in expressions.
 */
public final class SymbolCollector {
    private final Set<Symbol> symbols = new LinkedHashSet<Symbol>();

    public SymbolCollector add(Expr e) {
        if (e == null) return this;
        if (e instanceof Symbol) {
            symbols.add((Symbol) e);
            return this;
        }
        for (Expr o : e.operands()) {
            add(o);
        }
        return this;
    }

    public Set<Symbol> getSymbols() {
        return symbols;
    }

    /**
     * Return the symbols occurring in <code>e</code> in order of first
     * occurrence.
     */
    public static Set<Symbol> collect(Expr e) {
        return new SymbolCollector().add(e).getSymbols();
    }

    /** Whether any symbol of <code>e</code> is in <code>names</code>. */
    public static boolean mentionsAny(Expr e, Set<Symbol> names) {
        if (e == null) return false;
        if (e instanceof Symbol) return names.contains(e);
        for (Expr o : e.operands()) {
            if (mentionsAny(o, names)) return true;
        }
        return false;
    }
}
