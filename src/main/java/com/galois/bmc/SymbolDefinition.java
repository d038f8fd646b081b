package com.galois.bmc;

import com.galois.bmc.expr.Expr;

/**
 * A variable or function symbol together with its attributes.
 */
public final class SymbolDefinition implements Typed {
    private final String name;
    private final Type type;
    private final boolean staticLifetime;
    private final boolean threadLocal;
    private final Expr value;

    /**
     * Create a symbol definition.
     *
     * @param name the identifier of the symbol.
     * @param type the type of the symbol.
     * @param staticLifetime whether the symbol lives for the whole program.
     * @param threadLocal whether each thread has its own copy.
     * @param value the initial value, or <code>null</code> for none.
     */
    public SymbolDefinition(String name, Type type, boolean staticLifetime,
                            boolean threadLocal, Expr value) {
        if (name == null) throw new NullPointerException("name");
        if (type == null) throw new NullPointerException("type");
        if (value != null && !value.type().equals(type)) {
            throw new IllegalArgumentException(
                "Initial value of " + name + " has type " + value.type()
                + " but symbol has type " + type);
        }
        this.name = name;
        this.type = type;
        this.staticLifetime = staticLifetime;
        this.threadLocal = threadLocal;
        this.value = value;
    }

    public String getName() {
        return name;
    }

    public Type type() {
        return type;
    }

    public boolean isStaticLifetime() {
        return staticLifetime;
    }

    public boolean isThreadLocal() {
        return threadLocal;
    }

    /**
     * A static, non thread-local variable visible to every thread.
     */
    public boolean isShared() {
        return staticLifetime && !threadLocal && !type.isCode();
    }

    public Expr getValue() {
        return value;
    }

    public String toString() {
        return name + " : " + type;
    }
}
