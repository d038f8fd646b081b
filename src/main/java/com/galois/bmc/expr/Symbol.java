package com.galois.bmc.expr;

import java.util.List;

import com.galois.bmc.Type;

/**
 * A reference to a program variable.
 *
 * <p>
 * Symbols carry two optional renaming levels used by symbolic execution.
 * Level 1 distinguishes the instances of a local variable in different
 * function frames; level 2 is the SSA version.  The printed identifier of
 * <code>x</code> in frame 3 at version 2 is <code>x!3#2</code>.
 */
public final class Symbol extends Expr {
    private final String name;
    private final int frame;
    private final int version;

    /**
     * Create an unrenamed symbol.
     */
    public Symbol(String name, Type type) {
        this(name, type, -1, -1);
    }

    Symbol(String name, Type type, int frame, int version) {
        super(type);
        if (name == null) throw new NullPointerException("name");
        this.name = name;
        this.frame = frame;
        this.version = version;
    }

    /** Name of the variable before any renaming. */
    public String getName() {
        return name;
    }

    /** Frame number, or <code>-1</code> when not renamed at level 1. */
    public int getFrame() {
        return frame;
    }

    /** SSA version, or <code>-1</code> when not renamed at level 2. */
    public int getVersion() {
        return version;
    }

    public Symbol withFrame(int frame) {
        return new Symbol(name, type(), frame, version);
    }

    public Symbol withVersion(int version) {
        return new Symbol(name, type(), frame, version);
    }

    public Symbol withType(Type type) {
        return new Symbol(name, type, frame, version);
    }

    /** Drop the SSA version. */
    public Symbol level1() {
        return version < 0 ? this : new Symbol(name, type(), frame, -1);
    }

    /** Drop both renaming levels. */
    public Symbol level0() {
        return (frame < 0 && version < 0) ? this : new Symbol(name, type());
    }

    /**
     * Identifier including the frame but not the version.
     */
    public String getL1Identifier() {
        return frame < 0 ? name : name + "!" + frame;
    }

    public String getIdentifier() {
        String id = getL1Identifier();
        return version < 0 ? id : id + "#" + version;
    }

    public boolean isConstant() {
        return false;
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 0, "symbol");
        return this;
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitSymbol(this);
    }

    boolean sameAttributes(Expr o) {
        Symbol other = (Symbol) o;
        return name.equals(other.name)
            && frame == other.frame
            && version == other.version;
    }

    int attributesHash() {
        return (name.hashCode() * 31 + frame) * 31 + version;
    }

    public String toString() {
        return getIdentifier();
    }
}
