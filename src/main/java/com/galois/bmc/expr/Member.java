package com.galois.bmc.expr;

import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/** Selection of a named component of a struct value. */
public final class Member extends Expr {
    private final Expr compound;
    private final String name;

    Member(Expr compound, String name, Type type) {
        super(type);
        if (!compound.type().isStruct() && !compound.type().isStructTag())
            throw new IllegalArgumentException("member expects a struct operand, got " + compound.type());
        if (name == null) throw new NullPointerException("name");
        this.compound = compound;
        this.name = name;
    }

    public Expr getCompound() {
        return compound;
    }

    public String getComponentName() {
        return name;
    }

    public List<Expr> operands() {
        return Collections.singletonList(compound);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 1, "member");
        return new Member(ops.get(0), name, type());
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitMember(this);
    }

    boolean sameAttributes(Expr o) {
        return name.equals(((Member) o).name);
    }

    int attributesHash() {
        return name.hashCode();
    }

    public String toString() {
        return compound + "." + name;
    }
}
