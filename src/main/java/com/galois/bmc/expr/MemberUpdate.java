package com.galois.bmc.expr;

import java.util.Arrays;
import java.util.List;

/** A struct value equal to another except for one component. */
public final class MemberUpdate extends Expr {
    private final Expr compound;
    private final String name;
    private final Expr value;

    MemberUpdate(Expr compound, String name, Expr value) {
        super(compound.type());
        if (!compound.type().isStruct() && !compound.type().isStructTag())
            throw new IllegalArgumentException("member update expects a struct operand, got " + compound.type());
        if (name == null) throw new NullPointerException("name");
        this.compound = compound;
        this.name = name;
        this.value = value;
    }

    public Expr getCompound() {
        return compound;
    }

    public String getComponentName() {
        return name;
    }

    public Expr getValue() {
        return value;
    }

    public List<Expr> operands() {
        return Arrays.asList(compound, value);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 2, "member update");
        return new MemberUpdate(ops.get(0), name, ops.get(1));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitMemberUpdate(this);
    }

    boolean sameAttributes(Expr o) {
        return name.equals(((MemberUpdate) o).name);
    }

    int attributesHash() {
        return name.hashCode();
    }

    public String toString() {
        return compound + " with ." + name + " := " + value;
    }
}
