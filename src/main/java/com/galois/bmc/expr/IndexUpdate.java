package com.galois.bmc.expr;

import java.util.Arrays;
import java.util.List;

/** An array equal to another except at one index. */
public final class IndexUpdate extends Expr {
    private final Expr array;
    private final Expr index;
    private final Expr value;

    IndexUpdate(Expr array, Expr index, Expr value) {
        super(array.type());
        if (!Index.elementType(array).equals(value.type()))
            throw new IllegalArgumentException(
                "index update expects a value of type " + array.type().arrayElementType()
                + ", got " + value.type());
        if (!index.type().isBitvector())
            throw new IllegalArgumentException("index update expects a bitvector index, got " + index.type());
        this.array = array;
        this.index = index;
        this.value = value;
    }

    public Expr getArray() {
        return array;
    }

    public Expr getIndex() {
        return index;
    }

    public Expr getValue() {
        return value;
    }

    public List<Expr> operands() {
        return Arrays.asList(array, index, value);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 3, "index update");
        return new IndexUpdate(ops.get(0), ops.get(1), ops.get(2));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitIndexUpdate(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        return array + " with [" + index + "] := " + value;
    }
}
