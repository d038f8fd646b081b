package com.galois.bmc.expr;

import java.util.Arrays;
import java.util.List;

import com.galois.bmc.Type;

/** Selection of an array element. */
public final class Index extends Expr {
    private final Expr array;
    private final Expr index;

    Index(Expr array, Expr index) {
        super(elementType(array));
        if (!index.type().isBitvector())
            throw new IllegalArgumentException("index expects a bitvector index, got " + index.type());
        this.array = array;
        this.index = index;
    }

    static Type elementType(Expr array) {
        if (!array.type().isArray())
            throw new IllegalArgumentException("index expects an array operand, got " + array.type());
        return array.type().arrayElementType();
    }

    public Expr getArray() {
        return array;
    }

    public Expr getIndex() {
        return index;
    }

    public List<Expr> operands() {
        return Arrays.asList(array, index);
    }

    public Expr withOperands(List<Expr> ops) {
        checkArity(ops, 2, "index");
        return new Index(ops.get(0), ops.get(1));
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitIndex(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        return array + "[" + index + "]";
    }
}
