package com.galois.bmc.expr;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.Type;

/**
 * Concatenation of bitvectors.  The first operand provides the most
 * significant bits.
 */
public final class Concat extends Expr {
    private final List<Expr> parts;

    Concat(List<Expr> parts) {
        super(Type.bv(totalWidth(parts)));
        this.parts = Collections.unmodifiableList(new ArrayList<Expr>(parts));
    }

    private static long totalWidth(List<Expr> parts) {
        long w = 0;
        for (Expr e : parts) {
            if (!e.type().isBitvector())
                throw new IllegalArgumentException("concat expects bitvector arguments, got " + e.type());
            w += e.type().width();
        }
        return w;
    }

    public List<Expr> operands() {
        return parts;
    }

    public Expr withOperands(List<Expr> ops) {
        return new Concat(ops);
    }

    public <R> R accept(ExprVisitor<R> v) {
        return v.visitConcat(this);
    }

    boolean sameAttributes(Expr o) {
        return true;
    }

    int attributesHash() {
        return 0;
    }

    public String toString() {
        StringBuilder b = new StringBuilder("concat(");
        for (int i = 0; i != parts.size(); ++i) {
            if (i > 0) b.append(", ");
            b.append(parts.get(i));
        }
        return b.append(")").toString();
    }
}
