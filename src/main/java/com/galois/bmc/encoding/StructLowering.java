package com.galois.bmc.encoding;

import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.expr.ArrayLiteral;
import com.galois.bmc.expr.ArrayOf;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.ExprTransformer;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Member;
import com.galois.bmc.expr.MemberUpdate;
import com.galois.bmc.expr.Nondet;
import com.galois.bmc.expr.StructLiteral;
import com.galois.bmc.expr.Symbol;

/**
 * Rewrites expressions over structs into expressions over their flat
 * bitvector encodings.  Symbols keep their names and get the encoded
 * type; member selection becomes bit extraction and struct construction
 * becomes concatenation.  The result mentions no struct type.
 */
public final class StructLowering extends ExprTransformer {
    private final StructEncoding encoding;

    public StructLowering(StructEncoding encoding) {
        this.encoding = encoding;
    }

    public StructEncoding getEncoding() {
        return encoding;
    }

    public Expr visitSymbol(Symbol e) {
        if (!encoding.needsEncoding(e.type())) return e;
        return e.withType(encoding.encode(e.type()));
    }

    public Expr visitNondet(Nondet e) {
        if (!encoding.needsEncoding(e.type())) return e;
        return Exprs.nondet(encoding.encode(e.type()));
    }

    public Expr visitMember(Member e) {
        Expr c = transform(e.getCompound());
        FieldLayout f = encoding.layout(e.getCompound().type()).getField(e.getComponentName());
        if (f == null) {
            throw new IllegalArgumentException("No component " + e.getComponentName() + " in " + e);
        }
        return encoding.fromBits(Exprs.extract(c, f.getOffset(), f.getWidth()), f.getType());
    }

    public Expr visitMemberUpdate(MemberUpdate e) {
        Expr c = transform(e.getCompound());
        Expr v = transform(e.getValue());
        StructLayout layout = encoding.layout(e.getCompound().type());
        List<Expr> parts = new ArrayList<Expr>();
        List<FieldLayout> fields = layout.getFields();
        for (int i = fields.size() - 1; i >= 0; --i) {
            FieldLayout f = fields.get(i);
            if (f.getWidth() == 0) continue;
            if (f.getName().equals(e.getComponentName())) {
                parts.add(encoding.toBits(v, f.getType()));
            } else {
                parts.add(Exprs.extract(c, f.getOffset(), f.getWidth()));
            }
        }
        return concat(parts);
    }

    public Expr visitStructLiteral(StructLiteral e) {
        StructLayout layout = encoding.layout(e.type());
        List<Expr> values = e.operands();
        List<FieldLayout> fields = layout.getFields();
        List<Expr> parts = new ArrayList<Expr>();
        for (int i = fields.size() - 1; i >= 0; --i) {
            FieldLayout f = fields.get(i);
            if (f.getWidth() == 0) continue;
            parts.add(encoding.toBits(transform(values.get(i)), f.getType()));
        }
        return concat(parts);
    }

    private static Expr concat(List<Expr> parts) {
        if (parts.isEmpty()) return Exprs.constant(Type.bv(0), 0);
        if (parts.size() == 1 && parts.get(0).type().equals(Type.bv(parts.get(0).type().width()))) {
            return parts.get(0);
        }
        return Exprs.concat(parts);
    }

    public Expr visitArrayLiteral(ArrayLiteral e) {
        if (!encoding.needsEncoding(e.type())) return super.visitArrayLiteral(e);
        return Exprs.arrayLiteral(encoding.encode(e.type()), transform(e.operands()));
    }

    public Expr visitArrayOf(ArrayOf e) {
        if (!encoding.needsEncoding(e.type())) return super.visitArrayOf(e);
        return Exprs.arrayOf(encoding.encode(e.type()), transform(e.getValue()));
    }
}
