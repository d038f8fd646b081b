package com.galois.bmc.encoding;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.BmcFailedException;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;
import com.galois.bmc.expr.ArrayLiteral;
import com.galois.bmc.expr.ArrayOf;
import com.galois.bmc.expr.BoolConstant;
import com.galois.bmc.expr.BvConstant;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;

/**
 * Flattens struct types into raw bitvectors.
 *
 * <p>
 * A struct encodes to a bitvector whose width is the sum of the widths of
 * its components, laid out in declaration order starting at the least
 * significant bit.  Booleans occupy one bit, and an array component of
 * constant size <code>n</code> occupies <code>n</code> times the width of
 * its element.  Arrays encode to arrays of encoded elements with the size
 * expression copied.  All other types are left unchanged.
 *
 * <p>
 * Results are memoised in the {@link EncodingCache} supplied by the caller.
 */
public final class StructEncoding {
    private final SymbolTable ns;
    private final EncodingCache cache;

    public StructEncoding(SymbolTable ns, EncodingCache cache) {
        if (ns == null) throw new NullPointerException("ns");
        if (cache == null) throw new NullPointerException("cache");
        this.ns = ns;
        this.cache = cache;
    }

    public StructEncoding(SymbolTable ns) {
        this(ns, new EncodingCache());
    }

    public SymbolTable getSymbolTable() {
        return ns;
    }

    /**
     * Whether values of this type are changed by the encoding.
     */
    public boolean needsEncoding(Type t) {
        if (t.isStruct() || t.isStructTag()) return true;
        if (t.isArray()) return needsEncoding(t.arrayElementType());
        return false;
    }

    /**
     * Return the encoded form of a type.
     *
     * @throws com.galois.bmc.UnknownTypeTagException if a struct tag has no
     *   definition.
     */
    public Type encode(Type t) {
        if (!needsEncoding(t)) return t;
        Type r = cache.encoded.get(t);
        if (r == null) {
            if (t.isArray()) {
                r = Type.array(encode(t.arrayElementType()), t.arraySize());
            } else {
                r = Type.bv(width(t));
            }
            cache.encoded.put(t, r);
        }
        return r;
    }

    /**
     * Number of bits a value of this type occupies inside a struct encoding.
     */
    public long width(Type t) {
        if (t.isBool()) return 1;
        if (t.isBitvector()) return t.width();
        Long w = cache.widths.get(t);
        if (w != null) return w;
        long r;
        if (t.isStructTag()) {
            r = width(ns.lookupTag(t.tag()));
        } else if (t.isStruct()) {
            r = 0;
            for (Type.Component c : t.components()) {
                r += width(c.getType());
            }
        } else if (t.isArray()) {
            long n = t.constantArraySize();
            if (n < 0) {
                throw new BmcFailedException("Cannot flatten array of non-constant size: " + t);
            }
            r = n * width(t.arrayElementType());
        } else {
            throw new BmcFailedException("Type " + t + " has no bit-level encoding.");
        }
        cache.widths.put(t, r);
        return r;
    }

    /**
     * Return the field map of a struct or struct tag type.
     */
    public StructLayout layout(Type t) {
        StructLayout l = cache.layouts.get(t);
        if (l != null) return l;
        Type st = ns.follow(t);
        if (!st.isStruct()) {
            throw new IllegalArgumentException("Expected struct type, got " + t);
        }
        List<FieldLayout> fields = new ArrayList<FieldLayout>();
        long offset = 0;
        for (Type.Component c : st.components()) {
            long w = width(c.getType());
            fields.add(new FieldLayout(c.getName(), c.getType(), encode(c.getType()),
                                       offset, w, c.isPadding()));
            offset += w;
        }
        l = new StructLayout(fields, offset);
        cache.layouts.put(t, l);
        return l;
    }

    /**
     * Convert a value of an encoded field type into raw bits.
     */
    Expr toBits(Expr v, Type fieldType) {
        long w = width(fieldType);
        Type ft = ns.follow(fieldType);
        if (ft.isBool()) {
            return Exprs.ite(v, Exprs.constant(Type.bv(1), 1), Exprs.constant(Type.bv(1), 0));
        }
        if (ft.isBitvector()) {
            return Exprs.typecast(v, Type.bv(w));
        }
        if (ft.isStruct()) {
            return v;
        }
        // Array of constant size: element 0 in the low bits.
        long n = ft.constantArraySize();
        List<Expr> parts = new ArrayList<Expr>();
        for (long i = n - 1; i >= 0; --i) {
            parts.add(toBits(Exprs.index(v, i), ft.arrayElementType()));
        }
        if (parts.isEmpty()) {
            return Exprs.constant(Type.bv(0), 0);
        }
        return Exprs.concat(parts);
    }

    /**
     * Convert raw bits into a value of the encoded field type.
     */
    Expr fromBits(Expr bits, Type fieldType) {
        Type ft = ns.follow(fieldType);
        if (ft.isBool()) {
            return Exprs.eq(bits, Exprs.constant(Type.bv(1), 1));
        }
        if (ft.isBitvector()) {
            return Exprs.typecast(bits, ft);
        }
        if (ft.isStruct()) {
            return bits;
        }
        long n = ft.constantArraySize();
        long ew = width(ft.arrayElementType());
        List<Expr> elems = new ArrayList<Expr>();
        for (long i = 0; i != n; ++i) {
            elems.add(fromBits(Exprs.extract(bits, i * ew, ew), ft.arrayElementType()));
        }
        return Exprs.arrayLiteral(encode(fieldType), elems);
    }

    /**
     * Rebuild a value of type <code>t</code> from a constant of type
     * <code>encode(t)</code>.  Bitvector encodings of structs become struct
     * literals; arrays are decoded element by element.
     */
    public Expr decode(Type t, Expr v) {
        if (!needsEncoding(t)) return v;
        Type rt = ns.follow(t);
        if (rt.isStruct()) {
            if (!(v instanceof BvConstant)) return v;
            BigInteger bits = ((BvConstant) v).getValue();
            List<Expr> values = new ArrayList<Expr>();
            for (FieldLayout f : layout(t).getFields()) {
                BigInteger fb = bits.shiftRight((int) f.getOffset());
                values.add(decodeBits(f.getType(), fb, f.getWidth()));
            }
            return Exprs.structLiteral(ns, t, values);
        }
        if (v instanceof ArrayLiteral) {
            List<Expr> elems = new ArrayList<Expr>();
            for (Expr e : v.operands()) {
                elems.add(decode(rt.arrayElementType(), e));
            }
            return Exprs.arrayLiteral(t, elems);
        }
        if (v instanceof ArrayOf) {
            return Exprs.arrayOf(t, decode(rt.arrayElementType(), ((ArrayOf) v).getValue()));
        }
        return v;
    }

    private Expr decodeBits(Type fieldType, BigInteger bits, long width) {
        BigInteger mask = BigInteger.ONE.shiftLeft((int) width).subtract(BigInteger.ONE);
        BigInteger b = bits.and(mask);
        Type ft = ns.follow(fieldType);
        if (ft.isBool()) {
            return BoolConstant.of(b.signum() != 0);
        }
        if (ft.isBitvector()) {
            return Exprs.constant(ft, b);
        }
        if (ft.isStruct()) {
            return decode(fieldType, Exprs.constant(Type.bv(width), b));
        }
        long n = ft.constantArraySize();
        long ew = width(ft.arrayElementType());
        List<Expr> elems = new ArrayList<Expr>();
        for (long i = 0; i != n; ++i) {
            elems.add(decodeBits(ft.arrayElementType(), b.shiftRight((int) (i * ew)), ew));
        }
        return Exprs.arrayLiteral(fieldType, elems);
    }
}
