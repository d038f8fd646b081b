package com.galois.bmc.expr;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;

/**
 * Type-checked constructors for expressions.
 *
 * <p>
 * Every method checks its operand types and throws
 * <code>IllegalArgumentException</code> when they do not fit the operator.
 * No simplification is performed; see {@link Simplifier}.
 */
public final class Exprs {
    private Exprs() {}

    public static final BoolConstant TRUE = BoolConstant.TRUE;
    public static final BoolConstant FALSE = BoolConstant.FALSE;

    public static BoolConstant bool(boolean b) {
        return BoolConstant.of(b);
    }

    public static BvConstant constant(Type type, long value) {
        return new BvConstant(type, value);
    }

    public static BvConstant constant(Type type, BigInteger value) {
        return new BvConstant(type, value);
    }

    public static Symbol symbol(String name, Type type) {
        return new Symbol(name, type);
    }

    public static StringConstant string(String value) {
        return new StringConstant(value);
    }

    public static Nondet nondet(Type type) {
        return new Nondet(type);
    }

    /** Complement Boolean value. */
    public static Expr not(Expr x) {
        return new UnaryExpr(UnaryExpr.Op.NOT, x);
    }

    /** Two's complement negation. */
    public static Expr neg(Expr x) {
        return new UnaryExpr(UnaryExpr.Op.NEG, x);
    }

    public static Expr bitNot(Expr x) {
        return new UnaryExpr(UnaryExpr.Op.BITNOT, x);
    }

    public static Expr binary(BinaryExpr.Op op, Expr x, Expr y) {
        return new BinaryExpr(op, x, y);
    }

    /** And two Boolean values. */
    public static Expr and(Expr x, Expr y) {
        return binary(BinaryExpr.Op.AND, x, y);
    }

    /**
     * Conjunction of a list of Boolean values; <code>true</code> when the
     * list is empty.
     */
    public static Expr and(List<Expr> xs) {
        if (xs.isEmpty()) return TRUE;
        Expr r = xs.get(0);
        for (int i = 1; i < xs.size(); ++i) {
            r = and(r, xs.get(i));
        }
        return r;
    }

    /** Inclusive-or of two Boolean values. */
    public static Expr or(Expr x, Expr y) {
        return binary(BinaryExpr.Op.OR, x, y);
    }

    /**
     * Disjunction of a list of Boolean values; <code>false</code> when the
     * list is empty.
     */
    public static Expr or(List<Expr> xs) {
        if (xs.isEmpty()) return FALSE;
        Expr r = xs.get(0);
        for (int i = 1; i < xs.size(); ++i) {
            r = or(r, xs.get(i));
        }
        return r;
    }

    public static Expr implies(Expr x, Expr y) {
        return binary(BinaryExpr.Op.IMPLIES, x, y);
    }

    /** Exclusive-or of two Boolean values. */
    public static Expr xor(Expr x, Expr y) {
        return binary(BinaryExpr.Op.XOR, x, y);
    }

    public static Expr eq(Expr x, Expr y) {
        return binary(BinaryExpr.Op.EQ, x, y);
    }

    public static Expr ne(Expr x, Expr y) {
        return binary(BinaryExpr.Op.NE, x, y);
    }

    public static Expr lt(Expr x, Expr y) {
        return binary(BinaryExpr.Op.LT, x, y);
    }

    public static Expr le(Expr x, Expr y) {
        return binary(BinaryExpr.Op.LE, x, y);
    }

    public static Expr gt(Expr x, Expr y) {
        return binary(BinaryExpr.Op.GT, x, y);
    }

    public static Expr ge(Expr x, Expr y) {
        return binary(BinaryExpr.Op.GE, x, y);
    }

    public static Expr plus(Expr x, Expr y) {
        return binary(BinaryExpr.Op.PLUS, x, y);
    }

    public static Expr minus(Expr x, Expr y) {
        return binary(BinaryExpr.Op.MINUS, x, y);
    }

    public static Expr mult(Expr x, Expr y) {
        return binary(BinaryExpr.Op.MULT, x, y);
    }

    public static Expr div(Expr x, Expr y) {
        return binary(BinaryExpr.Op.DIV, x, y);
    }

    public static Expr mod(Expr x, Expr y) {
        return binary(BinaryExpr.Op.MOD, x, y);
    }

    public static Expr bitAnd(Expr x, Expr y) {
        return binary(BinaryExpr.Op.BITAND, x, y);
    }

    public static Expr bitOr(Expr x, Expr y) {
        return binary(BinaryExpr.Op.BITOR, x, y);
    }

    public static Expr bitXor(Expr x, Expr y) {
        return binary(BinaryExpr.Op.BITXOR, x, y);
    }

    public static Expr shl(Expr x, Expr y) {
        return binary(BinaryExpr.Op.SHL, x, y);
    }

    /** Right shift; arithmetic for signed operands, logical otherwise. */
    public static Expr shr(Expr x, Expr y) {
        return binary(BinaryExpr.Op.SHR, x, y);
    }

    /**
     * if-then-else applied to values with the same type.
     */
    public static Expr ite(Expr c, Expr x, Expr y) {
        return new Ite(c, x, y);
    }

    /**
     * Select a component of a struct whose type is given directly.
     */
    public static Expr member(Expr compound, String name) {
        if (!compound.type().isStruct())
            throw new IllegalArgumentException("member expects a struct operand, got " + compound.type());
        return new Member(compound, name, componentType(compound.type(), name));
    }

    /**
     * Select a component of a struct, resolving tags in <code>ns</code>.
     */
    public static Expr member(SymbolTable ns, Expr compound, String name) {
        return new Member(compound, name, componentType(ns.follow(compound.type()), name));
    }

    public static Expr memberUpdate(SymbolTable ns, Expr compound, String name, Expr value) {
        Type t = componentType(ns.follow(compound.type()), name);
        if (!t.equals(value.type()))
            throw new IllegalArgumentException(
                "member update of " + name + " expects a value of type " + t + ", got " + value.type());
        return new MemberUpdate(compound, name, value);
    }

    private static Type componentType(Type struct, String name) {
        if (!struct.isStruct())
            throw new IllegalArgumentException("member expects a struct operand, got " + struct);
        Type.Component c = struct.component(name);
        if (c == null)
            throw new IllegalArgumentException("struct has no component " + name);
        return c.getType();
    }

    public static Expr index(Expr array, Expr index) {
        return new Index(array, index);
    }

    public static Expr index(Expr array, long index) {
        return new Index(array, constant(indexType(array), index));
    }

    /** Type used to index an array: the type of its size expression. */
    public static Type indexType(Expr array) {
        if (!array.type().isArray())
            throw new IllegalArgumentException("index expects an array operand, got " + array.type());
        return array.type().arraySize().type();
    }

    public static Expr indexUpdate(Expr array, Expr index, Expr value) {
        return new IndexUpdate(array, index, value);
    }

    public static Expr structLiteral(SymbolTable ns, Type type, List<Expr> values) {
        Type resolved = ns.follow(type);
        // Check against the definition; the literal keeps the tag.
        new StructLiteral(resolved, values);
        return new StructLiteral(type, values);
    }

    public static Expr structLiteral(Type type, Expr... values) {
        return new StructLiteral(type, Arrays.asList(values));
    }

    public static Expr arrayLiteral(Type type, List<Expr> values) {
        return new ArrayLiteral(type, values);
    }

    public static Expr arrayOf(Type type, Expr value) {
        return new ArrayOf(type, value);
    }

    public static Expr typecast(Expr x, Type type) {
        if (x.type().equals(type)) return x;
        return new Typecast(x, type);
    }

    public static Expr extract(Expr x, long low, long width) {
        return new Extract(x, low, width);
    }

    public static Expr concat(List<Expr> parts) {
        return new Concat(parts);
    }

    /**
     * The zero value of a type: <code>false</code>, bitvector zero, or an
     * aggregate of zeros.
     */
    public static Expr zero(SymbolTable ns, Type type) {
        Type t = ns.follow(type);
        if (t.isBool()) return FALSE;
        if (t.isBitvector()) return constant(t, 0);
        if (t.isStruct()) {
            List<Expr> values = new ArrayList<Expr>();
            for (Type.Component c : t.components()) {
                values.add(zero(ns, c.getType()));
            }
            return new StructLiteral(type, values);
        }
        if (t.isArray()) {
            return new ArrayOf(t, zero(ns, t.arrayElementType()));
        }
        throw new IllegalArgumentException("Type " + type + " has no zero value.");
    }
}
