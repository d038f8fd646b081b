package com.galois.bmc.expr;

import java.util.List;

import com.galois.bmc.SymbolDefinition;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;
import com.galois.bmc.UnknownTypeTagException;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.cfg.ValidationError;
import com.galois.bmc.cfg.ValidationResult;

/**
 * Recursive validation of an expression against a symbol table.  Problems
 * are added to a {@link ValidationResult}; nothing is thrown.
 */
public final class ExprValidator {
    private final SymbolTable ns;
    private final Position pos;
    private final ValidationResult result;

    public ExprValidator(SymbolTable ns, Position pos, ValidationResult result) {
        this.ns = ns;
        this.pos = pos;
        this.result = result;
    }

    public static ValidationResult validate(Expr e, SymbolTable ns, Position pos) {
        ValidationResult r = new ValidationResult();
        new ExprValidator(ns, pos, r).validate(e);
        return r;
    }

    public void validate(Expr e) {
        validateType(e.type());
        for (Expr o : e.operands()) {
            validate(o);
        }
        if (e instanceof Symbol) {
            validateSymbol((Symbol) e);
        } else if (e instanceof Member) {
            Member m = (Member) e;
            checkComponent(m.getCompound().type(), m.getComponentName(), m.type(), e);
        } else if (e instanceof MemberUpdate) {
            MemberUpdate m = (MemberUpdate) e;
            checkComponent(m.getCompound().type(), m.getComponentName(), m.getValue().type(), e);
        } else if (e instanceof StructLiteral) {
            validateStructLiteral(e);
        }
    }

    private void validateSymbol(Symbol s) {
        if (s.getFrame() >= 0 || s.getVersion() >= 0) return;
        SymbolDefinition def = ns.lookup(s.getName());
        if (def == null) {
            result.add(ValidationError.Kind.UNKNOWN_SYMBOL, pos,
                       "symbol " + s.getName() + " is not defined");
        } else if (!def.type().equals(s.type())) {
            result.add(ValidationError.Kind.TYPE_MISMATCH, pos,
                       "symbol " + s.getName() + " used with type " + s.type()
                       + " but declared with type " + def.type());
        }
    }

    private Type resolve(Type t) {
        try {
            return ns.follow(t);
        } catch (UnknownTypeTagException ex) {
            result.add(ValidationError.Kind.UNKNOWN_TYPE_TAG, pos, ex.getMessage());
            return null;
        }
    }

    private void checkComponent(Type compound, String name, Type expected, Expr e) {
        Type st = resolve(compound);
        if (st == null) return;
        Type.Component c = st.isStruct() ? st.component(name) : null;
        if (c == null) {
            result.add(ValidationError.Kind.MALFORMED_EXPRESSION, pos,
                       "no component " + name + " in " + compound + ": " + e);
        } else if (!c.getType().equals(expected)) {
            result.add(ValidationError.Kind.TYPE_MISMATCH, pos,
                       "component " + name + " has type " + c.getType()
                       + " but is used with type " + expected + ": " + e);
        }
    }

    private void validateStructLiteral(Expr e) {
        Type st = resolve(e.type());
        if (st == null) return;
        List<Type.Component> comps = st.components();
        List<Expr> values = e.operands();
        if (comps.size() != values.size()) {
            result.add(ValidationError.Kind.MALFORMED_EXPRESSION, pos,
                       "struct literal has " + values.size() + " values for "
                       + comps.size() + " components: " + e);
            return;
        }
        for (int i = 0; i != comps.size(); ++i) {
            if (!comps.get(i).getType().equals(values.get(i).type())) {
                result.add(ValidationError.Kind.TYPE_MISMATCH, pos,
                           "struct literal value for " + comps.get(i).getName()
                           + " has type " + values.get(i).type());
            }
        }
    }

    private void validateType(Type t) {
        if (t.isStructTag()) {
            if (!ns.hasTag(t.tag())) {
                result.add(ValidationError.Kind.UNKNOWN_TYPE_TAG, pos, "Unknown type tag: " + t.tag());
            }
        } else if (t.isStruct()) {
            for (Type.Component c : t.components()) {
                validateType(c.getType());
            }
        } else if (t.isArray()) {
            validateType(t.arrayElementType());
        } else if (t.isCode()) {
            for (int i = 0; i != t.getCodeParameterCount(); ++i) {
                validateType(t.getCodeParameterType(i));
            }
            validateType(t.getCodeReturnType());
        }
    }
}
