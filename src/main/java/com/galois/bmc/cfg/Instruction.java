package com.galois.bmc.cfg;

import java.util.List;

import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.ExprValidator;
import com.galois.bmc.expr.Index;
import com.galois.bmc.expr.Member;
import com.galois.bmc.expr.Symbol;

/**
 * A statement of a goto program.
 *
 * <p>
 * Each kind of statement is its own subclass with typed accessors.
 * Construction rejects missing operands and operands of the wrong form
 * with a {@link StructuralInvariantViolation}.  Three levels of validation
 * are available on every instruction:
 * <ul>
 * <li>{@link #check()} looks at the form of the operands only;</li>
 * <li>{@link #validate(SymbolTable)} also checks that operand types agree;</li>
 * <li>{@link #validateFull(SymbolTable)} also validates every nested
 * sub-expression against the symbol table.</li>
 * </ul>
 * Each returns a {@link ValidationResult} collecting all problems found.
 */
public abstract class Instruction {
    private final Position position;

    Instruction(Position position) {
        if (position == null) throw new NullPointerException("position");
        this.position = position;
    }

    public Position getPosition() {
        return position;
    }

    public abstract InstructionKind getKind();

    public abstract <R> R accept(InstructionVisitor<R> v);

    /**
     * All expression operands of this instruction, in a fixed order.
     */
    public abstract List<Expr> operands();

    /**
     * Check the form of the operands without a type environment.
     */
    public ValidationResult check() {
        return new ValidationResult();
    }

    /**
     * Check the form of the operands and the agreement of their types.
     */
    public ValidationResult validate(SymbolTable ns) {
        return check();
    }

    /**
     * Validate this instruction and every nested sub-expression.
     */
    public ValidationResult validateFull(SymbolTable ns) {
        ValidationResult r = validate(ns);
        ExprValidator v = new ExprValidator(ns, position, r);
        for (Expr e : operands()) {
            v.validate(e);
        }
        return r;
    }

    static <T> T require(T operand, String what) {
        if (operand == null) {
            throw new StructuralInvariantViolation(what + " is missing");
        }
        return operand;
    }

    /**
     * Whether <code>e</code> denotes a storage location: a symbol, or a
     * member or element of one.
     */
    public static boolean isLvalue(Expr e) {
        if (e instanceof Symbol) return true;
        if (e instanceof Member) return isLvalue(((Member) e).getCompound());
        if (e instanceof Index) return isLvalue(((Index) e).getArray());
        return false;
    }

    /**
     * The symbol at the root of an lvalue.
     */
    public static Symbol rootSymbol(Expr e) {
        while (!(e instanceof Symbol)) {
            if (e instanceof Member) {
                e = ((Member) e).getCompound();
            } else if (e instanceof Index) {
                e = ((Index) e).getArray();
            } else {
                throw new StructuralInvariantViolation("Not an lvalue: " + e);
            }
        }
        return (Symbol) e;
    }

    void checkLvalue(Expr e, String what, ValidationResult r) {
        if (!isLvalue(e)) {
            r.add(ValidationError.Kind.OPERAND_KIND, position, what + " is not an lvalue: " + e);
        }
    }

    void checkBoolean(Expr e, String what, ValidationResult r) {
        if (!e.type().isBool()) {
            r.add(ValidationError.Kind.OPERAND_KIND, position,
                  what + " must be Boolean, got " + e.type());
        }
    }

    public String toString() {
        return getKind() + " " + operands();
    }
}
