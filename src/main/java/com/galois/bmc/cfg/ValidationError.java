package com.galois.bmc.cfg;

/**
 * One problem found while checking or validating an instruction.
 */
public final class ValidationError {
    public enum Kind {
        /** Wrong number of operands. */
        ARITY,
        /** An operand of the wrong form, such as a non-symbol where a variable is required. */
        OPERAND_KIND,
        /** Operand types do not agree. */
        TYPE_MISMATCH,
        /** A struct tag has no definition. */
        UNKNOWN_TYPE_TAG,
        /** A level-0 symbol is not in the symbol table. */
        UNKNOWN_SYMBOL,
        /** A nested expression is inconsistent with its definition. */
        MALFORMED_EXPRESSION
    }

    private final Kind kind;
    private final Position position;
    private final String message;

    public ValidationError(Kind kind, Position position, String message) {
        this.kind = kind;
        this.position = position;
        this.message = message;
    }

    public Kind getKind() {
        return kind;
    }

    public Position getPosition() {
        return position;
    }

    public String getMessage() {
        return message;
    }

    public String toString() {
        return kind + " at " + position + ": " + message;
    }
}
