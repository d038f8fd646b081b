package com.galois.bmc.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.StructuralInvariantViolation;

/**
 * Aggregated outcome of checking or validating instructions.  Problems are
 * collected rather than thrown so callers can report all of them; use
 * {@link #throwIfInvalid()} to turn a failed result into an exception.
 */
public final class ValidationResult {
    private final List<ValidationError> errors = new ArrayList<ValidationError>();

    public static ValidationResult ok() {
        return new ValidationResult();
    }

    public ValidationResult add(ValidationError.Kind kind, Position pos, String message) {
        errors.add(new ValidationError(kind, pos, message));
        return this;
    }

    public ValidationResult addAll(ValidationResult other) {
        errors.addAll(other.errors);
        return this;
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean hasError(ValidationError.Kind kind) {
        for (ValidationError e : errors) {
            if (e.getKind() == kind) return true;
        }
        return false;
    }

    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }

    /**
     * @throws StructuralInvariantViolation if any problem was recorded.
     */
    public void throwIfInvalid() {
        if (!isValid()) {
            throw new StructuralInvariantViolation(this);
        }
    }

    public String toString() {
        if (errors.isEmpty()) return "valid";
        StringBuilder b = new StringBuilder();
        for (ValidationError e : errors) {
            if (b.length() > 0) b.append('\n');
            b.append(e);
        }
        return b.toString();
    }
}
