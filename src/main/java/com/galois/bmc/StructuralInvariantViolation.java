package com.galois.bmc;

import com.galois.bmc.cfg.ValidationResult;

/**
 * Thrown when an instruction or expression is built with the wrong operand
 * count or kind, or when a caller asks for a validation result to be
 * enforced.
 */
public class StructuralInvariantViolation extends BmcFailedException {
    private final ValidationResult result;

    public StructuralInvariantViolation(String message) {
        super(message);
        this.result = null;
    }

    public StructuralInvariantViolation(ValidationResult result) {
        super(result.toString());
        this.result = result;
    }

    /**
     * The diagnostics that caused this exception, or <code>null</code> when
     * it was raised during construction.
     */
    public ValidationResult getResult() {
        return result;
    }
}
