package com.galois.bmc.solver;

import com.galois.bmc.BmcFailedException;

/**
 * Thrown when the decision procedure back end fails.
 */
public class DecisionProcedureException extends BmcFailedException {
    public DecisionProcedureException(String message) {
        super(message);
    }

    public DecisionProcedureException(String message, Throwable cause) {
        super(message, cause);
    }
}
