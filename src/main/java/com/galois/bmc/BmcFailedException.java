package com.galois.bmc;

/**
 * BmcFailedException is thrown when a verification run cannot continue
 * because its input or its internal state is malformed.
 */
public class BmcFailedException extends RuntimeException {
    public BmcFailedException(String message) {
        super(message);
    }

    public BmcFailedException(String message, Throwable cause) {
        super(message, cause);
    }

    public BmcFailedException(Throwable cause) {
        super(cause);
    }
}
