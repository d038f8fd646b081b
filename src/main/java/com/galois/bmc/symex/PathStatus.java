package com.galois.bmc.symex;

/**
 * Life cycle of one execution path.  A path is {@link #RUNNING} until it
 * reaches one of the terminal states.
 */
public enum PathStatus {
    RUNNING,
    COMPLETED,
    ABANDONED_COMPLEXITY,
    ABANDONED_DEPTH;

    public boolean isTerminal() {
        return this != RUNNING;
    }

    public boolean isAbandoned() {
        return this == ABANDONED_COMPLEXITY || this == ABANDONED_DEPTH;
    }
}
