package com.galois.bmc.symex;

/** Kinds of equation steps. */
public enum SsaStepKind {
    ASSIGNMENT,
    DECL,
    DEAD,
    ASSUME,
    ASSERT,
    GOTO,
    LOCATION,
    FUNCTION_CALL,
    FUNCTION_RETURN,
    INPUT,
    OUTPUT,
    SHARED_READ,
    SHARED_WRITE,
    SPAWN,
    /** A constraint added after execution, such as memory ordering. */
    CONSTRAINT;

    /** Whether the step defines its SSA left-hand side. */
    public boolean isDefinition() {
        return this == ASSIGNMENT || this == SHARED_WRITE;
    }

    /** Whether the step is a shared-memory event seen by the memory model. */
    public boolean isSharedEvent() {
        return this == SHARED_READ || this == SHARED_WRITE || this == SPAWN;
    }
}
