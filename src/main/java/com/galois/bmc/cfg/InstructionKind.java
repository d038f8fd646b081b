package com.galois.bmc.cfg;

/** The closed set of instruction kinds. */
public enum InstructionKind {
    ASSIGN,
    DECL,
    DEAD,
    FUNCTION_CALL,
    ASSUME,
    ASSERT,
    INPUT,
    OUTPUT,
    GOTO,
    RETURN,
    SKIP,
    START_THREAD
}
