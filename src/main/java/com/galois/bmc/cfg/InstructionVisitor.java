package com.galois.bmc.cfg;

/**
 * Visitor over instruction kinds.
 */
public interface InstructionVisitor<R> {
    R visitAssign(Assign i);
    R visitDecl(Decl i);
    R visitDead(Dead i);
    R visitFunctionCall(FunctionCall i);
    R visitAssume(Assume i);
    R visitAssert(Assert i);
    R visitInput(Input i);
    R visitOutput(Output i);
    R visitGoto(Goto i);
    R visitReturn(Return i);
    R visitSkip(Skip i);
    R visitStartThread(StartThread i);
}
