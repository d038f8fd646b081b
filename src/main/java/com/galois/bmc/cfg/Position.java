package com.galois.bmc.cfg;

import com.galois.bmc.proto.Protos;

/**
 * Location of an instruction, used in diagnostics and traces.
 * Positions are values: two positions naming the same place are equal.
 */
public abstract class Position {
    protected final String functionName;

    protected Position(String functionName) {
        if (functionName == null) throw new NullPointerException("functionName");
        this.functionName = functionName;
    }

    /** Function the instruction belongs to. */
    public String getFunctionName() { return functionName; }

    public abstract Protos.Position getPosRep();

    /**
     * Rebuild a position from its serialized form.
     * @throws IllegalArgumentException if the code is not recognized
     */
    public static Position fromProto(Protos.Position p) {
        switch (p.getCode()) {
        case InternalPos:
            return new InternalPosition(p.getFunctionName());
        case SourcePos:
            return new SourcePosition(p.getFunctionName(),
                                      p.getPath(),
                                      p.getLine(),
                                      p.getCol());
        default:
            throw new IllegalArgumentException("Unknown position code: " + p.getCode());
        }
    }
}
