package com.galois.bmc.cfg;

import com.galois.bmc.proto.Protos;

/**
 * Position of instructions that have no source counterpart, such as
 * global initialisation or instructions added by symbolic execution.
 */
public class InternalPosition extends Position {

    public InternalPosition(String functionName) {
        super(functionName);
    }

    public Protos.Position getPosRep() {
        return Protos.Position.newBuilder()
            .setCode(Protos.PositionCode.InternalPos)
            .setFunctionName(functionName)
            .build();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof InternalPosition
            && ((InternalPosition) o).functionName.equals(functionName);
    }

    @Override
    public int hashCode() {
        return functionName.hashCode();
    }

    @Override
    public String toString() {
        return "function " + functionName + " (built-in)";
    }
}
