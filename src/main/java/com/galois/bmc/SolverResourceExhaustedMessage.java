package com.galois.bmc;

import com.galois.bmc.proto.Protos;

/**
   Reported when the decision procedure gives up because of a time or memory
   limit.  Properties it was deciding stay UNKNOWN.
*/
public class SolverResourceExhaustedMessage extends BmcMessage {
    public SolverResourceExhaustedMessage( String message ) {
        super(message);
    }

    protected Protos.DiagnosticCode getDiagnosticCode() {
        return Protos.DiagnosticCode.SolverResourceExhaustedDiag;
    }

    public boolean isInconclusive() {
        return true;
    }
}
