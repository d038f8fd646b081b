package com.galois.bmc;

import com.galois.bmc.proto.Protos;

/**
   Reported when the decision procedure fails.  Properties it was deciding
   stay UNKNOWN.
*/
public class SolverErrorMessage extends BmcMessage {
    public SolverErrorMessage( String message ) {
        super(message);
    }

    protected Protos.DiagnosticCode getDiagnosticCode() {
        return Protos.DiagnosticCode.SolverErrorDiag;
    }

    public boolean isInconclusive() {
        return true;
    }
}
