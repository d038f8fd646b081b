package com.galois.bmc;

import java.util.*;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.proto.Protos;

/**
   Reported when symbolic execution drops a path because its guard grew
   beyond the configured complexity limit, or because the enclosing loop was
   blacklisted.
*/
public class ComplexityAbandonedMessage extends BmcMessage {
    public ComplexityAbandonedMessage( String message, List<Position> backtrace ) {
        super(message, backtrace);
    }

    protected Protos.DiagnosticCode getDiagnosticCode() {
        return Protos.DiagnosticCode.ComplexityAbandonedDiag;
    }

    public boolean isInconclusive() {
        return true;
    }
}
