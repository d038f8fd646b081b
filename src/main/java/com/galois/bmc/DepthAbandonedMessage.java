package com.galois.bmc;

import java.util.*;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.proto.Protos;

/**
   Reported when a path executes more instructions than the configured depth.
*/
public class DepthAbandonedMessage extends BmcMessage {
    public DepthAbandonedMessage( String message, List<Position> backtrace ) {
        super(message, backtrace);
    }

    protected Protos.DiagnosticCode getDiagnosticCode() {
        return Protos.DiagnosticCode.DepthAbandonedDiag;
    }

    public boolean isInconclusive() {
        return true;
    }
}
