package com.galois.bmc;

import java.util.*;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.proto.Protos;

/**
 * A diagnostic reported during a verification run.  Diagnostics never abort
 * the run; they annotate results that are inconclusive.
 */
public class BmcMessage {
    String message;
    List<Position> backtrace;

    public BmcMessage( String message ) {
        this.message = message;
    }

    public BmcMessage( String message, List<Position> backtrace ) {
        this.message = message;
        this.backtrace = new LinkedList<Position>( backtrace );
    }

    /**
     * Rebuild a message from its protocol buffer form.
     */
    public static BmcMessage fromDiagnostic( Protos.Diagnostic d ) {
        String s = d.getMessage();
        List<Position> bt = new LinkedList<Position>();
        for( Protos.Position pp : d.getBacktraceList() ) {
            bt.add( Position.fromProto( pp ) );
        }

        switch( d.getCode() ) {
        case ComplexityAbandonedDiag:
            return new ComplexityAbandonedMessage( s, bt );
        case DepthAbandonedDiag:
            return new DepthAbandonedMessage( s, bt );
        case SolverResourceExhaustedDiag:
            return new SolverResourceExhaustedMessage( s );
        case SolverErrorDiag:
            return new SolverErrorMessage( s );
        default:
            return new BmcMessage( s, bt );
        }
    }

    public String getMessage()
    {
        return message;
    }

    public List<Position> getBacktrace()
    {
        if( backtrace == null ) {
            backtrace = new LinkedList<Position>();
        }

        return backtrace;
    }

    protected Protos.DiagnosticCode getDiagnosticCode() {
        return Protos.DiagnosticCode.GenericDiag;
    }

    /**
     * Whether the condition reported by this message leaves some result
     * inconclusive.
     */
    public boolean isInconclusive() {
        return false;
    }

    public Protos.Diagnostic getDiagnosticRep() {
        Protos.Diagnostic.Builder b = Protos.Diagnostic.newBuilder()
            .setCode( getDiagnosticCode() )
            .setMessage( message );
        for( Position p : getBacktrace() ) {
            b.addBacktrace( p.getPosRep() );
        }
        return b.build();
    }

    public String toString()
    {
        StringBuilder b = new StringBuilder();
        b.append( this.getClass().getName() );
        b.append( ": ");
        b.append( message );
        if( backtrace != null ) {
            for( Position p : backtrace ) {
                b.append( "\n  at " );
                b.append( p.toString() );
            }
        }

        return b.toString();
    }
}
