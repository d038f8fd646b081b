package com.galois.bmc.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.cfg.Position;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.symex.SsaStepKind;

/**
 * One step of a counterexample: an equation step that is live in the
 * model, with the values the model assigns to it.
 */
public final class TraceStep {
    private final SsaStepKind kind;
    private final Position position;
    private final int thread;
    private final Expr lhs;
    private final Expr value;
    private final String comment;
    private final List<Expr> ioValues;
    private final boolean hidden;

    TraceStep(SsaStepKind kind, Position position, int thread, Expr lhs, Expr value,
              String comment, List<Expr> ioValues, boolean hidden) {
        this.kind = kind;
        this.position = position;
        this.thread = thread;
        this.lhs = lhs;
        this.value = value;
        this.comment = comment;
        this.ioValues = Collections.unmodifiableList(new ArrayList<Expr>(ioValues));
        this.hidden = hidden;
    }

    public SsaStepKind getKind() {
        return kind;
    }

    public Position getPosition() {
        return position;
    }

    public int getThread() {
        return thread;
    }

    /** Assigned expression as written in the program, or <code>null</code>. */
    public Expr getLhs() {
        return lhs;
    }

    /**
     * Value in the model: the assigned value for assignments and reads, the
     * condition's truth value for assertions, assumptions and gotos.
     * <code>null</code> when the model has no representable value.
     */
    public Expr getValue() {
        return value;
    }

    public String getComment() {
        return comment;
    }

    public List<Expr> getIoValues() {
        return ioValues;
    }

    public boolean isHidden() {
        return hidden;
    }

    static Protos.TraceStepKind kindCode(SsaStepKind k) {
        switch (k) {
        case ASSIGNMENT: return Protos.TraceStepKind.AssignmentStep;
        case ASSUME: return Protos.TraceStepKind.AssumptionStep;
        case ASSERT: return Protos.TraceStepKind.AssertionStep;
        case FUNCTION_CALL: return Protos.TraceStepKind.FunctionCallStep;
        case FUNCTION_RETURN: return Protos.TraceStepKind.FunctionReturnStep;
        case INPUT: return Protos.TraceStepKind.InputStep;
        case OUTPUT: return Protos.TraceStepKind.OutputStep;
        case SHARED_READ: return Protos.TraceStepKind.SharedReadStep;
        case SHARED_WRITE: return Protos.TraceStepKind.SharedWriteStep;
        case SPAWN: return Protos.TraceStepKind.SpawnStep;
        case GOTO: return Protos.TraceStepKind.GotoStep;
        case DECL: return Protos.TraceStepKind.DeclStep;
        case DEAD: return Protos.TraceStepKind.DeadStep;
        case CONSTRAINT: return Protos.TraceStepKind.ConstraintStep;
        default: return Protos.TraceStepKind.LocationStep;
        }
    }

    public Protos.TraceStep getTraceStepRep() {
        Protos.TraceStep.Builder b = Protos.TraceStep.newBuilder()
            .setKind(kindCode(kind))
            .setPos(position.getPosRep())
            .setThread(thread);
        if (lhs != null) b.setLhs(lhs.toString());
        if (value != null) b.setValue(value.toString());
        if (comment != null) b.setComment(comment);
        for (Expr e : ioValues) {
            b.addIoValue(e == null ? "?" : e.toString());
        }
        return b.build();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(kind).append(" @ ").append(position);
        if (thread != 0) b.append(" [thread ").append(thread).append(']');
        if (lhs != null) b.append(": ").append(lhs).append(" = ").append(value);
        else if (value != null) b.append(": ").append(value);
        if (!ioValues.isEmpty()) b.append(' ').append(ioValues);
        if (comment != null) b.append(" -- ").append(comment);
        return b.toString();
    }
}
