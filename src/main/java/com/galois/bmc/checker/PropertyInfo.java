package com.galois.bmc.checker;

import com.galois.bmc.cfg.Position;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.trace.GotoTrace;

/**
 * The record kept for one property during a run.
 */
public final class PropertyInfo {
    private final String id;
    private final String description;
    private final Position position;
    private PropertyStatus status;
    private boolean notDisproved = false;
    private String reason = null;
    private GotoTrace trace = null;

    public PropertyInfo(String id, String description, Position position, PropertyStatus status) {
        this.id = id;
        this.description = description;
        this.position = position;
        this.status = status;
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public Position getPosition() {
        return position;
    }

    public PropertyStatus getStatus() {
        return status;
    }

    /**
     * Change the status.
     *
     * @throws InvalidStatusTransitionException if the property would move
     *   backwards.
     */
    public void setStatus(PropertyStatus next) {
        if (!status.canBecome(next)) {
            throw new InvalidStatusTransitionException(id, status, next);
        }
        status = next;
    }

    /**
     * Whether PASS was assigned because nothing refuted the property, not
     * because the decision procedure proved it.
     */
    public boolean isNotDisproved() {
        return notDisproved;
    }

    void setNotDisproved(boolean b) {
        notDisproved = b;
    }

    /** Why the property is inconclusive, or <code>null</code>. */
    public String getReason() {
        return reason;
    }

    void setReason(String r) {
        reason = r;
    }

    public GotoTrace getTrace() {
        return trace;
    }

    void setTrace(GotoTrace t) {
        trace = t;
    }

    public Protos.PropertyResult getPropertyResultRep() {
        Protos.PropertyResult.Builder b = Protos.PropertyResult.newBuilder()
            .setId(id)
            .setStatus(status.getCode())
            .setNotDisproved(notDisproved);
        if (description != null) b.setDescription(description);
        if (position != null) b.setPos(position.getPosRep());
        if (reason != null) b.setReason(reason);
        if (trace != null) b.setTrace(trace.getTraceRep());
        return b.build();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append('[').append(id).append("] ");
        if (description != null) b.append(description).append(": ");
        b.append(status);
        if (notDisproved) b.append(" (not disproved)");
        if (reason != null) b.append(" (").append(reason).append(')');
        return b.toString();
    }
}
