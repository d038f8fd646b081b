package com.galois.bmc.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.proto.Protos;

/**
 * A counterexample for one failed property.
 */
public final class GotoTrace {
    private final String propertyId;
    private final List<TraceStep> steps;

    public GotoTrace(String propertyId, List<TraceStep> steps) {
        this.propertyId = propertyId;
        this.steps = Collections.unmodifiableList(new ArrayList<TraceStep>(steps));
    }

    public String getPropertyId() {
        return propertyId;
    }

    public List<TraceStep> getSteps() {
        return steps;
    }

    /** The violated assertion, which ends the trace. */
    public TraceStep getFailedStep() {
        if (steps.isEmpty()) return null;
        return steps.get(steps.size() - 1);
    }

    public Protos.Trace getTraceRep() {
        Protos.Trace.Builder b = Protos.Trace.newBuilder().setPropertyId(propertyId);
        for (TraceStep s : steps) {
            b.addStep(s.getTraceStepRep());
        }
        return b.build();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append("Trace for ").append(propertyId).append(":\n");
        for (TraceStep s : steps) {
            if (s.isHidden()) continue;
            b.append("  ").append(s).append('\n');
        }
        return b.toString();
    }
}
