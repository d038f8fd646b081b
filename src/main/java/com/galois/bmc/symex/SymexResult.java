package com.galois.bmc.symex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.galois.bmc.BmcMessage;

/**
 * Outcome of symbolic execution: the equation, how many paths completed or
 * were abandoned, coverage, and the diagnostics reported on the way.
 */
public final class SymexResult {
    private final Equation equation;
    private final SymexCoverage coverage;
    private final List<BmcMessage> messages;
    private final int completedPaths;
    private final int abandonedPaths;
    private final Set<String> loopsAtBound;
    private final Set<String> ignoredProperties;

    SymexResult(Equation equation, SymexCoverage coverage, List<BmcMessage> messages,
                int completedPaths, int abandonedPaths,
                Set<String> loopsAtBound, Set<String> ignoredProperties) {
        this.equation = equation;
        this.coverage = coverage;
        this.messages = Collections.unmodifiableList(new ArrayList<BmcMessage>(messages));
        this.completedPaths = completedPaths;
        this.abandonedPaths = abandonedPaths;
        this.loopsAtBound = Collections.unmodifiableSet(new LinkedHashSet<String>(loopsAtBound));
        this.ignoredProperties =
            Collections.unmodifiableSet(new LinkedHashSet<String>(ignoredProperties));
    }

    public Equation getEquation() {
        return equation;
    }

    public SymexCoverage getCoverage() {
        return coverage;
    }

    public List<BmcMessage> getMessages() {
        return messages;
    }

    public int getCompletedPaths() {
        return completedPaths;
    }

    public int getAbandonedPaths() {
        return abandonedPaths;
    }

    public boolean hasAbandonedPaths() {
        return abandonedPaths > 0;
    }

    /** Loops left on some path because they reached their bound. */
    public Set<String> getLoopsAtBound() {
        return loopsAtBound;
    }

    public boolean isBoundReached(String loopId) {
        return loopsAtBound.contains(loopId);
    }

    /**
     * Properties with an assertion dropped because it was reached before
     * the incremental loop was unwound <code>unwind-min</code> times.
     */
    public Set<String> getIgnoredProperties() {
        return ignoredProperties;
    }

    /**
     * Text of the first abandonment diagnostic, or <code>null</code> if no
     * path was abandoned.
     */
    public String getAbandonReason() {
        for (BmcMessage m : messages) {
            if (m.isInconclusive()) return m.getMessage();
        }
        return null;
    }
}
