package com.galois.bmc.symex;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The SSA equation: symbolic steps in execution order.
 *
 * <p>
 * An equation is never modified.  Slicing produces a new equation that
 * remembers its parent and, for each kept step, the index of that step in
 * the parent, so the unsliced equation stays available for diagnostics.
 */
public final class Equation implements Iterable<SsaStep> {
    private final List<SsaStep> steps;
    private final Equation parent;
    private final int[] parentIndex;

    public Equation(List<SsaStep> steps) {
        this(Collections.unmodifiableList(new ArrayList<SsaStep>(steps)), null, null);
    }

    private Equation(List<SsaStep> steps, Equation parent, int[] parentIndex) {
        this.steps = steps;
        this.parent = parent;
        this.parentIndex = parentIndex;
    }

    public int size() {
        return steps.size();
    }

    public SsaStep get(int i) {
        return steps.get(i);
    }

    public List<SsaStep> getSteps() {
        return steps;
    }

    public Iterator<SsaStep> iterator() {
        return steps.iterator();
    }

    /** The equation this one was sliced from, or <code>null</code>. */
    public Equation getParent() {
        return parent;
    }

    /** The equation symbolic execution produced, before any slicing. */
    public Equation getRoot() {
        Equation e = this;
        while (e.parent != null) {
            e = e.parent;
        }
        return e;
    }

    /**
     * Index in the root equation of step <code>i</code> of this one.
     */
    public int rootIndex(int i) {
        if (parent == null) return i;
        return parent.rootIndex(parentIndex[i]);
    }

    /**
     * A new equation consisting of these steps followed by
     * <code>more</code>.  The result has no parent; extension happens before
     * slicing.
     */
    public Equation extend(List<SsaStep> more) {
        if (parent != null) {
            throw new IllegalStateException("Cannot extend a sliced equation.");
        }
        List<SsaStep> l = new ArrayList<SsaStep>(steps);
        l.addAll(more);
        return new Equation(l);
    }

    /**
     * The equation keeping exactly the steps whose index is set in
     * <code>keep</code>, in their original order.
     */
    public Equation slice(BitSet keep) {
        List<SsaStep> l = new ArrayList<SsaStep>();
        int[] idx = new int[keep.cardinality()];
        int n = 0;
        for (int i = keep.nextSetBit(0); i >= 0 && i < steps.size(); i = keep.nextSetBit(i + 1)) {
            l.add(steps.get(i));
            idx[n++] = i;
        }
        if (n != idx.length) {
            int[] trimmed = new int[n];
            System.arraycopy(idx, 0, trimmed, 0, n);
            idx = trimmed;
        }
        return new Equation(Collections.unmodifiableList(l), this, idx);
    }

    public List<SsaStep> select(SsaStepPredicate p) {
        List<SsaStep> r = new ArrayList<SsaStep>();
        for (SsaStep s : steps) {
            if (p.matches(s)) r.add(s);
        }
        return r;
    }

    public List<SsaStep> assertions() {
        return select(new SsaStepPredicate() {
                public boolean matches(SsaStep s) {
                    return s.isAssert();
                }
            });
    }

    /** Identifiers of all properties asserted in this equation, in order. */
    public Set<String> propertyIds() {
        Set<String> r = new LinkedHashSet<String>();
        for (SsaStep s : steps) {
            if (s.isAssert()) r.add(s.getPropertyId());
        }
        return r;
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i != steps.size(); ++i) {
            b.append(i).append(": ").append(steps.get(i)).append('\n');
        }
        return b.toString();
    }

    /**
     * Accumulates steps during symbolic execution.
     */
    public static final class Builder {
        private final List<SsaStep> steps = new ArrayList<SsaStep>();

        public Builder append(SsaStep s) {
            steps.add(s);
            return this;
        }

        public int size() {
            return steps.size();
        }

        public Equation build() {
            return new Equation(steps);
        }
    }
}
