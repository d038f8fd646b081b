package com.galois.bmc.postprocess;

import com.galois.bmc.symex.Equation;

/**
 * A sliced equation together with statistics about what was removed.
 */
public final class SliceResult {
    private final Equation equation;
    private final int removed;
    private final int droppedAssertions;

    SliceResult(Equation equation, int removed, int droppedAssertions) {
        this.equation = equation;
        this.removed = removed;
        this.droppedAssertions = droppedAssertions;
    }

    public Equation getEquation() {
        return equation;
    }

    /** Number of steps removed. */
    public int getRemoved() {
        return removed;
    }

    /** Number of removed assertions that were trivially true. */
    public int getDroppedAssertions() {
        return droppedAssertions;
    }

    public String toString() {
        return "slicing removed " + removed + " of "
            + (equation.size() + removed) + " steps";
    }
}
