package com.galois.bmc;

/**
 * Thrown when slicing dropped a step that an undecided property depends on.
 * This indicates a bug in the slicer.
 */
public class SliceInvariantViolation extends BmcFailedException {
    private final String propertyId;
    private final int stepIndex;

    public SliceInvariantViolation(String propertyId, int stepIndex, String step) {
        super("Slicing removed step " + stepIndex + " (" + step
              + ") required by property " + propertyId);
        this.propertyId = propertyId;
        this.stepIndex = stepIndex;
    }

    public String getPropertyId() {
        return propertyId;
    }

    /** Index of the missing step in the unsliced equation. */
    public int getStepIndex() {
        return stepIndex;
    }
}
