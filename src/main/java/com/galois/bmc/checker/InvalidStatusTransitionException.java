package com.galois.bmc.checker;

import com.galois.bmc.BmcFailedException;

/**
 * Thrown when a property would move backwards in its status order, for
 * example from <code>FAIL</code> to <code>PASS</code>.
 */
public class InvalidStatusTransitionException extends BmcFailedException {
    private final String propertyId;
    private final PropertyStatus from;
    private final PropertyStatus to;

    public InvalidStatusTransitionException(String propertyId, PropertyStatus from, PropertyStatus to) {
        super("Property " + propertyId + " cannot change from " + from + " to " + to);
        this.propertyId = propertyId;
        this.from = from;
        this.to = to;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public PropertyStatus getFrom() {
        return from;
    }

    public PropertyStatus getTo() {
        return to;
    }
}
