package com.galois.bmc.checker;

import com.galois.bmc.proto.Protos;

/**
 * Status of a tracked property.
 *
 * <p>
 * Statuses only move forward: <code>NOT_CHECKED</code> may become any other
 * status, <code>UNKNOWN</code> may become <code>PASS</code> or
 * <code>FAIL</code>, and <code>PASS</code> and <code>FAIL</code> are final.
 */
public enum PropertyStatus {
    NOT_CHECKED(Protos.PropertyStatusCode.NotChecked),
    UNKNOWN(Protos.PropertyStatusCode.Unknown),
    PASS(Protos.PropertyStatusCode.Pass),
    FAIL(Protos.PropertyStatusCode.Fail);

    private final Protos.PropertyStatusCode code;

    PropertyStatus(Protos.PropertyStatusCode code) {
        this.code = code;
    }

    public Protos.PropertyStatusCode getCode() {
        return code;
    }

    /** Whether this status is a definitive answer. */
    public boolean isDecided() {
        return this == PASS || this == FAIL;
    }

    public boolean canBecome(PropertyStatus next) {
        if (next == this) return true;
        switch (this) {
        case NOT_CHECKED:
            return true;
        case UNKNOWN:
            return next == PASS || next == FAIL;
        default:
            return false;
        }
    }

    public static PropertyStatus fromCode(Protos.PropertyStatusCode c) {
        for (PropertyStatus s : values()) {
            if (s.code == c) return s;
        }
        throw new IllegalArgumentException("Unknown status code " + c);
    }
}
