package com.galois.bmc.symex;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.BmcOptions;
import com.galois.bmc.expr.Expr;

/**
 * Complexity limits for symbolic execution.  A path whose guard grows
 * beyond the configured number of nodes is abandoned.  Each abandonment is
 * charged to the innermost loop the path was in; a loop is blacklisted
 * once it was charged the configured number of times, after which paths
 * reaching its back-edge are abandoned.
 */
final class ComplexityModule {
    private final long limit;
    private final long failedChildLoopsLimit;
    private final Map<String, Long> failures = new HashMap<String, Long>();
    private final Set<String> blacklist = new HashSet<String>();

    ComplexityModule(BmcOptions options) {
        this.limit = options.getComplexityLimit();
        this.failedChildLoopsLimit = options.getFailedChildLoopsLimit();
    }

    boolean isEnabled() {
        return limit > 0;
    }

    boolean exceeds(Expr guard) {
        return limit > 0 && guard.size() > limit;
    }

    /**
     * Charge an abandoned path to <code>loopId</code>.
     *
     * @return whether the loop has just been blacklisted.
     */
    boolean recordFailure(String loopId) {
        if (loopId == null || failedChildLoopsLimit <= 0) return false;
        Long n = failures.get(loopId);
        long c = (n == null ? 0 : n.longValue()) + 1;
        failures.put(loopId, c);
        if (c >= failedChildLoopsLimit && !blacklist.contains(loopId)) {
            blacklist.add(loopId);
            return true;
        }
        return false;
    }

    boolean isBlacklisted(String loopId) {
        return blacklist.contains(loopId);
    }
}
