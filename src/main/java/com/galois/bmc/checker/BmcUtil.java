package com.galois.bmc.checker;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;

/**
 * Property status passes applied around the decision procedure.
 */
public final class BmcUtil {
    private BmcUtil() {}

    /**
     * Register the properties asserted in <code>eq</code>.  A property not
     * yet checked passes at once when every one of its assertion steps is
     * constant true; otherwise it becomes <code>UNKNOWN</code>.  Properties
     * seen for the first time, such as unwinding assertions, are added.
     *
     * @return the number of properties that passed without solving.
     */
    public static int updatePropertiesStatusFromEquation(Properties properties, Equation eq) {
        return updatePropertiesStatusFromEquation(properties, eq, true);
    }

    /**
     * As {@link #updatePropertiesStatusFromEquation(Properties, Equation)},
     * but constant true properties only pass when <code>shortcut</code> is
     * set.  Otherwise they become <code>UNKNOWN</code> like the others, as
     * when some path was never explored.
     */
    public static int updatePropertiesStatusFromEquation(Properties properties, Equation eq,
                                                         boolean shortcut) {
        Map<String, Boolean> allTrue = new LinkedHashMap<String, Boolean>();
        Map<String, SsaStep> first = new LinkedHashMap<String, SsaStep>();
        for (SsaStep s : eq) {
            if (!s.isAssert()) continue;
            String id = s.getPropertyId();
            if (!first.containsKey(id)) first.put(id, s);
            Boolean prev = allTrue.get(id);
            boolean t = s.getCondExpr().isTrue();
            allTrue.put(id, prev == null ? t : (prev.booleanValue() && t));
        }

        int passed = 0;
        for (Map.Entry<String, Boolean> e : allTrue.entrySet()) {
            PropertyInfo p = properties.get(e.getKey());
            if (p == null) {
                SsaStep s = first.get(e.getKey());
                p = new PropertyInfo(e.getKey(), s.getComment(), s.getPosition(),
                                     PropertyStatus.NOT_CHECKED);
                properties.add(p);
            }
            if (p.getStatus() != PropertyStatus.NOT_CHECKED) continue;
            if (shortcut && e.getValue().booleanValue()) {
                p.setStatus(PropertyStatus.PASS);
                ++passed;
            } else {
                p.setStatus(PropertyStatus.UNKNOWN);
            }
        }
        return passed;
    }

    /**
     * Properties never reached by symbolic execution hold on every explored
     * path.  They pass, unless a path was abandoned, in which case they stay
     * <code>NOT_CHECKED</code> with <code>abandonReason</code> attached.
     */
    public static void updateStatusOfNotCheckedProperties(Properties properties, String abandonReason) {
        updateStatusOfNotCheckedProperties(properties, abandonReason,
                                           Collections.<String>emptySet(), null);
    }

    /**
     * As {@link #updateStatusOfNotCheckedProperties(Properties, String)},
     * except that the properties in <code>ignored</code> had their
     * assertions dropped; they stay <code>NOT_CHECKED</code> with
     * <code>ignoreReason</code>.
     */
    public static void updateStatusOfNotCheckedProperties(Properties properties, String abandonReason,
                                                          Set<String> ignored, String ignoreReason) {
        for (PropertyInfo p : properties) {
            if (p.getStatus() != PropertyStatus.NOT_CHECKED) continue;
            if (ignored.contains(p.getId())) {
                p.setReason(ignoreReason);
            } else if (abandonReason == null) {
                p.setStatus(PropertyStatus.PASS);
            } else {
                p.setReason(abandonReason);
            }
        }
    }

    /**
     * Run-end sweep: every property still <code>UNKNOWN</code> passes and is
     * flagged as not disproved.  Skipped on an inconclusive run, where the
     * properties keep <code>UNKNOWN</code> and get <code>reason</code>.
     *
     * @return the number of properties swept to PASS.
     */
    public static int updateStatusOfUnknownProperties(Properties properties, boolean inconclusive,
                                                      String reason) {
        int n = 0;
        for (PropertyInfo p : properties) {
            if (p.getStatus() != PropertyStatus.UNKNOWN) continue;
            if (inconclusive) {
                if (p.getReason() == null) p.setReason(reason);
                continue;
            }
            p.setStatus(PropertyStatus.PASS);
            p.setNotDisproved(true);
            ++n;
        }
        return n;
    }
}
