package com.galois.bmc.symex;

/**
 * Selects equation steps, for example the assertions of one failing
 * property.
 */
public interface SsaStepPredicate {
    boolean matches(SsaStep step);
}
