package com.galois.bmc.postprocess;

import com.galois.bmc.symex.SsaStep;

/**
 * Every thread's events happen in program order.
 */
public class SequentialConsistency extends MemoryModel {
    public String getName() {
        return "sc";
    }

    protected boolean keepsProgramOrder(SsaStep first, SsaStep second) {
        return true;
    }
}
