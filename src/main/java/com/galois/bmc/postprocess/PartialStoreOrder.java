package com.galois.bmc.postprocess;

import com.galois.bmc.symex.SsaStep;

/**
 * Partial store order: like total store order, and writes of one thread to
 * different variables may also be reordered.
 */
public class PartialStoreOrder extends TotalStoreOrder {
    public String getName() {
        return "pso";
    }

    protected boolean keepsProgramOrder(SsaStep first, SsaStep second) {
        if (isWrite(first) && isWrite(second) && !sameVariable(first, second)) {
            return false;
        }
        return super.keepsProgramOrder(first, second);
    }
}
