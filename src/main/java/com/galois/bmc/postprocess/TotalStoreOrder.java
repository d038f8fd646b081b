package com.galois.bmc.postprocess;

import com.galois.bmc.symex.SsaStep;

/**
 * Total store order: a read may overtake an earlier write of the same
 * thread to a different variable.
 */
public class TotalStoreOrder extends MemoryModel {
    public String getName() {
        return "tso";
    }

    protected boolean keepsProgramOrder(SsaStep first, SsaStep second) {
        if (isWrite(first) && isRead(second) && !sameVariable(first, second)) {
            return false;
        }
        return true;
    }
}
