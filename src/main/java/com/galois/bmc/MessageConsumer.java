package com.galois.bmc;

/**
 * Receives diagnostics produced while a verification run executes.
 */
public interface MessageConsumer {
    void acceptMessage(BmcMessage msg);
}
