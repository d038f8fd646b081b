package com.galois.bmc.cfg;

/**
 * A natural loop of a goto function, identified by its back-edge.
 */
public final class Loop {
    private final String id;
    private final int head;
    private final int backEdge;

    Loop(String id, int head, int backEdge) {
        this.id = id;
        this.head = head;
        this.backEdge = backEdge;
    }

    /**
     * Loop identifier <code>function.N</code>, numbering the back-edges of
     * the function in program order from zero.
     */
    public String getId() {
        return id;
    }

    /** Index of the first instruction of the loop body. */
    public int getHead() {
        return head;
    }

    /** Index of the backwards goto closing the loop. */
    public int getBackEdge() {
        return backEdge;
    }

    public boolean contains(int pc) {
        return pc >= head && pc <= backEdge;
    }

    public String toString() {
        return id + " [" + head + ", " + backEdge + "]";
    }
}
