package com.galois.bmc.cfg;

/**
 * A jump target inside a {@link GotoProgram} under construction.
 */
public final class Label {
    int index = -1;
    private final String name;

    Label(String name) {
        this.name = name;
    }

    public boolean isPlaced() {
        return index >= 0;
    }

    public String toString() {
        return name;
    }
}
