package com.galois.bmc;

/**
 * Thrown when a struct tag type has no definition in the symbol table.
 */
public class UnknownTypeTagException extends BmcFailedException {
    private final String tag;

    public UnknownTypeTagException(String tag) {
        super("Unknown type tag: " + tag);
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
