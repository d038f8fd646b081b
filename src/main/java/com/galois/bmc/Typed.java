package com.galois.bmc;

/**
 * Implemented by expressions and symbol definitions, whose type is
 * fixed when they are created.
 */
public interface Typed {
    /**
     * @return the type every value of this object has
     */
    Type type();
}
