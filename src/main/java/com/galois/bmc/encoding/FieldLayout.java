package com.galois.bmc.encoding;

import com.galois.bmc.Type;

/**
 * Placement of one struct component in the flat encoding.
 */
public final class FieldLayout {
    private final String name;
    private final Type type;
    private final Type encodedType;
    private final long offset;
    private final long width;
    private final boolean padding;

    FieldLayout(String name, Type type, Type encodedType, long offset, long width, boolean padding) {
        this.name = name;
        this.type = type;
        this.encodedType = encodedType;
        this.offset = offset;
        this.width = width;
        this.padding = padding;
    }

    public String getName() {
        return name;
    }

    /** The declared component type. */
    public Type getType() {
        return type;
    }

    public Type getEncodedType() {
        return encodedType;
    }

    /** Offset of the lowest bit of the field, counting from the least significant bit. */
    public long getOffset() {
        return offset;
    }

    public long getWidth() {
        return width;
    }

    /** Byte offset of the field, for fields starting on a byte boundary. */
    public long getByteOffset() {
        return offset / 8;
    }

    public boolean isPadding() {
        return padding;
    }

    public String toString() {
        return name + "@" + offset + ":" + width + " " + encodedType;
    }
}
