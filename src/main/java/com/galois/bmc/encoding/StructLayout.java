package com.galois.bmc.encoding;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.BmcFailedException;

/**
 * The ordered field map of an encoded struct.  Fields appear in declaration
 * order with increasing, contiguous offsets; their widths add up to the
 * width of the encoding.
 */
public final class StructLayout {
    private final List<FieldLayout> fields;
    private final long width;

    StructLayout(List<FieldLayout> fields, long width) {
        this.fields = Collections.unmodifiableList(new ArrayList<FieldLayout>(fields));
        this.width = width;
        checkInvariants();
    }

    private void checkInvariants() {
        long next = 0;
        for (FieldLayout f : fields) {
            if (f.getOffset() != next) {
                throw new BmcFailedException("Field " + f.getName() + " at offset " + f.getOffset()
                                             + ", expected " + next);
            }
            next += f.getWidth();
        }
        if (next != width) {
            throw new BmcFailedException("Field widths add up to " + next + ", not " + width);
        }
    }

    public List<FieldLayout> getFields() {
        return fields;
    }

    public long getWidth() {
        return width;
    }

    /** Return the named field or <code>null</code>. */
    public FieldLayout getField(String name) {
        for (FieldLayout f : fields) {
            if (f.getName().equals(name)) return f;
        }
        return null;
    }

    public String toString() {
        return fields.toString();
    }
}
