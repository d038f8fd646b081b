package com.galois.bmc.encoding;

import java.util.HashMap;
import java.util.Map;

import com.galois.bmc.Type;

/**
 * Memo table for {@link StructEncoding}.  One cache belongs to one
 * verification run and is handed to every encoder of that run; it must not
 * be shared between runs over different symbol tables.
 */
public final class EncodingCache {
    final Map<Type, Type> encoded = new HashMap<Type, Type>();
    final Map<Type, StructLayout> layouts = new HashMap<Type, StructLayout>();
    final Map<Type, Long> widths = new HashMap<Type, Long>();

    /** Number of distinct types encoded so far. */
    public int size() {
        return encoded.size();
    }

    public void clear() {
        encoded.clear();
        layouts.clear();
        widths.clear();
    }
}
