package com.galois.bmc.symex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.galois.bmc.cfg.Position;
import com.galois.bmc.proto.Protos;

/**
 * Per-location execution counts collected during symbolic execution.
 */
public final class SymexCoverage {
    /** One instruction location and how often it was executed. */
    public static final class Entry {
        private final String function;
        private final int index;
        private final Position position;
        private long count;

        Entry(String function, int index, Position position) {
            this.function = function;
            this.index = index;
            this.position = position;
        }

        public String getFunction() {
            return function;
        }

        public int getIndex() {
            return index;
        }

        public Position getPosition() {
            return position;
        }

        public long getCount() {
            return count;
        }

        public Protos.CoverageEntry getCoverageRep() {
            return Protos.CoverageEntry.newBuilder()
                .setFunctionName(function)
                .setIndex(index)
                .setPos(position.getPosRep())
                .setCount(count)
                .build();
        }
    }

    private final Map<String, Map<Integer, Entry>> entries =
        new TreeMap<String, Map<Integer, Entry>>();

    public void record(String function, int index, Position position) {
        Map<Integer, Entry> m = entries.get(function);
        if (m == null) {
            m = new TreeMap<Integer, Entry>();
            entries.put(function, m);
        }
        Entry e = m.get(index);
        if (e == null) {
            e = new Entry(function, index, position);
            m.put(index, e);
        }
        e.count++;
    }

    /** Execution count of one location, <code>0</code> if never reached. */
    public long getCount(String function, int index) {
        Map<Integer, Entry> m = entries.get(function);
        if (m == null) return 0;
        Entry e = m.get(index);
        return e == null ? 0 : e.count;
    }

    /** All entries ordered by function name and index. */
    public List<Entry> getEntries() {
        List<Entry> r = new ArrayList<Entry>();
        for (Map<Integer, Entry> m : entries.values()) {
            r.addAll(m.values());
        }
        return Collections.unmodifiableList(r);
    }
}
