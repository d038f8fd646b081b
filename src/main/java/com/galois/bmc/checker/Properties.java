package com.galois.bmc.checker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.cfg.Assert;
import com.galois.bmc.cfg.GotoFunction;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.cfg.Instruction;

/**
 * The properties tracked by a run, in the order they were first seen.
 */
public final class Properties implements Iterable<PropertyInfo> {
    private final Map<String, PropertyInfo> map = new LinkedHashMap<String, PropertyInfo>();

    /**
     * Collect the assertions of every function body of <code>model</code>
     * as <code>NOT_CHECKED</code> properties.
     */
    public static Properties fromModel(GotoModel model) {
        Properties r = new Properties();
        for (GotoFunction f : model.getFunctions().values()) {
            if (!f.hasBody()) continue;
            for (Instruction i : f.getBody()) {
                if (i instanceof Assert) {
                    Assert a = (Assert) i;
                    if (!r.contains(a.getPropertyId())) {
                        r.add(new PropertyInfo(a.getPropertyId(), a.getDescription(),
                                               a.getPosition(), PropertyStatus.NOT_CHECKED));
                    }
                }
            }
        }
        return r;
    }

    public void add(PropertyInfo p) {
        if (map.containsKey(p.getId())) {
            throw new IllegalArgumentException("Duplicate property " + p.getId());
        }
        map.put(p.getId(), p);
    }

    public boolean contains(String id) {
        return map.containsKey(id);
    }

    public PropertyInfo get(String id) {
        return map.get(id);
    }

    public int size() {
        return map.size();
    }

    public Collection<PropertyInfo> values() {
        return Collections.unmodifiableCollection(map.values());
    }

    public Iterator<PropertyInfo> iterator() {
        return values().iterator();
    }

    /** Identifiers of the properties with status <code>s</code>. */
    public Set<String> withStatus(PropertyStatus s) {
        Set<String> r = new LinkedHashSet<String>();
        for (PropertyInfo p : map.values()) {
            if (p.getStatus() == s) r.add(p.getId());
        }
        return r;
    }

    public int count(PropertyStatus s) {
        return withStatus(s).size();
    }

    public boolean hasUnknown() {
        return count(PropertyStatus.UNKNOWN) > 0;
    }

    /** Identifiers of the properties still needing the decision procedure. */
    public Set<String> undecided() {
        Set<String> r = new LinkedHashSet<String>(withStatus(PropertyStatus.UNKNOWN));
        r.addAll(withStatus(PropertyStatus.NOT_CHECKED));
        return r;
    }

    /** A snapshot of the status of every property. */
    public Map<String, PropertyStatus> statusMap() {
        Map<String, PropertyStatus> r = new LinkedHashMap<String, PropertyStatus>();
        for (PropertyInfo p : map.values()) {
            r.put(p.getId(), p.getStatus());
        }
        return r;
    }

    public String toString() {
        return new ArrayList<PropertyInfo>(map.values()).toString();
    }
}
