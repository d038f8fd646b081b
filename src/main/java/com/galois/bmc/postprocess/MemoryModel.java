package com.galois.bmc.postprocess;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.galois.bmc.Type;
import com.galois.bmc.cfg.InternalPosition;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;
import com.galois.bmc.symex.SsaStepKind;

/**
 * Adds ordering constraints between the shared-memory events of an
 * equation.
 *
 * <p>
 * Every shared read, shared write and spawn gets a 32-bit clock.  Events of
 * one thread are ordered by their clocks as far as the model requires.
 * Each read chooses, through a fresh Boolean symbol, one write of the same
 * variable with a smaller clock whose value it returns; no other write to
 * that variable may lie between the two.  The constraints are appended to
 * the equation; no step is removed.
 */
public abstract class MemoryModel {
    public static final String CLOCK_PREFIX = "memory_model::clock_";
    public static final String RF_PREFIX = "memory_model::rf_";

    private static final Type CLOCK_TYPE = Type.unsignedbv(32);
    private static final Position POSITION = new InternalPosition("memory_model");

    /**
     * Return the implementation of the given model.
     */
    public static MemoryModel create(Protos.MemoryModel m) {
        switch (m) {
        case TotalStoreOrder:
            return new TotalStoreOrder();
        case PartialStoreOrder:
            return new PartialStoreOrder();
        default:
            return new SequentialConsistency();
        }
    }

    public abstract String getName();

    /**
     * Whether the program order between two events of one thread is kept.
     * The first event precedes the second.
     */
    protected abstract boolean keepsProgramOrder(SsaStep first, SsaStep second);

    protected static boolean isRead(SsaStep s) {
        return s.getKind() == SsaStepKind.SHARED_READ;
    }

    protected static boolean isWrite(SsaStep s) {
        return s.getKind() == SsaStepKind.SHARED_WRITE;
    }

    protected static String variable(SsaStep s) {
        if (s.getSsaLhs() == null) return null;
        return s.getSsaLhs().getL1Identifier();
    }

    protected static boolean sameVariable(SsaStep a, SsaStep b) {
        String x = variable(a);
        return x != null && x.equals(variable(b));
    }

    private static Symbol clock(int index) {
        return new Symbol(CLOCK_PREFIX + index, CLOCK_TYPE);
    }

    private static SsaStep constraint(Expr cond, String comment) {
        return SsaStep.builder(SsaStepKind.CONSTRAINT)
            .cond(cond)
            .comment(comment)
            .position(POSITION)
            .hidden(true)
            .build();
    }

    /**
     * Return <code>eq</code> extended with the ordering constraints of this
     * model, or <code>eq</code> itself when it has no shared events.
     */
    public Equation apply(Equation eq) {
        List<Integer> events = new ArrayList<Integer>();
        Map<Integer, List<Integer>> perThread = new TreeMap<Integer, List<Integer>>();
        Map<String, List<Integer>> writes = new LinkedHashMap<String, List<Integer>>();
        Map<String, List<Integer>> reads = new LinkedHashMap<String, List<Integer>>();
        for (int i = 0; i != eq.size(); ++i) {
            SsaStep s = eq.get(i);
            if (!s.getKind().isSharedEvent()) continue;
            events.add(i);
            List<Integer> t = perThread.get(s.getThread());
            if (t == null) {
                t = new ArrayList<Integer>();
                perThread.put(s.getThread(), t);
            }
            t.add(i);
            if (isWrite(s)) add(writes, variable(s), i);
            if (isRead(s)) add(reads, variable(s), i);
        }
        if (events.isEmpty()) return eq;

        List<SsaStep> out = new ArrayList<SsaStep>();
        programOrder(eq, perThread, out);
        spawnOrder(eq, perThread, out);
        writeSerialization(eq, writes, out);
        readsFrom(eq, reads, writes, out);
        return eq.extend(out);
    }

    private static void add(Map<String, List<Integer>> m, String k, int i) {
        List<Integer> l = m.get(k);
        if (l == null) {
            l = new ArrayList<Integer>();
            m.put(k, l);
        }
        l.add(i);
    }

    private static Expr before(int a, int b) {
        return Exprs.lt(clock(a), clock(b));
    }

    private static Expr both(SsaStep a, SsaStep b) {
        return Exprs.and(a.getGuard(), b.getGuard());
    }

    private void programOrder(Equation eq, Map<Integer, List<Integer>> perThread, List<SsaStep> out) {
        for (List<Integer> t : perThread.values()) {
            for (int i = 0; i < t.size(); ++i) {
                for (int j = i + 1; j < t.size(); ++j) {
                    SsaStep a = eq.get(t.get(i));
                    SsaStep b = eq.get(t.get(j));
                    if (!keepsProgramOrder(a, b)) continue;
                    out.add(constraint(Exprs.implies(both(a, b), before(t.get(i), t.get(j))), "po"));
                }
            }
        }
    }

    private void spawnOrder(Equation eq, Map<Integer, List<Integer>> perThread, List<SsaStep> out) {
        for (List<Integer> t : perThread.values()) {
            for (int i : t) {
                SsaStep spawn = eq.get(i);
                if (spawn.getKind() != SsaStepKind.SPAWN) continue;
                List<Integer> child = perThread.get(spawn.getSpawnedThread());
                if (child == null) continue;
                for (int j : child) {
                    out.add(constraint(Exprs.implies(both(spawn, eq.get(j)), before(i, j)), "spawn"));
                }
            }
        }
    }

    private void writeSerialization(Equation eq, Map<String, List<Integer>> writes, List<SsaStep> out) {
        for (List<Integer> ws : writes.values()) {
            for (int i = 0; i < ws.size(); ++i) {
                for (int j = i + 1; j < ws.size(); ++j) {
                    SsaStep a = eq.get(ws.get(i));
                    SsaStep b = eq.get(ws.get(j));
                    out.add(constraint(Exprs.implies(both(a, b),
                                                     Exprs.ne(clock(ws.get(i)), clock(ws.get(j)))),
                                       "ws"));
                }
            }
        }
    }

    private void readsFrom(Equation eq, Map<String, List<Integer>> reads,
                           Map<String, List<Integer>> writes, List<SsaStep> out) {
        for (Map.Entry<String, List<Integer>> e : reads.entrySet()) {
            List<Integer> ws = writes.get(e.getKey());
            if (ws == null) ws = new ArrayList<Integer>();
            for (int r : e.getValue()) {
                SsaStep read = eq.get(r);
                List<Expr> choices = new ArrayList<Expr>();
                for (int w : ws) {
                    SsaStep write = eq.get(w);
                    Symbol rf = new Symbol(RF_PREFIX + w + "_" + r, Type.BOOL);
                    choices.add(rf);
                    Expr sees = Exprs.and(write.getGuard(),
                                          Exprs.and(Exprs.eq(read.getSsaLhs(), write.getSsaLhs()),
                                                    before(w, r)));
                    out.add(constraint(Exprs.implies(rf, sees), "rf"));
                    for (int w2 : ws) {
                        if (w2 == w) continue;
                        SsaStep other = eq.get(w2);
                        // A write after the one read from must follow the read.
                        Expr later = Exprs.and(rf, Exprs.and(other.getGuard(), before(w, w2)));
                        out.add(constraint(Exprs.implies(later, before(r, w2)), "fr"));
                    }
                }
                out.add(constraint(Exprs.implies(read.getGuard(), Exprs.or(choices)), "rf-some"));
            }
        }
    }
}
