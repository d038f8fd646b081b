package com.galois.bmc.symex;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import com.galois.bmc.cfg.GotoFunction;
import com.galois.bmc.cfg.Loop;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.expr.Expr;

/**
 * An active function call on a path's call stack.
 */
final class CallFrame {
    final GotoFunction function;
    final int frameId;
    /** Where the caller continues, or <code>-1</code> for a thread's entry. */
    final int returnPc;
    /** Where the caller stores the returned value; may be <code>null</code>. */
    final Expr callerLhs;
    final Position callSite;
    private final Map<String, Long> loopIterations;

    CallFrame(GotoFunction function, int frameId, int returnPc, Expr callerLhs, Position callSite) {
        this(function, frameId, returnPc, callerLhs, callSite, new HashMap<String, Long>());
    }

    private CallFrame(GotoFunction function, int frameId, int returnPc, Expr callerLhs,
                      Position callSite, Map<String, Long> loopIterations) {
        this.function = function;
        this.frameId = frameId;
        this.returnPc = returnPc;
        this.callerLhs = callerLhs;
        this.callSite = callSite;
        this.loopIterations = loopIterations;
    }

    CallFrame copy() {
        return new CallFrame(function, frameId, returnPc, callerLhs, callSite,
                             new HashMap<String, Long>(loopIterations));
    }

    /** Count one more iteration of a loop and return the new count. */
    long nextIteration(String loopId) {
        Long n = loopIterations.get(loopId);
        long c = (n == null ? 0 : n.longValue()) + 1;
        loopIterations.put(loopId, c);
        return c;
    }

    long getIterations(String loopId) {
        Long n = loopIterations.get(loopId);
        return n == null ? 0 : n.longValue();
    }

    void resetLoop(String loopId) {
        loopIterations.remove(loopId);
    }

    /** Forget the counters of every loop that does not contain <code>pc</code>. */
    void leaveLoops(int pc) {
        if (loopIterations.isEmpty()) return;
        for (Loop l : function.getLoops()) {
            if (!l.contains(pc)) {
                loopIterations.remove(l.getId());
            }
        }
    }

    /** Keep the larger iteration count of each loop. */
    void mergeLoops(CallFrame other) {
        Iterator<Map.Entry<String, Long>> i = other.loopIterations.entrySet().iterator();
        while (i.hasNext()) {
            Map.Entry<String, Long> e = i.next();
            if (getIterations(e.getKey()) < e.getValue().longValue()) {
                loopIterations.put(e.getKey(), e.getValue());
            }
        }
    }

    /** The innermost loop containing <code>pc</code>, or <code>null</code>. */
    Loop innermostLoop(int pc) {
        Loop r = null;
        for (Loop l : function.getLoops()) {
            if (l.contains(pc)
                && (r == null || l.getBackEdge() - l.getHead() < r.getBackEdge() - r.getHead())) {
                r = l;
            }
        }
        return r;
    }

    public String toString() {
        return function.getName() + "!" + frameId;
    }
}
