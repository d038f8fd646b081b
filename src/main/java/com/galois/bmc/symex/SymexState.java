package com.galois.bmc.symex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;

/**
 * The state of one execution path: its guard, call stack, program
 * counter, current values of renamed variables and the threads it has
 * spawned but not yet run.
 */
final class SymexState {
    /** A spawned thread waiting to run once the current one finishes. */
    static final class PendingThread {
        final int id;
        final String function;
        final List<Expr> guard;

        PendingThread(int id, String function, List<Expr> guard) {
            this.id = id;
            this.function = function;
            this.guard = guard;
        }
    }

    /** Guard conjuncts, outermost first. */
    List<Expr> guard;
    List<CallFrame> stack;
    int pc;
    int thread;
    long depth;
    /** Back-edges of the incremental loop taken on this path. */
    long incrementalUnwindings;
    /** Current value of each variable, keyed by level-1 identifier. */
    Map<String, Expr> values;
    List<PendingThread> threads;
    PathStatus status = PathStatus.RUNNING;
    /** Set when the path stops here and is resumed from the worklist later. */
    boolean suspended;

    SymexState() {
        this.guard = new ArrayList<Expr>();
        this.stack = new ArrayList<CallFrame>();
        this.values = new HashMap<String, Expr>();
        this.threads = new ArrayList<PendingThread>();
    }

    SymexState copy() {
        SymexState s = new SymexState();
        s.guard = new ArrayList<Expr>(guard);
        for (CallFrame f : stack) {
            s.stack.add(f.copy());
        }
        s.pc = pc;
        s.thread = thread;
        s.depth = depth;
        s.incrementalUnwindings = incrementalUnwindings;
        s.values = new HashMap<String, Expr>(values);
        s.threads = new ArrayList<PendingThread>(threads);
        return s;
    }

    CallFrame top() {
        return stack.get(stack.size() - 1);
    }

    CallFrame pop() {
        return stack.remove(stack.size() - 1);
    }

    void push(CallFrame f) {
        stack.add(f);
    }

    Expr guardExpr() {
        return Exprs.and(guard);
    }

    void addGuard(Expr e) {
        if (e.isTrue()) return;
        if (e.isFalse()) {
            guard.clear();
        }
        guard.add(e);
    }

    boolean isGuardFalse() {
        return guard.size() == 1 && guard.get(0).isFalse();
    }

    /** Identifies the program point for merging: frame and instruction. */
    String location() {
        return top().frameId + ":" + pc;
    }
}
