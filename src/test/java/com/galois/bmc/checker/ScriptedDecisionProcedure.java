package com.galois.bmc.checker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.solver.DecisionProcedure;

/**
 * Decision procedure answering from a fixed list of verdicts.  In a
 * satisfiable model every Boolean is true and other values are unknown.
 */
class ScriptedDecisionProcedure implements DecisionProcedure {
    private final Deque<Result> script;
    final List<Expr> asserted = new ArrayList<Expr>();
    int handles = 0;
    int calls = 0;
    int depth = 0;
    boolean closed = false;
    private Result last = null;

    ScriptedDecisionProcedure(Result... script) {
        this.script = new ArrayDeque<Result>(Arrays.asList(script));
    }

    public void setToTrue(Expr e) {
        asserted.add(e);
    }

    public void setToFalse(Expr e) {
        asserted.add(Exprs.not(e));
    }

    public Symbol handle(Expr e) {
        Symbol h = new Symbol("scripted::handle", Type.BOOL).withVersion(++handles);
        setToTrue(Exprs.eq(h, e));
        return h;
    }

    public Result solve() {
        ++calls;
        if (script.isEmpty()) {
            throw new AssertionError("unexpected solver call " + calls);
        }
        last = script.poll();
        return last;
    }

    public Expr getValue(Expr e) {
        if (last != Result.SATISFIABLE) {
            throw new IllegalStateException("no model");
        }
        return e.type().isBool() ? Exprs.TRUE : null;
    }

    public String getReasonUnknown() {
        return last == Result.RESOURCE_EXHAUSTED || last == Result.ERROR ? "scripted" : null;
    }

    public void push() {
        ++depth;
    }

    public void pop() {
        if (depth == 0) throw new IllegalStateException("pop without push");
        --depth;
    }

    public String getDescription() {
        return "scripted";
    }

    public int getSolverCallCount() {
        return calls;
    }

    public void close() {
        closed = true;
    }
}
