package com.galois.bmc.solver;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;
import com.galois.bmc.encoding.EncodingCache;
import com.galois.bmc.encoding.StructEncoding;
import com.galois.bmc.encoding.StructLowering;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;

/**
 * Decision procedure backed by an incremental Z3 solver.
 *
 * <p>
 * Expressions are first lowered with {@link StructLowering}, so structs
 * reach Z3 as flat bitvectors; model values are decoded back into struct
 * and array literals.  The solver context is owned by this object and
 * released by {@link #close()}.
 */
public class Z3DecisionProcedure implements DecisionProcedure {
    /** Name of the literals returned by {@link #handle}. */
    public static final String HANDLE_SYMBOL = "bmc::handle";

    private static final long MAX_ARRAY_ELEMENTS = 1024;

    private final Context ctx;
    private final Solver solver;
    private final Z3Converter converter;
    private final StructEncoding encoding;
    private final StructLowering lowering;
    private Model model = null;
    private int handleCounter = 0;
    private int solverCalls = 0;
    private String reasonUnknown = null;

    /**
     * @param ns symbol table used to resolve struct tags.
     * @param timeoutMs per-call time limit in milliseconds, <code>0</code>
     *   for none.
     */
    public Z3DecisionProcedure(SymbolTable ns, long timeoutMs) {
        this.ctx = new Context();
        try {
            this.solver = ctx.mkSolver();
            if (timeoutMs > 0) {
                Params p = ctx.mkParams();
                p.add("timeout", (int) Math.min(timeoutMs, Integer.MAX_VALUE));
                solver.setParameters(p);
            }
        } catch (Z3Exception e) {
            ctx.close();
            throw new DecisionProcedureException("Could not create Z3 solver", e);
        }
        this.converter = new Z3Converter(ctx);
        this.encoding = new StructEncoding(ns, new EncodingCache());
        this.lowering = new StructLowering(encoding);
    }

    public Z3DecisionProcedure(SymbolTable ns) {
        this(ns, 0);
    }

    private BoolExpr toZ3(Expr e) {
        try {
            return converter.convertBool(lowering.transform(e));
        } catch (Z3Exception ex) {
            throw new DecisionProcedureException("Z3 rejected " + e, ex);
        }
    }

    public void setToTrue(Expr e) {
        BoolExpr b = toZ3(e);
        try {
            solver.add(b);
        } catch (Z3Exception ex) {
            throw new DecisionProcedureException("Z3 rejected " + e, ex);
        }
    }

    public void setToFalse(Expr e) {
        setToTrue(Exprs.not(e));
    }

    public Symbol handle(Expr e) {
        Symbol h = new Symbol(HANDLE_SYMBOL, Type.BOOL).withVersion(++handleCounter);
        setToTrue(Exprs.eq(h, e));
        return h;
    }

    public Result solve() {
        ++solverCalls;
        model = null;
        reasonUnknown = null;
        try {
            Status s = solver.check();
            switch (s) {
            case SATISFIABLE:
                model = solver.getModel();
                return Result.SATISFIABLE;
            case UNSATISFIABLE:
                return Result.UNSATISFIABLE;
            default:
                reasonUnknown = solver.getReasonUnknown();
                return Result.RESOURCE_EXHAUSTED;
            }
        } catch (Z3Exception ex) {
            reasonUnknown = ex.getMessage();
            return Result.ERROR;
        }
    }

    public String getReasonUnknown() {
        return reasonUnknown;
    }

    public Expr getValue(Expr e) {
        if (model == null) {
            throw new IllegalStateException("No model: the last solve was not satisfiable.");
        }
        try {
            Expr lowered = lowering.transform(e);
            Expr v = converter.valueOf(model, converter.convert(lowered), lowered.type(),
                                       MAX_ARRAY_ELEMENTS);
            if (v == null) return null;
            return encoding.decode(e.type(), v);
        } catch (Z3Exception ex) {
            throw new DecisionProcedureException("Could not evaluate " + e, ex);
        }
    }

    public void push() {
        solver.push();
    }

    public void pop() {
        solver.pop();
        model = null;
    }

    public String getDescription() {
        return "Z3 " + com.microsoft.z3.Version.getString();
    }

    public int getSolverCallCount() {
        return solverCalls;
    }

    public void close() {
        ctx.close();
    }
}
