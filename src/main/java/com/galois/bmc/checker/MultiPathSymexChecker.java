package com.galois.bmc.checker;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.galois.bmc.BmcMessage;
import com.galois.bmc.BmcOptions;
import com.galois.bmc.MessageConsumer;
import com.galois.bmc.SolverErrorMessage;
import com.galois.bmc.SolverResourceExhaustedMessage;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.postprocess.MemoryModel;
import com.galois.bmc.postprocess.SliceResult;
import com.galois.bmc.postprocess.Slicer;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.GotoSymex;
import com.galois.bmc.symex.SymexResult;
import com.galois.bmc.trace.GotoTrace;
import com.galois.bmc.trace.TraceBuilder;

/**
 * Incremental checker over all paths of a program.
 *
 * <p>
 * The first call to {@link #run} executes the program symbolically, applies
 * the memory model and slices the equation.  Each call then decides as many
 * properties as one solver call allows: the disjunction of the remaining
 * goals is asserted in a fresh solver scope, and failed properties get
 * their trace before the scope is released.
 */
public class MultiPathSymexChecker {
    /** Whether more calls to {@link MultiPathSymexChecker#run} can help. */
    public enum Progress {
        DONE,
        FOUND_FAIL
    }

    public static final class Result {
        private final Progress progress;
        private final Set<String> updated;

        Result(Progress progress, Set<String> updated) {
            this.progress = progress;
            this.updated = Collections.unmodifiableSet(updated);
        }

        public Progress getProgress() {
            return progress;
        }

        /** Properties whose status changed during the call. */
        public Set<String> getUpdatedProperties() {
            return updated;
        }
    }

    private final GotoModel model;
    private final BmcOptions options;
    private final DecisionProcedure dp;
    private final List<MessageConsumer> listeners = new ArrayList<MessageConsumer>();
    private final List<BmcMessage> messages = new ArrayList<BmcMessage>();
    private PrintStream statusStream = null;
    private boolean buildTraces = true;
    private String openLoop = null;

    private SymexResult symexResult = null;
    private Equation equation = null;
    private PropertyDecider decider = null;
    private long solverRuntimeNanos = 0;
    private boolean inconclusive = false;
    private String inconclusiveReason = null;

    public MultiPathSymexChecker(GotoModel model, BmcOptions options, DecisionProcedure dp) {
        this.model = model;
        this.options = options;
        this.dp = dp;
    }

    /**
     * Set the stream for status messages, or <code>null</code> to disable
     * them.
     */
    public synchronized void setStatusStream(PrintStream s) {
        statusStream = s;
    }

    private void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("bmc: %s\n", msg);
            statusStream.flush();
        }
    }

    public synchronized void addMessageListener(MessageConsumer listener) {
        listeners.add(listener);
    }

    private void report(BmcMessage m) {
        messages.add(m);
        for (MessageConsumer c : listeners) {
            c.acceptMessage(m);
        }
    }

    /** Attach a counterexample to each failed property.  On by default. */
    public void setBuildTraces(boolean b) {
        buildTraces = b;
    }

    /**
     * Name a loop that is unwound further later on.  While symbolic
     * execution cuts it at its bound, refuting the goals does not make the
     * properties pass.
     */
    public void setOpenLoop(String loopId) {
        openLoop = loopId;
    }

    /**
     * Decide what one solver call can decide.
     *
     * @return {@link Progress#DONE} once no property is left undecided or
     *   the decision procedure gave up.
     */
    public Result run(Properties properties) {
        if (equation == null) {
            generateEquation(properties);
        }

        Set<String> updated = new LinkedHashSet<String>();
        if (inconclusive || !properties.hasUnknown()) {
            return new Result(Progress.DONE, updated);
        }

        long prep = decider.prepare(properties);
        logStatus(String.format("converted equation in %.3fs", prep / 1e9));

        dp.push();
        try {
            decider.addConstraintFromGoals(properties);
            logStatus("running " + dp.getDescription());
            DecisionProcedure.Result r = decider.solve();
            solverRuntimeNanos += decider.getLastRuntimeNanos();
            logStatus(String.format("decision procedure returned %s in %.3fs",
                                    r, decider.getLastRuntimeNanos() / 1e9));

            updated.addAll(decider.run(r, properties, canPass()));
            switch (r) {
            case SATISFIABLE:
                if (updated.isEmpty()) {
                    giveUp(new SolverErrorMessage("model satisfies no goal"));
                    break;
                }
                if (buildTraces) {
                    for (String id : updated) {
                        GotoTrace t = TraceBuilder.build(
                            equation, dp, PropertyDecider.matchesFailingProperty(id));
                        properties.get(id).setTrace(t);
                    }
                }
                break;
            case UNSATISFIABLE:
                if (!canPass()) {
                    // The remaining goals may fail on a path that was not explored.
                    return new Result(Progress.DONE, updated);
                }
                break;
            case RESOURCE_EXHAUSTED:
                giveUp(new SolverResourceExhaustedMessage(describe("decision procedure gave up")));
                break;
            case ERROR:
                giveUp(new SolverErrorMessage(describe("decision procedure failed")));
                break;
            default:
                break;
            }
        } finally {
            dp.pop();
        }

        if (inconclusive || !properties.hasUnknown()) {
            return new Result(Progress.DONE, updated);
        }
        return new Result(Progress.FOUND_FAIL, updated);
    }

    private String describe(String what) {
        String why = dp.getReasonUnknown();
        return why == null ? what : what + ": " + why;
    }

    private void giveUp(BmcMessage m) {
        inconclusive = true;
        inconclusiveReason = m.getMessage();
        report(m);
    }

    private void generateEquation(Properties properties) {
        GotoSymex symex = new GotoSymex(model, options);
        symex.setOpenLoop(openLoop);
        symex.setStatusStream(statusStream);
        for (MessageConsumer c : listeners) {
            symex.addMessageListener(c);
        }
        symexResult = symex.run();
        messages.addAll(symexResult.getMessages());

        MemoryModel mm = MemoryModel.create(options.getMemoryModel());
        Equation eq = mm.apply(symexResult.getEquation());

        int passed = BmcUtil.updatePropertiesStatusFromEquation(properties, eq, canPass());
        if (passed > 0) {
            logStatus(passed + " properties hold trivially");
        }

        if (options.isSliceFormula()) {
            SliceResult sr = new Slicer().slice(eq, properties.withStatus(PropertyStatus.UNKNOWN));
            logStatus(sr.toString());
            report(new BmcMessage(sr.toString()));
            eq = sr.getEquation();
        }

        equation = eq;
        decider = new PropertyDecider(equation, dp);
    }

    /** The result of symbolic execution, once {@link #run} was called. */
    public SymexResult getSymexResult() {
        return symexResult;
    }

    /** The equation handed to the decision procedure. */
    public Equation getEquation() {
        return equation;
    }

    public double getSolverRuntimeSeconds() {
        return solverRuntimeNanos / 1e9;
    }

    private boolean hasAbandonedPaths() {
        return symexResult != null && symexResult.hasAbandonedPaths();
    }

    /**
     * Whether the equation covers every behavior, so goals it refutes
     * hold: no path was abandoned and the open loop, if any, was not cut.
     */
    private boolean canPass() {
        if (hasAbandonedPaths()) return false;
        return openLoop == null || symexResult == null || !symexResult.isBoundReached(openLoop);
    }

    /**
     * Whether undecided properties cannot be trusted to hold: the decision
     * procedure gave up, or symbolic execution abandoned a path.
     */
    public boolean isInconclusive() {
        return inconclusive || hasAbandonedPaths();
    }

    /**
     * Why the run is inconclusive: the decision procedure's diagnostic if it
     * gave up, otherwise the reason the first path was abandoned.
     */
    public String getInconclusiveReason() {
        if (inconclusiveReason != null) return inconclusiveReason;
        return hasAbandonedPaths() ? symexResult.getAbandonReason() : null;
    }

    /** Every diagnostic produced so far, symbolic execution included. */
    public List<BmcMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }
}
