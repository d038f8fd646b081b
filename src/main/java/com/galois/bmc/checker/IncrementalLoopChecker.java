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
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.SymexResult;

/**
 * Checks the properties after each unwinding of one loop.
 *
 * <p>
 * The loop named by <code>incremental-loop</code> is bounded at
 * <code>unwind-min</code> (at least one), then one more iteration at a time
 * up to <code>unwind-max</code>; without <code>unwind-max</code> it is
 * unwound until symbolic execution no longer cuts it.  For every bound the
 * program is executed afresh and checked inside its own solver scope, which
 * is released before the next bound.
 *
 * <p>
 * Failures found at any bound are final.  Goals refuted while the loop is
 * still cut prove nothing, so properties only pass once the loop ran to
 * completion or at the last bound.
 */
public class IncrementalLoopChecker {
    private final GotoModel model;
    private final BmcOptions options;
    private final DecisionProcedure dp;
    private final String loopId;
    private final List<MessageConsumer> listeners = new ArrayList<MessageConsumer>();
    private final List<BmcMessage> messages = new ArrayList<BmcMessage>();
    private PrintStream statusStream = null;
    private boolean buildTraces = true;

    private MultiPathSymexChecker last = null;
    private long lastBound = 0;
    private double solverRuntimeSeconds = 0;
    private boolean inconclusive = false;
    private String inconclusiveReason = null;

    /**
     * @throws IllegalArgumentException if no incremental loop is configured,
     *   the loop does not exist, or <code>unwind-min</code> exceeds
     *   <code>unwind-max</code>.
     */
    public IncrementalLoopChecker(GotoModel model, BmcOptions options, DecisionProcedure dp) {
        if (!options.isIncrementalLoop()) {
            throw new IllegalArgumentException("No incremental loop configured.");
        }
        if (model.findLoop(options.getIncrementalLoop()) == null) {
            throw new IllegalArgumentException("Unknown loop " + options.getIncrementalLoop());
        }
        if (options.getUnwindMax() > 0 && options.getUnwindMin() > options.getUnwindMax()) {
            throw new IllegalArgumentException("unwind-min " + options.getUnwindMin()
                                               + " exceeds unwind-max " + options.getUnwindMax());
        }
        this.model = model;
        this.options = options;
        this.dp = dp;
        this.loopId = options.getIncrementalLoop();
    }

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

    /** Attach a counterexample to each failed property.  On by default. */
    public void setBuildTraces(boolean b) {
        buildTraces = b;
    }

    public Properties run() {
        Properties properties = Properties.fromModel(model);
        Set<String> ignored = new LinkedHashSet<String>();
        long max = options.getUnwindMax();
        boolean open = true;

        for (long k = Math.max(1, options.getUnwindMin()); ; ++k) {
            boolean finalBound = max > 0 && k >= max;
            boolean cut = checkBound(properties, k, finalBound, ignored);
            open = cut && !finalBound;
            if (inconclusive || !cut || finalBound || properties.undecided().isEmpty()) {
                break;
            }
        }

        SymexResult sr = last.getSymexResult();
        String abandoned = null;
        if (sr.hasAbandonedPaths()) {
            abandoned = sr.getAbandonReason();
        } else if (open) {
            // Unreached properties may still be reached by further iterations.
            abandoned = "loop " + loopId + " was cut after " + lastBound + " iterations";
        }
        BmcUtil.updateStatusOfNotCheckedProperties(
            properties, abandoned, ignored,
            "assertion reached before loop " + loopId + " was unwound "
            + options.getUnwindMin() + " times");
        int swept = BmcUtil.updateStatusOfUnknownProperties(properties, inconclusive,
                                                            inconclusiveReason);
        if (swept > 0) {
            logStatus(swept + " properties not disproved");
        }
        logStatus(properties.count(PropertyStatus.FAIL) + " of " + properties.size()
                  + " properties failed, loop " + loopId + " unwound " + lastBound + " times");
        return properties;
    }

    /**
     * Execute and check the program with the loop bounded at
     * <code>k</code>.
     *
     * @return whether symbolic execution cut the loop at its bound.
     */
    private boolean checkBound(Properties properties, long k, boolean finalBound,
                               Set<String> ignored) {
        BmcOptions o = options.copy();
        o.setLoopBound(loopId, k);
        logStatus("checking with loop " + loopId + " unwound " + k + " times");

        MultiPathSymexChecker checker = new MultiPathSymexChecker(model, o, dp);
        checker.setStatusStream(statusStream);
        checker.setBuildTraces(buildTraces);
        if (!finalBound) {
            checker.setOpenLoop(loopId);
        }
        for (MessageConsumer c : listeners) {
            checker.addMessageListener(c);
        }

        dp.push();
        try {
            MultiPathSymexChecker.Result r;
            do {
                r = checker.run(properties);
                if (!r.getUpdatedProperties().isEmpty()) {
                    logStatus("bound " + k + " decided " + r.getUpdatedProperties());
                }
            } while (r.getProgress() == MultiPathSymexChecker.Progress.FOUND_FAIL);
        } finally {
            dp.pop();
        }

        last = checker;
        lastBound = k;
        messages.addAll(checker.getMessages());
        solverRuntimeSeconds += checker.getSolverRuntimeSeconds();
        SymexResult sr = checker.getSymexResult();
        ignored.addAll(sr.getIgnoredProperties());
        if (checker.isInconclusive()) {
            inconclusive = true;
            inconclusiveReason = checker.getInconclusiveReason();
        }
        return sr.isBoundReached(loopId);
    }

    /** The checker of the last bound, once {@link #run} was called. */
    public MultiPathSymexChecker getLastChecker() {
        return last;
    }

    /** The last bound the loop was checked at. */
    public long getLastBound() {
        return lastBound;
    }

    public double getSolverRuntimeSeconds() {
        return solverRuntimeSeconds;
    }

    public boolean isInconclusive() {
        return inconclusive;
    }

    public String getInconclusiveReason() {
        return inconclusiveReason;
    }

    /** Diagnostics of every bound checked. */
    public List<BmcMessage> getMessages() {
        return Collections.unmodifiableList(messages);
    }
}
