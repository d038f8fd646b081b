package com.galois.bmc;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.checker.AllPropertiesVerifier;
import com.galois.bmc.checker.IncrementalLoopChecker;
import com.galois.bmc.checker.MultiPathSymexChecker;
import com.galois.bmc.checker.Properties;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.solver.Z3DecisionProcedure;
import com.galois.bmc.symex.SymexResult;

/**
 * Bounded model checker for goto programs.
 *
 * <p>
 * A <code>Bmc</code> object checks one model with one set of options.  By
 * default it owns a {@link Z3DecisionProcedure} for the duration of
 * {@link #run}; another decision procedure can be supplied instead, in
 * which case the caller keeps ownership.
 */
public class Bmc {
    private final GotoModel model;
    private final BmcOptions options;
    private final DecisionProcedure suppliedDp;
    private final List<MessageConsumer> listeners = new ArrayList<MessageConsumer>();
    private PrintStream statusStream = null;

    public Bmc(GotoModel model, BmcOptions options) {
        this(model, options, null);
    }

    public Bmc(GotoModel model, BmcOptions options, DecisionProcedure dp) {
        this.model = model;
        this.options = options;
        this.suppliedDp = dp;
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

    /**
     * Check every property of the model.
     *
     * @throws StructuralInvariantViolation if the program is malformed.
     * @throws UnknownTypeTagException if a struct tag cannot be resolved.
     */
    public VerificationResult run() {
        DecisionProcedure dp = suppliedDp;
        if (dp == null) {
            dp = new Z3DecisionProcedure(model.getSymbolTable(), options.getSolverTimeoutMs());
        }
        try {
            logStatus("checking " + model.getEntryPoint() + " with " + dp.getDescription());
            if (options.isIncrementalLoop()) {
                return runIncremental(dp);
            }
            AllPropertiesVerifier v = new AllPropertiesVerifier(model, options, dp);
            v.setStatusStream(statusStream);
            for (MessageConsumer c : listeners) {
                v.addMessageListener(c);
            }
            Properties properties = v.run();

            MultiPathSymexChecker checker = v.getChecker();
            SymexResult sr = checker.getSymexResult();
            boolean inconclusive = checker.isInconclusive() || sr.hasAbandonedPaths();
            return new VerificationResult(properties, checker.getSolverRuntimeSeconds(),
                                          sr.getCoverage(), checker.getMessages(), inconclusive);
        } finally {
            if (suppliedDp == null) {
                dp.close();
            }
        }
    }

    private VerificationResult runIncremental(DecisionProcedure dp) {
        IncrementalLoopChecker c = new IncrementalLoopChecker(model, options, dp);
        c.setStatusStream(statusStream);
        for (MessageConsumer l : listeners) {
            c.addMessageListener(l);
        }
        Properties properties = c.run();
        SymexResult sr = c.getLastChecker().getSymexResult();
        return new VerificationResult(properties, c.getSolverRuntimeSeconds(),
                                      sr.getCoverage(), c.getMessages(), c.isInconclusive());
    }
}
