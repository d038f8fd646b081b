package com.galois.bmc.checker;

import java.io.PrintStream;

import com.galois.bmc.BmcOptions;
import com.galois.bmc.MessageConsumer;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.solver.DecisionProcedure;
import com.galois.bmc.symex.SymexResult;

/**
 * Decides every property of a program.
 *
 * <p>
 * The checker is driven until nothing is left to decide; failed properties
 * carry their counterexample.  Then the terminal passes run: properties
 * never reached pass unless a path was abandoned, and properties nothing
 * refuted pass flagged as not disproved, unless the run was inconclusive.
 */
public class AllPropertiesVerifier {
    private final GotoModel model;
    private final MultiPathSymexChecker checker;
    private PrintStream statusStream = null;

    public AllPropertiesVerifier(GotoModel model, BmcOptions options, DecisionProcedure dp) {
        this.model = model;
        this.checker = new MultiPathSymexChecker(model, options, dp);
    }

    public synchronized void setStatusStream(PrintStream s) {
        statusStream = s;
        checker.setStatusStream(s);
    }

    private void logStatus(String msg) {
        if (statusStream != null) {
            statusStream.printf("bmc: %s\n", msg);
            statusStream.flush();
        }
    }

    public void addMessageListener(MessageConsumer listener) {
        checker.addMessageListener(listener);
    }

    public MultiPathSymexChecker getChecker() {
        return checker;
    }

    public Properties run() {
        Properties properties = Properties.fromModel(model);
        int cycles = 0;
        MultiPathSymexChecker.Result r;
        do {
            r = checker.run(properties);
            ++cycles;
            if (!r.getUpdatedProperties().isEmpty()) {
                logStatus("cycle " + cycles + " decided " + r.getUpdatedProperties());
            }
        } while (r.getProgress() == MultiPathSymexChecker.Progress.FOUND_FAIL);

        SymexResult sr = checker.getSymexResult();
        String abandoned = sr.hasAbandonedPaths() ? sr.getAbandonReason() : null;
        if (abandoned != null) {
            logStatus("paths were abandoned, undecided properties stay open: " + abandoned);
        }
        BmcUtil.updateStatusOfNotCheckedProperties(properties, abandoned);
        int swept = BmcUtil.updateStatusOfUnknownProperties(
            properties, checker.isInconclusive(), checker.getInconclusiveReason());
        if (swept > 0) {
            logStatus(swept + " properties not disproved");
        }

        logStatus(properties.count(PropertyStatus.FAIL) + " of " + properties.size()
                  + " properties failed");
        return properties;
    }
}
