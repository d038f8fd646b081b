package com.galois.bmc;

import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.galois.bmc.checker.Properties;
import com.galois.bmc.checker.PropertyInfo;
import com.galois.bmc.checker.PropertyStatus;
import com.galois.bmc.proto.Protos;
import com.galois.bmc.symex.SymexCoverage;

/**
 * Outcome of a verification run: a status for every property, the
 * counterexamples of failed ones, solver time, coverage and diagnostics.
 */
public class VerificationResult {
    private final Properties properties;
    private final double solverRuntimeSeconds;
    private final SymexCoverage coverage;
    private final List<BmcMessage> diagnostics;
    private final boolean inconclusive;

    public VerificationResult(Properties properties, double solverRuntimeSeconds,
                              SymexCoverage coverage, List<BmcMessage> diagnostics,
                              boolean inconclusive) {
        this.properties = properties;
        this.solverRuntimeSeconds = solverRuntimeSeconds;
        this.coverage = coverage;
        this.diagnostics = Collections.unmodifiableList(new ArrayList<BmcMessage>(diagnostics));
        this.inconclusive = inconclusive;
    }

    public Properties getProperties() {
        return properties;
    }

    public PropertyInfo getProperty(String id) {
        return properties.get(id);
    }

    public PropertyStatus getStatus(String id) {
        PropertyInfo p = properties.get(id);
        if (p == null) {
            throw new IllegalArgumentException("Unknown property " + id);
        }
        return p.getStatus();
    }

    public Map<String, PropertyStatus> getStatusMap() {
        return properties.statusMap();
    }

    public double getSolverRuntimeSeconds() {
        return solverRuntimeSeconds;
    }

    public SymexCoverage getCoverage() {
        return coverage;
    }

    public List<BmcMessage> getDiagnostics() {
        return diagnostics;
    }

    /**
     * Whether some result is not definitive because a path was abandoned or
     * the decision procedure gave up.
     */
    public boolean isInconclusive() {
        return inconclusive;
    }

    /**
     * Whether every property passed on a conclusive run.  A run that
     * abandoned a path or lost the decision procedure never succeeds.
     */
    public boolean isSuccess() {
        return !inconclusive && properties.count(PropertyStatus.PASS) == properties.size();
    }

    public Protos.VerificationResult getResultRep() {
        Protos.VerificationResult.Builder b = Protos.VerificationResult.newBuilder()
            .setSolverRuntimeSeconds(solverRuntimeSeconds)
            .setInconclusive(inconclusive);
        for (PropertyInfo p : properties) {
            b.addProperty(p.getPropertyResultRep());
        }
        for (SymexCoverage.Entry e : coverage.getEntries()) {
            b.addCoverage(e.getCoverageRep());
        }
        for (BmcMessage m : diagnostics) {
            b.addDiagnostic(m.getDiagnosticRep());
        }
        return b.build();
    }

    /**
     * Write the length-delimited protocol buffer form to <code>out</code>.
     */
    public void writeDelimitedTo(OutputStream out) throws IOException {
        getResultRep().writeDelimitedTo(out);
        out.flush();
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        for (PropertyInfo p : properties) {
            b.append(p).append('\n');
        }
        b.append(String.format("Runtime decision procedure: %.3fs", solverRuntimeSeconds));
        if (inconclusive) b.append(" (inconclusive)");
        return b.toString();
    }
}
