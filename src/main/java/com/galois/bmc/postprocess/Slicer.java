package com.galois.bmc.postprocess;

import java.util.BitSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.SliceInvariantViolation;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.SymbolCollector;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.symex.Equation;
import com.galois.bmc.symex.SsaStep;

/**
 * Removes the steps of an equation that cannot influence any undecided
 * property.
 *
 * <p>
 * One backward pass over the equation keeps:
 * <ul>
 * <li>assertions of undecided properties that are not trivially true;</li>
 * <li>assumptions and constraints occurring before the last kept
 * assertion;</li>
 * <li>every definition of a variable that a kept step depends on, together
 * with the definitions of the guard it was made under;</li>
 * <li>other steps before the last kept assertion, such as calls and
 * locations, without following their operands.</li>
 * </ul>
 * Since every SSA variable is defined once, one pass reaches the
 * dependency closure.
 */
public class Slicer {
    /**
     * Slice <code>eq</code> for the given undecided properties.
     */
    public SliceResult slice(Equation eq, Set<String> undecided) {
        int last = -1;
        for (int i = eq.size() - 1; i >= 0; --i) {
            if (isRelevantAssertion(eq.get(i), undecided)) {
                last = i;
                break;
            }
        }

        BitSet keep = new BitSet(eq.size());
        Set<Symbol> needed = new HashSet<Symbol>();
        int dropped = 0;
        for (int i = eq.size() - 1; i >= 0; --i) {
            SsaStep s = eq.get(i);
            switch (s.getKind()) {
            case ASSERT:
                if (isRelevantAssertion(s, undecided) && i <= last) {
                    keep(keep, needed, i, s.getCondExpr());
                } else if (s.getCondExpr().isTrue()) {
                    ++dropped;
                }
                break;
            case ASSUME:
                if (i < last) keep(keep, needed, i, s.getCondExpr());
                break;
            case CONSTRAINT:
                if (last >= 0) keep(keep, needed, i, s.getCondExpr());
                break;
            case ASSIGNMENT:
            case SHARED_WRITE:
                if (needed.contains(s.getSsaLhs())) {
                    keep(keep, needed, i, s.getRhs());
                    needed.addAll(SymbolCollector.collect(s.getGuard()));
                }
                break;
            case SHARED_READ:
            case DECL:
                if (needed.contains(s.getSsaLhs())) {
                    keep.set(i);
                    needed.addAll(SymbolCollector.collect(s.getGuard()));
                }
                break;
            default:
                if (i < last) keep.set(i);
            }
        }

        Equation sliced = eq.slice(keep);
        check(eq, sliced, undecided);
        return new SliceResult(sliced, eq.size() - sliced.size(), dropped);
    }

    private static boolean isRelevantAssertion(SsaStep s, Set<String> undecided) {
        return s.isAssert()
            && undecided.contains(s.getPropertyId())
            && !s.getCondExpr().isTrue();
    }

    private static void keep(BitSet keep, Set<Symbol> needed, int i, Expr e) {
        keep.set(i);
        needed.addAll(SymbolCollector.collect(e));
    }

    /**
     * Verify that the sliced equation still contains every nontrivial
     * assertion of an undecided property and every definition such an
     * assertion depends on.
     */
    void check(Equation original, Equation sliced, Set<String> undecided) {
        Map<Symbol, Integer> definedAt = new HashMap<Symbol, Integer>();
        for (int i = 0; i != original.size(); ++i) {
            SsaStep s = original.get(i);
            if (s.getKind().isDefinition()) definedAt.put(s.getSsaLhs(), i);
        }
        Set<Symbol> present = new HashSet<Symbol>();
        Set<SsaStep> kept = new HashSet<SsaStep>();
        for (SsaStep s : sliced) {
            kept.add(s);
            if (s.getKind().isDefinition()) present.add(s.getSsaLhs());
        }
        for (int i = 0; i != original.size(); ++i) {
            SsaStep s = original.get(i);
            if (isRelevantAssertion(s, undecided) && !kept.contains(s)) {
                throw new SliceInvariantViolation(s.getPropertyId(), i, s.toString());
            }
        }
        for (SsaStep s : sliced) {
            Expr deps = s.getKind().isDefinition() ? s.getRhs() : s.getCondExpr();
            if (deps == null) continue;
            for (Symbol x : SymbolCollector.collect(deps)) {
                Integer d = definedAt.get(x);
                if (d != null && !present.contains(x)) {
                    throw new SliceInvariantViolation(s.isAssert() ? s.getPropertyId() : null,
                                                      d, original.get(d).toString());
                }
            }
        }
    }
}
