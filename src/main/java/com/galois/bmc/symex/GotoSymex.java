package com.galois.bmc.symex;

import java.io.PrintStream;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.galois.bmc.BmcMessage;
import com.galois.bmc.BmcOptions;
import com.galois.bmc.ComplexityAbandonedMessage;
import com.galois.bmc.DepthAbandonedMessage;
import com.galois.bmc.MessageConsumer;
import com.galois.bmc.StructuralInvariantViolation;
import com.galois.bmc.SymbolDefinition;
import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;
import com.galois.bmc.cfg.Assert;
import com.galois.bmc.cfg.Assign;
import com.galois.bmc.cfg.Assume;
import com.galois.bmc.cfg.Dead;
import com.galois.bmc.cfg.Decl;
import com.galois.bmc.cfg.FunctionCall;
import com.galois.bmc.cfg.Goto;
import com.galois.bmc.cfg.GotoFunction;
import com.galois.bmc.cfg.GotoModel;
import com.galois.bmc.cfg.Input;
import com.galois.bmc.cfg.Instruction;
import com.galois.bmc.cfg.InstructionVisitor;
import com.galois.bmc.cfg.InternalPosition;
import com.galois.bmc.cfg.IoInstruction;
import com.galois.bmc.cfg.Loop;
import com.galois.bmc.cfg.Output;
import com.galois.bmc.cfg.Position;
import com.galois.bmc.cfg.Return;
import com.galois.bmc.cfg.Skip;
import com.galois.bmc.cfg.StartThread;
import com.galois.bmc.expr.BvConstant;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.ExprTransformer;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Index;
import com.galois.bmc.expr.Member;
import com.galois.bmc.expr.Nondet;
import com.galois.bmc.expr.Simplifier;
import com.galois.bmc.expr.Symbol;
import com.galois.bmc.expr.UnaryExpr;
import com.galois.bmc.proto.Protos;

/**
 * Symbolic execution of a goto program into an SSA {@link Equation}.
 *
 * <p>
 * Execution starts at the entry function after initializing all static
 * variables.  Every assignment introduces a new SSA version of its target;
 * constant values are propagated.  At conditional branches the path guard is
 * split.  By default each branch continues as its own path and paths are
 * explored depth-first or breadth-first; with path merging enabled the two
 * sides are joined again where control flow meets, and differing variables
 * are combined with if-then-else.
 *
 * <p>
 * Loops are unwound until their bound.  When a back-edge is reached for the
 * bound-th time the loop is left: an unwinding assertion is added if
 * enabled, and unless partial loops are permitted the remaining iterations
 * are assumed away.  Recursion is bounded the same way, using the name of
 * the function as the loop identifier.
 *
 * <p>
 * With an incremental loop configured, each path counts the back-edges of
 * that loop it took, and may drop assertions reached before the loop was
 * unwound <code>unwind-min</code> times.
 *
 * <p>
 * Spawned threads run after the spawning thread has finished; their reads
 * and writes of shared variables are recorded as shared-memory events for
 * the memory model.
 */
public class GotoSymex {
    /** Name of the symbols that branch conditions are bound to. */
    public static final String GUARD_SYMBOL = "goto_symex::guard";
    /** Name of the symbols standing for nondeterministic values. */
    public static final String NONDET_SYMBOL = "symex::nondet";
    /** Suffix of the variable holding a function's return value. */
    public static final String RETURN_VALUE = "::return_value";
    /** Function name given to the initialization of static variables. */
    public static final String INITIALIZE = "__bmc_initialize";

    private final GotoModel model;
    private final SymbolTable ns;
    private final BmcOptions options;
    private final Simplifier simplifier;
    private final boolean concurrent;
    private final List<MessageConsumer> listeners = new ArrayList<MessageConsumer>();
    private PrintStream statusStream = null;
    private String openLoop = null;

    // State of the current run.
    private ComplexityModule complexity;
    private Equation.Builder target;
    private Map<String, Integer> versions;
    private Map<String, Symbol> level1Symbols;
    private int guardCounter;
    private int nondetCounter;
    private int frameCounter;
    private int threadCounter;
    private SymexCoverage coverage;
    private List<BmcMessage> messages;
    private int completedPaths;
    private int abandonedPaths;
    private Deque<SymexState> worklist;
    private Map<String, SymexState> pending;
    private Set<String> loopsAtBound;
    private Set<String> ignoredProperties;

    public GotoSymex(GotoModel model, BmcOptions options) {
        this.model = model;
        this.ns = model.getSymbolTable();
        this.options = options;
        this.simplifier = new Simplifier(ns);
        this.concurrent = model.hasConcurrency();
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
     * Name a loop whose bound is not final, because it will be unwound
     * further in a later run.  No unwinding assertion is added for it.
     */
    public void setOpenLoop(String loopId) {
        openLoop = loopId;
    }

    private void report(BmcMessage m) {
        messages.add(m);
        for (MessageConsumer c : listeners) {
            c.acceptMessage(m);
        }
    }

    /**
     * Execute the entry function of the model.
     */
    public SymexResult run() {
        if (options.isValidateProgram()) {
            model.validate(true).throwIfInvalid();
        }

        complexity = new ComplexityModule(options);
        target = new Equation.Builder();
        versions = new HashMap<String, Integer>();
        level1Symbols = new HashMap<String, Symbol>();
        guardCounter = 0;
        nondetCounter = 0;
        frameCounter = 0;
        threadCounter = 0;
        coverage = new SymexCoverage();
        messages = new ArrayList<BmcMessage>();
        completedPaths = 0;
        abandonedPaths = 0;
        worklist = new ArrayDeque<SymexState>();
        pending = new LinkedHashMap<String, SymexState>();
        loopsAtBound = new LinkedHashSet<String>();
        ignoredProperties = new LinkedHashSet<String>();

        GotoFunction entry = model.getEntryFunction();
        SymexState s = new SymexState();
        initializeStatics(s, false);

        s.push(new CallFrame(entry, ++frameCounter, -1, null, null));
        Position entryPos = new InternalPosition(entry.getName());
        for (Symbol p : entry.getParameters()) {
            assign(s, p, freshNondet(p.type()), p, entryPos, true);
        }
        worklist.push(s);

        SymexState next;
        while ((next = nextState()) != null) {
            runPath(next);
        }

        Equation eq = target.build();
        logStatus("symbolic execution produced " + eq.size() + " steps, "
                  + completedPaths + " paths completed, "
                  + abandonedPaths + " abandoned");
        return new SymexResult(eq, coverage, messages, completedPaths, abandonedPaths,
                               loopsAtBound, ignoredProperties);
    }

    private SymexState nextState() {
        SymexState s = worklist.poll();
        if (s != null) {
            s.suspended = false;
            return s;
        }
        // Resume the pending state in the deepest frame with the lowest
        // instruction index.
        String best = null;
        SymexState bestState = null;
        for (Map.Entry<String, SymexState> e : pending.entrySet()) {
            SymexState c = e.getValue();
            if (bestState == null
                || c.stack.size() > bestState.stack.size()
                || (c.stack.size() == bestState.stack.size() && c.pc < bestState.pc)) {
                best = e.getKey();
                bestState = c;
            }
        }
        if (best != null) {
            pending.remove(best);
            bestState.suspended = false;
        }
        return bestState;
    }

    private void runPath(SymexState s) {
        while (s.status == PathStatus.RUNNING && !s.suspended) {
            if (s.isGuardFalse()) {
                return;
            }
            step(s);
        }
        if (s.status == PathStatus.COMPLETED) {
            ++completedPaths;
        } else if (s.status.isAbandoned()) {
            ++abandonedPaths;
        }
    }

    private void step(SymexState s) {
        if (options.isPathMerging()) {
            SymexState other = pending.remove(s.location());
            if (other != null) {
                merge(s, other);
            }
        }
        CallFrame f = s.top();
        List<Instruction> body = f.function.getBody();
        if (s.pc >= body.size()) {
            endOfFunction(s);
            return;
        }
        Instruction i = body.get(s.pc);
        coverage.record(f.function.getName(), s.pc, i.getPosition());
        ++s.depth;
        if (options.getDepth() > 0 && s.depth > options.getDepth()) {
            abandon(s, PathStatus.ABANDONED_DEPTH,
                    new DepthAbandonedMessage("depth limit " + options.getDepth() + " exceeded",
                                              backtrace(s, i.getPosition())));
            return;
        }
        i.accept(new Executor(s));
    }

    private void abandon(SymexState s, PathStatus status, BmcMessage m) {
        s.status = status;
        report(m);
        logStatus(m.getMessage());
    }

    private List<Position> backtrace(SymexState s, Position here) {
        List<Position> bt = new LinkedList<Position>();
        bt.add(here);
        for (int i = s.stack.size() - 1; i >= 0; --i) {
            Position p = s.stack.get(i).callSite;
            if (p != null) bt.add(p);
        }
        return bt;
    }

    // ------------------------------------------------------------------
    // Steps

    private SsaStep.Builder stepFor(SsaStepKind kind, SymexState s, Position pos) {
        SsaStep.Builder b = SsaStep.builder(kind)
            .guard(s.guardExpr())
            .position(pos)
            .thread(s.thread);
        if (!s.stack.isEmpty()) {
            b.function(s.top().function.getName()).pc(s.pc);
        } else {
            b.function(INITIALIZE);
        }
        return b;
    }

    private void emit(SsaStep.Builder b) {
        target.append(b.build());
    }

    // ------------------------------------------------------------------
    // Renaming

    private boolean isSharedEvent(Symbol l0) {
        if (!concurrent) return false;
        SymbolDefinition d = ns.lookup(l0.getName());
        return d != null && d.isShared();
    }

    /**
     * Whether elements of an array variable are tracked as separate
     * variables.
     */
    private boolean isFieldSensitive(Symbol l0) {
        long max = options.getMaxFieldSensitivityArraySize();
        if (max <= 0) return false;
        Type t = ns.follow(l0.type());
        if (!t.isArray()) return false;
        long n = t.constantArraySize();
        return n >= 0 && n <= max && !isSharedEvent(l0);
    }

    private Symbol level1(SymexState s, Symbol l0) {
        if (l0.getFrame() >= 0) return l0.level1();
        SymbolDefinition d = ns.lookup(l0.getName());
        if (d != null && d.isStaticLifetime()) {
            return d.isThreadLocal() ? l0.withFrame(s.thread) : l0;
        }
        return l0.withFrame(s.top().frameId);
    }

    private static Symbol element(Symbol l1, long k) {
        Type t = l1.type().arrayElementType();
        Symbol e = new Symbol(l1.getName() + "[[" + k + "]]", t);
        return l1.getFrame() < 0 ? e : e.withFrame(l1.getFrame());
    }

    private long elementCount(Symbol l0) {
        return ns.follow(l0.type()).constantArraySize();
    }

    private Expr currentValue(SymexState s, Symbol l1) {
        Expr v = s.values.get(l1.getL1Identifier());
        if (v != null) return v;
        return l1.withVersion(0);
    }

    private Symbol fresh(Symbol l1) {
        String id = l1.getL1Identifier();
        Integer v = versions.get(id);
        int n = v == null ? 1 : v.intValue() + 1;
        versions.put(id, n);
        level1Symbols.put(id, l1);
        return l1.withVersion(n);
    }

    private Symbol freshNondet(Type t) {
        return new Symbol(NONDET_SYMBOL, t).withVersion(++nondetCounter);
    }

    private Expr read(SymexState s, Symbol l0, Position pos) {
        Symbol l1 = level1(s, l0);
        if (isSharedEvent(l0)) {
            Symbol r = fresh(l1);
            emit(stepFor(SsaStepKind.SHARED_READ, s, pos)
                 .ssaLhs(r).originalLhs(l0).hidden(true));
            return r;
        }
        if (l0.getFrame() < 0 && isFieldSensitive(l0)) {
            long n = elementCount(l0);
            List<Expr> elems = new ArrayList<Expr>();
            for (long k = 0; k != n; ++k) {
                elems.add(currentValue(s, element(l1, k)));
            }
            return Exprs.arrayLiteral(l0.type(), elems);
        }
        return currentValue(s, l1);
    }

    /**
     * Replaces variables by their current values and nondeterministic
     * choices by fresh symbols.
     */
    private final class Renamer extends ExprTransformer {
        private final SymexState s;
        private final Position pos;

        Renamer(SymexState s, Position pos) {
            this.s = s;
            this.pos = pos;
        }

        public Expr visitSymbol(Symbol e) {
            return read(s, e, pos);
        }

        public Expr visitNondet(Nondet e) {
            return freshNondet(e.type());
        }

        public Expr visitIndex(Index e) {
            if (e.getArray() instanceof Symbol) {
                Symbol a = (Symbol) e.getArray();
                if (a.getFrame() < 0 && isFieldSensitive(a)) {
                    return readElement(a, simplifier.transform(transform(e.getIndex())));
                }
            }
            return transformOperands(e);
        }

        private Expr readElement(Symbol a, Expr idx) {
            Symbol l1 = level1(s, a);
            long n = elementCount(a);
            if (n == 0) {
                return freshNondet(elementType(a));
            }
            if (idx instanceof BvConstant) {
                BigInteger k = ((BvConstant) idx).getValue();
                if (k.compareTo(BigInteger.valueOf(n)) >= 0) {
                    return freshNondet(elementType(a));
                }
                return currentValue(s, element(l1, k.longValue()));
            }
            // Out-of-range indices read the last element.
            Expr r = currentValue(s, element(l1, n - 1));
            for (long k = n - 2; k >= 0; --k) {
                r = Exprs.ite(Exprs.eq(idx, Exprs.constant(idx.type(), k)),
                              currentValue(s, element(l1, k)), r);
            }
            return r;
        }

        private Type elementType(Symbol a) {
            return ns.follow(a.type()).arrayElementType();
        }
    }

    private Expr rename(SymexState s, Expr e, Position pos) {
        return simplifier.transform(new Renamer(s, pos).transform(e));
    }

    // ------------------------------------------------------------------
    // Assignment

    /**
     * Assign the already renamed value <code>rhs</code> to the program
     * lvalue <code>lhs</code>.
     */
    private void assign(SymexState s, Expr lhs, Expr rhs, Expr originalLhs,
                        Position pos, boolean hidden) {
        if (lhs instanceof Symbol) {
            Symbol x = (Symbol) lhs;
            if (x.getFrame() < 0 && isFieldSensitive(x)) {
                Symbol l1 = level1(s, x);
                long n = elementCount(x);
                for (long k = 0; k != n; ++k) {
                    Expr v = simplifier.transform(Exprs.index(rhs, Exprs.constant(Exprs.indexType(rhs), k)));
                    writeLevel1(s, element(l1, k), v, originalLhs, pos, hidden, false);
                }
                return;
            }
            writeLevel1(s, level1(s, x), rhs, originalLhs, pos, hidden, isSharedEvent(x));
        } else if (lhs instanceof Member) {
            Member m = (Member) lhs;
            Expr current = rename(s, m.getCompound(), pos);
            Expr updated = simplifier.transform(
                Exprs.memberUpdate(ns, current, m.getComponentName(), rhs));
            assign(s, m.getCompound(), updated, originalLhs, pos, hidden);
        } else if (lhs instanceof Index) {
            Index ix = (Index) lhs;
            Expr idx = rename(s, ix.getIndex(), pos);
            if (ix.getArray() instanceof Symbol) {
                Symbol a = (Symbol) ix.getArray();
                if (a.getFrame() < 0 && isFieldSensitive(a)) {
                    writeElement(s, a, idx, rhs, originalLhs, pos, hidden);
                    return;
                }
            }
            Expr current = rename(s, ix.getArray(), pos);
            Expr updated = simplifier.transform(Exprs.indexUpdate(current, idx, rhs));
            assign(s, ix.getArray(), updated, originalLhs, pos, hidden);
        } else {
            throw new IllegalArgumentException("Not an lvalue: " + lhs);
        }
    }

    private void writeElement(SymexState s, Symbol a, Expr idx, Expr rhs, Expr originalLhs,
                              Position pos, boolean hidden) {
        Symbol l1 = level1(s, a);
        long n = elementCount(a);
        if (idx instanceof BvConstant) {
            BigInteger k = ((BvConstant) idx).getValue();
            // Writes outside the array have no effect on its elements.
            if (k.compareTo(BigInteger.valueOf(n)) < 0) {
                writeLevel1(s, element(l1, k.longValue()), rhs, originalLhs, pos, hidden, false);
            }
            return;
        }
        for (long k = 0; k != n; ++k) {
            Symbol el = element(l1, k);
            Expr v = simplifier.transform(
                Exprs.ite(Exprs.eq(idx, Exprs.constant(idx.type(), k)), rhs, currentValue(s, el)));
            writeLevel1(s, el, v, originalLhs, pos, hidden, false);
        }
    }

    private void writeLevel1(SymexState s, Symbol l1, Expr rhs, Expr originalLhs,
                             Position pos, boolean hidden, boolean shared) {
        Symbol ssa = fresh(l1);
        emit(stepFor(shared ? SsaStepKind.SHARED_WRITE : SsaStepKind.ASSIGNMENT, s, pos)
             .ssaLhs(ssa).rhs(rhs).originalLhs(originalLhs).hidden(hidden));
        if (shared) return;
        s.values.put(l1.getL1Identifier(), rhs.isConstant() ? rhs : ssa);
    }

    private void initializeStatics(SymexState s, boolean threadLocalOnly) {
        Position pos = new InternalPosition(INITIALIZE);
        for (SymbolDefinition d : ns.getSymbols()) {
            if (!d.isStaticLifetime()) continue;
            if (threadLocalOnly && !d.isThreadLocal()) continue;
            Type t = ns.follow(d.type());
            if (t.isCode() || t.isEmpty() || t.isString()) continue;
            Symbol x = new Symbol(d.getName(), d.type());
            Expr v = d.getValue() != null ? d.getValue() : Exprs.zero(ns, d.type());
            if (isSharedEvent(x)) {
                writeLevel1(s, x, v, x, pos, true, true);
            } else if (isFieldSensitive(x)) {
                Symbol l1 = level1(s, x);
                long n = elementCount(x);
                for (long k = 0; k != n; ++k) {
                    Expr ev = simplifier.transform(Exprs.index(v, k));
                    writeLevel1(s, element(l1, k), ev, x, pos, true, false);
                }
            } else {
                writeLevel1(s, level1(s, x), simplifier.transform(v), x, pos, true, false);
            }
        }
    }

    // ------------------------------------------------------------------
    // Control flow

    private void setPc(SymexState s, int pc) {
        s.pc = pc;
        s.top().leaveLoops(pc);
    }

    private Symbol returnValueSymbol(CallFrame f) {
        return new Symbol(f.function.getName() + RETURN_VALUE, f.function.getReturnType())
            .withFrame(f.frameId);
    }

    /**
     * Continue <code>s</code> at a later instruction of the same function.
     * When merging, the state waits there for the others.
     */
    private void jumpForward(SymexState s, int to) {
        if (options.isPathMerging() && to != s.pc + 1) {
            setPc(s, to);
            addPending(s);
            s.suspended = true;
            return;
        }
        setPc(s, to);
    }

    private void addPending(SymexState s) {
        String loc = s.location();
        SymexState there = pending.get(loc);
        if (there != null) {
            merge(there, s);
        } else {
            pending.put(loc, s);
        }
    }

    /**
     * Split <code>s</code> on the renamed condition <code>c</code>: the taken
     * side continues at <code>to</code>, the other at the next instruction.
     */
    private void branch(SymexState s, Expr c, int to, Position pos) {
        Expr g = c;
        if (!isAtomicCondition(c)) {
            Symbol gs = new Symbol(GUARD_SYMBOL, Type.BOOL).withVersion(++guardCounter);
            emit(stepFor(SsaStepKind.ASSIGNMENT, s, pos).ssaLhs(gs).rhs(c).hidden(true));
            g = gs;
        }
        int from = s.pc;
        SymexState other = s.copy();
        boolean backwards = to <= from;

        // For a loop, the current state iterates and the exit waits.
        SymexState taken = backwards ? s : other;
        SymexState fall = backwards ? other : s;
        taken.addGuard(g);
        fall.addGuard(simplifier.transform(Exprs.not(g)));
        setPc(taken, to);
        setPc(fall, from + 1);

        boolean otherDropped = checkComplexity(other, pos);
        if (otherDropped) {
            ++abandonedPaths;
        }
        if (checkComplexity(s, pos)) {
            if (!otherDropped) worklist.push(other);
            return;
        }
        if (otherDropped) {
            return;
        }

        if (options.isPathMerging()) {
            addPending(other);
        } else if (options.getPathStrategy() == Protos.PathStrategy.BreadthFirst) {
            worklist.addLast(s);
            worklist.addLast(other);
            s.suspended = true;
        } else {
            worklist.push(other);
        }
    }

    private static boolean isAtomicCondition(Expr c) {
        if (c instanceof Symbol) return true;
        return c instanceof UnaryExpr
            && ((UnaryExpr) c).getOp() == UnaryExpr.Op.NOT
            && ((UnaryExpr) c).getOperand() instanceof Symbol;
    }

    /**
     * Abandon <code>s</code> if its guard has grown too large.
     *
     * @return whether the path was abandoned.
     */
    private boolean checkComplexity(SymexState s, Position pos) {
        if (!complexity.exceeds(s.guardExpr())) return false;
        CallFrame f = s.top();
        Loop loop = f.innermostLoop(s.pc);
        abandon(s, PathStatus.ABANDONED_COMPLEXITY,
                new ComplexityAbandonedMessage("path guard exceeds complexity limit "
                                               + options.getComplexityLimit(),
                                               backtrace(s, pos)));
        if (loop != null && complexity.recordFailure(loop.getId())) {
            logStatus("loop " + loop.getId() + " blacklisted");
        }
        return true;
    }

    private void backEdge(SymexState s, Goto g, Expr c) {
        CallFrame f = s.top();
        Loop loop = f.function.loopAt(s.pc);
        Position pos = g.getPosition();
        if (c.isFalse()) {
            setPc(s, s.pc + 1);
            return;
        }
        if (complexity.isBlacklisted(loop.getId())) {
            abandon(s, PathStatus.ABANDONED_COMPLEXITY,
                    new ComplexityAbandonedMessage("loop " + loop.getId() + " is blacklisted",
                                                   backtrace(s, pos)));
            return;
        }
        long count = f.nextIteration(loop.getId());
        if (loop.getId().equals(options.getIncrementalLoop())) {
            ++s.incrementalUnwindings;
        }
        long bound = options.getLoopBound(loop.getId());
        if (bound > 0 && count >= bound) {
            loopsAtBound.add(loop.getId());
            Expr exit = simplifier.transform(Exprs.not(c));
            if (options.isUnwindingAssertions() && !loop.getId().equals(openLoop)) {
                String n = loop.getId().substring(f.function.getName().length() + 1);
                emit(stepFor(SsaStepKind.ASSERT, s, pos)
                     .cond(exit)
                     .propertyId(f.function.getName() + ".unwind." + n)
                     .comment("unwinding assertion loop " + n));
            }
            if (!options.isPartialLoops()) {
                emit(stepFor(SsaStepKind.ASSUME, s, pos).cond(exit).hidden(true));
                s.addGuard(exit);
            }
            f.resetLoop(loop.getId());
            setPc(s, s.pc + 1);
            return;
        }
        if (c.isTrue()) {
            s.pc = g.getTarget();
            return;
        }
        branch(s, c, g.getTarget(), pos);
    }

    private void endOfFunction(SymexState s) {
        CallFrame f = s.pop();
        Position pos = new InternalPosition(f.function.getName());
        SsaStep.Builder ret = SsaStep.builder(SsaStepKind.FUNCTION_RETURN)
            .guard(s.guardExpr()).position(pos).thread(s.thread)
            .function(f.function.getName()).pc(f.function.getBody().size());
        emit(ret);

        if (!s.stack.isEmpty()) {
            s.pc = f.returnPc;
            if (f.callerLhs != null && !f.function.getReturnType().isEmpty()) {
                Expr v = currentValue(s, returnValueSymbol(f));
                assign(s, f.callerLhs, v, f.callerLhs, f.callSite, false);
            }
            return;
        }

        if (!s.threads.isEmpty()) {
            startThread(s, s.threads.remove(0));
            return;
        }
        s.status = PathStatus.COMPLETED;
    }

    private void startThread(SymexState s, SymexState.PendingThread t) {
        GotoFunction fn = model.getFunction(t.function);
        s.thread = t.id;
        for (Expr e : t.guard) {
            if (!s.guard.contains(e)) s.addGuard(e);
        }
        initializeStatics(s, true);
        s.push(new CallFrame(fn, ++frameCounter, -1, null, null));
        s.pc = 0;
        logStatus("running thread " + t.id + " (" + t.function + ")");
    }

    // ------------------------------------------------------------------
    // Merging

    /** Merge <code>other</code> into <code>s</code>; both are at the same location. */
    private void merge(SymexState s, SymexState other) {
        if (other.isGuardFalse()) return;
        if (s.isGuardFalse()) {
            s.guard = other.guard;
            s.values = other.values;
            s.stack = other.stack;
            s.depth = other.depth;
            s.threads = other.threads;
            s.thread = other.thread;
            return;
        }

        int common = 0;
        while (common < s.guard.size() && common < other.guard.size()
               && s.guard.get(common).equals(other.guard.get(common))) {
            ++common;
        }
        List<Expr> prefix = new ArrayList<Expr>(s.guard.subList(0, common));
        Expr mine = Exprs.and(s.guard.subList(common, s.guard.size()));
        Expr theirs = Exprs.and(other.guard.subList(common, other.guard.size()));
        List<Expr> merged = new ArrayList<Expr>(prefix);
        if (common != s.guard.size() && common != other.guard.size()) {
            Expr d = simplifier.transform(Exprs.or(mine, theirs));
            if (!d.isTrue()) merged.add(d);
        }

        Set<String> keys = new HashSet<String>(s.values.keySet());
        keys.addAll(other.values.keySet());
        Map<String, Expr> values = new HashMap<String, Expr>(s.values);
        s.guard = merged;
        for (String k : keys) {
            Symbol l1 = level1Symbols.get(k);
            Expr a = s.values.containsKey(k) ? s.values.get(k) : l1.withVersion(0);
            Expr b = other.values.containsKey(k) ? other.values.get(k) : l1.withVersion(0);
            if (a.equals(b)) continue;
            Expr phi = simplifier.transform(Exprs.ite(mine, a, b));
            Symbol ssa = fresh(l1);
            emit(SsaStep.builder(SsaStepKind.ASSIGNMENT)
                 .guard(s.guardExpr()).position(new InternalPosition(s.top().function.getName()))
                 .thread(s.thread).function(s.top().function.getName()).pc(s.pc)
                 .ssaLhs(ssa).rhs(phi).originalLhs(l1.level0()).hidden(true));
            values.put(k, phi.isConstant() ? phi : ssa);
        }
        s.values = values;

        for (int i = 0; i != s.stack.size() && i != other.stack.size(); ++i) {
            s.stack.get(i).mergeLoops(other.stack.get(i));
        }
        s.depth = Math.max(s.depth, other.depth);
        for (SymexState.PendingThread t : other.threads) {
            boolean known = false;
            for (SymexState.PendingThread u : s.threads) {
                if (u.id == t.id) known = true;
            }
            if (!known) s.threads.add(t);
        }
    }

    // ------------------------------------------------------------------
    // Instructions

    private final class Executor implements InstructionVisitor<Void> {
        private final SymexState s;

        Executor(SymexState s) {
            this.s = s;
        }

        private Expr rename(Expr e, Position pos) {
            return GotoSymex.this.rename(s, e, pos);
        }

        private void next() {
            setPc(s, s.pc + 1);
        }

        public Void visitAssign(Assign i) {
            Expr rhs = rename(i.getRhs(), i.getPosition());
            assign(s, i.getLhs(), rhs, i.getLhs(), i.getPosition(), false);
            next();
            return null;
        }

        public Void visitDecl(Decl i) {
            Symbol x = i.getSymbol();
            Symbol l1 = level1(s, x);
            if (isFieldSensitive(x)) {
                long n = elementCount(x);
                for (long k = 0; k != n; ++k) {
                    declare(element(l1, k), x, i.getPosition());
                }
            } else {
                declare(l1, x, i.getPosition());
            }
            next();
            return null;
        }

        private void declare(Symbol l1, Symbol x, Position pos) {
            Symbol ssa = fresh(l1);
            emit(stepFor(SsaStepKind.DECL, s, pos).ssaLhs(ssa).originalLhs(x));
            s.values.put(l1.getL1Identifier(), ssa);
        }

        public Void visitDead(Dead i) {
            Symbol x = i.getSymbol();
            Symbol l1 = level1(s, x);
            emit(stepFor(SsaStepKind.DEAD, s, i.getPosition()).originalLhs(x).hidden(true));
            s.values.remove(l1.getL1Identifier());
            if (isFieldSensitive(x)) {
                long n = elementCount(x);
                for (long k = 0; k != n; ++k) {
                    s.values.remove(element(l1, k).getL1Identifier());
                }
            }
            next();
            return null;
        }

        public Void visitFunctionCall(FunctionCall i) {
            Position pos = i.getPosition();
            String name = i.getFunctionName();
            GotoFunction callee = model.getFunction(name);
            Type retType = i.getFunction().type().getCodeReturnType();

            if (callee == null || !callee.hasBody()) {
                logStatus("no body for function " + name);
                if (i.getLhs() != null) {
                    assign(s, i.getLhs(), freshNondet(retType), i.getLhs(), pos, false);
                }
                next();
                return null;
            }

            int active = 0;
            for (CallFrame f : s.stack) {
                if (f.function.getName().equals(name)) ++active;
            }
            long bound = options.getLoopBound(name);
            if (bound > 0 && active >= bound) {
                if (options.isUnwindingAssertions()) {
                    emit(stepFor(SsaStepKind.ASSERT, s, pos)
                         .cond(Exprs.FALSE)
                         .propertyId(name + ".recursion")
                         .comment("recursion unwinding assertion"));
                }
                if (options.isPartialLoops()) {
                    if (i.getLhs() != null) {
                        assign(s, i.getLhs(), freshNondet(retType), i.getLhs(), pos, false);
                    }
                    next();
                } else {
                    emit(stepFor(SsaStepKind.ASSUME, s, pos).cond(Exprs.FALSE).hidden(true));
                    s.addGuard(Exprs.FALSE);
                }
                return null;
            }

            List<Symbol> params = callee.getParameters();
            if (params.size() != i.getArguments().size()) {
                throw new StructuralInvariantViolation(
                    "call to " + name + " passes " + i.getArguments().size()
                    + " arguments, expected " + params.size());
            }
            List<Expr> args = new ArrayList<Expr>();
            for (Expr a : i.getArguments()) {
                args.add(rename(a, pos));
            }
            emit(stepFor(SsaStepKind.FUNCTION_CALL, s, pos).function(name));
            CallFrame frame = new CallFrame(callee, ++frameCounter, s.pc + 1, i.getLhs(), pos);
            s.push(frame);
            s.pc = 0;
            for (int k = 0; k != params.size(); ++k) {
                assign(s, params.get(k), args.get(k), params.get(k), pos, true);
            }
            return null;
        }

        public Void visitAssume(Assume i) {
            Expr c = rename(i.getCondition(), i.getPosition());
            if (!c.isTrue()) {
                emit(stepFor(SsaStepKind.ASSUME, s, i.getPosition()).cond(c));
            }
            if (c.isFalse()) {
                s.addGuard(Exprs.FALSE);
                return null;
            }
            next();
            return null;
        }

        public Void visitAssert(Assert i) {
            if (options.isIgnorePropertiesBeforeUnwindMin()
                && options.isIncrementalLoop()
                && s.incrementalUnwindings < options.getUnwindMin()) {
                ignoredProperties.add(i.getPropertyId());
                next();
                return null;
            }
            Expr c = rename(i.getCondition(), i.getPosition());
            emit(stepFor(SsaStepKind.ASSERT, s, i.getPosition())
                 .cond(c)
                 .propertyId(i.getPropertyId())
                 .comment(i.getDescription()));
            next();
            return null;
        }

        private Void io(IoInstruction i, SsaStepKind kind) {
            List<Expr> args = new ArrayList<Expr>();
            for (Expr e : i.getExpressions()) {
                args.add(rename(e, i.getPosition()));
            }
            emit(stepFor(kind, s, i.getPosition()).io(i.getDescription(), args));
            next();
            return null;
        }

        public Void visitInput(Input i) {
            return io(i, SsaStepKind.INPUT);
        }

        public Void visitOutput(Output i) {
            return io(i, SsaStepKind.OUTPUT);
        }

        public Void visitGoto(Goto i) {
            Expr c = i.isUnconditional() ? Exprs.TRUE : rename(i.getCondition(), i.getPosition());
            emit(stepFor(SsaStepKind.GOTO, s, i.getPosition()).cond(c).hidden(true));
            if (i.isBackwards(s.pc)) {
                backEdge(s, i, c);
                return null;
            }
            if (c.isFalse()) {
                next();
            } else if (c.isTrue()) {
                jumpForward(s, i.getTarget());
            } else {
                branch(s, c, i.getTarget(), i.getPosition());
            }
            return null;
        }

        public Void visitReturn(Return i) {
            CallFrame f = s.top();
            if (i.getValue() != null) {
                Expr v = rename(i.getValue(), i.getPosition());
                writeLevel1(s, returnValueSymbol(f), v, returnValueSymbol(f).level0(),
                            i.getPosition(), true, false);
            }
            jumpForward(s, f.function.getBody().size());
            return null;
        }

        public Void visitSkip(Skip i) {
            emit(stepFor(SsaStepKind.LOCATION, s, i.getPosition()).hidden(true));
            next();
            return null;
        }

        public Void visitStartThread(StartThread i) {
            int id = ++threadCounter;
            emit(stepFor(SsaStepKind.SPAWN, s, i.getPosition()).spawnedThread(id));
            s.threads.add(new SymexState.PendingThread(id, i.getFunctionName(),
                                                       new ArrayList<Expr>(s.guard)));
            next();
            return null;
        }
    }
}
