package com.galois.bmc.symex;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.cfg.Position;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Simplifier;
import com.galois.bmc.expr.Symbol;

/**
 * One entry of the SSA equation.  Steps are immutable.
 *
 * <p>
 * Every step carries the guard under which it is live.  Definitions
 * (assignments and shared writes) constrain their SSA left-hand side
 * unconditionally; assumptions and assertions contribute
 * <code>guard ==&gt; cond</code>.
 */
public final class SsaStep {
    private final SsaStepKind kind;
    private final Expr guard;
    private final Symbol ssaLhs;
    private final Expr originalLhs;
    private final Expr rhs;
    private final Expr cond;
    private final Expr condExpr;
    private final String propertyId;
    private final String comment;
    private final Position position;
    private final String function;
    private final int pc;
    private final int thread;
    private final String ioDescription;
    private final List<Expr> ioArgs;
    private final boolean hidden;
    private final int spawnedThread;

    private SsaStep(Builder b) {
        if (b.kind == null) throw new NullPointerException("kind");
        if (b.guard == null) throw new NullPointerException("guard");
        if (b.position == null) throw new NullPointerException("position");
        this.kind = b.kind;
        this.guard = b.guard;
        this.ssaLhs = b.ssaLhs;
        this.originalLhs = b.originalLhs;
        this.rhs = b.rhs;
        this.cond = b.cond;
        this.propertyId = b.propertyId;
        this.comment = b.comment;
        this.position = b.position;
        this.function = b.function;
        this.pc = b.pc;
        this.thread = b.thread;
        this.ioDescription = b.ioDescription;
        this.ioArgs = Collections.unmodifiableList(new ArrayList<Expr>(b.ioArgs));
        this.hidden = b.hidden;
        this.spawnedThread = b.spawnedThread;

        switch (kind) {
        case ASSIGNMENT:
        case SHARED_WRITE:
            if (ssaLhs == null || rhs == null)
                throw new IllegalArgumentException(kind + " needs a left-hand side and a value");
            this.condExpr = Exprs.eq(ssaLhs, rhs);
            break;
        case ASSUME:
        case ASSERT:
            if (cond == null)
                throw new IllegalArgumentException(kind + " needs a condition");
            if (kind == SsaStepKind.ASSERT && propertyId == null)
                throw new IllegalArgumentException("assertion needs a property identifier");
            this.condExpr = Simplifier.simplify(Exprs.implies(guard, cond));
            break;
        case CONSTRAINT:
            if (cond == null)
                throw new IllegalArgumentException("constraint needs a condition");
            this.condExpr = cond;
            break;
        case SHARED_READ:
        case DECL:
            if (ssaLhs == null)
                throw new IllegalArgumentException(kind + " needs a left-hand side");
            this.condExpr = null;
            break;
        default:
            this.condExpr = null;
        }
    }

    public SsaStepKind getKind() {
        return kind;
    }

    public boolean isAssert() {
        return kind == SsaStepKind.ASSERT;
    }

    public boolean isAssume() {
        return kind == SsaStepKind.ASSUME;
    }

    public Expr getGuard() {
        return guard;
    }

    /** The renamed variable defined or read by this step, or <code>null</code>. */
    public Symbol getSsaLhs() {
        return ssaLhs;
    }

    /** The left-hand side as written in the program, for traces. */
    public Expr getOriginalLhs() {
        return originalLhs;
    }

    public Expr getRhs() {
        return rhs;
    }

    public Expr getCond() {
        return cond;
    }

    /**
     * The formula this step contributes: <code>lhs == rhs</code> for
     * definitions, <code>guard ==&gt; cond</code> simplified for assumptions
     * and assertions, the condition for constraints, and <code>null</code>
     * for markers.
     */
    public Expr getCondExpr() {
        return condExpr;
    }

    public String getPropertyId() {
        return propertyId;
    }

    public String getComment() {
        return comment;
    }

    public Position getPosition() {
        return position;
    }

    public String getFunction() {
        return function;
    }

    /** Index of the originating instruction within its function. */
    public int getPc() {
        return pc;
    }

    public int getThread() {
        return thread;
    }

    public String getIoDescription() {
        return ioDescription;
    }

    public List<Expr> getIoArgs() {
        return ioArgs;
    }

    /** Whether the step was introduced by symbolic execution itself. */
    public boolean isHidden() {
        return hidden;
    }

    /** Thread started by a spawn step, or <code>-1</code>. */
    public int getSpawnedThread() {
        return spawnedThread;
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(kind);
        b.append(" [").append(guard).append("] ");
        switch (kind) {
        case ASSIGNMENT:
        case SHARED_WRITE:
            b.append(ssaLhs).append(" = ").append(rhs);
            break;
        case SHARED_READ:
        case DECL:
            b.append(ssaLhs);
            break;
        case ASSERT:
            b.append(cond).append(" (").append(propertyId).append(")");
            break;
        case ASSUME:
        case CONSTRAINT:
        case GOTO:
            b.append(cond);
            break;
        case INPUT:
        case OUTPUT:
            b.append(ioDescription).append(' ').append(ioArgs);
            break;
        case SPAWN:
            b.append("thread ").append(spawnedThread);
            break;
        default:
            if (function != null) b.append(function);
        }
        return b.toString();
    }

    public static Builder builder(SsaStepKind kind) {
        return new Builder(kind);
    }

    /**
     * Builder for steps.  Only the kind, guard and position are required;
     * the kind determines which other fields must be set.
     */
    public static final class Builder {
        private final SsaStepKind kind;
        private Expr guard = Exprs.TRUE;
        private Symbol ssaLhs;
        private Expr originalLhs;
        private Expr rhs;
        private Expr cond;
        private String propertyId;
        private String comment;
        private Position position;
        private String function;
        private int pc = -1;
        private int thread = 0;
        private String ioDescription;
        private List<Expr> ioArgs = Collections.<Expr>emptyList();
        private boolean hidden = false;
        private int spawnedThread = -1;

        private Builder(SsaStepKind kind) {
            this.kind = kind;
        }

        public Builder guard(Expr g) { this.guard = g; return this; }
        public Builder ssaLhs(Symbol s) { this.ssaLhs = s; return this; }
        public Builder originalLhs(Expr e) { this.originalLhs = e; return this; }
        public Builder rhs(Expr e) { this.rhs = e; return this; }
        public Builder cond(Expr e) { this.cond = e; return this; }
        public Builder propertyId(String id) { this.propertyId = id; return this; }
        public Builder comment(String c) { this.comment = c; return this; }
        public Builder position(Position p) { this.position = p; return this; }
        public Builder function(String f) { this.function = f; return this; }
        public Builder pc(int pc) { this.pc = pc; return this; }
        public Builder thread(int t) { this.thread = t; return this; }
        public Builder io(String description, List<Expr> args) {
            this.ioDescription = description;
            this.ioArgs = args;
            return this;
        }
        public Builder hidden(boolean h) { this.hidden = h; return this; }
        public Builder spawnedThread(int t) { this.spawnedThread = t; return this; }

        public SsaStep build() {
            return new SsaStep(this);
        }
    }
}
