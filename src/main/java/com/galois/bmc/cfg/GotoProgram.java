package com.galois.bmc.cfg;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.galois.bmc.Type;
import com.galois.bmc.Typed;
import com.galois.bmc.expr.Expr;
import com.galois.bmc.expr.Exprs;
import com.galois.bmc.expr.Symbol;

/**
 * Builder for the instruction list of one goto function.
 *
 * <p>
 * Statements are appended in order.  Jumps refer to {@link Label}s that are
 * placed before the instruction they denote; labels are resolved to
 * instruction indices by {@link #build()}.  Operand types are checked as
 * statements are added.
 */
public final class GotoProgram {
    private final String functionName;
    private final List<Symbol> parameters;
    private final Type returnType;

    /** Instructions, with <code>null</code> at unresolved gotos. */
    private final List<Instruction> instructions = new ArrayList<Instruction>();
    private final List<PendingGoto> gotos = new ArrayList<PendingGoto>();
    private final List<Label> labels = new ArrayList<Label>();

    /** Current position used when adding statements */
    private Position currentPos;

    private int assertionCount = 0;
    private boolean built = false;

    private static final class PendingGoto {
        final int index;
        final Position pos;
        final Expr cond;
        final Label target;

        PendingGoto(int index, Position pos, Expr cond, Label target) {
            this.index = index;
            this.pos = pos;
            this.cond = cond;
            this.target = target;
        }
    }

    /**
     * Start building a function.
     * @param functionName name of the function.
     * @param parameters formal parameters.
     * @param returnType return type, {@link Type#EMPTY} for none.
     */
    public GotoProgram(String functionName, List<Symbol> parameters, Type returnType) {
        this.functionName = functionName;
        this.parameters = new ArrayList<Symbol>(parameters);
        this.returnType = returnType;
        this.currentPos = new InternalPosition(functionName);
    }

    public GotoProgram(String functionName) {
        this(functionName, new ArrayList<Symbol>(), Type.EMPTY);
    }

    public String getFunctionName() {
        return functionName;
    }

    public void setCurrentPosition( Position pos )
    {
        if( pos == null ) {
            throw new IllegalArgumentException("pos cannot be null");
        }
        this.currentPos = pos;
    }

    /**
     * Set the current position to a line of the given file.
     */
    public void setLine(String path, long line) {
        setCurrentPosition(new SourcePosition(functionName, path, line, 0));
    }

    // Check value is non-null and have type equal to tp.
    private static void checkTypeEquals(String nm, Typed v, Type tp) {
        if (v == null) {
            String msg = String.format("%s must not be null.", nm);
            throw new NullPointerException(msg);
        }
        if (!v.type().equals(tp)) {
            String msg = String.format("%s has incorrect type. Expected %s, but got %s", nm, tp.toString(), v.type().toString());
            throw new IllegalArgumentException(msg);
        }
    }

    /** Number of instructions added so far. */
    public int size() {
        return instructions.size();
    }

    /**
     * Append an instruction as is.
     */
    public void add(Instruction i) {
        if (built) {
            throw new IllegalStateException("This function has already been built.");
        }
        instructions.add(i);
    }

    public void assign(Expr lhs, Expr rhs) {
        checkTypeEquals("rhs", rhs, lhs.type());
        Assign a = new Assign(currentPos, lhs, rhs);
        a.check().throwIfInvalid();
        add(a);
    }

    public void decl(Symbol s) {
        add(new Decl(currentPos, s));
    }

    public void dead(Symbol s) {
        add(new Dead(currentPos, s));
    }

    /**
     * Call a function.
     * @param lhs target of the result, or <code>null</code> to discard it.
     * @param function the function symbol, of code type.
     * @param args the arguments.
     */
    public void call(Expr lhs, Symbol function, Expr... args) {
        FunctionCall c = new FunctionCall(currentPos, lhs, function, Arrays.asList(args));
        ValidationResult r = c.check();
        Type t = function.type();
        if (t.isCode()) {
            for (int i = 0; i != Math.min(args.length, t.getCodeParameterCount()); ++i) {
                checkTypeEquals("arg", args[i], t.getCodeParameterType(i));
            }
            if (lhs != null) {
                checkTypeEquals("lhs", lhs, t.getCodeReturnType());
            }
        }
        r.throwIfInvalid();
        add(c);
    }

    public void assume(Expr cond) {
        checkTypeEquals("cond", cond, Type.BOOL);
        add(new Assume(currentPos, cond));
    }

    /**
     * Add an assertion with a generated property identifier
     * <code>function.assertion.N</code>.
     * @return the property identifier.
     */
    public String assertCond(Expr cond, String description) {
        String id = functionName + ".assertion." + (++assertionCount);
        assertCond(cond, id, description);
        return id;
    }

    public void assertCond(Expr cond, String propertyId, String description) {
        checkTypeEquals("cond", cond, Type.BOOL);
        add(new Assert(currentPos, cond, propertyId, description));
    }

    public Label newLabel() {
        Label l = new Label(functionName + ".L" + labels.size());
        labels.add(l);
        return l;
    }

    /**
     * Place a label before the next instruction to be added.
     */
    public void place(Label l) {
        if (l.isPlaced()) {
            throw new IllegalStateException("Label " + l + " has already been placed.");
        }
        l.index = instructions.size();
    }

    /** Jump to <code>target</code> if <code>cond</code> holds. */
    public void gotoIf(Expr cond, Label target) {
        checkTypeEquals("cond", cond, Type.BOOL);
        if (target == null) throw new NullPointerException("target");
        gotos.add(new PendingGoto(instructions.size(), currentPos, cond, target));
        add(null);
    }

    public void jump(Label target) {
        gotoIf(Exprs.TRUE, target);
    }

    public void returnValue(Expr v) {
        checkTypeEquals("return value", v, returnType);
        add(new Return(currentPos, v));
    }

    public void returnVoid() {
        if (!returnType.isEmpty()) {
            throw new IllegalArgumentException("Function " + functionName + " must return a value.");
        }
        add(new Return(currentPos, null));
    }

    public void input(String description, Expr... values) {
        add(new Input(currentPos, Exprs.string(description), Arrays.asList(values)));
    }

    public void output(String description, Expr... values) {
        add(new Output(currentPos, Exprs.string(description), Arrays.asList(values)));
    }

    public void startThread(Symbol function) {
        StartThread s = new StartThread(currentPos, function);
        s.check().throwIfInvalid();
        add(s);
    }

    public void skip() {
        add(new Skip(currentPos));
    }

    /**
     * Resolve labels and produce the function.
     *
     * @throws IllegalStateException if a jump refers to a label that was
     *   never placed.
     */
    public GotoFunction build() {
        if (built) {
            throw new IllegalStateException("This function has already been built.");
        }
        for (PendingGoto g : gotos) {
            if (!g.target.isPlaced()) {
                throw new IllegalStateException("Label " + g.target + " was never placed.");
            }
            instructions.set(g.index, new Goto(g.pos, g.cond, g.target.index));
        }
        built = true;
        return new GotoFunction(functionName, parameters, returnType, instructions);
    }
}
