package com.galois.bmc.cfg;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.galois.bmc.SymbolTable;
import com.galois.bmc.Type;
import com.galois.bmc.expr.Symbol;

/**
 * A function of a goto program: its signature and, unless it is only
 * declared, its instruction list.
 */
public final class GotoFunction {
    private final String name;
    private final List<Symbol> parameters;
    private final Type returnType;
    private final List<Instruction> body;
    private final List<Loop> loops;

    /**
     * @param name function name.
     * @param parameters the formal parameters.
     * @param returnType the return type, {@link Type#EMPTY} for none.
     * @param body the instructions, or <code>null</code> for a function
     *   without a body.
     */
    public GotoFunction(String name, List<Symbol> parameters, Type returnType, List<Instruction> body) {
        if (name == null) throw new NullPointerException("name");
        if (returnType == null) throw new NullPointerException("returnType");
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<Symbol>(parameters));
        this.returnType = returnType;
        this.body = body == null ? null : Collections.unmodifiableList(new ArrayList<Instruction>(body));
        this.loops = findLoops();
    }

    private List<Loop> findLoops() {
        List<Loop> r = new ArrayList<Loop>();
        if (body == null) return r;
        for (int pc = 0; pc != body.size(); ++pc) {
            Instruction i = body.get(pc);
            if (i instanceof Goto && ((Goto) i).isBackwards(pc)) {
                r.add(new Loop(name + "." + r.size(), ((Goto) i).getTarget(), pc));
            }
        }
        return Collections.unmodifiableList(r);
    }

    public String getName() {
        return name;
    }

    public List<Symbol> getParameters() {
        return parameters;
    }

    public Type getReturnType() {
        return returnType;
    }

    /** The code type of this function. */
    public Type getType() {
        Type[] args = new Type[parameters.size()];
        for (int i = 0; i != args.length; ++i) {
            args[i] = parameters.get(i).type();
        }
        return Type.code(args, returnType);
    }

    public boolean hasBody() {
        return body != null;
    }

    public List<Instruction> getBody() {
        if (body == null) return Collections.<Instruction>emptyList();
        return body;
    }

    public List<Loop> getLoops() {
        return loops;
    }

    /**
     * Return the loop closed by the backwards goto at <code>pc</code>, or
     * <code>null</code>.
     */
    public Loop loopAt(int pc) {
        for (Loop l : loops) {
            if (l.getBackEdge() == pc) return l;
        }
        return null;
    }

    /**
     * Validate every instruction and the function-level constraints on jump
     * targets and returned values.
     *
     * @param full whether nested expressions are validated too.
     */
    public ValidationResult validate(SymbolTable ns, boolean full) {
        ValidationResult r = new ValidationResult();
        List<Instruction> is = getBody();
        for (int pc = 0; pc != is.size(); ++pc) {
            Instruction i = is.get(pc);
            r.addAll(full ? i.validateFull(ns) : i.validate(ns));
            if (i instanceof Goto && ((Goto) i).getTarget() > is.size()) {
                r.add(ValidationError.Kind.OPERAND_KIND, i.getPosition(),
                      "goto target " + ((Goto) i).getTarget() + " is outside " + name);
            }
            if (i instanceof Return) {
                Return ret = (Return) i;
                Type t = ret.getValue() == null ? Type.EMPTY : ret.getValue().type();
                if (!t.equals(returnType)) {
                    r.add(ValidationError.Kind.TYPE_MISMATCH, i.getPosition(),
                          "returned value has type " + t + " but " + name + " returns " + returnType);
                }
            }
        }
        return r;
    }

    public String toString() {
        StringBuilder b = new StringBuilder();
        b.append(name).append(parameters).append(" -> ").append(returnType).append('\n');
        List<Instruction> is = getBody();
        for (int pc = 0; pc != is.size(); ++pc) {
            b.append("  ").append(pc).append(": ").append(is.get(pc)).append('\n');
        }
        return b.toString();
    }
}
