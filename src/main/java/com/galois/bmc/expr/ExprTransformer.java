package com.galois.bmc.expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Bottom-up rewriting of expressions.  Each visit method first transforms
 * the operands and rebuilds the node only if one of them changed, so
 * unchanged subtrees keep their identity.  Subclasses override the visit
 * methods for the kinds they rewrite and call <code>super</code> to handle
 * the operands.
 */
public class ExprTransformer implements ExprVisitor<Expr> {

    public Expr transform(Expr e) {
        return e.accept(this);
    }

    public List<Expr> transform(List<Expr> es) {
        List<Expr> r = new ArrayList<Expr>(es.size());
        for (Expr e : es) {
            r.add(transform(e));
        }
        return r;
    }

    /**
     * Transform the operands of <code>e</code>, returning <code>e</code>
     * itself when none of them changed.
     */
    protected Expr transformOperands(Expr e) {
        List<Expr> ops = e.operands();
        List<Expr> changed = null;
        for (int i = 0; i != ops.size(); ++i) {
            Expr o = ops.get(i);
            Expr n = transform(o);
            if (n != o) {
                if (changed == null) {
                    changed = new ArrayList<Expr>(ops);
                }
                changed.set(i, n);
            }
        }
        return changed == null ? e : e.withOperands(changed);
    }

    public Expr visitSymbol(Symbol e) {
        return e;
    }

    public Expr visitBoolConstant(BoolConstant e) {
        return e;
    }

    public Expr visitBvConstant(BvConstant e) {
        return e;
    }

    public Expr visitStringConstant(StringConstant e) {
        return e;
    }

    public Expr visitNondet(Nondet e) {
        return e;
    }

    public Expr visitUnary(UnaryExpr e) {
        return transformOperands(e);
    }

    public Expr visitBinary(BinaryExpr e) {
        return transformOperands(e);
    }

    public Expr visitIte(Ite e) {
        return transformOperands(e);
    }

    public Expr visitMember(Member e) {
        return transformOperands(e);
    }

    public Expr visitIndex(Index e) {
        return transformOperands(e);
    }

    public Expr visitIndexUpdate(IndexUpdate e) {
        return transformOperands(e);
    }

    public Expr visitMemberUpdate(MemberUpdate e) {
        return transformOperands(e);
    }

    public Expr visitStructLiteral(StructLiteral e) {
        return transformOperands(e);
    }

    public Expr visitArrayLiteral(ArrayLiteral e) {
        return transformOperands(e);
    }

    public Expr visitArrayOf(ArrayOf e) {
        return transformOperands(e);
    }

    public Expr visitTypecast(Typecast e) {
        return transformOperands(e);
    }

    public Expr visitExtract(Extract e) {
        return transformOperands(e);
    }

    public Expr visitConcat(Concat e) {
        return transformOperands(e);
    }
}
