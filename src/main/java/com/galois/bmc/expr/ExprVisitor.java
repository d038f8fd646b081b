package com.galois.bmc.expr;

/**
 * Visitor over the closed set of expression kinds.
 */
public interface ExprVisitor<R> {
    R visitSymbol(Symbol e);
    R visitBoolConstant(BoolConstant e);
    R visitBvConstant(BvConstant e);
    R visitStringConstant(StringConstant e);
    R visitNondet(Nondet e);
    R visitUnary(UnaryExpr e);
    R visitBinary(BinaryExpr e);
    R visitIte(Ite e);
    R visitMember(Member e);
    R visitIndex(Index e);
    R visitIndexUpdate(IndexUpdate e);
    R visitMemberUpdate(MemberUpdate e);
    R visitStructLiteral(StructLiteral e);
    R visitArrayLiteral(ArrayLiteral e);
    R visitArrayOf(ArrayOf e);
    R visitTypecast(Typecast e);
    R visitExtract(Extract e);
    R visitConcat(Concat e);
}
