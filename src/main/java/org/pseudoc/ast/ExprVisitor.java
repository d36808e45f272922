package org.pseudoc.ast;

public interface ExprVisitor<R>
{
	R visitName(Expr.Name expr);

	R visitNum(Expr.Num expr);

	R visitStr(Expr.Str expr);

	R visitFString(Expr.FString expr);

	R visitBool(Expr.Bool expr);

	R visitNone(Expr.NoneLit expr);

	R visitList(Expr.ListDisplay expr);

	R visitTuple(Expr.TupleDisplay expr);

	R visitSet(Expr.SetDisplay expr);

	R visitDict(Expr.DictDisplay expr);

	R visitBinary(Expr.Binary expr);

	R visitUnary(Expr.Unary expr);

	R visitCompare(Expr.Compare expr);

	R visitBoolOp(Expr.BoolOp expr);

	R visitCall(Expr.Call expr);

	R visitAttribute(Expr.Attribute expr);

	R visitSubscript(Expr.Subscript expr);

	R visitSlice(Expr.Slice expr);

	R visitConditional(Expr.Conditional expr);

	R visitParen(Expr.Paren expr);

	R visitUnsupported(Expr.Unsupported expr);
}
