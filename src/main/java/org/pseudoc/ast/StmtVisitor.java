package org.pseudoc.ast;

public interface StmtVisitor<R>
{
	R visitComment(Stmt.Comment stmt);

	R visitAssign(Stmt.Assign stmt);

	R visitAugAssign(Stmt.AugAssign stmt);

	R visitAnnAssign(Stmt.AnnAssign stmt);

	R visitExprStmt(Stmt.ExprStmt stmt);

	R visitIf(Stmt.If stmt);

	R visitFor(Stmt.For stmt);

	R visitWhile(Stmt.While stmt);

	R visitFunctionDef(Stmt.FunctionDef stmt);

	R visitClassDef(Stmt.ClassDef stmt);

	R visitReturn(Stmt.Return stmt);

	R visitPass(Stmt.Pass stmt);

	R visitBreak(Stmt.Break stmt);

	R visitContinue(Stmt.Continue stmt);

	R visitMatch(Stmt.Match stmt);

	R visitUnsupported(Stmt.Unsupported stmt);

	R visitUnknown(Stmt.Unknown stmt);
}
