package org.pseudoc.ast;

import java.util.List;

/**
 * Depth-first walk over statements and expressions. Subclasses override {@link #onStmt} /
 * {@link #onExpr} and can stop the walk early with {@link #stop()}. Nested function and class
 * bodies are skipped unless {@link #descendIntoDefinitions()} says otherwise.
 */
public abstract class AstScanner implements StmtVisitor<Void>, ExprVisitor<Void>
{
	private boolean stopped = false;

	protected void onStmt(Stmt stmt)
	{
	}

	protected void onExpr(Expr expr)
	{
	}

	protected boolean descendIntoDefinitions()
	{
		return false;
	}

	protected final void stop()
	{
		stopped = true;
	}

	public void scan(List<Stmt> body)
	{
		for (Stmt stmt : body)
		{
			if (stopped)
			{
				return;
			}
			scan(stmt);
		}
	}

	public void scan(Stmt stmt)
	{
		if (stmt == null || stopped)
		{
			return;
		}
		onStmt(stmt);
		if (!stopped)
		{
			stmt.accept(this);
		}
	}

	public void scan(Expr expr)
	{
		if (expr == null || stopped)
		{
			return;
		}
		onExpr(expr);
		if (!stopped)
		{
			expr.accept(this);
		}
	}

	private void scanAll(List<Expr> exprs)
	{
		for (Expr e : exprs)
		{
			scan(e);
		}
	}

	// --- statements ---

	@Override
	public Void visitComment(Stmt.Comment stmt)
	{
		return null;
	}

	@Override
	public Void visitAssign(Stmt.Assign stmt)
	{
		scan(stmt.value());
		scanAll(stmt.targets());
		return null;
	}

	@Override
	public Void visitAugAssign(Stmt.AugAssign stmt)
	{
		scan(stmt.target());
		scan(stmt.value());
		return null;
	}

	@Override
	public Void visitAnnAssign(Stmt.AnnAssign stmt)
	{
		scan(stmt.target());
		scan(stmt.value());
		return null;
	}

	@Override
	public Void visitExprStmt(Stmt.ExprStmt stmt)
	{
		scan(stmt.value());
		return null;
	}

	@Override
	public Void visitIf(Stmt.If stmt)
	{
		scan(stmt.test());
		scan(stmt.body());
		scan(stmt.orElse());
		return null;
	}

	@Override
	public Void visitFor(Stmt.For stmt)
	{
		scan(stmt.target());
		scan(stmt.iter());
		scan(stmt.body());
		scan(stmt.orElse());
		return null;
	}

	@Override
	public Void visitWhile(Stmt.While stmt)
	{
		scan(stmt.test());
		scan(stmt.body());
		scan(stmt.orElse());
		return null;
	}

	@Override
	public Void visitFunctionDef(Stmt.FunctionDef stmt)
	{
		if (descendIntoDefinitions())
		{
			scan(stmt.body());
		}
		return null;
	}

	@Override
	public Void visitClassDef(Stmt.ClassDef stmt)
	{
		if (descendIntoDefinitions())
		{
			scan(stmt.body());
		}
		return null;
	}

	@Override
	public Void visitReturn(Stmt.Return stmt)
	{
		scan(stmt.value());
		return null;
	}

	@Override
	public Void visitPass(Stmt.Pass stmt)
	{
		return null;
	}

	@Override
	public Void visitBreak(Stmt.Break stmt)
	{
		return null;
	}

	@Override
	public Void visitContinue(Stmt.Continue stmt)
	{
		return null;
	}

	@Override
	public Void visitMatch(Stmt.Match stmt)
	{
		scan(stmt.subject());
		for (Stmt.CaseClause clause : stmt.cases())
		{
			scan(clause.pattern());
			scan(clause.body());
		}
		return null;
	}

	@Override
	public Void visitUnsupported(Stmt.Unsupported stmt)
	{
		scan(stmt.body());
		return null;
	}

	@Override
	public Void visitUnknown(Stmt.Unknown stmt)
	{
		return null;
	}

	// --- expressions ---

	@Override
	public Void visitName(Expr.Name expr)
	{
		return null;
	}

	@Override
	public Void visitNum(Expr.Num expr)
	{
		return null;
	}

	@Override
	public Void visitStr(Expr.Str expr)
	{
		return null;
	}

	@Override
	public Void visitFString(Expr.FString expr)
	{
		scanAll(expr.parts());
		return null;
	}

	@Override
	public Void visitBool(Expr.Bool expr)
	{
		return null;
	}

	@Override
	public Void visitNone(Expr.NoneLit expr)
	{
		return null;
	}

	@Override
	public Void visitList(Expr.ListDisplay expr)
	{
		scanAll(expr.elements());
		return null;
	}

	@Override
	public Void visitTuple(Expr.TupleDisplay expr)
	{
		scanAll(expr.elements());
		return null;
	}

	@Override
	public Void visitSet(Expr.SetDisplay expr)
	{
		scanAll(expr.elements());
		return null;
	}

	@Override
	public Void visitDict(Expr.DictDisplay expr)
	{
		scanAll(expr.keys());
		scanAll(expr.values());
		return null;
	}

	@Override
	public Void visitBinary(Expr.Binary expr)
	{
		scan(expr.left());
		scan(expr.right());
		return null;
	}

	@Override
	public Void visitUnary(Expr.Unary expr)
	{
		scan(expr.operand());
		return null;
	}

	@Override
	public Void visitCompare(Expr.Compare expr)
	{
		scan(expr.left());
		scan(expr.right());
		return null;
	}

	@Override
	public Void visitBoolOp(Expr.BoolOp expr)
	{
		scan(expr.left());
		scan(expr.right());
		return null;
	}

	@Override
	public Void visitCall(Expr.Call expr)
	{
		scan(expr.func());
		scanAll(expr.args());
		for (Expr.Keyword keyword : expr.keywords())
		{
			scan(keyword.value());
		}
		return null;
	}

	@Override
	public Void visitAttribute(Expr.Attribute expr)
	{
		scan(expr.value());
		return null;
	}

	@Override
	public Void visitSubscript(Expr.Subscript expr)
	{
		scan(expr.value());
		scan(expr.index());
		return null;
	}

	@Override
	public Void visitSlice(Expr.Slice expr)
	{
		scan(expr.lower());
		scan(expr.upper());
		scan(expr.step());
		return null;
	}

	@Override
	public Void visitConditional(Expr.Conditional expr)
	{
		scan(expr.body());
		scan(expr.test());
		scan(expr.orElse());
		return null;
	}

	@Override
	public Void visitParen(Expr.Paren expr)
	{
		scan(expr.inner());
		return null;
	}

	@Override
	public Void visitUnsupported(Expr.Unsupported expr)
	{
		return null;
	}
}
