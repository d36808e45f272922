package org.pseudoc.ast;

import java.util.List;

/**
 * Untyped statement tree produced by the structural parser. Bodies are already nested by
 * indentation; elif chains arrive right-nested (an {@link If} as the sole or-else element).
 */
public sealed interface Stmt
{
	/**
	 * 1-based source line of the statement's first physical line.
	 */
	int line();

	<R> R accept(StmtVisitor<R> visitor);

	record Comment(String text, int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitComment(this);
		}
	}

	/**
	 * {@code a = b = value}; more than one target only for chained assignment.
	 */
	record Assign(List<Expr> targets, Expr value, int line) implements Stmt
	{
		public Assign
		{
			targets = List.copyOf(targets);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitAssign(this);
		}
	}

	/**
	 * {@code target op= value}; {@code op} is the bare operator ({@code +}, {@code //} ...).
	 */
	record AugAssign(Expr target, String op, Expr value, int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitAugAssign(this);
		}
	}

	/**
	 * {@code target: annotation [= value]}; value may be null.
	 */
	record AnnAssign(Expr target, Expr annotation, Expr value, int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitAnnAssign(this);
		}
	}

	record ExprStmt(Expr value, int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitExprStmt(this);
		}
	}

	record If(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt
	{
		public If
		{
			body = List.copyOf(body);
			orElse = List.copyOf(orElse);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitIf(this);
		}
	}

	record For(Expr target, Expr iter, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt
	{
		public For
		{
			body = List.copyOf(body);
			orElse = List.copyOf(orElse);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitFor(this);
		}
	}

	record While(Expr test, List<Stmt> body, List<Stmt> orElse, int line) implements Stmt
	{
		public While
		{
			body = List.copyOf(body);
			orElse = List.copyOf(orElse);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitWhile(this);
		}
	}

	record FunctionDef(String name, List<Param> params, Expr returns, List<Stmt> body, int line) implements Stmt
	{
		public FunctionDef
		{
			params = List.copyOf(params);
			body = List.copyOf(body);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitFunctionDef(this);
		}
	}

	record ClassDef(String name, List<String> bases, List<Stmt> body, int line) implements Stmt
	{
		public ClassDef
		{
			bases = List.copyOf(bases);
			body = List.copyOf(body);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitClassDef(this);
		}
	}

	record Return(Expr value, int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitReturn(this);
		}
	}

	record Pass(int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitPass(this);
		}
	}

	record Break(int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitBreak(this);
		}
	}

	record Continue(int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitContinue(this);
		}
	}

	record Match(Expr subject, List<CaseClause> cases, int line) implements Stmt
	{
		public Match
		{
			cases = List.copyOf(cases);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitMatch(this);
		}
	}

	/**
	 * One {@code case} of a match; a null pattern is the wildcard {@code _}.
	 */
	record CaseClause(Expr pattern, List<Stmt> body, int line)
	{
		public CaseClause
		{
			body = List.copyOf(body);
		}
	}

	/**
	 * A construct the converter recognizes but has no pseudocode for (try, with, import ...).
	 * Block forms keep their body so its statements are still converted.
	 */
	record Unsupported(String keyword, String text, List<Stmt> body, int line) implements Stmt
	{
		public Unsupported
		{
			body = List.copyOf(body);
		}

		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitUnsupported(this);
		}
	}

	/**
	 * Placeholder for a line that could not be parsed at all.
	 */
	record Unknown(String text, int line) implements Stmt
	{
		@Override
		public <R> R accept(StmtVisitor<R> visitor)
		{
			return visitor.visitUnknown(this);
		}
	}
}
