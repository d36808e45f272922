package org.pseudoc.ast;

import java.util.List;

/**
 * Expression tree produced by the expression analyzer. The set of variants is closed; consumers
 * dispatch through {@link ExprVisitor} so that a new variant cannot be silently ignored.
 */
public sealed interface Expr
{
	<R> R accept(ExprVisitor<R> visitor);

	record Name(String id) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitName(this);
		}
	}

	/**
	 * Numeric literal; {@code text} has underscores removed.
	 */
	record Num(String text, boolean integral) implements Expr
	{
		/**
		 * Value of an integral literal, or null when the literal is fractional or does not fit
		 * in a {@code long}.
		 */
		public Long longValue()
		{
			if (!integral)
			{
				return null;
			}
			try
			{
				return Long.parseLong(text);
			}
			catch (NumberFormatException e)
			{
				return null;
			}
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitNum(this);
		}
	}

	record Str(String value) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitStr(this);
		}
	}

	/**
	 * Interpolated string: literal fragments are {@link Str}, everything else is an embedded expression.
	 */
	record FString(List<Expr> parts) implements Expr
	{
		public FString
		{
			parts = List.copyOf(parts);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitFString(this);
		}
	}

	record Bool(boolean value) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitBool(this);
		}
	}

	record NoneLit() implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitNone(this);
		}
	}

	record ListDisplay(List<Expr> elements) implements Expr
	{
		public ListDisplay
		{
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitList(this);
		}
	}

	record TupleDisplay(List<Expr> elements) implements Expr
	{
		public TupleDisplay
		{
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitTuple(this);
		}
	}

	record SetDisplay(List<Expr> elements) implements Expr
	{
		public SetDisplay
		{
			elements = List.copyOf(elements);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitSet(this);
		}
	}

	record DictDisplay(List<Expr> keys, List<Expr> values) implements Expr
	{
		public DictDisplay
		{
			keys = List.copyOf(keys);
			values = List.copyOf(values);
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitDict(this);
		}
	}

	/**
	 * Arithmetic or bitwise operator, {@code op} in source spelling ({@code +}, {@code //}, {@code **} ...).
	 */
	record Binary(Expr left, String op, Expr right) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitBinary(this);
		}
	}

	/**
	 * {@code -}, {@code +}, {@code ~} or {@code not}.
	 */
	record Unary(String op, Expr operand) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitUnary(this);
		}
	}

	record Compare(Expr left, String op, Expr right) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitCompare(this);
		}
	}

	/**
	 * {@code and} / {@code or}.
	 */
	record BoolOp(String op, Expr left, Expr right) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitBoolOp(this);
		}
	}

	record Call(Expr func, List<Expr> args, List<Keyword> keywords) implements Expr
	{
		public Call
		{
			args = List.copyOf(args);
			keywords = List.copyOf(keywords);
		}

		/**
		 * Simple callee name, or null when the callee is not a bare name.
		 */
		public String calleeName()
		{
			return func instanceof Name n ? n.id() : null;
		}

		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitCall(this);
		}
	}

	record Keyword(String name, Expr value)
	{
	}

	record Attribute(Expr value, String attr) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitAttribute(this);
		}
	}

	record Subscript(Expr value, Expr index) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitSubscript(this);
		}
	}

	/**
	 * Slice inside a subscript; any bound may be null.
	 */
	record Slice(Expr lower, Expr upper, Expr step) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitSlice(this);
		}
	}

	record Conditional(Expr body, Expr test, Expr orElse, String text) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitConditional(this);
		}
	}

	/**
	 * Parentheses written in the source, kept so the output groups the same way.
	 */
	record Paren(Expr inner) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitParen(this);
		}
	}

	/**
	 * Recognized but not translatable (lambda, comprehension, starred argument ...).
	 */
	record Unsupported(String description, String text) implements Expr
	{
		@Override
		public <R> R accept(ExprVisitor<R> visitor)
		{
			return visitor.visitUnsupported(this);
		}
	}
}
