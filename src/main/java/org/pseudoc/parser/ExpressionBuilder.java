package org.pseudoc.parser;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.pseudoc.ast.Expr;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds a PyExpr parse tree into the {@link Expr} tree.
 */
public class ExpressionBuilder extends PyExprBaseVisitor<Expr>
{
	private final ExpressionParser expressionParser;
	private final int line;

	public ExpressionBuilder(ExpressionParser expressionParser, int line)
	{
		this.expressionParser = expressionParser;
		this.line = line;
	}

	@Override
	public Expr visitExpressionInput(PyExprParser.ExpressionInputContext ctx)
	{
		return visit(ctx.exprList());
	}

	@Override
	public Expr visitExprList(PyExprParser.ExprListContext ctx)
	{
		if (ctx.expr().size() == 1 && ctx.COMMA().isEmpty())
		{
			return visit(ctx.expr(0));
		}
		return new Expr.TupleDisplay(visitAll(ctx.expr()));
	}

	// --- operators ---

	@Override
	public Expr visitPrimaryExpr(PyExprParser.PrimaryExprContext ctx)
	{
		return visit(ctx.primary());
	}

	@Override
	public Expr visitPowerExpr(PyExprParser.PowerExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), "**", visit(ctx.expr(1)));
	}

	@Override
	public Expr visitUnaryExpr(PyExprParser.UnaryExprContext ctx)
	{
		Expr operand = visit(ctx.expr());
		String op = ctx.op.getText();
		if (op.equals("-") && operand instanceof Expr.Num num && !num.text().startsWith("-"))
		{
			return new Expr.Num("-" + num.text(), num.integral());
		}
		return new Expr.Unary(op, operand);
	}

	@Override
	public Expr visitMulExpr(PyExprParser.MulExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), ctx.op.getText(), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitAddExpr(PyExprParser.AddExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), ctx.op.getText(), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitShiftExpr(PyExprParser.ShiftExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), ctx.op.getText(), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitBitAndExpr(PyExprParser.BitAndExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), "&", visit(ctx.expr(1)));
	}

	@Override
	public Expr visitBitXorExpr(PyExprParser.BitXorExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), "^", visit(ctx.expr(1)));
	}

	@Override
	public Expr visitBitOrExpr(PyExprParser.BitOrExprContext ctx)
	{
		return new Expr.Binary(visit(ctx.expr(0)), "|", visit(ctx.expr(1)));
	}

	@Override
	public Expr visitCompareExpr(PyExprParser.CompareExprContext ctx)
	{
		List<String> words = new ArrayList<>();
		for (int i = 0; i < ctx.compOp().getChildCount(); i++)
		{
			words.add(ctx.compOp().getChild(i).getText());
		}
		return new Expr.Compare(visit(ctx.expr(0)), String.join(" ", words), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitNotExpr(PyExprParser.NotExprContext ctx)
	{
		return new Expr.Unary("not", visit(ctx.expr()));
	}

	@Override
	public Expr visitAndExpr(PyExprParser.AndExprContext ctx)
	{
		return new Expr.BoolOp("and", visit(ctx.expr(0)), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitOrExpr(PyExprParser.OrExprContext ctx)
	{
		return new Expr.BoolOp("or", visit(ctx.expr(0)), visit(ctx.expr(1)));
	}

	@Override
	public Expr visitConditionalExpr(PyExprParser.ConditionalExprContext ctx)
	{
		return new Expr.Conditional(visit(ctx.expr(0)), visit(ctx.expr(1)), visit(ctx.expr(2)), sourceText(ctx));
	}

	@Override
	public Expr visitLambdaExpr(PyExprParser.LambdaExprContext ctx)
	{
		return new Expr.Unsupported("lambda expression", sourceText(ctx));
	}

	// --- trailers ---

	@Override
	public Expr visitPrimary(PyExprParser.PrimaryContext ctx)
	{
		Expr current = visit(ctx.atom());
		for (PyExprParser.TrailerContext trailer : ctx.trailer())
		{
			if (trailer instanceof PyExprParser.CallTrailerContext call)
			{
				current = buildCall(current, call.arguments());
			}
			else if (trailer instanceof PyExprParser.SubscriptTrailerContext sub)
			{
				current = new Expr.Subscript(current, buildIndex(sub.subscriptList()));
			}
			else if (trailer instanceof PyExprParser.AttributeTrailerContext attr)
			{
				current = new Expr.Attribute(current, attr.NAME().getText());
			}
		}
		return current;
	}

	private Expr buildCall(Expr func, PyExprParser.ArgumentsContext arguments)
	{
		List<Expr> args = new ArrayList<>();
		List<Expr.Keyword> keywords = new ArrayList<>();
		if (arguments != null)
		{
			for (PyExprParser.ArgumentContext arg : arguments.argument())
			{
				if (arg instanceof PyExprParser.KeywordArgumentContext kw)
				{
					keywords.add(new Expr.Keyword(kw.NAME().getText(), visit(kw.expr())));
				}
				else if (arg instanceof PyExprParser.StarArgumentContext star)
				{
					args.add(new Expr.Unsupported("starred argument", sourceText(star)));
				}
				else if (arg instanceof PyExprParser.PositionalArgumentContext pos)
				{
					if (pos.compFor() != null)
					{
						args.add(new Expr.Unsupported("generator expression", sourceText(pos)));
					}
					else
					{
						args.add(visit(pos.expr()));
					}
				}
			}
		}
		return new Expr.Call(func, args, keywords);
	}

	private Expr buildIndex(PyExprParser.SubscriptListContext ctx)
	{
		List<Expr> items = new ArrayList<>();
		for (PyExprParser.SubscriptItemContext item : ctx.subscriptItem())
		{
			if (item instanceof PyExprParser.SliceItemContext slice)
			{
				items.add(new Expr.Slice(visitOrNull(slice.lower), visitOrNull(slice.upper), visitOrNull(slice.step)));
			}
			else if (item instanceof PyExprParser.IndexItemContext index)
			{
				items.add(visit(index.expr()));
			}
		}
		if (items.size() == 1 && ctx.COMMA().isEmpty())
		{
			return items.get(0);
		}
		return new Expr.TupleDisplay(items);
	}

	// --- atoms ---

	@Override
	public Expr visitEmptyTupleAtom(PyExprParser.EmptyTupleAtomContext ctx)
	{
		return new Expr.TupleDisplay(List.of());
	}

	@Override
	public Expr visitGeneratorAtom(PyExprParser.GeneratorAtomContext ctx)
	{
		return new Expr.Unsupported("generator expression", sourceText(ctx));
	}

	@Override
	public Expr visitParenAtom(PyExprParser.ParenAtomContext ctx)
	{
		PyExprParser.ExprListContext list = ctx.exprList();
		if (list.expr().size() == 1 && list.COMMA().isEmpty())
		{
			return new Expr.Paren(visit(list.expr(0)));
		}
		return new Expr.TupleDisplay(visitAll(list.expr()));
	}

	@Override
	public Expr visitListCompAtom(PyExprParser.ListCompAtomContext ctx)
	{
		return new Expr.Unsupported("list comprehension", sourceText(ctx));
	}

	@Override
	public Expr visitListAtom(PyExprParser.ListAtomContext ctx)
	{
		if (ctx.exprList() == null)
		{
			return new Expr.ListDisplay(List.of());
		}
		return new Expr.ListDisplay(visitAll(ctx.exprList().expr()));
	}

	@Override
	public Expr visitBraceCompAtom(PyExprParser.BraceCompAtomContext ctx)
	{
		return new Expr.Unsupported("comprehension", sourceText(ctx));
	}

	@Override
	public Expr visitDictAtom(PyExprParser.DictAtomContext ctx)
	{
		List<Expr> keys = new ArrayList<>();
		List<Expr> values = new ArrayList<>();
		for (PyExprParser.DictEntryContext entry : ctx.dictEntry())
		{
			if (entry.POWER() != null)
			{
				keys.add(new Expr.Unsupported("dictionary unpacking", sourceText(entry)));
				values.add(new Expr.NoneLit());
				continue;
			}
			keys.add(visit(entry.key));
			values.add(visit(entry.value));
		}
		return new Expr.DictDisplay(keys, values);
	}

	@Override
	public Expr visitSetAtom(PyExprParser.SetAtomContext ctx)
	{
		return new Expr.SetDisplay(visitAll(ctx.exprList().expr()));
	}

	@Override
	public Expr visitNameAtom(PyExprParser.NameAtomContext ctx)
	{
		return new Expr.Name(ctx.NAME().getText());
	}

	@Override
	public Expr visitNumberAtom(PyExprParser.NumberAtomContext ctx)
	{
		return number(ctx.NUMBER().getText());
	}

	@Override
	public Expr visitStringAtom(PyExprParser.StringAtomContext ctx)
	{
		List<Expr> parts = new ArrayList<>();
		boolean formatted = false;
		for (TerminalNode token : ctx.STRING())
		{
			String raw = token.getText();
			int p = 0;
			while (p < raw.length() && Character.isLetter(raw.charAt(p)))
			{
				p++;
			}
			String prefix = raw.substring(0, p).toLowerCase();
			String body = raw.substring(p);
			int q = body.startsWith("\"\"\"") || body.startsWith("'''") ? 3 : 1;
			String content = body.substring(q, body.length() - q);
			if (!prefix.contains("r"))
			{
				content = unescapeQuotes(content);
			}
			if (prefix.contains("f"))
			{
				formatted = true;
				parts.addAll(new FStringSplitter(content).split());
			}
			else
			{
				parts.add(new Expr.Str(content));
			}
		}

		List<Expr> merged = mergeLiterals(parts);
		if (!formatted)
		{
			return merged.isEmpty() ? new Expr.Str("") : merged.get(0);
		}
		return new Expr.FString(merged);
	}

	@Override
	public Expr visitBoolAtom(PyExprParser.BoolAtomContext ctx)
	{
		return new Expr.Bool(ctx.TRUE() != null);
	}

	@Override
	public Expr visitNoneAtom(PyExprParser.NoneAtomContext ctx)
	{
		return new Expr.NoneLit();
	}

	@Override
	public Expr visitEllipsisAtom(PyExprParser.EllipsisAtomContext ctx)
	{
		return new Expr.Unsupported("ellipsis", "...");
	}

	// --- helpers ---

	private List<Expr> visitAll(List<PyExprParser.ExprContext> contexts)
	{
		List<Expr> out = new ArrayList<>();
		for (PyExprParser.ExprContext c : contexts)
		{
			out.add(visit(c));
		}
		return out;
	}

	private Expr visitOrNull(PyExprParser.ExprContext ctx)
	{
		return ctx == null ? null : visit(ctx);
	}

	static Expr.Num number(String text)
	{
		String clean = text.replace("_", "");
		String lower = clean.toLowerCase();
		try
		{
			if (lower.startsWith("0x"))
			{
				return new Expr.Num(Long.toString(Long.parseLong(clean.substring(2), 16)), true);
			}
			if (lower.startsWith("0o"))
			{
				return new Expr.Num(Long.toString(Long.parseLong(clean.substring(2), 8)), true);
			}
			if (lower.startsWith("0b"))
			{
				return new Expr.Num(Long.toString(Long.parseLong(clean.substring(2), 2)), true);
			}
		}
		catch (NumberFormatException e)
		{
			// out of range for a long; keep the literal as written
			return new Expr.Num(clean, true);
		}
		boolean integral = !(lower.contains(".") || lower.contains("e"));
		if (clean.startsWith("."))
		{
			clean = "0" + clean;
		}
		else if (clean.endsWith("."))
		{
			clean = clean + "0";
		}
		return new Expr.Num(clean, integral);
	}

	private static String unescapeQuotes(String s)
	{
		return s.replace("\\'", "'").replace("\\\"", "\"");
	}

	private static List<Expr> mergeLiterals(List<Expr> parts)
	{
		List<Expr> out = new ArrayList<>();
		for (Expr part : parts)
		{
			if (part instanceof Expr.Str str && !out.isEmpty() && out.get(out.size() - 1) instanceof Expr.Str prev)
			{
				out.set(out.size() - 1, new Expr.Str(prev.value() + str.value()));
			}
			else
			{
				out.add(part);
			}
		}
		return out;
	}

	private static String sourceText(ParserRuleContext ctx)
	{
		if (ctx.start == null || ctx.stop == null || ctx.stop.getStopIndex() < ctx.start.getStartIndex())
		{
			return ctx.getText();
		}
		return ctx.start.getInputStream().getText(Interval.of(ctx.start.getStartIndex(), ctx.stop.getStopIndex()));
	}

	/**
	 * Splits the body of an f-string into literal and expression fragments. Conversion
	 * ({@code !r}) and format-spec ({@code :.2f}) suffixes are dropped.
	 */
	private final class FStringSplitter
	{
		private final String content;
		private final List<Expr> parts = new ArrayList<>();
		private final StringBuilder literal = new StringBuilder();

		FStringSplitter(String content)
		{
			this.content = content;
		}

		List<Expr> split()
		{
			int i = 0;
			while (i < content.length())
			{
				char ch = content.charAt(i);
				if (ch == '{' && i + 1 < content.length() && content.charAt(i + 1) == '{')
				{
					literal.append('{');
					i += 2;
					continue;
				}
				if (ch == '}' && i + 1 < content.length() && content.charAt(i + 1) == '}')
				{
					literal.append('}');
					i += 2;
					continue;
				}
				if (ch == '{')
				{
					int end = findClosingBrace(i + 1);
					String inner = content.substring(i + 1, end);
					flushLiteral();
					parts.add(parseReplacement(inner));
					i = Math.min(end + 1, content.length());
					continue;
				}
				literal.append(ch);
				i++;
			}
			flushLiteral();
			return parts;
		}

		private void flushLiteral()
		{
			if (literal.length() > 0)
			{
				parts.add(new Expr.Str(literal.toString()));
				literal.setLength(0);
			}
		}

		private int findClosingBrace(int from)
		{
			int depth = 0;
			char quote = 0;
			for (int i = from; i < content.length(); i++)
			{
				char ch = content.charAt(i);
				if (quote != 0)
				{
					if (ch == quote)
					{
						quote = 0;
					}
					continue;
				}
				if (ch == '\'' || ch == '"')
				{
					quote = ch;
				}
				else if (ch == '(' || ch == '[' || ch == '{')
				{
					depth++;
				}
				else if (ch == ')' || ch == ']' || ch == '}')
				{
					if (depth == 0)
					{
						return i;
					}
					depth--;
				}
			}
			return content.length();
		}

		private Expr parseReplacement(String inner)
		{
			String expression = inner;
			int depth = 0;
			for (int i = 0; i < inner.length(); i++)
			{
				char ch = inner.charAt(i);
				if (ch == '(' || ch == '[' || ch == '{')
				{
					depth++;
				}
				else if (ch == ')' || ch == ']' || ch == '}')
				{
					depth--;
				}
				else if (depth == 0 && ch == ':')
				{
					expression = inner.substring(0, i);
					break;
				}
				else if (depth == 0 && ch == '!' && (i + 1 >= inner.length() || inner.charAt(i + 1) != '='))
				{
					expression = inner.substring(0, i);
					break;
				}
			}
			expression = expression.strip();
			if (expression.endsWith("=") && !expression.endsWith("=="))
			{
				// self-documenting {x=}
				expression = expression.substring(0, expression.length() - 1).strip();
			}
			return expressionParser.parseOrRaw(expression, line);
		}
	}
}
