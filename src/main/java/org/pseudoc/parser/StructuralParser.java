package org.pseudoc.parser;

import org.pseudoc.ast.Expr;
import org.pseudoc.ast.ModuleNode;
import org.pseudoc.ast.Param;
import org.pseudoc.ast.Stmt;
import org.pseudoc.parser.LineClassifier.LineKind;
import org.pseudoc.parser.LineClassifier.LineShape;
import org.pseudoc.util.Debug;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the statement tree from indentation alone. A line ending in ':' opens a body made of
 * the following lines with strictly greater indentation; the body ends at the first line
 * indented at or below the opener. Never throws: problems become diagnostics and placeholders.
 */
public class StructuralParser
{
	private static final Pattern FOR_HEADER = Pattern.compile("^(.+?)\\s+in\\s+(.+)$", Pattern.DOTALL);
	private static final Pattern DEF_HEADER = Pattern.compile(
			"^([A-Za-z_]\\w*)\\s*\\((.*)\\)\\s*(?:->\\s*(.+))?$", Pattern.DOTALL);
	private static final Pattern CLASS_HEADER = Pattern.compile("^([A-Za-z_]\\w*)\\s*(?:\\((.*)\\))?$", Pattern.DOTALL);

	private final ErrorHandler errorHandler;
	private final ExpressionParser expressionParser;
	private final int tabSize;
	private final boolean includeComments;
	private final boolean trace;

	private List<LogicalLine> lines;
	private int pos;

	public StructuralParser(ErrorHandler errorHandler, int tabSize, boolean includeComments, boolean trace)
	{
		this.errorHandler = errorHandler;
		this.expressionParser = new ExpressionParser(errorHandler);
		this.tabSize = tabSize;
		this.includeComments = includeComments;
		this.trace = trace;
	}

	public ModuleNode parse(String source)
	{
		LogicalLineReader reader = new LogicalLineReader(source, tabSize, errorHandler);
		lines = reader.read();
		pos = 0;
		Debug.trace(trace, "Structural parse: " + lines.size() + " logical line(s)");

		List<Stmt> body = parseBlock(0);
		return new ModuleNode(body, reader.physicalLineCount());
	}

	// ------------------------------------------------------------------ blocks

	private List<Stmt> parseBlock(int blockIndent)
	{
		List<Stmt> out = new ArrayList<>();
		while (pos < lines.size())
		{
			LogicalLine line = lines.get(pos);
			if (line.isCommentOnly())
			{
				if (line.indent() < blockIndent && !nextCodeLineBelongsTo(blockIndent))
				{
					break;
				}
				pos++;
				addComment(out, line.comment(), line.line());
				continue;
			}
			if (line.indent() < blockIndent)
			{
				break;
			}
			if (line.indent() > blockIndent)
			{
				errorHandler.logWarning(DiagnosticKind.STYLE, line.line(), "Unexpected indentation; line attached to the enclosing block");
			}
			pos++;
			out.addAll(parseStatement(line));
		}
		return out;
	}

	private boolean nextCodeLineBelongsTo(int blockIndent)
	{
		for (int i = pos; i < lines.size(); i++)
		{
			if (!lines.get(i).isCommentOnly())
			{
				return lines.get(i).indent() >= blockIndent;
			}
		}
		return false;
	}

	private int nextCodeIndent()
	{
		for (int i = pos; i < lines.size(); i++)
		{
			if (!lines.get(i).isCommentOnly())
			{
				return lines.get(i).indent();
			}
		}
		return -1;
	}

	private List<Stmt> parseBody(LogicalLine header, LineShape shape)
	{
		if (shape.missingColon())
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, header.line(), "Expected ':' at the end of '" + shape.keyword() + "' header");
		}
		if (shape.tail() != null)
		{
			List<Stmt> body = new ArrayList<>();
			for (String part : TopLevelScanner.splitTopLevel(shape.tail(), ';'))
			{
				if (!part.isBlank())
				{
					body.add(parseLine(new LogicalLine(header.line(), header.indent(), part.strip(), null)));
				}
			}
			return body;
		}
		int indent = nextCodeIndent();
		if (indent <= header.indent())
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, header.line(), "Expected an indented block after '" + shape.keyword() + "'");
			return List.of();
		}
		return parseBlock(indent);
	}

	// ------------------------------------------------------------------ statements

	private List<Stmt> parseStatement(LogicalLine line)
	{
		List<Stmt> out = new ArrayList<>();
		LineShape shape = LineClassifier.classify(line.code());

		if (!shape.kind().isBlock() && TopLevelScanner.splitTopLevel(line.code(), ';').size() > 1)
		{
			for (String part : TopLevelScanner.splitTopLevel(line.code(), ';'))
			{
				if (!part.isBlank())
				{
					out.add(parseLine(new LogicalLine(line.line(), line.indent(), part.strip(), null)));
				}
			}
			addComment(out, line.comment(), line.line());
			return out;
		}

		if (shape.kind().isBlock())
		{
			// a comment on a block header reads best above the block
			addComment(out, line.comment(), line.line());
			out.add(parseShape(line, shape));
			return out;
		}
		out.add(parseShape(line, shape));
		addComment(out, line.comment(), line.line());
		return out;
	}

	private Stmt parseLine(LogicalLine line)
	{
		return parseShape(line, LineClassifier.classify(line.code()));
	}

	private Stmt parseShape(LogicalLine line, LineShape shape)
	{
		int ln = line.line();
		switch (shape.kind())
		{
			case IF:
				return parseIf(line, shape);
			case FOR:
				return parseFor(line, shape);
			case WHILE:
			{
				Expr test = expressionParser.parseOrRaw(shape.head(), ln);
				List<Stmt> body = parseBody(line, shape);
				return new Stmt.While(test, body, parseLoopElse(line.indent()), ln);
			}
			case DEF:
				return parseFunction(line, shape);
			case CLASS:
				return parseClass(line, shape);
			case MATCH:
				return parseMatch(line, shape);
			case ELIF:
			case ELSE:
			case CASE:
				errorHandler.logError(DiagnosticKind.SYNTAX, ln, "'" + shape.keyword() + "' without a matching opening statement");
				return new Stmt.Unsupported(shape.keyword(), line.code(), parseBody(line, shape), ln);
			case TRY:
			case EXCEPT:
			case FINALLY:
			case WITH:
				return new Stmt.Unsupported(shape.keyword(), stripColon(line.code()), parseBody(line, shape), ln);
			case RETURN:
			{
				if (shape.head().isEmpty())
				{
					return new Stmt.Return(null, ln);
				}
				Optional<Expr> value = expressionParser.parse(shape.head(), ln);
				return value.<Stmt>map(v -> new Stmt.Return(v, ln)).orElseGet(() -> unknown(line));
			}
			case PASS:
				return new Stmt.Pass(ln);
			case BREAK:
				return new Stmt.Break(ln);
			case CONTINUE:
				return new Stmt.Continue(ln);
			case IMPORT:
			case KEYWORD_STATEMENT:
				return new Stmt.Unsupported(shape.keyword(), line.code(), List.of(), ln);
			case AUG_ASSIGN:
			{
				Optional<Expr> target = expressionParser.parse(shape.head(), ln);
				Optional<Expr> value = target.isPresent() ? expressionParser.parse(shape.tail(), ln) : Optional.empty();
				if (target.isEmpty() || value.isEmpty())
				{
					return unknown(line);
				}
				return new Stmt.AugAssign(target.get(), shape.op(), value.get(), ln);
			}
			case ANN_ASSIGN:
			{
				Optional<Expr> target = expressionParser.parse(shape.head(), ln);
				Expr annotation = expressionParser.parseOrRaw(shape.annotation(), ln);
				Expr value = null;
				if (shape.tail() != null)
				{
					Optional<Expr> parsed = expressionParser.parse(shape.tail(), ln);
					if (parsed.isEmpty())
					{
						return unknown(line);
					}
					value = parsed.get();
				}
				if (target.isEmpty())
				{
					return unknown(line);
				}
				return new Stmt.AnnAssign(target.get(), annotation, value, ln);
			}
			case ASSIGN:
			{
				List<Expr> targets = new ArrayList<>();
				for (String t : shape.targets())
				{
					Optional<Expr> target = expressionParser.parse(t, ln);
					if (target.isEmpty())
					{
						return unknown(line);
					}
					targets.add(target.get());
				}
				Optional<Expr> value = expressionParser.parse(shape.tail(), ln);
				if (value.isEmpty())
				{
					return unknown(line);
				}
				return new Stmt.Assign(targets, value.get(), ln);
			}
			default:
			{
				Optional<Expr> value = expressionParser.parse(shape.head(), ln);
				if (value.isEmpty())
				{
					return unknown(line);
				}
				if (value.get() instanceof Expr.Str docstring)
				{
					return new Stmt.Comment(docstring.value(), ln);
				}
				return new Stmt.ExprStmt(value.get(), ln);
			}
		}
	}

	private Stmt unknown(LogicalLine line)
	{
		Debug.trace(trace, "Unparsed line " + line.line() + ": " + line.code());
		return new Stmt.Unknown(line.code(), line.line());
	}

	// ------------------------------------------------------------------ conditionals

	private Stmt parseIf(LogicalLine line, LineShape shape)
	{
		Expr test = expressionParser.parseOrRaw(shape.head(), line.line());
		List<Stmt> body = parseBody(line, shape);
		List<Stmt> orElse = parseElseChain(line.indent());
		return new Stmt.If(test, body, orElse, line.line());
	}

	/**
	 * An elif at the opener's indentation becomes a nested If, the sole element of the or-else
	 * list; a plain else contributes its body directly.
	 */
	private List<Stmt> parseElseChain(int indent)
	{
		int save = pos;
		List<Stmt> leadingComments = new ArrayList<>();
		while (pos < lines.size() && lines.get(pos).isCommentOnly())
		{
			addComment(leadingComments, lines.get(pos).comment(), lines.get(pos).line());
			pos++;
		}
		if (pos < lines.size() && lines.get(pos).indent() == indent)
		{
			LogicalLine next = lines.get(pos);
			LineShape shape = LineClassifier.classify(next.code());
			if (shape.kind() == LineKind.ELIF)
			{
				pos++;
				Expr test = expressionParser.parseOrRaw(shape.head(), next.line());
				List<Stmt> body = new ArrayList<>(leadingComments);
				addComment(body, next.comment(), next.line());
				body.addAll(parseBody(next, shape));
				List<Stmt> orElse = parseElseChain(indent);
				return List.of(new Stmt.If(test, body, orElse, next.line()));
			}
			if (shape.kind() == LineKind.ELSE)
			{
				pos++;
				List<Stmt> body = new ArrayList<>(leadingComments);
				addComment(body, next.comment(), next.line());
				body.addAll(parseBody(next, shape));
				return body;
			}
		}
		pos = save;
		return List.of();
	}

	// ------------------------------------------------------------------ loops

	private Stmt parseFor(LogicalLine line, LineShape shape)
	{
		int ln = line.line();
		Matcher m = FOR_HEADER.matcher(shape.head());
		Expr target;
		Expr iter;
		if (m.matches())
		{
			target = expressionParser.parseOrRaw(m.group(1), ln);
			iter = expressionParser.parseOrRaw(m.group(2), ln);
		}
		else
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, ln, "Malformed for header: " + shape.head());
			target = new Expr.Unsupported("unparsed expression", shape.head());
			iter = new Expr.Unsupported("unparsed expression", "");
		}
		List<Stmt> body = parseBody(line, shape);
		return new Stmt.For(target, iter, body, parseLoopElse(line.indent()), ln);
	}

	private List<Stmt> parseLoopElse(int indent)
	{
		int next = pos;
		while (next < lines.size() && lines.get(next).isCommentOnly())
		{
			next++;
		}
		if (next < lines.size() && lines.get(next).indent() == indent)
		{
			LogicalLine line = lines.get(next);
			LineShape shape = LineClassifier.classify(line.code());
			if (shape.kind() == LineKind.ELSE)
			{
				pos = next + 1;
				return parseBody(line, shape);
			}
		}
		return List.of();
	}

	// ------------------------------------------------------------------ definitions

	private Stmt parseFunction(LogicalLine line, LineShape shape)
	{
		int ln = line.line();
		Matcher m = DEF_HEADER.matcher(shape.head());
		if (!m.matches())
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, ln, "Malformed function header: " + shape.head());
			return new Stmt.Unsupported("def", stripColon(line.code()), parseBody(line, shape), ln);
		}
		List<Param> params = new ArrayList<>();
		for (String raw : TopLevelScanner.splitTopLevel(m.group(2), ','))
		{
			Param param = parseParam(raw.strip(), ln);
			if (param != null)
			{
				params.add(param);
			}
		}
		Expr returns = m.group(3) == null ? null : expressionParser.parseOrRaw(m.group(3).strip(), ln);
		List<Stmt> body = parseBody(line, shape);
		return new Stmt.FunctionDef(m.group(1), params, returns, body, ln);
	}

	private Param parseParam(String text, int ln)
	{
		if (text.isEmpty() || text.equals("*") || text.equals("/"))
		{
			return null;
		}
		boolean variadic = text.startsWith("*");
		String rest = text.replaceFirst("^\\*{1,2}", "").strip();

		Expr defaultValue = null;
		int eq = TopLevelScanner.indexOfTopLevel(rest, '=');
		if (eq >= 0)
		{
			defaultValue = expressionParser.parseOrRaw(rest.substring(eq + 1).strip(), ln);
			rest = rest.substring(0, eq).strip();
		}
		Expr annotation = null;
		int colon = TopLevelScanner.indexOfTopLevel(rest, ':');
		if (colon >= 0)
		{
			annotation = expressionParser.parseOrRaw(rest.substring(colon + 1).strip(), ln);
			rest = rest.substring(0, colon).strip();
		}
		return new Param(rest, annotation, defaultValue, variadic);
	}

	private Stmt parseClass(LogicalLine line, LineShape shape)
	{
		int ln = line.line();
		Matcher m = CLASS_HEADER.matcher(shape.head());
		if (!m.matches())
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, ln, "Malformed class header: " + shape.head());
			return new Stmt.Unsupported("class", stripColon(line.code()), parseBody(line, shape), ln);
		}
		List<String> bases = new ArrayList<>();
		if (m.group(2) != null)
		{
			for (String base : TopLevelScanner.splitTopLevel(m.group(2), ','))
			{
				String b = base.strip();
				if (!b.isEmpty() && !b.contains("=") && !b.equals("object"))
				{
					bases.add(b);
				}
			}
		}
		return new Stmt.ClassDef(m.group(1), bases, parseBody(line, shape), ln);
	}

	// ------------------------------------------------------------------ match

	private Stmt parseMatch(LogicalLine line, LineShape shape)
	{
		int ln = line.line();
		Expr subject = expressionParser.parseOrRaw(shape.head(), ln);
		List<Stmt.CaseClause> cases = new ArrayList<>();
		int caseIndent = nextCodeIndent();
		if (caseIndent <= line.indent())
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, ln, "Expected an indented block after 'match'");
			return new Stmt.Match(subject, cases, ln);
		}

		while (pos < lines.size())
		{
			LogicalLine next = lines.get(pos);
			if (next.isCommentOnly())
			{
				if (!nextCodeLineBelongsTo(caseIndent))
				{
					break;
				}
				pos++;
				continue;
			}
			if (next.indent() < caseIndent)
			{
				break;
			}
			LineShape caseShape = LineClassifier.classify(next.code());
			pos++;
			if (caseShape.kind() != LineKind.CASE)
			{
				errorHandler.logError(DiagnosticKind.SYNTAX, next.line(), "Expected 'case' inside 'match'");
				continue;
			}
			String pattern = caseShape.head();
			int guard = TopLevelScanner.indexOfWord(pattern, "if");
			if (guard >= 0)
			{
				errorHandler.logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, next.line(), "Case guard ignored: " + pattern.substring(guard));
				pattern = pattern.substring(0, guard).strip();
			}
			Expr patternExpr = pattern.equals("_") ? null : expressionParser.parseOrRaw(pattern, next.line());
			cases.add(new Stmt.CaseClause(patternExpr, parseBody(next, caseShape), next.line()));
		}
		return new Stmt.Match(subject, cases, ln);
	}

	// ------------------------------------------------------------------ helpers

	private void addComment(List<Stmt> out, String comment, int line)
	{
		if (includeComments && comment != null)
		{
			out.add(new Stmt.Comment(comment, line));
		}
	}

	private static String stripColon(String code)
	{
		String s = code.strip();
		int colon = TopLevelScanner.indexOfTopLevel(s, ':');
		return colon >= 0 ? s.substring(0, colon).strip() : s;
	}
}
