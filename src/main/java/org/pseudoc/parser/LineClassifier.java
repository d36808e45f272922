package org.pseudoc.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decides the shape of one logical line. Tests run in a fixed order and the first match wins;
 * nothing is re-tried once a shape has been chosen.
 */
public final class LineClassifier
{
	private static final Pattern BLOCK_KEYWORD = Pattern.compile(
			"^(if|elif|else|for|while|def|class|try|except|finally|with|async)\\b");
	// soft keywords: only a block when followed by a subject
	private static final Pattern SOFT_BLOCK_KEYWORD = Pattern.compile("^(match|case)(?=[\\s(\\[{'\"-])");
	private static final Pattern SIMPLE_KEYWORD = Pattern.compile(
			"^(return|pass|break|continue|import|from|global|nonlocal|del|assert|raise|yield|await)\\b");
	private static final Pattern ANNOTATED_TARGET = Pattern.compile(
			"^([A-Za-z_]\\w*(?:\\s*\\.\\s*[A-Za-z_]\\w*)*)\\s*:(.+)$", Pattern.DOTALL);

	public enum LineKind
	{
		IF, ELIF, ELSE, FOR, WHILE, DEF, CLASS, MATCH, CASE, TRY, EXCEPT, FINALLY, WITH,
		RETURN, PASS, BREAK, CONTINUE, IMPORT, KEYWORD_STATEMENT,
		AUG_ASSIGN, ANN_ASSIGN, ASSIGN, EXPRESSION;

		public boolean isBlock()
		{
			return ordinal() <= WITH.ordinal();
		}
	}

	/**
	 * Classification result. Field use depends on kind:
	 * blocks: head = header after the keyword, tail = inline body or null, missingColon;
	 * simple keywords: head = rest of the line;
	 * AUG_ASSIGN: head = target, op, tail = value;
	 * ANN_ASSIGN: head = target, annotation, tail = value or null;
	 * ASSIGN: targets, tail = value;
	 * EXPRESSION: head = whole line.
	 */
	public record LineShape(LineKind kind, String keyword, String head, String tail, String op,
							String annotation, List<String> targets, boolean missingColon)
	{
		static LineShape of(LineKind kind, String keyword, String head)
		{
			return new LineShape(kind, keyword, head, null, null, null, List.of(), false);
		}
	}

	private LineClassifier()
	{
	}

	public static LineShape classify(String code)
	{
		Matcher block = BLOCK_KEYWORD.matcher(code);
		if (block.find())
		{
			return blockShape(block.group(1), code);
		}
		Matcher soft = SOFT_BLOCK_KEYWORD.matcher(code);
		if (soft.find() && TopLevelScanner.indexOfTopLevel(code, ':') > soft.end())
		{
			LineShape shape = blockShape(soft.group(1), code);
			if (!shape.head().isEmpty())
			{
				return shape;
			}
		}

		Matcher simple = SIMPLE_KEYWORD.matcher(code);
		if (simple.find())
		{
			String keyword = simple.group(1);
			String rest = code.substring(simple.end()).strip();
			return LineShape.of(simpleKind(keyword), keyword, rest);
		}

		List<TopLevelScanner.AssignOp> ops = TopLevelScanner.findAssignOps(code);
		if (!ops.isEmpty())
		{
			TopLevelScanner.AssignOp first = ops.get(0);
			if (first.isAugmented())
			{
				String target = code.substring(0, first.index()).strip();
				String value = code.substring(first.index() + first.length()).strip();
				return new LineShape(LineKind.AUG_ASSIGN, null, target, value, first.op(), null, List.of(), false);
			}

			List<String> parts = new ArrayList<>();
			int start = 0;
			for (TopLevelScanner.AssignOp op : ops)
			{
				if (op.isAugmented())
				{
					break;
				}
				parts.add(code.substring(start, op.index()).strip());
				start = op.index() + op.length();
			}
			String value = code.substring(start).strip();

			Matcher annotated = ANNOTATED_TARGET.matcher(parts.get(0));
			if (parts.size() == 1 && annotated.matches())
			{
				return new LineShape(LineKind.ANN_ASSIGN, null, annotated.group(1).replaceAll("\\s+", ""), value, null,
						annotated.group(2).strip(), List.of(), false);
			}
			return new LineShape(LineKind.ASSIGN, null, null, value, "=", null, List.copyOf(parts), false);
		}

		Matcher annotated = ANNOTATED_TARGET.matcher(code);
		if (annotated.matches() && TopLevelScanner.indexOfTopLevel(code, ':') == annotated.start(2) - 1)
		{
			return new LineShape(LineKind.ANN_ASSIGN, null, annotated.group(1).replaceAll("\\s+", ""), null, null,
					annotated.group(2).strip(), List.of(), false);
		}

		return LineShape.of(LineKind.EXPRESSION, null, code);
	}

	private static LineShape blockShape(String keyword, String code)
	{
		String afterKeyword = code.substring(keyword.length());
		int colon = TopLevelScanner.indexOfTopLevel(afterKeyword, ':');
		String head;
		String tail = null;
		boolean missingColon = false;
		if (colon < 0)
		{
			head = afterKeyword.strip();
			missingColon = true;
		}
		else
		{
			head = afterKeyword.substring(0, colon).strip();
			String rest = afterKeyword.substring(colon + 1).strip();
			tail = rest.isEmpty() ? null : rest;
		}
		return new LineShape(blockKind(keyword), keyword, head, tail, null, null, List.of(), missingColon);
	}

	private static LineKind blockKind(String keyword)
	{
		return switch (keyword)
		{
			case "if" -> LineKind.IF;
			case "elif" -> LineKind.ELIF;
			case "else" -> LineKind.ELSE;
			case "for" -> LineKind.FOR;
			case "while" -> LineKind.WHILE;
			case "def" -> LineKind.DEF;
			case "class" -> LineKind.CLASS;
			case "match" -> LineKind.MATCH;
			case "case" -> LineKind.CASE;
			case "try" -> LineKind.TRY;
			case "except" -> LineKind.EXCEPT;
			case "finally" -> LineKind.FINALLY;
			default -> LineKind.WITH; // with, async
		};
	}

	private static LineKind simpleKind(String keyword)
	{
		return switch (keyword)
		{
			case "return" -> LineKind.RETURN;
			case "pass" -> LineKind.PASS;
			case "break" -> LineKind.BREAK;
			case "continue" -> LineKind.CONTINUE;
			case "import", "from" -> LineKind.IMPORT;
			default -> LineKind.KEYWORD_STATEMENT;
		};
	}
}
