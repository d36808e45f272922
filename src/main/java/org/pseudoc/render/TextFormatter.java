package org.pseudoc.render;

import org.pseudoc.config.RenderOptions;

import java.util.List;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line-level formatting policy: keyword casing, operator spacing and comma spacing. String
 * literals are never touched.
 */
public class TextFormatter
{
	static final List<String> KEYWORDS = List.of(
			"DECLARE", "CONSTANT", "ARRAY", "OF", "TYPE", "ENDTYPE", "CLASS", "ENDCLASS", "INHERITS", "PUBLIC",
			"PRIVATE", "NEW", "SUPER", "IF", "THEN", "ELSE", "ENDIF", "CASE", "OTHERWISE", "ENDCASE", "FOR", "TO",
			"STEP", "NEXT", "IN", "WHILE", "ENDWHILE", "REPEAT", "UNTIL", "BREAK", "PROCEDURE", "ENDPROCEDURE",
			"FUNCTION", "ENDFUNCTION", "RETURNS", "RETURN", "CALL", "INPUT", "OUTPUT", "AND", "OR", "NOT", "MOD",
			"DIV", "TRUE", "FALSE", "NULL", "INTEGER", "REAL", "STRING", "BOOLEAN", "CHAR", "DATE"
	);

	private static final Pattern KEYWORD = Pattern.compile("\\b(" + String.join("|", KEYWORDS) + ")\\b");
	private static final Pattern SPACED_OPERATOR = Pattern.compile("\\s+(←|≠|≤|≥|=|<|>|\\+|-|\\*|/|&|\\^)\\s+");
	private static final Pattern TIGHT_ASSIGNMENT = Pattern.compile("\\s*←\\s*");
	private static final Pattern COMMA = Pattern.compile(",\\s*");

	private final RenderOptions options;

	public TextFormatter(RenderOptions options)
	{
		this.options = options;
	}

	public String format(String line)
	{
		String out = line;
		if (!options.isUppercaseKeywords())
		{
			out = outsideStrings(out, TextFormatter::lowercaseKeywords);
		}
		if (options.isSpaceAroundOperators())
		{
			out = outsideStrings(out, s -> TIGHT_ASSIGNMENT.matcher(s).replaceAll(" ← "));
		}
		else
		{
			out = outsideStrings(out, s -> SPACED_OPERATOR.matcher(s).replaceAll("$1"));
		}
		out = outsideStrings(out, s -> COMMA.matcher(s).replaceAll(options.isSpaceAfterComma() ? ", " : ","));
		return out;
	}

	private static String lowercaseKeywords(String s)
	{
		Matcher m = KEYWORD.matcher(s);
		StringBuilder sb = new StringBuilder();
		while (m.find())
		{
			m.appendReplacement(sb, m.group(1).toLowerCase());
		}
		m.appendTail(sb);
		return sb.toString();
	}

	/**
	 * Applies {@code transform} to every stretch of {@code line} outside double-quoted literals.
	 * An unterminated literal runs to the end of the line.
	 */
	static String outsideStrings(String line, UnaryOperator<String> transform)
	{
		StringBuilder out = new StringBuilder();
		int i = 0;
		while (i < line.length())
		{
			int quote = line.indexOf('"', i);
			if (quote < 0)
			{
				out.append(transform.apply(line.substring(i)));
				break;
			}
			out.append(transform.apply(line.substring(i, quote)));
			int close = quote + 1;
			while (close < line.length() && line.charAt(close) != '"')
			{
				if (line.charAt(close) == '\\')
				{
					close++;
				}
				close++;
			}
			int end = Math.min(close + 1, line.length());
			out.append(line, quote, end);
			i = end;
		}
		return out.toString();
	}
}
