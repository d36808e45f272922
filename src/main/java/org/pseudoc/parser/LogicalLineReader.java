package org.pseudoc.parser;

import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into logical lines: joins backslash continuations, lines inside open
 * brackets and multi-line triple-quoted strings; separates trailing comments; measures
 * indentation with tabs expanded to the configured width.
 */
public class LogicalLineReader
{
	private final String[] lines;
	private final int tabSize;
	private final ErrorHandler errorHandler;

	public LogicalLineReader(String source, int tabSize, ErrorHandler errorHandler)
	{
		this.lines = source.split("\r\n|\r|\n", -1);
		this.tabSize = tabSize > 0 ? tabSize : 4;
		this.errorHandler = errorHandler;
	}

	public int physicalLineCount()
	{
		// a trailing newline leaves one empty element behind
		int count = lines.length;
		if (count > 0 && lines[count - 1].isEmpty())
		{
			count--;
		}
		return count;
	}

	public List<LogicalLine> read()
	{
		List<LogicalLine> out = new ArrayList<>();
		int i = 0;
		while (i < lines.length)
		{
			String raw = lines[i];
			if (raw.isBlank())
			{
				i++;
				continue;
			}

			int startLine = i + 1;
			int indent = measureIndent(raw);
			ScanState state = new ScanState();
			StringBuilder code = new StringBuilder();
			String comment = null;
			String segment = raw.stripLeading();

			while (true)
			{
				String found = scanSegment(segment, state, code);
				if (found != null)
				{
					comment = comment == null ? found : comment + " " + found;
				}

				if (state.inString && !state.triple)
				{
					errorHandler.logError(DiagnosticKind.SYNTAX, i + 1, "Unterminated string literal");
					code.append(state.quote);
					state.inString = false;
				}

				boolean backslash = false;
				if (!state.inString && found == null)
				{
					int end = lastNonSpace(code);
					if (end >= 0 && code.charAt(end) == '\\')
					{
						code.setLength(end);
						backslash = true;
					}
				}

				boolean more = state.inString || state.depth > 0 || backslash;
				if (!more)
				{
					break;
				}
				if (i + 1 >= lines.length)
				{
					if (state.inString)
					{
						errorHandler.logError(DiagnosticKind.SYNTAX, startLine, "Unterminated triple-quoted string");
						code.append(String.valueOf(state.quote).repeat(3));
					}
					else if (state.depth > 0)
					{
						errorHandler.logError(DiagnosticKind.SYNTAX, startLine, "Unclosed bracket");
					}
					break;
				}
				i++;
				if (state.inString)
				{
					code.append('\n');
					segment = lines[i];
				}
				else
				{
					code.append(' ');
					segment = lines[i].strip();
				}
			}
			i++;

			String text = code.toString().strip();
			if (text.isEmpty() && comment == null)
			{
				continue;
			}
			out.add(new LogicalLine(startLine, indent, text, comment));
		}
		return out;
	}

	private int measureIndent(String raw)
	{
		int col = 0;
		for (int k = 0; k < raw.length(); k++)
		{
			char ch = raw.charAt(k);
			if (ch == ' ')
			{
				col++;
			}
			else if (ch == '\t')
			{
				col = (col / tabSize + 1) * tabSize;
			}
			else if (ch != '\f')
			{
				break;
			}
		}
		return col;
	}

	/**
	 * Appends the code part of {@code s} to {@code code}; returns the trailing comment text, if any.
	 */
	private static String scanSegment(String s, ScanState state, StringBuilder code)
	{
		for (int k = 0; k < s.length(); k++)
		{
			char ch = s.charAt(k);
			if (state.inString)
			{
				code.append(ch);
				if (ch == '\\' && k + 1 < s.length())
				{
					code.append(s.charAt(++k));
					continue;
				}
				if (state.triple)
				{
					String closing = String.valueOf(state.quote).repeat(3);
					if (s.startsWith(closing, k))
					{
						code.append(state.quote).append(state.quote);
						k += 2;
						state.inString = false;
					}
				}
				else if (ch == state.quote)
				{
					state.inString = false;
				}
				continue;
			}

			if (ch == '#')
			{
				return s.substring(k + 1).strip();
			}
			if (ch == '\'' || ch == '"')
			{
				state.inString = true;
				state.quote = ch;
				String opening = String.valueOf(ch).repeat(3);
				state.triple = s.startsWith(opening, k);
				if (state.triple)
				{
					code.append(opening);
					k += 2;
				}
				else
				{
					code.append(ch);
				}
				continue;
			}
			if (ch == '(' || ch == '[' || ch == '{')
			{
				state.depth++;
			}
			else if ((ch == ')' || ch == ']' || ch == '}') && state.depth > 0)
			{
				state.depth--;
			}
			code.append(ch);
		}
		return null;
	}

	private static int lastNonSpace(StringBuilder sb)
	{
		int k = sb.length() - 1;
		while (k >= 0 && Character.isWhitespace(sb.charAt(k)))
		{
			k--;
		}
		return k;
	}

	private static final class ScanState
	{
		boolean inString;
		boolean triple;
		char quote;
		int depth;
	}
}
