package org.pseudoc.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Character-level helpers that find separators at bracket depth zero and outside string
 * literals. Used by the line classifier, which never tokenizes a whole line.
 */
public final class TopLevelScanner
{
	private static final String AUGMENTED_PREFIXES = "+-*/%&|^@";

	private TopLevelScanner()
	{
	}

	/**
	 * An assignment operator found at top level; {@code op} is {@code "="} or the augmented
	 * operator without its trailing {@code =} ({@code "+"}, {@code "//"} ...).
	 */
	public record AssignOp(int index, int length, String op)
	{
		public boolean isAugmented()
		{
			return !op.equals("=");
		}
	}

	public static int indexOfTopLevel(String text, char target)
	{
		Cursor c = new Cursor(text);
		while (c.advance())
		{
			if (c.topLevel() && c.ch() == target)
			{
				return c.pos;
			}
		}
		return -1;
	}

	public static List<String> splitTopLevel(String text, char separator)
	{
		List<String> parts = new ArrayList<>();
		Cursor c = new Cursor(text);
		int start = 0;
		while (c.advance())
		{
			if (c.topLevel() && c.ch() == separator)
			{
				parts.add(text.substring(start, c.pos));
				start = c.pos + 1;
			}
		}
		parts.add(text.substring(start));
		return parts;
	}

	/**
	 * Finds assignment operators at top level, skipping comparisons ({@code == <= >= !=}) and
	 * walrus {@code :=}. Scanning stops at a top-level {@code lambda} so that lambda default
	 * values are not mistaken for chained assignment.
	 */
	public static List<AssignOp> findAssignOps(String text)
	{
		List<AssignOp> ops = new ArrayList<>();
		Cursor c = new Cursor(text);
		while (c.advance())
		{
			if (!c.topLevel())
			{
				continue;
			}
			int i = c.pos;
			if (startsWord(text, i, "lambda"))
			{
				break;
			}
			if (text.charAt(i) != '=')
			{
				continue;
			}
			if (i + 1 < text.length() && text.charAt(i + 1) == '=')
			{
				c.skip(1);
				continue;
			}
			char prev = i > 0 ? text.charAt(i - 1) : ' ';
			char prev2 = i > 1 ? text.charAt(i - 2) : ' ';
			if (prev == '!' || prev == ':' || prev == '=')
			{
				continue;
			}
			if (prev == '<' || prev == '>')
			{
				if (prev2 == prev)
				{
					ops.add(new AssignOp(i - 2, 3, "" + prev + prev));
				}
				continue;
			}
			if (AUGMENTED_PREFIXES.indexOf(prev) >= 0)
			{
				if ((prev == '*' || prev == '/') && prev2 == prev)
				{
					ops.add(new AssignOp(i - 2, 3, "" + prev + prev));
				}
				else
				{
					ops.add(new AssignOp(i - 1, 2, String.valueOf(prev)));
				}
				continue;
			}
			ops.add(new AssignOp(i, 1, "="));
		}
		return ops;
	}

	/**
	 * Index of the first top-level occurrence of {@code word} as a whole word, or -1.
	 */
	public static int indexOfWord(String text, String word)
	{
		Cursor c = new Cursor(text);
		while (c.advance())
		{
			if (c.topLevel() && startsWord(text, c.pos, word))
			{
				return c.pos;
			}
		}
		return -1;
	}

	private static boolean startsWord(String text, int i, String word)
	{
		if (!text.startsWith(word, i))
		{
			return false;
		}
		boolean leftOk = i == 0 || !isIdentifierChar(text.charAt(i - 1));
		int end = i + word.length();
		boolean rightOk = end >= text.length() || !isIdentifierChar(text.charAt(end));
		return leftOk && rightOk;
	}

	private static boolean isIdentifierChar(char ch)
	{
		return Character.isLetterOrDigit(ch) || ch == '_';
	}

	/**
	 * Walks a string tracking bracket depth and string literals. {@link #advance()} moves to the
	 * next character that is not inside a string literal (quotes themselves are skipped too).
	 */
	private static final class Cursor
	{
		private final String text;
		private int pos = -1;
		private int depth = 0;

		Cursor(String text)
		{
			this.text = text;
		}

		boolean advance()
		{
			pos++;
			while (pos < text.length())
			{
				char ch = text.charAt(pos);
				if (ch == '\'' || ch == '"')
				{
					pos = skipString(pos);
					continue;
				}
				if (ch == '(' || ch == '[' || ch == '{')
				{
					depth++;
					pos++;
					continue;
				}
				if (ch == ')' || ch == ']' || ch == '}')
				{
					if (depth > 0)
					{
						depth--;
					}
					pos++;
					continue;
				}
				return true;
			}
			return false;
		}

		void skip(int n)
		{
			pos += n;
		}

		char ch()
		{
			return text.charAt(pos);
		}

		boolean topLevel()
		{
			return depth == 0;
		}

		private int skipString(int start)
		{
			char quote = text.charAt(start);
			boolean triple = text.startsWith(String.valueOf(quote).repeat(3), start);
			int i = start + (triple ? 3 : 1);
			while (i < text.length())
			{
				char ch = text.charAt(i);
				if (ch == '\\')
				{
					i += 2;
					continue;
				}
				if (triple)
				{
					if (text.startsWith(String.valueOf(quote).repeat(3), i))
					{
						return i + 3;
					}
				}
				else if (ch == quote)
				{
					return i + 1;
				}
				i++;
			}
			return text.length();
		}
	}
}
