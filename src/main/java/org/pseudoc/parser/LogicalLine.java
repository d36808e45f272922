package org.pseudoc.parser;

/**
 * One logical source line after continuation joining. {@code code} is stripped of indentation
 * and of its trailing comment; {@code comment} is the comment text without {@code #}, or null.
 */
public record LogicalLine(int line, int indent, String code, String comment)
{
	public boolean isCommentOnly()
	{
		return code.isEmpty();
	}
}
