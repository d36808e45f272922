package org.pseudoc.util;

/**
 * A single non-fatal error or warning. Line and column are 1-based; either may be null when
 * the problem has no source position (for example, a rendering problem).
 */
public record Diagnostic(
		String message,
		DiagnosticKind kind,
		Integer line,
		Integer column,
		Severity severity
)
{
	public enum Severity
	{
		ERROR,
		WARNING
	}

	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	public String format()
	{
		StringBuilder sb = new StringBuilder("[").append(kind.getLabel()).append("]");
		if (line != null)
		{
			sb.append(" line ").append(line);
			if (column != null)
			{
				sb.append(':').append(column);
			}
		}
		return sb.append(" - ").append(message).toString();
	}

	@Override
	public String toString()
	{
		return format();
	}
}
