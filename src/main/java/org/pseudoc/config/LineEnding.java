package org.pseudoc.config;

public enum LineEnding
{
	LF("\n"),
	CRLF("\r\n");

	private final String sequence;

	LineEnding(String sequence)
	{
		this.sequence = sequence;
	}

	public String getSequence()
	{
		return sequence;
	}

	public static LineEnding fromString(String value)
	{
		return switch (value.toLowerCase())
		{
			case "lf", "unix" -> LF;
			case "crlf", "windows" -> CRLF;
			default -> throw new IllegalArgumentException("Unknown line ending: " + value + " (expected lf or crlf)");
		};
	}
}
