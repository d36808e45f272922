package org.pseudoc.config;

public enum OutputFormat
{
	PLAIN(".txt"),
	DOCUMENTATION(".md");

	private final String extension;

	OutputFormat(String extension)
	{
		this.extension = extension;
	}

	public String getExtension()
	{
		return extension;
	}

	/**
	 * Accepts the command-line spellings {@code plain}, {@code text}, {@code markdown}, {@code md}
	 * and the enum names.
	 */
	public static OutputFormat fromString(String value)
	{
		return switch (value.toLowerCase())
		{
			case "plain", "text", "txt" -> PLAIN;
			case "markdown", "md", "documentation", "doc" -> DOCUMENTATION;
			default -> throw new IllegalArgumentException("Unknown output format: " + value + " (expected plain or markdown)");
		};
	}
}
