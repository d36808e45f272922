package org.pseudoc.config;

public enum IndentStyle
{
	SPACE(' '),
	TAB('\t');

	private final char character;

	IndentStyle(char character)
	{
		this.character = character;
	}

	public char getCharacter()
	{
		return character;
	}

	public static IndentStyle fromString(String value)
	{
		return switch (value.toLowerCase())
		{
			case "space", "spaces" -> SPACE;
			case "tab", "tabs" -> TAB;
			default -> throw new IllegalArgumentException("Unknown indent character: " + value + " (expected space or tab)");
		};
	}
}
