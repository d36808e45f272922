package org.pseudoc.config;

/**
 * Options for {@code Converter.render}. Field names double as the keys of the {@code render}
 * section of a configuration file.
 */
public class RenderOptions
{
	private OutputFormat format = OutputFormat.PLAIN;
	private int indentSize = 3;
	private IndentStyle indentChar = IndentStyle.SPACE;
	private LineEnding lineEnding = LineEnding.LF;
	private boolean includeComments = true;
	private boolean includeLineNumbers = false;
	private boolean uppercaseKeywords = true;
	private boolean spaceAroundOperators = true;
	private boolean spaceAfterComma = true;
	// 0 disables the check
	private int maxLineLength = 80;
	private String title;

	public OutputFormat getFormat()
	{
		return format == null ? OutputFormat.PLAIN : format;
	}

	public RenderOptions setFormat(OutputFormat format)
	{
		this.format = format;
		return this;
	}

	public int getIndentSize()
	{
		return indentSize;
	}

	public RenderOptions setIndentSize(int indentSize)
	{
		this.indentSize = indentSize;
		return this;
	}

	public IndentStyle getIndentChar()
	{
		return indentChar == null ? IndentStyle.SPACE : indentChar;
	}

	public RenderOptions setIndentChar(IndentStyle indentChar)
	{
		this.indentChar = indentChar;
		return this;
	}

	public LineEnding getLineEnding()
	{
		return lineEnding == null ? LineEnding.LF : lineEnding;
	}

	public RenderOptions setLineEnding(LineEnding lineEnding)
	{
		this.lineEnding = lineEnding;
		return this;
	}

	public boolean isIncludeComments()
	{
		return includeComments;
	}

	public RenderOptions setIncludeComments(boolean includeComments)
	{
		this.includeComments = includeComments;
		return this;
	}

	public boolean isIncludeLineNumbers()
	{
		return includeLineNumbers;
	}

	public RenderOptions setIncludeLineNumbers(boolean includeLineNumbers)
	{
		this.includeLineNumbers = includeLineNumbers;
		return this;
	}

	public boolean isUppercaseKeywords()
	{
		return uppercaseKeywords;
	}

	public RenderOptions setUppercaseKeywords(boolean uppercaseKeywords)
	{
		this.uppercaseKeywords = uppercaseKeywords;
		return this;
	}

	public boolean isSpaceAroundOperators()
	{
		return spaceAroundOperators;
	}

	public RenderOptions setSpaceAroundOperators(boolean spaceAroundOperators)
	{
		this.spaceAroundOperators = spaceAroundOperators;
		return this;
	}

	public boolean isSpaceAfterComma()
	{
		return spaceAfterComma;
	}

	public RenderOptions setSpaceAfterComma(boolean spaceAfterComma)
	{
		this.spaceAfterComma = spaceAfterComma;
		return this;
	}

	public int getMaxLineLength()
	{
		return maxLineLength;
	}

	public RenderOptions setMaxLineLength(int maxLineLength)
	{
		this.maxLineLength = maxLineLength;
		return this;
	}

	public String getTitle()
	{
		return title;
	}

	public RenderOptions setTitle(String title)
	{
		this.title = title;
		return this;
	}
}
