package org.pseudoc.config;

/**
 * Parse and render options together; the shape of a configuration file.
 */
public class ConversionOptions
{
	private ParseOptions parse = new ParseOptions();
	private RenderOptions render = new RenderOptions();

	public ConversionOptions()
	{
	}

	public ConversionOptions(ParseOptions parse, RenderOptions render)
	{
		this.parse = parse;
		this.render = render;
	}

	public ParseOptions getParse()
	{
		if (parse == null)
		{
			parse = new ParseOptions();
		}
		return parse;
	}

	public RenderOptions getRender()
	{
		if (render == null)
		{
			render = new RenderOptions();
		}
		return render;
	}
}
