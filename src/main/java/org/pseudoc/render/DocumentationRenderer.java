package org.pseudoc.render;

import org.pseudoc.config.RenderOptions;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrNode;
import org.pseudoc.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Markdown document around the plain output: a title, the definitions found in the IR and
 * the pseudocode in a fenced block.
 */
public class DocumentationRenderer extends Renderer
{
	private static final String DEFAULT_TITLE = "Pseudocode";

	private final TextRenderer text;
	private int lineCount;

	public DocumentationRenderer(RenderOptions options, ErrorHandler errorHandler)
	{
		super(options, errorHandler);
		this.text = new TextRenderer(options, errorHandler);
	}

	@Override
	public String render(IrNode root)
	{
		String newline = options.getLineEnding().getSequence();
		String title = options.getTitle() == null || options.getTitle().isBlank() ? DEFAULT_TITLE : options.getTitle();

		List<String> out = new ArrayList<>();
		out.add("# " + title);
		out.add("");

		List<String> definitions = new ArrayList<>();
		if (root != null)
		{
			collectDefinitions(root, null, definitions);
		}
		if (!definitions.isEmpty())
		{
			out.add("## Definitions");
			out.add("");
			for (String definition : definitions)
			{
				out.add("- " + definition);
			}
			out.add("");
		}

		String body = text.render(root);
		out.add("## Code");
		out.add("");
		out.add("```pseudocode");
		if (!body.isEmpty())
		{
			out.add(body);
		}
		out.add("```");
		String document = String.join(newline, out) + newline;
		lineCount = (int) document.lines().count();
		return document;
	}

	@Override
	public int getLineCount()
	{
		return lineCount;
	}

	private static void collectDefinitions(IrNode node, String owner, List<String> out)
	{
		IrKind kind = node.getKind();
		String name = node.getMeta().getName();
		boolean definition = kind == IrKind.FUNCTION || kind == IrKind.PROCEDURE || kind == IrKind.TYPE || kind == IrKind.CLASS;
		if (definition && name != null)
		{
			String qualified = owner == null ? name : owner + "." + name;
			out.add(kind.name() + " `" + qualified + "`");
		}
		String childOwner = kind == IrKind.CLASS && name != null ? name : owner;
		for (IrNode child : node.getChildren())
		{
			collectDefinitions(child, childOwner, out);
		}
		for (IrNode branch : node.getMeta().getAlternate())
		{
			collectDefinitions(branch, childOwner, out);
		}
	}
}
