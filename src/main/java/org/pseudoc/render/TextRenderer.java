package org.pseudoc.render;

import org.pseudoc.config.RenderOptions;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrNode;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Plain pseudocode output: one line per statement, one indentation unit per nesting level,
 * closing keywords decided by the node kind.
 */
public class TextRenderer extends Renderer
{
	private static final String COMMENT_PREFIX = "// ";

	private final TextFormatter formatter;
	private final String indentUnit;
	private final List<String> lines = new ArrayList<>();

	public TextRenderer(RenderOptions options, ErrorHandler errorHandler)
	{
		super(options, errorHandler);
		this.formatter = new TextFormatter(options);
		this.indentUnit = String.valueOf(options.getIndentChar().getCharacter())
				.repeat(Math.max(0, options.getIndentSize()));
	}

	@Override
	public String render(IrNode root)
	{
		lines.clear();
		if (root != null)
		{
			emit(root, 0);
		}
		List<String> finished = new ArrayList<>();
		int width = Integer.toString(lines.size()).length();
		for (int i = 0; i < lines.size(); i++)
		{
			String line = lines.get(i);
			if (options.getMaxLineLength() > 0 && line.length() > options.getMaxLineLength())
			{
				errorHandler.logWarning(DiagnosticKind.LONG_LINE, i + 1,
						"Line is " + line.length() + " characters long (limit " + options.getMaxLineLength() + ")");
			}
			if (options.isIncludeLineNumbers())
			{
				line = String.format("%" + width + "d  %s", i + 1, line);
			}
			finished.add(line);
		}
		return String.join(options.getLineEnding().getSequence(), finished);
	}

	@Override
	public int getLineCount()
	{
		return lines.size();
	}

	private void emit(IrNode node, int level)
	{
		switch (node.getKind())
		{
			case MODULE, BLOCK, COMPOUND -> emitAll(node.getChildren(), level);
			case COMMENT -> emitComment(node, level);
			case IF -> emitIf(node, level);
			case FOR -> emitFor(node, level);
			case WHILE -> emitTerminated(node, level, IrKind.ENDWHILE);
			case REPEAT -> emitTerminated(node, level, IrKind.UNTIL);
			default -> emitBlock(node, level);
		}
	}

	private void emitAll(List<IrNode> nodes, int level)
	{
		for (IrNode child : coalesceComments(nodes))
		{
			emit(child, level);
		}
	}

	private void emitComment(IrNode node, int level)
	{
		if (!options.isIncludeComments())
		{
			return;
		}
		for (String part : node.getText().split("\n", -1))
		{
			String text = part.strip();
			add(level, text.isEmpty() ? "//" : COMMENT_PREFIX + text);
		}
	}

	private void emitIf(IrNode node, int level)
	{
		line(node, level);
		emitAll(node.getChildren(), level + 1);
		for (IrNode alternate : node.getMeta().getAlternate())
		{
			if (alternate.getKind() != IrKind.ELSEIF && alternate.getKind() != IrKind.ELSE)
			{
				malformed(node, "IF alternate of kind " + alternate.getKind() + " rendered as ELSE");
			}
			line(alternate, level);
			emitAll(alternate.getChildren(), level + 1);
		}
		add(level, formatter.format(IrKind.IF.getClosingKeyword()));
	}

	private void emitFor(IrNode node, int level)
	{
		line(node, level);
		emitAll(node.getChildren(), level + 1);
		String variable = node.getMeta().getLoopVariable();
		if (variable == null || variable.isEmpty())
		{
			malformed(node, "FOR loop without a loop variable");
			add(level, formatter.format("NEXT"));
			return;
		}
		add(level, formatter.format("NEXT " + variable));
	}

	/**
	 * WHILE and REPEAT carry their terminator as the last child; it is rendered at the level
	 * of the opening line.
	 */
	private void emitTerminated(IrNode node, int level, IrKind terminator)
	{
		line(node, level);
		List<IrNode> children = node.getChildren();
		IrNode last = children.isEmpty() ? null : children.get(children.size() - 1);
		if (last == null || last.getKind() != terminator)
		{
			malformed(node, node.getKind() + " without " + terminator);
			emitAll(children, level + 1);
			add(level, formatter.format(terminator == IrKind.ENDWHILE ? "ENDWHILE" : "UNTIL TRUE"));
			return;
		}
		emitAll(children.subList(0, children.size() - 1), level + 1);
		line(last, level);
	}

	private void emitBlock(IrNode node, int level)
	{
		line(node, level);
		emitAll(node.getChildren(), level + 1);
		String closing = node.getKind().getClosingKeyword();
		if (closing != null)
		{
			add(level, formatter.format(closing));
		}
	}

	private void line(IrNode node, int level)
	{
		String text = node.getText();
		if (text.isEmpty())
		{
			if (node.getKind().requiresText())
			{
				malformed(node, node.getKind() + " node without text");
			}
			text = fallbackText(node.getKind());
		}
		add(level, formatter.format(text));
	}

	private static String fallbackText(IrKind kind)
	{
		return switch (kind)
		{
			case IF -> "IF TRUE THEN";
			case ELSEIF -> "ELSE IF TRUE THEN";
			case WHILE -> "WHILE TRUE";
			case UNTIL -> "UNTIL TRUE";
			case RETURN -> "RETURN";
			default -> kind.name();
		};
	}

	private void malformed(IrNode node, String message)
	{
		errorHandler.logWarning(DiagnosticKind.CONVERSION, node.getMeta().getLine(), message);
	}

	private void add(int level, String text)
	{
		lines.add(indentUnit.repeat(level) + text);
	}
}
