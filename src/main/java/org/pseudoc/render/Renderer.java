package org.pseudoc.render;

import org.pseudoc.config.RenderOptions;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrNode;
import org.pseudoc.util.ErrorHandler;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes an IR tree to text. Implementations never throw for malformed IR; they report a
 * CONVERSION warning and emit a best-effort line instead.
 */
public abstract class Renderer
{
	protected final RenderOptions options;
	protected final ErrorHandler errorHandler;

	protected Renderer(RenderOptions options, ErrorHandler errorHandler)
	{
		this.options = options;
		this.errorHandler = errorHandler;
	}

	public abstract String render(IrNode root);

	/**
	 * Number of output lines of the last {@link #render} call.
	 */
	public abstract int getLineCount();

	/**
	 * Merges runs of consecutive COMMENT siblings into one node whose text holds one comment
	 * per line. Other nodes are returned unchanged.
	 */
	public static List<IrNode> coalesceComments(List<IrNode> nodes)
	{
		List<IrNode> out = new ArrayList<>();
		StringBuilder pending = null;
		int pendingLine = 0;
		for (IrNode node : nodes)
		{
			if (node.getKind() == IrKind.COMMENT)
			{
				if (pending == null)
				{
					pending = new StringBuilder(node.getText());
					Integer line = node.getMeta().getLine();
					pendingLine = line == null ? 0 : line;
				}
				else
				{
					pending.append('\n').append(node.getText());
				}
				continue;
			}
			if (pending != null)
			{
				out.add(IrNode.leaf(IrKind.COMMENT, pending.toString(), pendingLine));
				pending = null;
			}
			out.add(node);
		}
		if (pending != null)
		{
			out.add(IrNode.leaf(IrKind.COMMENT, pending.toString(), pendingLine));
		}
		return out;
	}
}
