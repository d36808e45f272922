package org.pseudoc.ir;

import java.util.List;

/**
 * Immutable IR node. {@code text} is the node's own rendered line (possibly empty for pure
 * containers); {@code children} is the nested body.
 */
public final class IrNode
{
	private final IrKind kind;
	private final String text;
	private final List<IrNode> children;
	private final IrMeta meta;

	public IrNode(IrKind kind, String text, List<IrNode> children, IrMeta meta)
	{
		this.kind = kind;
		this.text = text == null ? "" : text;
		this.children = List.copyOf(children);
		this.meta = meta == null ? IrMeta.EMPTY : meta;
	}

	public static IrNode leaf(IrKind kind, String text, int line)
	{
		return new IrNode(kind, text, List.of(), IrMeta.atLine(line));
	}

	public static IrNode block(IrKind kind, String text, List<IrNode> children, IrMeta meta)
	{
		return new IrNode(kind, text, children, meta);
	}

	public static IrNode module(List<IrNode> children)
	{
		return new IrNode(IrKind.MODULE, "", children, IrMeta.EMPTY);
	}

	public IrKind getKind()
	{
		return kind;
	}

	public String getText()
	{
		return text;
	}

	public List<IrNode> getChildren()
	{
		return children;
	}

	public IrMeta getMeta()
	{
		return meta;
	}

	/**
	 * This node plus all descendants, including IF alternates.
	 */
	public int countNodes()
	{
		int count = 1;
		for (IrNode child : children)
		{
			count += child.countNodes();
		}
		for (IrNode branch : meta.getAlternate())
		{
			count += branch.countNodes();
		}
		return count;
	}

	@Override
	public String toString()
	{
		return kind + (text.isEmpty() ? "" : " '" + text + "'") + (children.isEmpty() ? "" : " [" + children.size() + "]");
	}
}
