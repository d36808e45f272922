package org.pseudoc.ast;

import java.util.List;

/**
 * Root of the statement tree for one source unit.
 */
public record ModuleNode(List<Stmt> body, int lineCount)
{
	public ModuleNode
	{
		body = List.copyOf(body);
	}
}
