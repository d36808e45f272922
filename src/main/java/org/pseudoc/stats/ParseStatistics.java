package org.pseudoc.stats;

import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrNode;

import java.util.Set;
import java.util.TreeSet;

/**
 * Counts taken from a finished IR tree.
 */
public record ParseStatistics(
		int lineCount,
		int nodeCount,
		int functionCount,
		int classCount,
		int variableCount,
		long parseTimeMs
)
{
	public static ParseStatistics of(IrNode ir, int lineCount, long parseTimeMs)
	{
		int[] functions = new int[1];
		int[] classes = new int[1];
		Set<String> variables = new TreeSet<>();
		walk(ir, functions, classes, variables);
		return new ParseStatistics(lineCount, ir.countNodes(), functions[0], classes[0], variables.size(), parseTimeMs);
	}

	private static void walk(IrNode node, int[] functions, int[] classes, Set<String> variables)
	{
		IrKind kind = node.getKind();
		if (kind == IrKind.FUNCTION || kind == IrKind.PROCEDURE)
		{
			functions[0]++;
		}
		else if (kind == IrKind.TYPE || kind == IrKind.CLASS)
		{
			classes[0]++;
		}
		else if (kind == IrKind.ASSIGN)
		{
			variables.add(assignedName(node.getText()));
		}
		else if (kind == IrKind.INPUT && node.getText().startsWith("INPUT "))
		{
			variables.add(node.getText().substring("INPUT ".length()).strip());
		}
		else if (kind == IrKind.ARRAY && node.getMeta().getName() != null)
		{
			variables.add(node.getMeta().getName());
		}
		for (IrNode child : node.getChildren())
		{
			walk(child, functions, classes, variables);
		}
		for (IrNode branch : node.getMeta().getAlternate())
		{
			walk(branch, functions, classes, variables);
		}
	}

	private static String assignedName(String text)
	{
		int arrow = text.indexOf('←');
		return (arrow < 0 ? text : text.substring(0, arrow)).strip();
	}
}
