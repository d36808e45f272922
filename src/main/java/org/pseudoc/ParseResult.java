package org.pseudoc;

import org.pseudoc.ir.IrNode;
import org.pseudoc.stats.ParseStatistics;
import org.pseudoc.util.Diagnostic;

import java.util.List;

public record ParseResult(IrNode ir, List<Diagnostic> errors, List<Diagnostic> warnings, ParseStatistics statistics)
{
	public ParseResult
	{
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}
}
