package org.pseudoc;

import org.pseudoc.stats.RenderStatistics;
import org.pseudoc.util.Diagnostic;

import java.util.List;

public record RenderResult(String code, List<Diagnostic> errors, List<Diagnostic> warnings, RenderStatistics statistics)
{
	public RenderResult
	{
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}
}
