package org.pseudoc;

import org.pseudoc.ir.IrNode;
import org.pseudoc.stats.ConversionStatistics;
import org.pseudoc.util.Diagnostic;

import java.util.ArrayList;
import java.util.List;

/**
 * Output of a full conversion. Parse and render diagnostics are kept apart.
 */
public record ConversionResult(ParseResult parse, RenderResult render, ConversionStatistics statistics)
{
	public String code()
	{
		return render.code();
	}

	public IrNode ir()
	{
		return parse.ir();
	}

	public List<Diagnostic> errors()
	{
		List<Diagnostic> all = new ArrayList<>(parse.errors());
		all.addAll(render.errors());
		return all;
	}

	public List<Diagnostic> warnings()
	{
		List<Diagnostic> all = new ArrayList<>(parse.warnings());
		all.addAll(render.warnings());
		return all;
	}

	public boolean hasErrors()
	{
		return parse.hasErrors() || render.hasErrors();
	}
}
