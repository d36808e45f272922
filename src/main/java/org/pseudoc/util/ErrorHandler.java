// File: src/main/java/org/pseudoc/util/ErrorHandler.java
package org.pseudoc.util;

import org.pseudoc.util.Diagnostic.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects diagnostics for one conversion. Nothing here throws: every stage appends and moves on.
 */
public class ErrorHandler
{
	private final List<Diagnostic> errors = new ArrayList<>();
	private final List<Diagnostic> warnings = new ArrayList<>();
	private final int maxErrors;
	private final boolean trace;
	private boolean truncated = false;

	public ErrorHandler()
	{
		this(Integer.MAX_VALUE, false);
	}

	public ErrorHandler(int maxErrors, boolean trace)
	{
		this.maxErrors = maxErrors <= 0 ? Integer.MAX_VALUE : maxErrors;
		this.trace = trace;
	}

	public void logError(DiagnosticKind kind, Integer line, Integer column, String msg)
	{
		if (errors.size() >= maxErrors)
		{
			if (!truncated)
			{
				truncated = true;
				warnings.add(new Diagnostic("Too many errors; further errors suppressed (limit " + maxErrors + ").",
						DiagnosticKind.VALIDATION, line, null, Severity.WARNING));
			}
			return;
		}
		Diagnostic d = new Diagnostic(msg, kind, line, column, Severity.ERROR);
		errors.add(d);
		if (trace)
		{
			Debug.logError(d.format());
		}
	}

	public void logError(DiagnosticKind kind, Integer line, String msg)
	{
		logError(kind, line, null, msg);
	}

	public void logWarning(DiagnosticKind kind, Integer line, Integer column, String msg)
	{
		Diagnostic d = new Diagnostic(msg, kind, line, column, Severity.WARNING);
		warnings.add(d);
		if (trace)
		{
			Debug.logWarning(d.format());
		}
	}

	public void logWarning(DiagnosticKind kind, Integer line, String msg)
	{
		logWarning(kind, line, null, msg);
	}

	public boolean hasErrors()
	{
		return !errors.isEmpty();
	}

	public boolean isTruncated()
	{
		return truncated;
	}

	public List<Diagnostic> getErrors()
	{
		return Collections.unmodifiableList(errors);
	}

	public List<Diagnostic> getWarnings()
	{
		return Collections.unmodifiableList(warnings);
	}
}
