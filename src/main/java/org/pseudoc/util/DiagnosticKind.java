package org.pseudoc.util;

public enum DiagnosticKind
{
	SYNTAX("Syntax Error"),
	TYPE("Type Error"),
	NAME("Name Error"),
	UNSUPPORTED_FEATURE("Unsupported Feature"),
	CONVERSION("Conversion Error"),
	VALIDATION("Validation Error"),

	// warning-only categories
	TYPE_INFERENCE("Type Inference"),
	STYLE("Style"),
	LONG_LINE("Long Line"),
	PERFORMANCE_HINT("Performance");

	private final String label;

	DiagnosticKind(String label)
	{
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}
}
