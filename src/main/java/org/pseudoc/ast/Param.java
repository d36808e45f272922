package org.pseudoc.ast;

/**
 * A function parameter. Annotation and default value may be null.
 */
public record Param(String name, Expr annotation, Expr defaultValue, boolean variadic)
{
	public Param(String name)
	{
		this(name, null, null, false);
	}
}
