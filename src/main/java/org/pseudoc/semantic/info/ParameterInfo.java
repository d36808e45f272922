package org.pseudoc.semantic.info;

import org.pseudoc.ast.Expr;
import org.pseudoc.semantic.type.TypeRef;

/**
 * A constructor parameter (without {@code self}) with the type it was given before the main walk.
 * The default value may be null.
 */
public record ParameterInfo(String name, TypeRef type, Expr defaultValue)
{
	public boolean hasDefaultValue()
	{
		return defaultValue != null;
	}
}
