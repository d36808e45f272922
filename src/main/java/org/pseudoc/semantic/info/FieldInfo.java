package org.pseudoc.semantic.info;

import org.pseudoc.ast.Expr;
import org.pseudoc.semantic.type.TypeRef;

/**
 * A field of a user class.
 *
 * @param sourceParameter constructor parameter copied into the field, or null
 * @param initializer     value assigned to the field when it is not a plain parameter copy, or null
 * @param classLevel      declared in the class body rather than in the constructor
 */
public record FieldInfo(
		String name,
		String sourceParameter,
		TypeRef type,
		Expr initializer,
		boolean classLevel
)
{
}
