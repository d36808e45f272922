// File: src/main/java/org/pseudoc/semantic/symbol/FunctionSymbol.java
package org.pseudoc.semantic.symbol;

import org.pseudoc.semantic.type.TypeRef;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A function or procedure. A function without a recorded return type yet (its first valued
 * return has not been visited) still counts as a function when {@link #returnsValue()} is set.
 */
public class FunctionSymbol implements Symbol
{
	private final String name;
	private final int line;
	private final boolean returnsValue;
	private final List<ParameterSymbol> parameters;
	private TypeRef returnType;

	public FunctionSymbol(String name, List<ParameterSymbol> parameters, boolean returnsValue, TypeRef returnType, int line)
	{
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.returnsValue = returnsValue;
		this.returnType = returnType;
		this.line = line;
	}

	@Override
	public String getName()
	{
		return name;
	}

	/**
	 * Recorded return type, or null for procedures and for functions whose return type is not known yet.
	 */
	@Override
	public TypeRef getType()
	{
		return returnType;
	}

	public void setReturnType(TypeRef returnType)
	{
		this.returnType = returnType;
	}

	public boolean returnsValue()
	{
		return returnsValue;
	}

	public List<ParameterSymbol> getParameters()
	{
		return parameters;
	}

	public int getLine()
	{
		return line;
	}

	@Override
	public String toString()
	{
		String params = parameters.stream()
				.map(p -> p.getName() + " : " + p.getType())
				.collect(Collectors.joining(", "));
		return (returnsValue ? "FUNCTION " : "PROCEDURE ") + name + "(" + params + ")"
				+ (returnType != null ? " RETURNS " + returnType : "");
	}
}
