// File: src/main/java/org/pseudoc/semantic/symbol/ParameterSymbol.java
package org.pseudoc.semantic.symbol;

import org.pseudoc.semantic.type.TypeRef;

public class ParameterSymbol extends VariableSymbol
{
	private final int position;
	private final boolean hasDefaultValue;

	public ParameterSymbol(String name, TypeRef type, int position, boolean hasDefaultValue, int line)
	{
		super(name, type, line);
		this.position = position;
		this.hasDefaultValue = hasDefaultValue;
	}

	public int getPosition()
	{
		return position;
	}

	public boolean hasDefaultValue()
	{
		return hasDefaultValue;
	}
}
