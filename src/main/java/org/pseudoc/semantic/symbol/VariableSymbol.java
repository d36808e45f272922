// File: src/main/java/org/pseudoc/semantic/symbol/VariableSymbol.java
package org.pseudoc.semantic.symbol;

import org.pseudoc.semantic.type.TypeRef;

public class VariableSymbol implements Symbol
{
	private final String name;
	private final int line;
	private TypeRef type;
	private String ownerScope;
	private boolean initialized;
	// false when the type is only the fallback guess
	private boolean certain = true;

	// arrays only: declared upper bounds as rendered text, and the number of elements written so far
	private String sizeText;
	private String columnsText;
	private int knownLength = -1;

	public VariableSymbol(String name, TypeRef type, int line)
	{
		this.name = name;
		this.type = type;
		this.line = line;
		this.initialized = true;
	}

	@Override
	public String getName()
	{
		return name;
	}

	@Override
	public TypeRef getType()
	{
		return type;
	}

	public void setType(TypeRef type)
	{
		this.type = type;
	}

	public int getLine()
	{
		return line;
	}

	public String getOwnerScope()
	{
		return ownerScope;
	}

	void setOwnerScope(String ownerScope)
	{
		this.ownerScope = ownerScope;
	}

	public boolean isInitialized()
	{
		return initialized;
	}

	public void setInitialized(boolean initialized)
	{
		this.initialized = initialized;
	}

	public boolean isCertain()
	{
		return certain;
	}

	public void setCertain(boolean certain)
	{
		this.certain = certain;
	}

	public String getSizeText()
	{
		return sizeText;
	}

	public String getColumnsText()
	{
		return columnsText;
	}

	public void setBounds(String sizeText, String columnsText)
	{
		this.sizeText = sizeText;
		this.columnsText = columnsText;
	}

	public int getKnownLength()
	{
		return knownLength;
	}

	public void setKnownLength(int knownLength)
	{
		this.knownLength = knownLength;
	}

	@Override
	public String toString()
	{
		return name + " : " + type;
	}
}
