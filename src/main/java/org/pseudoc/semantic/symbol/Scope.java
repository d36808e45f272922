// File: src/main/java/org/pseudoc/semantic/symbol/Scope.java
package org.pseudoc.semantic.symbol;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One lexical scope. Variables and functions live in separate maps; resolution walks the
 * enclosing chain and returns the first match, so inner definitions shadow outer ones.
 */
public class Scope
{
	private final String name;
	private final ScopeKind kind;
	private final Scope enclosingScope;
	private final int depth;
	private final Map<String, VariableSymbol> variables = new LinkedHashMap<>();
	private final Map<String, FunctionSymbol> functions = new LinkedHashMap<>();

	public Scope(String name, ScopeKind kind, Scope enclosingScope)
	{
		this.name = name;
		this.kind = kind;
		this.enclosingScope = enclosingScope;
		this.depth = enclosingScope == null ? 0 : enclosingScope.depth + 1;
	}

	public void defineVariable(VariableSymbol sym)
	{
		sym.setOwnerScope(name);
		variables.put(sym.getName(), sym);
	}

	public void defineFunction(FunctionSymbol sym)
	{
		functions.put(sym.getName(), sym);
	}

	public Optional<VariableSymbol> resolveVariable(String name)
	{
		VariableSymbol local = variables.get(name);
		if (local != null)
		{
			return Optional.of(local);
		}
		if (enclosingScope != null)
		{
			return enclosingScope.resolveVariable(name);
		}
		return Optional.empty();
	}

	public Optional<VariableSymbol> resolveVariableLocally(String name)
	{
		return Optional.ofNullable(variables.get(name));
	}

	public Optional<FunctionSymbol> resolveFunction(String name)
	{
		FunctionSymbol local = functions.get(name);
		if (local != null)
		{
			return Optional.of(local);
		}
		if (enclosingScope != null)
		{
			return enclosingScope.resolveFunction(name);
		}
		return Optional.empty();
	}

	public String getName()
	{
		return name;
	}

	public ScopeKind getKind()
	{
		return kind;
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public int getDepth()
	{
		return depth;
	}
}
