package org.pseudoc.semantic;

import org.pseudoc.semantic.symbol.FunctionSymbol;
import org.pseudoc.semantic.symbol.Scope;
import org.pseudoc.semantic.symbol.ScopeKind;
import org.pseudoc.semantic.symbol.VariableSymbol;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.Optional;

/**
 * Stack of lexical scopes for one conversion. Registrations go to the current scope only;
 * lookups walk outward to the global scope.
 */
public class ScopeManager
{
	public static final int DEFAULT_MAX_DEPTH = 50;

	private final ErrorHandler errorHandler;
	private final int maxDepth;
	private final Scope globalScope = new Scope("global", ScopeKind.GLOBAL, null);
	private Scope currentScope = globalScope;
	private boolean depthReported = false;

	public ScopeManager(ErrorHandler errorHandler, int maxDepth)
	{
		this.errorHandler = errorHandler;
		this.maxDepth = maxDepth > 0 ? maxDepth : DEFAULT_MAX_DEPTH;
	}

	public Scope enterScope(String name, ScopeKind kind)
	{
		currentScope = new Scope(name, kind, currentScope);
		if (currentScope.getDepth() > maxDepth && !depthReported)
		{
			depthReported = true;
			errorHandler.logError(DiagnosticKind.VALIDATION, null,
					"Maximum nesting depth of " + maxDepth + " exceeded in '" + name + "'");
		}
		return currentScope;
	}

	public void exitScope()
	{
		if (currentScope == globalScope)
		{
			errorHandler.logError(DiagnosticKind.VALIDATION, null, "Attempted to exit the global scope");
			return;
		}
		currentScope = currentScope.getEnclosingScope();
	}

	public void registerVariable(VariableSymbol variable)
	{
		currentScope.defineVariable(variable);
	}

	/**
	 * Registers an assigned variable in the nearest function, class or global scope.
	 */
	public void registerAssigned(VariableSymbol variable)
	{
		getDeclaringScope().defineVariable(variable);
	}

	public void registerFunction(FunctionSymbol function)
	{
		currentScope.defineFunction(function);
	}

	public Optional<VariableSymbol> findVariable(String name)
	{
		return currentScope.resolveVariable(name);
	}

	public Optional<FunctionSymbol> findFunction(String name)
	{
		return currentScope.resolveFunction(name);
	}

	public boolean isDefinedLocally(String name)
	{
		return currentScope.resolveVariableLocally(name).isPresent();
	}

	/**
	 * Nearest enclosing function or class scope, or the global scope. Assignments inside loops
	 * and blocks register here since the source language has no block scoping.
	 */
	public Scope getDeclaringScope()
	{
		Scope scope = currentScope;
		while (scope.getKind() != ScopeKind.FUNCTION && scope.getKind() != ScopeKind.CLASS
				&& scope.getEnclosingScope() != null)
		{
			scope = scope.getEnclosingScope();
		}
		return scope;
	}

	public Scope getCurrentScope()
	{
		return currentScope;
	}

	public Scope getGlobalScope()
	{
		return globalScope;
	}

	public int getDepth()
	{
		return currentScope.getDepth();
	}
}
