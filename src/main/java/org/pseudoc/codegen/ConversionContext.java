package org.pseudoc.codegen;

import org.pseudoc.config.ParseOptions;
import org.pseudoc.semantic.ClassRegistry;
import org.pseudoc.semantic.ScopeManager;
import org.pseudoc.semantic.TypeInferrer;
import org.pseudoc.semantic.symbol.FunctionSymbol;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.Debug;
import org.pseudoc.util.ErrorHandler;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.Stack;

/**
 * Everything one conversion needs, created once per parse and passed to every visitor.
 * Nothing here outlives the call that created it.
 */
public class ConversionContext
{
	private final ParseOptions options;
	private final ErrorHandler errorHandler;
	private final ScopeManager scopes;
	private final ClassRegistry classes;
	private final TypeInferrer types;
	private final Map<String, TypeRef> appendedTypes;

	// loop variable -> rendered element reference, innermost loop last
	private final Stack<Map<String, String>> substitutions = new Stack<>();
	private final Stack<FunctionFrame> functions = new Stack<>();
	private final Set<String> reportedNames = new HashSet<>();
	private String currentClass;
	private int loopDepth = 0;
	private int line = 0;

	public ConversionContext(ParseOptions options, ErrorHandler errorHandler, ScopeManager scopes,
							 ClassRegistry classes, TypeInferrer types, Map<String, TypeRef> appendedTypes)
	{
		this.options = options;
		this.errorHandler = errorHandler;
		this.scopes = scopes;
		this.classes = classes;
		this.types = types;
		this.appendedTypes = appendedTypes;
	}

	public ParseOptions getOptions()
	{
		return options;
	}

	public ErrorHandler getErrorHandler()
	{
		return errorHandler;
	}

	public ScopeManager getScopes()
	{
		return scopes;
	}

	public ClassRegistry getClasses()
	{
		return classes;
	}

	public TypeInferrer getTypes()
	{
		return types;
	}

	public void trace(String message)
	{
		Debug.trace(options.isDebug(), message);
	}

	// ------------------------------------------------------------------ source position

	public int getLine()
	{
		return line;
	}

	public void setLine(int line)
	{
		this.line = line;
	}

	// ------------------------------------------------------------------ type names

	/**
	 * Pseudocode spelling of a type: user classes by their record or class name, arrays as
	 * {@code ARRAY OF T}, unknown types by the fallback.
	 */
	public String typeName(TypeRef type)
	{
		if (type == null)
		{
			return typeName(types.fallback());
		}
		if (type.isInstance())
		{
			return classes.typeName(type.className());
		}
		if (type.is(DataType.ARRAY))
		{
			return "ARRAY OF " + elementTypeName(type);
		}
		return type.type().name();
	}

	/**
	 * Element type name for an array declaration.
	 */
	public String elementTypeName(TypeRef arrayType)
	{
		TypeRef element = arrayType == null ? null : arrayType.element();
		if (element == null || element.is(DataType.ANY) && !options.isStrictTypes())
		{
			return typeName(types.fallback());
		}
		return typeName(element);
	}

	public Optional<TypeRef> appendedType(String listName)
	{
		return Optional.ofNullable(appendedTypes.get(listName));
	}

	// ------------------------------------------------------------------ loop substitution

	public void pushSubstitution(String variable, String replacement)
	{
		Map<String, String> frame = new HashMap<>();
		frame.put(variable, replacement);
		substitutions.push(frame);
	}

	public void popSubstitution()
	{
		substitutions.pop();
	}

	public Optional<String> substitution(String variable)
	{
		for (int i = substitutions.size() - 1; i >= 0; i--)
		{
			String replacement = substitutions.get(i).get(variable);
			if (replacement != null)
			{
				return Optional.of(replacement);
			}
		}
		return Optional.empty();
	}

	public void enterLoop()
	{
		loopDepth++;
	}

	public void exitLoop()
	{
		loopDepth--;
	}

	public boolean isInLoop()
	{
		return loopDepth > 0;
	}

	// ------------------------------------------------------------------ classes and functions

	public String getCurrentClass()
	{
		return currentClass;
	}

	public void setCurrentClass(String currentClass)
	{
		this.currentClass = currentClass;
	}

	public boolean isInClass()
	{
		return currentClass != null;
	}

	public void enterFunction(FunctionSymbol symbol)
	{
		functions.push(new FunctionFrame(symbol));
	}

	public void exitFunction()
	{
		functions.pop();
	}

	public Optional<FunctionFrame> currentFunction()
	{
		return functions.isEmpty() ? Optional.empty() : Optional.of(functions.peek());
	}

	/**
	 * True the first time a name is reported, so each unresolved name warns once.
	 */
	public boolean markReported(String name)
	{
		return reportedNames.add(name);
	}

	/**
	 * The function whose body is being converted. Its return type is the type of the first
	 * valued {@code return} met in source order.
	 */
	public static final class FunctionFrame
	{
		private final FunctionSymbol symbol;
		private TypeRef returnType;

		FunctionFrame(FunctionSymbol symbol)
		{
			this.symbol = symbol;
		}

		public void recordReturn(TypeRef type)
		{
			if (returnType == null)
			{
				returnType = type;
				if (symbol.getType() == null)
				{
					symbol.setReturnType(type);
				}
			}
		}
	}
}
