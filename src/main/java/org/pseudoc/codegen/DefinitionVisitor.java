package org.pseudoc.codegen;

import org.pseudoc.ast.AstScanner;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.Param;
import org.pseudoc.ast.Stmt;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrMeta;
import org.pseudoc.ir.IrNode;
import org.pseudoc.semantic.CallSiteIndex;
import org.pseudoc.semantic.ScopeManager;
import org.pseudoc.semantic.TypeInferrer;
import org.pseudoc.semantic.info.ClassInfo;
import org.pseudoc.semantic.info.FieldInfo;
import org.pseudoc.semantic.info.ParameterInfo;
import org.pseudoc.semantic.symbol.FunctionSymbol;
import org.pseudoc.semantic.symbol.ParameterSymbol;
import org.pseudoc.semantic.symbol.ScopeKind;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts function and class definitions: FUNCTION/PROCEDURE blocks, TYPE records and
 * CLASS blocks with their constructor and methods.
 */
public class DefinitionVisitor
{
	private static final String CONSTRUCTOR = "__init__";

	private final ConversionContext context;
	private final StatementVisitor statements;
	private final ExpressionVisitor expressions;
	private final CallSiteIndex callSites;

	public DefinitionVisitor(ConversionContext context, StatementVisitor statements, ExpressionVisitor expressions,
							 CallSiteIndex callSites)
	{
		this.context = context;
		this.statements = statements;
		this.expressions = expressions;
		this.callSites = callSites;
	}

	// ------------------------------------------------------------------ signatures

	/**
	 * Builds the symbol for a function or method and registers it in the current scope.
	 * Parameter types come from the annotation, the default value, the first call site, the
	 * body's use of the parameter, and finally the fallback type, in that order.
	 */
	public FunctionSymbol declare(Stmt.FunctionDef def, ClassInfo owner)
	{
		TypeInferrer types = context.getTypes();
		List<Param> params = def.params();
		int first = owner != null && !params.isEmpty() ? 1 : 0;

		List<ParameterSymbol> parameters = new ArrayList<>();
		for (int i = first; i < params.size(); i++)
		{
			Param param = params.get(i);
			int position = i - first;
			TypeRef type = parameterType(def, param, position, owner);
			boolean certain = type != null;
			if (param.variadic())
			{
				context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, def.line(),
						"Variadic parameter '" + param.name() + "' of " + def.name() + " is passed as an array");
				type = TypeRef.array(null);
			}
			if (type == null)
			{
				type = types.fallback();
				context.getErrorHandler().logWarning(DiagnosticKind.TYPE_INFERENCE, def.line(),
						"Type of parameter '" + param.name() + "' of " + def.name() + " could not be inferred; using "
								+ context.typeName(type));
			}
			ParameterSymbol symbol = new ParameterSymbol(param.name(), type, position, param.defaultValue() != null, def.line());
			symbol.setCertain(certain);
			symbol.setInitialized(true);
			parameters.add(symbol);
		}

		TypeRef returnType = types.annotationType(def.returns());
		boolean returnsValue = returnsValue(def.body());
		if (returnType != null && returnType.is(DataType.ANY) && def.returns() instanceof Expr.NoneLit)
		{
			returnType = null;
		}
		FunctionSymbol symbol = new FunctionSymbol(def.name(), parameters, returnsValue || returnType != null,
				returnType, def.line());
		context.getScopes().registerFunction(symbol);
		context.trace("Declared " + symbol);
		return symbol;
	}

	private TypeRef parameterType(Stmt.FunctionDef def, Param param, int position, ClassInfo owner)
	{
		TypeInferrer types = context.getTypes();
		if (owner != null && def.name().equals(CONSTRUCTOR))
		{
			for (ParameterInfo info : owner.constructorParameters())
			{
				if (info.name().equals(param.name()))
				{
					return info.type().equals(types.fallback()) ? null : info.type();
				}
			}
		}
		TypeRef annotated = types.annotationType(param.annotation());
		if (annotated != null)
		{
			return annotated;
		}
		TypeRef fromDefault = TypeInferrer.literalType(param.defaultValue());
		if (fromDefault != null && !fromDefault.is(DataType.ANY))
		{
			return fromDefault;
		}
		if (owner == null)
		{
			Optional<TypeRef> fromCall = callSites.argumentType(def.name(), param.name(), position);
			if (fromCall.isPresent())
			{
				return fromCall.get();
			}
		}
		return TypeInferrer.inferParameterType(param.name(), def.body());
	}

	private static boolean returnsValue(List<Stmt> body)
	{
		boolean[] found = new boolean[1];
		new AstScanner()
		{
			@Override
			protected void onStmt(Stmt stmt)
			{
				if (stmt instanceof Stmt.Return ret && ret.value() != null)
				{
					found[0] = true;
					stop();
				}
			}
		}.scan(body);
		return found[0];
	}

	// ------------------------------------------------------------------ functions

	public List<IrNode> convertFunction(Stmt.FunctionDef def)
	{
		FunctionSymbol symbol = context.getScopes().findFunction(def.name())
				.filter(f -> f.getLine() == def.line())
				.orElseGet(() -> declare(def, null));
		return List.of(function(def, symbol, null, def.name(), ""));
	}

	/**
	 * FUNCTION or PROCEDURE block for a definition, with the body converted in its own scope.
	 * Methods get {@code self} bound to an instance of their class.
	 */
	private IrNode function(Stmt.FunctionDef def, FunctionSymbol symbol, String className, String displayName,
							String visibility)
	{
		ScopeManager scopes = context.getScopes();
		List<IrNode> body = new ArrayList<>();
		scopes.enterScope(def.name(), ScopeKind.FUNCTION);
		context.enterFunction(symbol);
		try
		{
			if (className != null && !def.params().isEmpty())
			{
				ParameterSymbol self = new ParameterSymbol(def.params().get(0).name(), TypeRef.instance(className), 0, false, def.line());
				scopes.registerVariable(self);
			}
			for (ParameterSymbol parameter : symbol.getParameters())
			{
				scopes.registerVariable(parameter);
			}
			if (className != null && def.name().equals(CONSTRUCTOR))
			{
				body.addAll(classLevelInitializers(className));
			}
			body.addAll(statements.convertBody(def.body()));
		}
		finally
		{
			context.exitFunction();
			scopes.exitScope();
		}

		List<String> parameters = new ArrayList<>();
		for (ParameterSymbol parameter : symbol.getParameters())
		{
			parameters.add(parameter.getName() + " : " + context.typeName(parameter.getType()));
		}
		String signature = displayName + "(" + String.join(", ", parameters) + ")";

		IrMeta.Builder meta = IrMeta.builder().name(displayName).parameters(parameters).line(def.line());
		if (symbol.returnsValue())
		{
			TypeRef returnType = symbol.getType();
			if (returnType == null)
			{
				returnType = context.getTypes().fallback();
				context.getErrorHandler().logWarning(DiagnosticKind.TYPE_INFERENCE, def.line(),
						"Return type of " + def.name() + " could not be inferred");
			}
			String returnName = context.typeName(returnType);
			meta.returnType(returnName);
			return IrNode.block(IrKind.FUNCTION, visibility + "FUNCTION " + signature + " RETURNS " + returnName, body,
					meta.build());
		}
		return IrNode.block(IrKind.PROCEDURE, visibility + "PROCEDURE " + signature, body, meta.build());
	}

	// ------------------------------------------------------------------ classes

	public List<IrNode> convertClass(Stmt.ClassDef def)
	{
		Optional<ClassInfo> found = context.getClasses().find(def.name());
		if (found.isEmpty() || context.isInClass() || context.currentFunction().isPresent())
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, def.line(),
					"Nested class '" + def.name() + "' is not supported");
			List<IrNode> out = new ArrayList<>();
			out.add(IrNode.leaf(IrKind.COMMENT, "Unsupported: class " + def.name(), def.line()));
			return out;
		}

		ClassInfo info = found.get();
		String previous = context.getCurrentClass();
		context.setCurrentClass(info.name());
		context.getScopes().enterScope(info.name(), ScopeKind.CLASS);
		try
		{
			IrNode node = context.getClasses().isRecord(info.name()) ? record(def, info) : fullClass(def, info);
			return List.of(node);
		}
		finally
		{
			context.getScopes().exitScope();
			context.setCurrentClass(previous);
		}
	}

	private IrNode record(Stmt.ClassDef def, ClassInfo info)
	{
		List<IrNode> children = new ArrayList<>();
		for (Stmt stmt : def.body())
		{
			if (stmt instanceof Stmt.Comment comment)
			{
				children.addAll(statements.convertBody(List.of(comment)));
			}
		}
		for (FieldInfo field : info.fields())
		{
			String type = context.typeName(field.type());
			children.add(new IrNode(IrKind.STATEMENT, "DECLARE " + field.name() + " : " + type, List.of(),
					IrMeta.builder().name(field.name()).dataType(type).line(def.line()).build()));
		}
		String typeName = context.getClasses().typeName(info.name());
		return IrNode.block(IrKind.TYPE, "TYPE " + typeName, children, IrMeta.builder().name(typeName).line(def.line()).build());
	}

	private IrNode fullClass(Stmt.ClassDef def, ClassInfo info)
	{
		String base = info.bases().isEmpty() ? null : info.bases().get(0);
		if (info.bases().size() > 1)
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, def.line(),
					"Multiple inheritance is not supported; " + info.name() + " inherits only from " + base);
		}

		List<IrNode> children = new ArrayList<>();
		for (FieldInfo field : info.fields())
		{
			if (base != null && context.getClasses().findField(base, field.name()).isPresent())
			{
				continue;
			}
			String type = context.typeName(field.type());
			children.add(new IrNode(IrKind.STATEMENT, "PRIVATE " + field.name() + " : " + type, List.of(),
					IrMeta.builder().name(field.name()).dataType(type).line(def.line()).build()));
		}

		List<Stmt.FunctionDef> methods = new ArrayList<>();
		for (Stmt stmt : def.body())
		{
			if (stmt instanceof Stmt.FunctionDef method)
			{
				methods.add(method);
			}
		}
		List<FunctionSymbol> symbols = new ArrayList<>();
		for (Stmt.FunctionDef method : methods)
		{
			symbols.add(declare(method, info));
		}

		if (!info.hasConstructor() && info.hasClassLevelFields())
		{
			List<IrNode> initializers = classLevelInitializers(info.name());
			children.add(IrNode.block(IrKind.PROCEDURE, "PUBLIC PROCEDURE NEW()", initializers,
					IrMeta.builder().name("NEW").parameters(List.of()).line(def.line()).build()));
		}

		int methodIndex = 0;
		for (Stmt stmt : def.body())
		{
			context.setLine(stmt.line());
			if (stmt instanceof Stmt.FunctionDef method)
			{
				FunctionSymbol symbol = symbols.get(methodIndex++);
				children.add(method(method, symbol, info));
			}
			else if (stmt instanceof Stmt.Comment)
			{
				children.addAll(statements.convertBody(List.of(stmt)));
			}
			else if (!isClassLevelField(stmt) && !(stmt instanceof Stmt.Pass))
			{
				context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
						"Statement in class body of " + info.name() + " is not supported");
				children.addAll(statements.convertBody(List.of(stmt)));
			}
		}

		String header = "CLASS " + info.name() + (base != null ? " INHERITS " + base : "");
		return IrNode.block(IrKind.CLASS, header, children,
				IrMeta.builder().name(info.name()).baseClass(base).line(def.line()).build());
	}

	private IrNode method(Stmt.FunctionDef def, FunctionSymbol symbol, ClassInfo owner)
	{
		if (def.name().equals(CONSTRUCTOR))
		{
			if (symbol.returnsValue())
			{
				context.getErrorHandler().logWarning(DiagnosticKind.VALIDATION, def.line(),
						"Constructor of " + owner.name() + " returns a value");
			}
			FunctionSymbol constructor = new FunctionSymbol("NEW", symbol.getParameters(), false, null, def.line());
			return function(def, constructor, owner.name(), "NEW", "PUBLIC ");
		}
		boolean hidden = def.name().startsWith("_") && !def.name().endsWith("__");
		return function(def, symbol, owner.name(), def.name(), hidden ? "PRIVATE " : "PUBLIC ");
	}

	/**
	 * Class-body attributes become private fields set at the start of the constructor.
	 */
	private List<IrNode> classLevelInitializers(String className)
	{
		List<IrNode> out = new ArrayList<>();
		ClassInfo info = context.getClasses().find(className).orElseThrow();
		for (FieldInfo field : info.fields())
		{
			if (field.classLevel() && field.initializer() != null)
			{
				out.add(IrNode.leaf(IrKind.ATTRIBUTE_ASSIGN, field.name() + " ← " + expressions.render(field.initializer()),
						info.line()));
			}
		}
		return out;
	}

	private static boolean isClassLevelField(Stmt stmt)
	{
		return stmt instanceof Stmt.Assign assign && assign.targets().size() == 1 && assign.targets().get(0) instanceof Expr.Name
				|| stmt instanceof Stmt.AnnAssign annotated && annotated.target() instanceof Expr.Name;
	}
}
