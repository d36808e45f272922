package org.pseudoc.codegen;

import org.pseudoc.ast.AstScanner;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.Stmt;
import org.pseudoc.ast.StmtVisitor;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrMeta;
import org.pseudoc.ir.IrNode;
import org.pseudoc.semantic.CallSiteIndex;
import org.pseudoc.semantic.ScopeManager;
import org.pseudoc.semantic.TypeInferrer;
import org.pseudoc.semantic.info.ClassInfo;
import org.pseudoc.semantic.info.FieldInfo;
import org.pseudoc.semantic.info.ParameterInfo;
import org.pseudoc.semantic.symbol.ScopeKind;
import org.pseudoc.semantic.symbol.VariableSymbol;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.DiagnosticKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts statements into IR nodes. One source statement may become several nodes
 * (declaration plus assignments, prompt plus input), so every visit returns a list.
 */
public class StatementVisitor implements StmtVisitor<List<IrNode>>
{
	private static final List<String> INDEX_NAMES = List.of("i", "j", "k", "idx");

	private final ConversionContext context;
	private final ExpressionVisitor expressions;
	private final DefinitionVisitor definitions;
	private final Set<String> temporaries = new HashSet<>();

	public StatementVisitor(ConversionContext context, CallSiteIndex callSites)
	{
		this.context = context;
		this.expressions = new ExpressionVisitor(context);
		this.definitions = new DefinitionVisitor(context, this, expressions, callSites);
	}

	public DefinitionVisitor getDefinitions()
	{
		return definitions;
	}

	public List<IrNode> convertBody(List<Stmt> body)
	{
		List<IrNode> out = new ArrayList<>();
		for (Stmt stmt : body)
		{
			context.setLine(stmt.line());
			Optional<Expr> unsupported = unsupportedExpression(stmt);
			if (unsupported.isPresent())
			{
				out.add(unsupportedPlaceholder(stmt, unsupported.get()));
				continue;
			}
			out.addAll(stmt.accept(this));
		}
		return out;
	}

	/**
	 * First expression in a simple statement that has no pseudocode form. Compound statements
	 * are not replaced so their bodies still convert.
	 */
	private static Optional<Expr> unsupportedExpression(Stmt stmt)
	{
		if (!(stmt instanceof Stmt.Assign || stmt instanceof Stmt.AugAssign || stmt instanceof Stmt.AnnAssign
				|| stmt instanceof Stmt.ExprStmt || stmt instanceof Stmt.Return))
		{
			return Optional.empty();
		}
		List<Expr> found = new ArrayList<>(1);
		new AstScanner()
		{
			@Override
			protected void onExpr(Expr expr)
			{
				if (expr instanceof Expr.Unsupported || expr instanceof Expr.Conditional)
				{
					found.add(expr);
					stop();
				}
			}
		}.scan(stmt);
		return found.stream().findFirst();
	}

	private IrNode unsupportedPlaceholder(Stmt stmt, Expr expr)
	{
		String description;
		String text;
		if (expr instanceof Expr.Unsupported unsupported)
		{
			description = unsupported.description();
			text = unsupported.text();
		}
		else
		{
			description = "conditional expression";
			text = ((Expr.Conditional) expr).text();
		}
		context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
				"Unsupported expression (" + description + "): " + text);

		// assigned names stay known so later statements do not report them as undefined
		if (stmt instanceof Stmt.Assign assign)
		{
			for (Expr target : assign.targets())
			{
				if (target instanceof Expr.Name name && context.getScopes().findVariable(name.id()).isEmpty())
				{
					register(name.id(), types().infer(assign.value()), false, stmt.line());
				}
			}
		}
		return IrNode.leaf(IrKind.COMMENT, "Unsupported: " + text, stmt.line());
	}

	/**
	 * Converts a nested body inside its own block scope.
	 */
	private List<IrNode> convertScoped(List<Stmt> body, String name, ScopeKind kind)
	{
		ScopeManager scopes = context.getScopes();
		scopes.enterScope(name, kind);
		try
		{
			return convertBody(body);
		}
		finally
		{
			scopes.exitScope();
		}
	}

	private String render(Expr expr)
	{
		return expressions.render(expr);
	}

	private TypeInferrer types()
	{
		return context.getTypes();
	}

	// ------------------------------------------------------------------ simple statements

	@Override
	public List<IrNode> visitComment(Stmt.Comment stmt)
	{
		if (!context.getOptions().isIncludeComments())
		{
			return List.of();
		}
		return List.of(IrNode.leaf(IrKind.COMMENT, stmt.text(), stmt.line()));
	}

	@Override
	public List<IrNode> visitPass(Stmt.Pass stmt)
	{
		return List.of();
	}

	@Override
	public List<IrNode> visitBreak(Stmt.Break stmt)
	{
		if (!context.isInLoop())
		{
			context.getErrorHandler().logError(DiagnosticKind.SYNTAX, stmt.line(), "'break' outside a loop");
		}
		else
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
					"'break' has no direct pseudocode equivalent; consider a conditional loop");
		}
		return List.of(IrNode.leaf(IrKind.BREAK, "BREAK", stmt.line()));
	}

	@Override
	public List<IrNode> visitContinue(Stmt.Continue stmt)
	{
		context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
				"'continue' has no pseudocode equivalent and was left as a comment");
		return List.of(IrNode.leaf(IrKind.COMMENT, "continue", stmt.line()));
	}

	@Override
	public List<IrNode> visitReturn(Stmt.Return stmt)
	{
		Optional<ConversionContext.FunctionFrame> frame = context.currentFunction();
		if (frame.isEmpty())
		{
			context.getErrorHandler().logWarning(DiagnosticKind.VALIDATION, stmt.line(), "'return' outside a function");
		}
		if (stmt.value() == null)
		{
			return List.of(IrNode.leaf(IrKind.RETURN, "RETURN", stmt.line()));
		}
		String value = render(stmt.value());
		frame.ifPresent(f -> f.recordReturn(types().infer(stmt.value())));
		return List.of(IrNode.leaf(IrKind.RETURN, "RETURN " + value, stmt.line()));
	}

	@Override
	public List<IrNode> visitUnsupported(Stmt.Unsupported stmt)
	{
		context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
				"'" + stmt.keyword() + "' is not supported in pseudocode: " + stmt.text());
		List<IrNode> out = new ArrayList<>();
		out.add(IrNode.leaf(IrKind.COMMENT, "Unsupported: " + stmt.text(), stmt.line()));
		out.addAll(convertBody(stmt.body()));
		return out;
	}

	@Override
	public List<IrNode> visitUnknown(Stmt.Unknown stmt)
	{
		return List.of(IrNode.leaf(IrKind.COMMENT, "Could not convert: " + stmt.text(), stmt.line()));
	}

	@Override
	public List<IrNode> visitFunctionDef(Stmt.FunctionDef stmt)
	{
		return definitions.convertFunction(stmt);
	}

	@Override
	public List<IrNode> visitClassDef(Stmt.ClassDef stmt)
	{
		return definitions.convertClass(stmt);
	}

	// ------------------------------------------------------------------ expression statements

	@Override
	public List<IrNode> visitExprStmt(Stmt.ExprStmt stmt)
	{
		int line = stmt.line();
		if (!(stmt.value() instanceof Expr.Call call))
		{
			context.getErrorHandler().logWarning(DiagnosticKind.STYLE, line, "Expression result is not used");
			return List.of(IrNode.leaf(IrKind.EXPRESSION, render(stmt.value()), line));
		}

		String callee = call.calleeName();
		boolean userFunction = callee != null && context.getScopes().findFunction(callee).isPresent();
		if (!userFunction && "print".equals(callee))
		{
			return List.of(output(call, line));
		}
		if (!userFunction && "input".equals(callee))
		{
			List<IrNode> out = new ArrayList<>(prompt(call, line));
			out.add(IrNode.leaf(IrKind.INPUT, "INPUT", line));
			return out;
		}
		if (userFunction)
		{
			return List.of(IrNode.leaf(IrKind.STATEMENT, "CALL " + render(call), line));
		}
		if (call.func() instanceof Expr.Attribute method)
		{
			return methodStatement(call, method, line);
		}
		return List.of(IrNode.leaf(IrKind.EXPRESSION, render(call), line));
	}

	private IrNode output(Expr.Call print, int line)
	{
		List<String> parts = new ArrayList<>();
		for (Expr arg : print.args())
		{
			parts.add(render(arg));
		}
		String text = parts.isEmpty() ? "OUTPUT \"\"" : "OUTPUT " + String.join(", ", parts);
		return IrNode.leaf(IrKind.OUTPUT, text, line);
	}

	private List<IrNode> prompt(Expr.Call input, int line)
	{
		if (input.args().isEmpty())
		{
			return List.of();
		}
		return List.of(IrNode.leaf(IrKind.OUTPUT, "OUTPUT " + render(input.args().get(0)), line));
	}

	private List<IrNode> methodStatement(Expr.Call call, Expr.Attribute method, int line)
	{
		Expr receiver = method.value();
		if (receiver instanceof Expr.Call inner && "super".equals(inner.calleeName()))
		{
			return List.of(IrNode.leaf(IrKind.STATEMENT, render(call), line));
		}

		TypeRef receiverType = types().infer(receiver);
		if (receiverType.is(DataType.ARRAY) && method.attr().equals("append") && call.args().size() == 1)
		{
			return List.of(append(receiver, call.args().get(0), line));
		}
		if (receiverType.is(DataType.ARRAY))
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, line,
					"List method '" + method.attr() + "' has no pseudocode equivalent");
			return List.of(IrNode.leaf(IrKind.STATEMENT, render(call), line));
		}

		boolean onSelf = context.isInClass() && receiver instanceof Expr.Name self && self.id().equals("self");
		boolean userMethod = onSelf || receiverType.isInstance()
				&& context.getClasses().hasMethod(receiverType.className(), method.attr());
		if (userMethod)
		{
			return List.of(IrNode.leaf(IrKind.STATEMENT, "CALL " + render(call), line));
		}
		if (TypeInferrer.isStringMethod(method.attr()) || isModule(receiver))
		{
			return List.of(IrNode.leaf(IrKind.EXPRESSION, render(call), line));
		}
		return List.of(IrNode.leaf(IrKind.STATEMENT, "CALL " + render(call), line));
	}

	private boolean isModule(Expr receiver)
	{
		return receiver instanceof Expr.Name name && (name.id().equals("math") || name.id().equals("random"))
				&& context.getScopes().findVariable(name.id()).isEmpty();
	}

	/**
	 * {@code a.append(x)} stores into the next free slot. Outside loops the slot number is
	 * known from the assignments seen so far.
	 */
	private IrNode append(Expr receiver, Expr value, int line)
	{
		String base = render(receiver);
		Optional<VariableSymbol> symbol = receiver instanceof Expr.Name name
				? context.getScopes().findVariable(name.id()) : Optional.empty();
		String slot;
		if (!context.isInLoop() && symbol.isPresent() && symbol.get().getKnownLength() >= 0)
		{
			int next = symbol.get().getKnownLength() + 1;
			symbol.get().setKnownLength(next);
			slot = Integer.toString(next);
		}
		else
		{
			symbol.ifPresent(s -> s.setKnownLength(-1));
			slot = "LENGTH(" + base + ") + 1";
		}
		symbol.ifPresent(s -> refineElementType(s, value));
		return IrNode.leaf(IrKind.ELEMENT_ASSIGN, base + "[" + slot + "] ← " + render(value), line);
	}

	private void refineElementType(VariableSymbol symbol, Expr value)
	{
		if (symbol.getType().element() == null)
		{
			symbol.setType(TypeRef.arrayOf(types().infer(value)));
		}
	}

	// ------------------------------------------------------------------ assignments

	@Override
	public List<IrNode> visitAssign(Stmt.Assign stmt)
	{
		List<IrNode> out = new ArrayList<>();
		for (Expr target : stmt.targets())
		{
			out.addAll(assign(target, stmt.value(), stmt.line()));
		}
		return out;
	}

	@Override
	public List<IrNode> visitAugAssign(Stmt.AugAssign stmt)
	{
		Expr value = stmt.value();
		if (value instanceof Expr.Binary || value instanceof Expr.BoolOp || value instanceof Expr.Compare)
		{
			value = new Expr.Paren(value);
		}
		Expr expanded = new Expr.Binary(stmt.target(), stmt.op(), value);
		String text = render(stmt.target()) + " ← " + render(expanded);

		if (stmt.target() instanceof Expr.Name name)
		{
			TypeRef type = types().infer(expanded);
			Optional<VariableSymbol> existing = context.getScopes().findVariable(name.id());
			if (existing.isEmpty())
			{
				context.getErrorHandler().logWarning(DiagnosticKind.NAME, stmt.line(),
						"Variable '" + name.id() + "' is updated before it is assigned");
				register(name.id(), type, true, stmt.line());
			}
			else
			{
				retype(existing.get(), type, stmt.line());
			}
		}
		return List.of(IrNode.leaf(assignKind(stmt.target()), text, stmt.line()));
	}

	@Override
	public List<IrNode> visitAnnAssign(Stmt.AnnAssign stmt)
	{
		TypeRef declared = types().annotationType(stmt.annotation());
		if (!(stmt.target() instanceof Expr.Name name))
		{
			return stmt.value() == null ? List.of() : assign(stmt.target(), stmt.value(), stmt.line());
		}
		if (declared == null)
		{
			context.getErrorHandler().logWarning(DiagnosticKind.TYPE_INFERENCE, stmt.line(),
					"Unknown type annotation for '" + name.id() + "'");
			declared = types().fallback();
		}

		Expr value = stmt.value();
		boolean declaresItself = value instanceof Expr.ListDisplay || value instanceof Expr.TupleDisplay
				|| isListRepeat(value) || isInstantiation(value);
		List<IrNode> out = new ArrayList<>();
		if (!declaresItself && !context.getScopes().isDefinedLocally(name.id()))
		{
			out.add(declaration(name.id(), declared, stmt.line()));
		}
		register(name.id(), declared, true, stmt.line());
		if (value != null)
		{
			out.addAll(assign(name, value, stmt.line()));
		}
		return out;
	}

	private List<IrNode> assign(Expr target, Expr value, int line)
	{
		if (target instanceof Expr.TupleDisplay || target instanceof Expr.ListDisplay)
		{
			return unpack(target, value, line);
		}

		Expr.Call input = inputCall(value);
		if (input != null)
		{
			return input(target, value, input, line);
		}
		if (isInstantiation(value))
		{
			return instantiate(target, (Expr.Call) value, line);
		}
		if (target instanceof Expr.Name name)
		{
			if (value instanceof Expr.ListDisplay || value instanceof Expr.TupleDisplay)
			{
				return arrayLiteral(name.id(), elementsOf(value), line);
			}
			if (isListRepeat(value))
			{
				return arrayRepeat(name.id(), (Expr.Binary) value, line);
			}
			if (value instanceof Expr.DictDisplay)
			{
				context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, line,
						"Dictionaries have no direct pseudocode equivalent");
			}
			return simpleAssign(name, value, line);
		}
		if (target instanceof Expr.Attribute
				&& (value instanceof Expr.ListDisplay || value instanceof Expr.TupleDisplay))
		{
			return List.of(IrNode.leaf(IrKind.ARRAY_LITERAL, render(target) + " ← " + render(value), line));
		}
		if (target instanceof Expr.Subscript || target instanceof Expr.Attribute)
		{
			return List.of(IrNode.leaf(assignKind(target), render(target) + " ← " + render(value), line));
		}
		context.getErrorHandler().logError(DiagnosticKind.CONVERSION, line, "Cannot assign to " + render(target));
		return List.of(IrNode.leaf(IrKind.STATEMENT, render(target) + " ← " + render(value), line));
	}

	private static IrKind assignKind(Expr target)
	{
		if (target instanceof Expr.Subscript)
		{
			return IrKind.ELEMENT_ASSIGN;
		}
		if (target instanceof Expr.Attribute)
		{
			return IrKind.ATTRIBUTE_ASSIGN;
		}
		return IrKind.ASSIGN;
	}

	private List<IrNode> simpleAssign(Expr.Name target, Expr value, int line)
	{
		String text = target.id() + " ← " + render(value);
		TypeRef type = types().infer(value);
		boolean certain = types().isCertain(value, type);

		List<IrNode> out = new ArrayList<>();
		Optional<VariableSymbol> existing = context.getScopes().findVariable(target.id());
		if (existing.isPresent() && context.substitution(target.id()).isEmpty())
		{
			retype(existing.get(), type, line);
		}
		else
		{
			if (context.getOptions().isDeclareVariables())
			{
				out.add(declaration(target.id(), type, line));
			}
			VariableSymbol symbol = register(target.id(), type, certain, line);
			if (type.is(DataType.ARRAY) && value instanceof Expr.Name source)
			{
				// aliasing a list keeps its length
				context.getScopes().findVariable(source.id()).ifPresent(s -> symbol.setKnownLength(s.getKnownLength()));
			}
		}
		out.add(IrNode.leaf(IrKind.ASSIGN, text, line));
		return out;
	}

	private IrNode declaration(String name, TypeRef type, int line)
	{
		return new IrNode(IrKind.STATEMENT, "DECLARE " + name + " : " + context.typeName(type), List.of(),
				IrMeta.builder().name(name).dataType(context.typeName(type)).line(line).build());
	}

	private VariableSymbol register(String name, TypeRef type, boolean certain, int line)
	{
		VariableSymbol symbol = new VariableSymbol(name, type, line);
		symbol.setInitialized(true);
		symbol.setCertain(certain);
		context.getScopes().registerAssigned(symbol);
		context.trace("Variable " + name + " : " + type);
		return symbol;
	}

	/**
	 * A later assignment may sharpen a guessed type or widen INTEGER to REAL. A conflicting
	 * certain type keeps the first one.
	 */
	private void retype(VariableSymbol symbol, TypeRef type, int line)
	{
		TypeRef current = symbol.getType();
		if (current.equals(type) || type.is(DataType.ANY))
		{
			return;
		}
		if (!symbol.isCertain())
		{
			symbol.setType(type);
			symbol.setCertain(!type.equals(types().fallback()));
			return;
		}
		DataType promoted = DataType.promote(current.type(), type.type());
		if (promoted != null)
		{
			symbol.setType(TypeRef.of(promoted));
			return;
		}
		if (current.is(DataType.ARRAY) && type.is(DataType.ARRAY))
		{
			return;
		}
		context.getErrorHandler().logWarning(DiagnosticKind.TYPE_INFERENCE, line,
				"Variable '" + symbol.getName() + "' was " + context.typeName(current) + " and is now assigned "
						+ context.typeName(type));
	}

	// ------------------------------------------------------------------ input

	private static Expr.Call inputCall(Expr value)
	{
		if (!(value instanceof Expr.Call call))
		{
			return null;
		}
		if ("input".equals(call.calleeName()))
		{
			return call;
		}
		String callee = call.calleeName();
		if (("int".equals(callee) || "float".equals(callee) || "str".equals(callee)) && call.args().size() == 1
				&& call.args().get(0) instanceof Expr.Call inner && "input".equals(inner.calleeName()))
		{
			return inner;
		}
		return null;
	}

	private List<IrNode> input(Expr target, Expr value, Expr.Call input, int line)
	{
		String callee = ((Expr.Call) value).calleeName();
		TypeRef type = switch (callee)
		{
			case "int" -> TypeRef.INTEGER;
			case "float" -> TypeRef.REAL;
			default -> TypeRef.STRING;
		};

		List<IrNode> out = new ArrayList<>(prompt(input, line));
		if (target instanceof Expr.Name name)
		{
			Optional<VariableSymbol> existing = context.getScopes().findVariable(name.id());
			if (existing.isPresent())
			{
				retype(existing.get(), type, line);
			}
			else
			{
				if (context.getOptions().isDeclareVariables())
				{
					out.add(declaration(name.id(), type, line));
				}
				register(name.id(), type, true, line);
			}
		}
		out.add(IrNode.leaf(IrKind.INPUT, "INPUT " + render(target), line));
		return out;
	}

	// ------------------------------------------------------------------ records and objects

	private boolean isInstantiation(Expr value)
	{
		return value instanceof Expr.Call call && call.calleeName() != null
				&& context.getClasses().isClass(call.calleeName())
				&& context.getScopes().findFunction(call.calleeName()).isEmpty();
	}

	private List<IrNode> instantiate(Expr target, Expr.Call call, int line)
	{
		String className = call.calleeName();
		TypeRef type = TypeRef.instance(className);
		List<IrNode> out = new ArrayList<>();

		if (target instanceof Expr.Name name)
		{
			Optional<VariableSymbol> existing = context.getScopes().findVariable(name.id());
			if (existing.isEmpty())
			{
				out.add(declaration(name.id(), type, line));
				register(name.id(), type, true, line);
			}
			else
			{
				retype(existing.get(), type, line);
			}
		}

		String targetText = render(target);
		if (context.getClasses().isRecord(className))
		{
			out.addAll(recordFields(targetText, call, line));
		}
		else
		{
			out.add(IrNode.leaf(assignKind(target), targetText + " ← " + render(call), line));
		}
		return out;
	}

	/**
	 * One field assignment per record field, in declaration order. Constructor arguments are
	 * matched by keyword first, then by position, then fall back to the parameter default.
	 */
	private List<IrNode> recordFields(String targetText, Expr.Call call, int line)
	{
		ClassInfo info = context.getClasses().find(call.calleeName()).orElseThrow();
		List<ParameterInfo> parameters = info.constructorParameters();
		if (call.args().size() > parameters.size())
		{
			context.getErrorHandler().logWarning(DiagnosticKind.VALIDATION, line,
					info.name() + "() takes " + parameters.size() + " arguments but " + call.args().size() + " were given");
		}

		List<String> arguments = new ArrayList<>();
		for (int i = 0; i < parameters.size(); i++)
		{
			arguments.add(argumentFor(call, parameters.get(i).name(), i));
		}

		List<IrNode> out = new ArrayList<>();
		int pushed = 0;
		for (int i = 0; i < parameters.size(); i++)
		{
			if (arguments.get(i) != null)
			{
				context.pushSubstitution(parameters.get(i).name(), arguments.get(i));
				pushed++;
			}
		}
		try
		{
			for (FieldInfo field : info.fields())
			{
				String value;
				if (field.sourceParameter() != null)
				{
					value = context.substitution(field.sourceParameter()).orElse(null);
					if (value == null)
					{
						context.getErrorHandler().logWarning(DiagnosticKind.VALIDATION, line,
								"No value given for field '" + field.name() + "' of " + info.name());
						continue;
					}
				}
				else if (field.initializer() != null)
				{
					value = render(field.initializer());
				}
				else
				{
					continue;
				}
				out.add(IrNode.leaf(IrKind.ATTRIBUTE_ASSIGN, targetText + "." + field.name() + " ← " + value, line));
			}
		}
		finally
		{
			for (int i = 0; i < pushed; i++)
			{
				context.popSubstitution();
			}
		}
		return out;
	}

	private String argumentFor(Expr.Call call, String parameter, int position)
	{
		for (Expr.Keyword keyword : call.keywords())
		{
			if (keyword.name().equals(parameter))
			{
				return render(keyword.value());
			}
		}
		if (position < call.args().size())
		{
			return render(call.args().get(position));
		}
		ParameterInfo info = context.getClasses().find(call.calleeName()).orElseThrow()
				.constructorParameters().get(position);
		return info.hasDefaultValue() ? render(info.defaultValue()) : null;
	}

	// ------------------------------------------------------------------ arrays

	private static List<Expr> elementsOf(Expr display)
	{
		if (display instanceof Expr.ListDisplay list)
		{
			return list.elements();
		}
		return ((Expr.TupleDisplay) display).elements();
	}

	private static boolean isListRepeat(Expr value)
	{
		return value instanceof Expr.Binary binary && binary.op().equals("*")
				&& (binary.left() instanceof Expr.ListDisplay l && l.elements().size() == 1
				|| binary.right() instanceof Expr.ListDisplay r && r.elements().size() == 1);
	}

	private List<IrNode> arrayLiteral(String name, List<Expr> elements, int line)
	{
		List<IrNode> out = new ArrayList<>();
		if (elements.isEmpty())
		{
			TypeRef element = context.appendedType(name)
					.orElseGet(() -> context.getScopes().findVariable(name).map(v -> v.getType().element()).orElse(null));
			TypeRef type = TypeRef.arrayOf(element);
			String size = Integer.toString(context.getOptions().getDefaultArraySize());
			out.add(arrayDeclaration(name, "1:" + size, size, type, line));
			VariableSymbol symbol = register(name, type, element != null, line);
			symbol.setKnownLength(0);
			return out;
		}

		List<List<Expr>> rows = rows(elements);
		if (rows != null)
		{
			int columns = rows.get(0).size();
			List<Expr> cells = new ArrayList<>();
			rows.forEach(cells::addAll);
			TypeRef type = TypeRef.arrayOf(types().elementType(cells));
			out.add(arrayDeclaration(name, "1:" + rows.size() + ", 1:" + columns, Integer.toString(rows.size()), type, line));
			VariableSymbol symbol = register(name, type, true, line);
			symbol.setBounds(Integer.toString(rows.size()), Integer.toString(columns));
			symbol.setKnownLength(rows.size());
			for (int r = 0; r < rows.size(); r++)
			{
				for (int c = 0; c < columns; c++)
				{
					out.add(IrNode.leaf(IrKind.ELEMENT_ASSIGN,
							name + "[" + (r + 1) + ", " + (c + 1) + "] ← " + render(rows.get(r).get(c)), line));
				}
			}
			return out;
		}

		TypeRef type = TypeRef.arrayOf(types().elementType(elements));
		out.add(arrayDeclaration(name, "1:" + elements.size(), Integer.toString(elements.size()), type, line));
		VariableSymbol symbol = register(name, type, true, line);
		symbol.setBounds(Integer.toString(elements.size()), null);
		symbol.setKnownLength(elements.size());
		for (int i = 0; i < elements.size(); i++)
		{
			Expr element = elements.get(i);
			String slot = name + "[" + (i + 1) + "]";
			if (element instanceof Expr.Call call && isInstantiation(call))
			{
				out.addAll(instantiate(new Expr.Subscript(new Expr.Name(name), new Expr.Num(Integer.toString(i), true)), call, line));
			}
			else
			{
				out.add(IrNode.leaf(IrKind.ELEMENT_ASSIGN, slot + " ← " + render(element), line));
			}
		}
		return out;
	}

	/**
	 * Rows of a list of equal-length lists, or null when the elements are not such a table.
	 */
	private static List<List<Expr>> rows(List<Expr> elements)
	{
		List<List<Expr>> rows = new ArrayList<>();
		for (Expr element : elements)
		{
			if (!(element instanceof Expr.ListDisplay row) || row.elements().isEmpty()
					|| !rows.isEmpty() && rows.get(0).size() != row.elements().size())
			{
				return null;
			}
			rows.add(row.elements());
		}
		return rows;
	}

	/**
	 * {@code [v] * n} only declares the array; slots are filled by later assignments.
	 */
	private List<IrNode> arrayRepeat(String name, Expr.Binary value, int line)
	{
		boolean listLeft = value.left() instanceof Expr.ListDisplay;
		Expr.ListDisplay list = (Expr.ListDisplay) (listLeft ? value.left() : value.right());
		Expr count = listLeft ? value.right() : value.left();

		Expr fill = list.elements().get(0);
		if (isListRepeat(fill))
		{
			// [[v] * c] * r
			Expr.Binary inner = (Expr.Binary) fill;
			boolean innerLeft = inner.left() instanceof Expr.ListDisplay;
			Expr columns = innerLeft ? inner.right() : inner.left();
			Expr cell = ((Expr.ListDisplay) (innerLeft ? inner.left() : inner.right())).elements().get(0);
			TypeRef type = TypeRef.arrayOf(types().infer(cell));
			String rowsText = render(count);
			String columnsText = render(columns);
			VariableSymbol symbol = register(name, type, true, line);
			symbol.setBounds(rowsText, columnsText);
			symbol.setKnownLength(literalLength(count));
			return List.of(arrayDeclaration(name, "1:" + rowsText + ", 1:" + columnsText, rowsText, type, line));
		}

		TypeRef type = TypeRef.arrayOf(types().infer(fill));
		String size = render(count);
		VariableSymbol symbol = register(name, type, true, line);
		symbol.setBounds(size, null);
		symbol.setKnownLength(literalLength(count));
		return List.of(arrayDeclaration(name, "1:" + size, size, type, line));
	}

	private static int literalLength(Expr count)
	{
		Long value = count instanceof Expr.Num num ? num.longValue() : null;
		return value != null && value >= 0 && value <= Integer.MAX_VALUE ? value.intValue() : -1;
	}

	private IrNode arrayDeclaration(String name, String bounds, String size, TypeRef type, int line)
	{
		String element = context.elementTypeName(type);
		String text = "DECLARE " + name + " : ARRAY[" + bounds + "] OF " + element;
		return new IrNode(IrKind.ARRAY, text, List.of(),
				IrMeta.builder().name(name).array(size, element).dataType("ARRAY").line(line).build());
	}

	// ------------------------------------------------------------------ unpacking

	/**
	 * {@code a, b = x, y} assigns element-wise. When a value reads a name assigned earlier in
	 * the same statement, the old values go through temporaries first.
	 */
	private List<IrNode> unpack(Expr target, Expr value, int line)
	{
		List<Expr> targets = elementsOf(target);
		if (!(value instanceof Expr.TupleDisplay || value instanceof Expr.ListDisplay)
				|| elementsOf(value).size() != targets.size())
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, line,
					"Unpacking assignment could not be split into single assignments");
			return List.of(IrNode.leaf(IrKind.ASSIGN, render(target) + " ← " + render(value), line));
		}
		List<Expr> values = elementsOf(value);

		Set<String> assigned = new HashSet<>();
		boolean readsAssigned = false;
		for (int i = 0; i < targets.size(); i++)
		{
			if (i > 0 && readsAny(values.get(i), assigned))
			{
				readsAssigned = true;
			}
			if (targets.get(i) instanceof Expr.Name name)
			{
				assigned.add(name.id());
			}
		}

		List<IrNode> out = new ArrayList<>();
		if (!readsAssigned)
		{
			for (int i = 0; i < targets.size(); i++)
			{
				out.addAll(assign(targets.get(i), values.get(i), line));
			}
			return out;
		}

		if (targets.size() == 2 && isName(values.get(0), targets.get(1)) && isName(values.get(1), targets.get(0)))
		{
			Expr.Name temp = new Expr.Name(freshName("temp"));
			out.addAll(assign(temp, targets.get(0), line));
			out.addAll(assign(targets.get(0), targets.get(1), line));
			out.addAll(assign(targets.get(1), temp, line));
			return out;
		}

		List<Expr.Name> temps = new ArrayList<>();
		for (int i = 0; i < values.size(); i++)
		{
			Expr.Name temp = new Expr.Name(freshName("temp" + (i + 1)));
			temps.add(temp);
			out.addAll(assign(temp, values.get(i), line));
		}
		for (int i = 0; i < targets.size(); i++)
		{
			out.addAll(assign(targets.get(i), temps.get(i), line));
		}
		return out;
	}

	private static boolean isName(Expr expr, Expr other)
	{
		return expr instanceof Expr.Name a && other instanceof Expr.Name b && a.id().equals(b.id());
	}

	private static boolean readsAny(Expr expr, Set<String> names)
	{
		boolean[] found = new boolean[1];
		new AstScanner()
		{
			@Override
			protected void onExpr(Expr e)
			{
				if (e instanceof Expr.Name name && names.contains(name.id()))
				{
					found[0] = true;
					stop();
				}
			}
		}.scan(expr);
		return found[0];
	}

	private String freshName(String base)
	{
		String name = base;
		int n = 1;
		while (!temporaries.contains(name) && (context.getScopes().findVariable(name).isPresent()
				|| context.getScopes().findFunction(name).isPresent()))
		{
			name = base + n++;
		}
		temporaries.add(name);
		return name;
	}

	// ------------------------------------------------------------------ selection

	@Override
	public List<IrNode> visitIf(Stmt.If stmt)
	{
		String condition = render(stmt.test());
		List<IrNode> body = convertScoped(stmt.body(), "if", ScopeKind.BLOCK);

		List<IrNode> alternates = new ArrayList<>();
		List<Stmt> orElse = stmt.orElse();
		while (!orElse.isEmpty())
		{
			Stmt.If elif = elseIf(orElse);
			if (elif != null)
			{
				context.setLine(elif.line());
				String elifCondition = render(elif.test());
				List<IrNode> elifBody = convertScoped(elif.body(), "elif", ScopeKind.BLOCK);
				alternates.add(IrNode.block(IrKind.ELSEIF, "ELSE IF " + elifCondition + " THEN", elifBody,
						IrMeta.builder().condition(elifCondition).line(elif.line()).build()));
				orElse = elif.orElse();
			}
			else
			{
				List<IrNode> elseBody = convertScoped(orElse, "else", ScopeKind.BLOCK);
				alternates.add(IrNode.block(IrKind.ELSE, "ELSE", elseBody, IrMeta.atLine(orElse.get(0).line())));
				orElse = List.of();
			}
		}

		IrMeta meta = IrMeta.builder().condition(condition).alternate(alternates).line(stmt.line()).build();
		return List.of(IrNode.block(IrKind.IF, "IF " + condition + " THEN", body, meta));
	}

	/**
	 * The nested conditional of an else branch that holds nothing else.
	 */
	private static Stmt.If elseIf(List<Stmt> orElse)
	{
		return orElse.size() == 1 && orElse.get(0) instanceof Stmt.If elif ? elif : null;
	}

	@Override
	public List<IrNode> visitMatch(Stmt.Match stmt)
	{
		String subject = render(stmt.subject());
		List<IrNode> clauses = new ArrayList<>();
		for (Stmt.CaseClause clause : stmt.cases())
		{
			context.setLine(clause.line());
			String label = clause.pattern() == null ? "OTHERWISE" : render(clause.pattern());
			List<IrNode> body = convertScoped(clause.body(), "case", ScopeKind.BLOCK);
			if (body.size() == 1 && body.get(0).getChildren().isEmpty() && body.get(0).getKind() != IrKind.COMMENT)
			{
				clauses.add(IrNode.leaf(IrKind.STATEMENT, label + " : " + body.get(0).getText(), clause.line()));
			}
			else
			{
				clauses.add(IrNode.block(IrKind.STATEMENT, label + " :", body, IrMeta.atLine(clause.line())));
			}
		}
		return List.of(IrNode.block(IrKind.CASE, "CASE OF " + subject, clauses,
				IrMeta.builder().condition(subject).line(stmt.line()).build()));
	}

	// ------------------------------------------------------------------ iteration

	@Override
	public List<IrNode> visitFor(Stmt.For stmt)
	{
		List<IrNode> out = new ArrayList<>();
		if (stmt.target() instanceof Expr.Name target && stmt.iter() instanceof Expr.Call call
				&& "range".equals(call.calleeName()) && context.getScopes().findFunction("range").isEmpty()
				&& !call.args().isEmpty() && call.args().size() <= 3)
		{
			out.add(rangeLoop(target.id(), call, stmt));
		}
		else if (stmt.target() instanceof Expr.Name target && stmt.iter() instanceof Expr.Name sequence
				&& isIndexable(sequence))
		{
			out.add(sequenceLoop(target.id(), sequence, stmt));
		}
		else
		{
			out.add(iteratorLoop(stmt));
		}

		if (!stmt.orElse().isEmpty())
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
					"'else' after a loop is not supported; its body follows the loop");
			out.add(IrNode.leaf(IrKind.COMMENT, "loop else", stmt.line()));
			out.addAll(convertBody(stmt.orElse()));
		}
		return out;
	}

	private IrNode rangeLoop(String variable, Expr.Call range, Stmt.For stmt)
	{
		List<Expr> args = range.args();
		Expr startExpr = args.size() == 1 ? new Expr.Num("0", true) : args.get(0);
		Expr endExpr = args.size() == 1 ? args.get(0) : args.get(1);
		Expr stepExpr = args.size() == 3 ? args.get(2) : null;

		String start = render(startExpr);
		String step = null;
		String end;
		Long stepValue = stepExpr == null ? Long.valueOf(1) : integer(stepExpr);
		if (stepValue != null && stepValue == 0)
		{
			context.getErrorHandler().logError(DiagnosticKind.VALIDATION, stmt.line(), "range() step must not be zero");
			stepValue = 1L;
		}

		if (stepValue == null)
		{
			step = render(stepExpr);
			end = exclusiveUpper(endExpr);
		}
		else
		{
			if (stepValue != 1)
			{
				step = Long.toString(stepValue);
			}
			Long first = integer(startExpr);
			Long limit = integer(endExpr);
			if (first != null && limit != null && Math.abs(stepValue) != 1)
			{
				end = Long.toString(lastReached(first, limit, stepValue));
			}
			else
			{
				end = stepValue > 0 ? exclusiveUpper(endExpr) : exclusiveLower(endExpr);
			}
		}

		if (context.getScopes().findVariable(variable).isEmpty())
		{
			register(variable, TypeRef.INTEGER, true, stmt.line());
		}

		context.getScopes().enterScope("for " + variable, ScopeKind.FOR);
		context.enterLoop();
		List<IrNode> body;
		try
		{
			body = convertBody(stmt.body());
		}
		finally
		{
			context.exitLoop();
			context.getScopes().exitScope();
		}

		String header = "FOR " + variable + " ← " + start + " TO " + end + (step == null ? "" : " STEP " + step);
		IrMeta meta = IrMeta.builder().loopVariable(variable).range(start, end, step).line(stmt.line()).build();
		return IrNode.block(IrKind.FOR, header, body, meta);
	}

	/**
	 * Last value a constant-step range actually reaches before passing its exclusive limit.
	 */
	static long lastReached(long start, long limit, long step)
	{
		if (step > 0)
		{
			long last = limit - 1;
			return last < start ? last : start + ((last - start) / step) * step;
		}
		long last = limit + 1;
		long magnitude = -step;
		return last > start ? last : start - ((start - last) / magnitude) * magnitude;
	}

	private String exclusiveUpper(Expr end)
	{
		Long value = integer(end);
		if (value != null)
		{
			return Long.toString(value - 1);
		}
		if (end instanceof Expr.Binary binary && integer(binary.right()) != null)
		{
			long k = integer(binary.right());
			if (binary.op().equals("+"))
			{
				return k == 1 ? render(binary.left()) : render(binary.left()) + " + " + (k - 1);
			}
			if (binary.op().equals("-"))
			{
				return render(binary.left()) + " - " + (k + 1);
			}
		}
		return render(end) + " - 1";
	}

	private String exclusiveLower(Expr end)
	{
		Long value = integer(end);
		if (value != null)
		{
			return Long.toString(value + 1);
		}
		if (end instanceof Expr.Binary binary && integer(binary.right()) != null)
		{
			long k = integer(binary.right());
			if (binary.op().equals("-"))
			{
				return k == 1 ? render(binary.left()) : render(binary.left()) + " - " + (k - 1);
			}
			if (binary.op().equals("+"))
			{
				return render(binary.left()) + " + " + (k + 1);
			}
		}
		return render(end) + " + 1";
	}

	private static Long integer(Expr expr)
	{
		return expr instanceof Expr.Num num ? num.longValue() : null;
	}

	private boolean isIndexable(Expr.Name sequence)
	{
		if (context.substitution(sequence.id()).isPresent())
		{
			return false;
		}
		return context.getScopes().findVariable(sequence.id())
				.map(v -> v.getType().is(DataType.ARRAY) || v.getType().is(DataType.STRING) && v.isCertain())
				.orElse(false);
	}

	/**
	 * {@code for x in s} becomes a counted loop over the positions of {@code s}, with every
	 * reference to {@code x} in the body rewritten to {@code s[i]}.
	 */
	private IrNode sequenceLoop(String variable, Expr.Name sequence, Stmt.For stmt)
	{
		VariableSymbol symbol = context.getScopes().findVariable(sequence.id()).orElseThrow();
		String end;
		if (symbol.getType().is(DataType.STRING))
		{
			end = "LENGTH(" + sequence.id() + ")";
		}
		else if (symbol.getKnownLength() >= 0)
		{
			end = Integer.toString(symbol.getKnownLength());
		}
		else if (symbol.getSizeText() != null)
		{
			end = symbol.getSizeText();
		}
		else
		{
			end = Integer.toString(context.getOptions().getDefaultArraySize());
			context.getErrorHandler().logWarning(DiagnosticKind.TYPE_INFERENCE, stmt.line(),
					"Length of '" + sequence.id() + "' is unknown; looping to " + end);
		}

		String index = indexName(variable, stmt.body());
		TypeRef element = symbol.getType().is(DataType.STRING) ? TypeRef.STRING : symbol.getType().element();

		context.getScopes().enterScope("for " + variable, ScopeKind.FOR);
		context.enterLoop();
		VariableSymbol indexSymbol = new VariableSymbol(index, TypeRef.INTEGER, stmt.line());
		context.getScopes().registerVariable(indexSymbol);
		VariableSymbol loopSymbol = new VariableSymbol(variable, element != null ? element : types().fallback(), stmt.line());
		loopSymbol.setCertain(element != null);
		context.getScopes().registerVariable(loopSymbol);
		context.pushSubstitution(variable, sequence.id() + "[" + index + "]");
		List<IrNode> body;
		try
		{
			body = convertBody(stmt.body());
		}
		finally
		{
			context.popSubstitution();
			context.exitLoop();
			context.getScopes().exitScope();
		}

		String header = "FOR " + index + " ← 1 TO " + end;
		IrMeta meta = IrMeta.builder().loopVariable(index).range("1", end, null).line(stmt.line()).build();
		return IrNode.block(IrKind.FOR, header, body, meta);
	}

	private String indexName(String loopVariable, List<Stmt> body)
	{
		Set<String> taken = namesIn(body);
		taken.add(loopVariable);
		for (String candidate : INDEX_NAMES)
		{
			if (!taken.contains(candidate) && context.getScopes().findVariable(candidate).isEmpty())
			{
				return candidate;
			}
		}
		int n = 1;
		while (taken.contains("idx" + n) || context.getScopes().findVariable("idx" + n).isPresent())
		{
			n++;
		}
		return "idx" + n;
	}

	private static Set<String> namesIn(List<Stmt> body)
	{
		Set<String> names = new HashSet<>();
		new AstScanner()
		{
			@Override
			protected void onExpr(Expr expr)
			{
				if (expr instanceof Expr.Name name)
				{
					names.add(name.id());
				}
			}
		}.scan(body);
		return names;
	}

	private IrNode iteratorLoop(Stmt.For stmt)
	{
		context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
				"Iterating over '" + render(stmt.iter()) + "' has no counted-loop equivalent");
		String variable = stmt.target() instanceof Expr.Name name ? name.id() : null;
		String iterable = render(stmt.iter());

		context.getScopes().enterScope("for", ScopeKind.FOR);
		context.enterLoop();
		for (Expr target : stmt.target() instanceof Expr.TupleDisplay tuple ? tuple.elements() : List.of(stmt.target()))
		{
			if (target instanceof Expr.Name name)
			{
				TypeRef element = types().infer(stmt.iter()).element();
				context.getScopes().registerVariable(new VariableSymbol(name.id(),
						element != null ? element : types().fallback(), stmt.line()));
			}
		}
		String targetText = render(stmt.target());
		List<IrNode> body;
		try
		{
			body = convertBody(stmt.body());
		}
		finally
		{
			context.exitLoop();
			context.getScopes().exitScope();
		}

		IrMeta meta = IrMeta.builder().loopVariable(variable != null ? variable : targetText).line(stmt.line()).build();
		return IrNode.block(IrKind.FOR, "FOR " + targetText + " IN " + iterable, body, meta);
	}

	@Override
	public List<IrNode> visitWhile(Stmt.While stmt)
	{
		Optional<Stmt.If> exit = repeatExit(stmt);
		List<IrNode> out = new ArrayList<>();

		context.getScopes().enterScope("while", ScopeKind.WHILE);
		context.enterLoop();
		try
		{
			if (exit.isPresent())
			{
				List<Stmt> body = new ArrayList<>(stmt.body());
				body.remove(exit.get());
				List<IrNode> children = new ArrayList<>(convertBody(body));
				context.setLine(exit.get().line());
				String condition = render(exit.get().test());
				children.add(IrNode.leaf(IrKind.UNTIL, "UNTIL " + condition, exit.get().line()));
				out.add(IrNode.block(IrKind.REPEAT, "REPEAT", children,
						IrMeta.builder().condition(condition).line(stmt.line()).build()));
			}
			else
			{
				String condition = render(stmt.test());
				List<IrNode> children = new ArrayList<>(convertBody(stmt.body()));
				children.add(IrNode.leaf(IrKind.ENDWHILE, "ENDWHILE", stmt.line()));
				out.add(IrNode.block(IrKind.WHILE, "WHILE " + condition, children,
						IrMeta.builder().condition(condition).line(stmt.line()).build()));
			}
		}
		finally
		{
			context.exitLoop();
			context.getScopes().exitScope();
		}

		if (!stmt.orElse().isEmpty())
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, stmt.line(),
					"'else' after a loop is not supported; its body follows the loop");
			out.add(IrNode.leaf(IrKind.COMMENT, "loop else", stmt.line()));
			out.addAll(convertBody(stmt.orElse()));
		}
		return out;
	}

	/**
	 * For {@code while True:} whose last statement is {@code if cond: break} and which has no
	 * other exit, the exit statement; the loop then renders as REPEAT ... UNTIL cond.
	 */
	private Optional<Stmt.If> repeatExit(Stmt.While loop)
	{
		if (!context.getOptions().isDetectRepeatUntil() || !loop.orElse().isEmpty()
				|| !(loop.test() instanceof Expr.Bool test && test.value()))
		{
			return Optional.empty();
		}
		List<Stmt> body = loop.body();
		int last = body.size() - 1;
		while (last >= 0 && body.get(last) instanceof Stmt.Comment)
		{
			last--;
		}
		if (last < 0 || !(body.get(last) instanceof Stmt.If exit) || !exit.orElse().isEmpty())
		{
			return Optional.empty();
		}
		List<Stmt> exitBody = exit.body().stream().filter(s -> !(s instanceof Stmt.Comment)).toList();
		if (exitBody.size() != 1 || !(exitBody.get(0) instanceof Stmt.Break))
		{
			return Optional.empty();
		}
		if (countBreaks(body.subList(0, last)) > 0)
		{
			return Optional.empty();
		}
		return Optional.of(exit);
	}

	/**
	 * Breaks that leave the current loop; nested loops keep their own.
	 */
	private static int countBreaks(List<Stmt> body)
	{
		int count = 0;
		for (Stmt stmt : body)
		{
			if (stmt instanceof Stmt.Break)
			{
				count++;
			}
			else if (stmt instanceof Stmt.If s)
			{
				count += countBreaks(s.body()) + countBreaks(s.orElse());
			}
			else if (stmt instanceof Stmt.Match s)
			{
				for (Stmt.CaseClause clause : s.cases())
				{
					count += countBreaks(clause.body());
				}
			}
			else if (stmt instanceof Stmt.Unsupported s)
			{
				count += countBreaks(s.body());
			}
		}
		return count;
	}
}
