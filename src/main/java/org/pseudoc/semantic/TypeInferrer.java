package org.pseudoc.semantic;

import org.pseudoc.ast.AstScanner;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.ExprVisitor;
import org.pseudoc.ast.Stmt;
import org.pseudoc.semantic.symbol.FunctionSymbol;
import org.pseudoc.semantic.symbol.VariableSymbol;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Bottom-up heuristic typing of expressions. The rules favour local syntactic evidence over
 * soundness; when nothing is known the single fallback type is used (STRING, or ANY when
 * strict typing is requested).
 */
public class TypeInferrer implements ExprVisitor<TypeRef>
{
	private static final Map<String, DataType> STRING_METHODS = Map.ofEntries(
			Map.entry("upper", DataType.STRING),
			Map.entry("lower", DataType.STRING),
			Map.entry("strip", DataType.STRING),
			Map.entry("lstrip", DataType.STRING),
			Map.entry("rstrip", DataType.STRING),
			Map.entry("replace", DataType.STRING),
			Map.entry("title", DataType.STRING),
			Map.entry("capitalize", DataType.STRING),
			Map.entry("join", DataType.STRING),
			Map.entry("format", DataType.STRING),
			Map.entry("split", DataType.ARRAY),
			Map.entry("find", DataType.INTEGER),
			Map.entry("index", DataType.INTEGER),
			Map.entry("count", DataType.INTEGER),
			Map.entry("startswith", DataType.BOOLEAN),
			Map.entry("endswith", DataType.BOOLEAN),
			Map.entry("isdigit", DataType.BOOLEAN),
			Map.entry("isalpha", DataType.BOOLEAN),
			Map.entry("isupper", DataType.BOOLEAN),
			Map.entry("islower", DataType.BOOLEAN)
	);

	private static final Set<String> BITWISE = Set.of("&", "|", "^", "<<", ">>");

	private final ScopeManager scopes;
	private final ClassRegistry classes;
	private final boolean strictTypes;

	public TypeInferrer(ScopeManager scopes, ClassRegistry classes, boolean strictTypes)
	{
		this.scopes = scopes;
		this.classes = classes;
		this.strictTypes = strictTypes;
	}

	public TypeRef infer(Expr expr)
	{
		if (expr == null)
		{
			return fallback();
		}
		TypeRef type = expr.accept(this);
		return type != null ? type : fallback();
	}

	public TypeRef fallback()
	{
		return strictTypes ? TypeRef.ANY : TypeRef.STRING;
	}

	public static boolean isStringMethod(String name)
	{
		return STRING_METHODS.containsKey(name);
	}

	/**
	 * Whether an expression is known to be a string, not just guessed to be one. Decides
	 * between concatenation and addition for {@code +}.
	 */
	public boolean isCertainlyString(Expr expr)
	{
		if (expr instanceof Expr.Str || expr instanceof Expr.FString)
		{
			return true;
		}
		if (expr instanceof Expr.Paren paren)
		{
			return isCertainlyString(paren.inner());
		}
		if (expr instanceof Expr.Binary binary)
		{
			return binary.op().equals("+") && (isCertainlyString(binary.left()) || isCertainlyString(binary.right()));
		}
		if (expr instanceof Expr.Name name)
		{
			return scopes.findVariable(name.id())
					.map(v -> v.isCertain() && v.getType().is(DataType.STRING))
					.orElse(false);
		}
		if (expr instanceof Expr.Subscript subscript)
		{
			return isCertainlyString(subscript.value());
		}
		if (expr instanceof Expr.Call call)
		{
			String callee = call.calleeName();
			if (callee != null)
			{
				return callee.equals("str") || callee.equals("input") || callee.equals("chr");
			}
			return call.func() instanceof Expr.Attribute method
					&& STRING_METHODS.get(method.attr()) == DataType.STRING
					&& !isInstanceMethod(method);
		}
		if (expr instanceof Expr.Attribute attribute)
		{
			TypeRef owner = infer(attribute.value());
			return owner.isInstance() && classes.fieldType(owner.className(), attribute.attr())
					.map(t -> t.is(DataType.STRING)).orElse(false);
		}
		return false;
	}

	/**
	 * Whether the inferred type can be trusted, i.e. it is not only the fallback for an
	 * unresolved name.
	 */
	public boolean isCertain(Expr expr, TypeRef inferred)
	{
		if (!inferred.equals(fallback()))
		{
			return true;
		}
		return inferred.is(DataType.STRING) ? isCertainlyString(expr) : !(expr instanceof Expr.Name);
	}

	private boolean isInstanceMethod(Expr.Attribute method)
	{
		TypeRef receiver = infer(method.value());
		return receiver.isInstance() && classes.hasMethod(receiver.className(), method.attr());
	}

	// ------------------------------------------------------------------ static helpers

	/**
	 * Type of a literal expression, or null when the expression is not a literal.
	 */
	public static TypeRef literalType(Expr expr)
	{
		if (expr instanceof Expr.Num num)
		{
			return num.integral() ? TypeRef.INTEGER : TypeRef.REAL;
		}
		if (expr instanceof Expr.Str || expr instanceof Expr.FString)
		{
			return TypeRef.STRING;
		}
		if (expr instanceof Expr.Bool)
		{
			return TypeRef.BOOLEAN;
		}
		if (expr instanceof Expr.NoneLit)
		{
			return TypeRef.ANY;
		}
		if (expr instanceof Expr.DictDisplay)
		{
			return TypeRef.RECORD;
		}
		if (expr instanceof Expr.Paren paren)
		{
			return literalType(paren.inner());
		}
		if (expr instanceof Expr.Unary unary && !unary.op().equals("not"))
		{
			return literalType(unary.operand());
		}
		List<Expr> elements = sequenceElements(expr);
		if (elements != null)
		{
			List<TypeRef> types = new ArrayList<>();
			for (Expr element : elements)
			{
				TypeRef t = literalType(element);
				types.add(t == null ? TypeRef.ANY : t);
			}
			return TypeRef.arrayOf(unify(types));
		}
		return null;
	}

	/**
	 * Maps a source annotation to a type: builtin names, list/tuple/set generics, dict, and
	 * names of user classes. Returns null for anything unrecognised.
	 */
	public static TypeRef annotationType(Expr annotation, Set<String> classNames)
	{
		if (annotation == null)
		{
			return null;
		}
		if (annotation instanceof Expr.Str str)
		{
			return annotationType(new Expr.Name(str.value().strip()), classNames);
		}
		if (annotation instanceof Expr.Attribute attribute)
		{
			return annotationType(new Expr.Name(attribute.attr()), classNames);
		}
		if (annotation instanceof Expr.Name name)
		{
			return switch (name.id())
			{
				case "int" -> TypeRef.INTEGER;
				case "float" -> TypeRef.REAL;
				case "str" -> TypeRef.STRING;
				case "bool" -> TypeRef.BOOLEAN;
				case "list", "List", "tuple", "Tuple", "set", "Set", "Sequence" -> TypeRef.array(null);
				case "dict", "Dict" -> TypeRef.RECORD;
				case "None", "Any", "object" -> TypeRef.ANY;
				default -> classNames.contains(name.id()) ? TypeRef.instance(name.id()) : null;
			};
		}
		if (annotation instanceof Expr.NoneLit)
		{
			return TypeRef.ANY;
		}
		if (annotation instanceof Expr.Subscript subscript && subscript.value() instanceof Expr.Name generic)
		{
			Expr argument = subscript.index();
			if (argument instanceof Expr.TupleDisplay tuple && !tuple.elements().isEmpty())
			{
				argument = tuple.elements().get(0);
			}
			switch (generic.id())
			{
				case "list", "List", "tuple", "Tuple", "set", "Set", "Sequence":
					return TypeRef.arrayOf(annotationType(argument, classNames));
				case "dict", "Dict":
					return TypeRef.RECORD;
				case "Optional":
					return annotationType(argument, classNames);
				default:
					return null;
			}
		}
		return null;
	}

	public TypeRef annotationType(Expr annotation)
	{
		return annotationType(annotation, classNameSet());
	}

	private Set<String> classNameSet()
	{
		Set<String> names = new HashSet<>();
		classes.getClasses().forEach(c -> names.add(c.name()));
		return names;
	}

	/**
	 * Common type of a list of element types: identical types stay, numeric types promote,
	 * anything else is ANY. Null for an empty list.
	 */
	public static TypeRef unify(List<TypeRef> types)
	{
		TypeRef result = null;
		for (TypeRef t : types)
		{
			if (result == null)
			{
				result = t;
			}
			else if (!result.equals(t))
			{
				DataType promoted = DataType.promote(result.type(), t.type());
				result = promoted != null ? TypeRef.of(promoted) : TypeRef.ANY;
			}
		}
		return result;
	}

	private static List<Expr> sequenceElements(Expr expr)
	{
		if (expr instanceof Expr.ListDisplay list)
		{
			return list.elements();
		}
		if (expr instanceof Expr.TupleDisplay tuple)
		{
			return tuple.elements();
		}
		if (expr instanceof Expr.SetDisplay set)
		{
			return set.elements();
		}
		return null;
	}

	// ------------------------------------------------------------------ parameter usage

	/**
	 * Types an unannotated parameter from how the body uses it. The first piece of evidence in
	 * source order wins; null when the body says nothing.
	 */
	public static TypeRef inferParameterType(String parameter, List<Stmt> body)
	{
		TypeRef[] found = new TypeRef[1];
		new AstScanner()
		{
			@Override
			protected void onExpr(Expr expr)
			{
				TypeRef evidence = usageEvidence(parameter, expr);
				if (evidence != null)
				{
					found[0] = evidence;
					stop();
				}
			}

			@Override
			protected void onStmt(Stmt stmt)
			{
				if (stmt instanceof Stmt.AugAssign aug && isName(aug.target(), parameter))
				{
					TypeRef value = literalType(aug.value());
					if (value != null && (value.isNumeric() || value.is(DataType.STRING)))
					{
						found[0] = value;
						stop();
					}
				}
				else if (stmt instanceof Stmt.For loop && isName(loop.iter(), parameter))
				{
					found[0] = TypeRef.array(null);
					stop();
				}
			}
		}.scan(body);
		return found[0];
	}

	private static TypeRef usageEvidence(String parameter, Expr expr)
	{
		if (expr instanceof Expr.Binary binary)
		{
			Expr other = isName(binary.left(), parameter) ? binary.right()
					: isName(binary.right(), parameter) ? binary.left() : null;
			if (other == null)
			{
				return null;
			}
			TypeRef otherType = literalType(other);
			if (otherType != null && otherType.is(DataType.STRING))
			{
				return binary.op().equals("+") ? TypeRef.STRING : null;
			}
			if (BITWISE.contains(binary.op()) || binary.op().equals("//"))
			{
				return TypeRef.INTEGER;
			}
			if (otherType != null && otherType.isNumeric())
			{
				return otherType;
			}
			if (!binary.op().equals("+"))
			{
				return TypeRef.INTEGER;
			}
			return null;
		}
		if (expr instanceof Expr.Compare compare)
		{
			Expr other = isName(compare.left(), parameter) ? compare.right()
					: isName(compare.right(), parameter) ? compare.left() : null;
			TypeRef otherType = other == null ? null : literalType(other);
			if (otherType != null && (otherType.isNumeric() || otherType.is(DataType.STRING)))
			{
				return otherType;
			}
			return null;
		}
		if (expr instanceof Expr.Call call)
		{
			if ("range".equals(call.calleeName()) && call.args().stream().anyMatch(a -> isName(a, parameter)))
			{
				return TypeRef.INTEGER;
			}
			if ("len".equals(call.calleeName()) && call.args().size() == 1 && isName(call.args().get(0), parameter))
			{
				return TypeRef.array(null);
			}
			if (call.func() instanceof Expr.Attribute method && isName(method.value(), parameter)
					&& STRING_METHODS.containsKey(method.attr()))
			{
				return TypeRef.STRING;
			}
		}
		return null;
	}

	private static boolean isName(Expr expr, String name)
	{
		return expr instanceof Expr.Name n && n.id().equals(name);
	}

	// ------------------------------------------------------------------ visitor

	@Override
	public TypeRef visitName(Expr.Name expr)
	{
		String id = expr.id();
		if (id.matches("\\d+"))
		{
			return TypeRef.INTEGER;
		}
		if (id.matches("\\d*\\.\\d+"))
		{
			return TypeRef.REAL;
		}
		if (id.equals("True") || id.equals("False"))
		{
			return TypeRef.BOOLEAN;
		}
		Optional<VariableSymbol> variable = scopes.findVariable(id);
		if (variable.isPresent())
		{
			return variable.get().getType();
		}
		if (classes.isClass(id))
		{
			return TypeRef.instance(id);
		}
		return fallback();
	}

	@Override
	public TypeRef visitNum(Expr.Num expr)
	{
		return expr.integral() ? TypeRef.INTEGER : TypeRef.REAL;
	}

	@Override
	public TypeRef visitStr(Expr.Str expr)
	{
		return TypeRef.STRING;
	}

	@Override
	public TypeRef visitFString(Expr.FString expr)
	{
		return TypeRef.STRING;
	}

	@Override
	public TypeRef visitBool(Expr.Bool expr)
	{
		return TypeRef.BOOLEAN;
	}

	@Override
	public TypeRef visitNone(Expr.NoneLit expr)
	{
		return TypeRef.ANY;
	}

	@Override
	public TypeRef visitList(Expr.ListDisplay expr)
	{
		return TypeRef.arrayOf(elementType(expr.elements()));
	}

	@Override
	public TypeRef visitTuple(Expr.TupleDisplay expr)
	{
		return TypeRef.arrayOf(elementType(expr.elements()));
	}

	@Override
	public TypeRef visitSet(Expr.SetDisplay expr)
	{
		return TypeRef.arrayOf(elementType(expr.elements()));
	}

	public TypeRef elementType(List<Expr> elements)
	{
		List<TypeRef> types = new ArrayList<>();
		for (Expr element : elements)
		{
			types.add(infer(element));
		}
		return unify(types);
	}

	@Override
	public TypeRef visitDict(Expr.DictDisplay expr)
	{
		return TypeRef.RECORD;
	}

	@Override
	public TypeRef visitBinary(Expr.Binary expr)
	{
		TypeRef left = infer(expr.left());
		TypeRef right = infer(expr.right());
		String op = expr.op();

		if (BITWISE.contains(op))
		{
			return TypeRef.INTEGER;
		}
		if (op.equals("+") && (left.is(DataType.STRING) || right.is(DataType.STRING)))
		{
			return TypeRef.STRING;
		}
		if ((op.equals("+") || op.equals("*")) && (left.is(DataType.ARRAY) || right.is(DataType.ARRAY)))
		{
			return left.is(DataType.ARRAY) ? left : right;
		}
		if (op.equals("*") && (left.is(DataType.STRING) || right.is(DataType.STRING)))
		{
			return TypeRef.STRING;
		}
		if (op.equals("%") && left.is(DataType.STRING))
		{
			return TypeRef.STRING;
		}
		if (op.equals("/"))
		{
			return TypeRef.REAL;
		}
		if (op.equals("//"))
		{
			return TypeRef.INTEGER;
		}

		DataType promoted = DataType.promote(left.type(), right.type());
		if (promoted != null)
		{
			return TypeRef.of(promoted);
		}
		if (left.isNumeric() || right.isNumeric())
		{
			// one side unknown: the numeric side decides
			return left.is(DataType.REAL) || right.is(DataType.REAL) ? TypeRef.REAL : TypeRef.INTEGER;
		}
		return fallback();
	}

	@Override
	public TypeRef visitUnary(Expr.Unary expr)
	{
		if (expr.op().equals("not"))
		{
			return TypeRef.BOOLEAN;
		}
		if (expr.op().equals("~"))
		{
			return TypeRef.INTEGER;
		}
		TypeRef operand = infer(expr.operand());
		return operand.isNumeric() ? operand : TypeRef.INTEGER;
	}

	@Override
	public TypeRef visitCompare(Expr.Compare expr)
	{
		return TypeRef.BOOLEAN;
	}

	@Override
	public TypeRef visitBoolOp(Expr.BoolOp expr)
	{
		return TypeRef.BOOLEAN;
	}

	@Override
	public TypeRef visitCall(Expr.Call expr)
	{
		String callee = expr.calleeName();
		if (callee != null)
		{
			return callType(callee, expr);
		}
		if (expr.func() instanceof Expr.Attribute method)
		{
			return methodType(method, expr);
		}
		return fallback();
	}

	private TypeRef callType(String callee, Expr.Call call)
	{
		switch (callee)
		{
			case "len":
			case "int":
				return TypeRef.INTEGER;
			case "round":
				return call.args().size() > 1 ? TypeRef.REAL : TypeRef.INTEGER;
			case "float":
				return TypeRef.REAL;
			case "str":
			case "input":
			case "chr":
				return TypeRef.STRING;
			case "ord":
				return TypeRef.INTEGER;
			case "bool":
				return TypeRef.BOOLEAN;
			case "abs":
			case "min":
			case "max":
			case "sum":
				return numericOfArguments(call.args());
			case "range":
				return TypeRef.array(DataType.INTEGER);
			case "list":
			case "sorted":
			case "reversed":
				if (!call.args().isEmpty())
				{
					TypeRef source = infer(call.args().get(0));
					if (source.is(DataType.ARRAY))
					{
						return source;
					}
					if (source.is(DataType.STRING))
					{
						return TypeRef.array(DataType.STRING);
					}
				}
				return TypeRef.array(null);
			default:
				break;
		}
		if (classes.isClass(callee))
		{
			return TypeRef.instance(callee);
		}
		Optional<FunctionSymbol> function = scopes.findFunction(callee);
		if (function.isPresent())
		{
			FunctionSymbol symbol = function.get();
			if (symbol.getType() != null)
			{
				return symbol.getType();
			}
			return symbol.returnsValue() ? fallback() : TypeRef.ANY;
		}
		return fallback();
	}

	private TypeRef numericOfArguments(List<Expr> args)
	{
		if (args.size() == 1)
		{
			TypeRef only = infer(args.get(0));
			if (only.is(DataType.ARRAY))
			{
				TypeRef element = only.element();
				return element != null && element.isNumeric() ? element : TypeRef.INTEGER;
			}
			return only.isNumeric() ? only : TypeRef.INTEGER;
		}
		DataType result = null;
		for (Expr arg : args)
		{
			TypeRef t = infer(arg);
			if (t.isNumeric())
			{
				result = result == null ? t.type() : DataType.promote(result, t.type());
			}
		}
		return result == null ? TypeRef.INTEGER : TypeRef.of(result);
	}

	private TypeRef methodType(Expr.Attribute method, Expr.Call call)
	{
		String name = method.attr();
		if (method.value() instanceof Expr.Name module)
		{
			switch (module.id() + "." + name)
			{
				case "random.randint":
				case "math.floor":
				case "math.ceil":
					return TypeRef.INTEGER;
				case "random.random":
				case "math.sqrt":
				case "math.pow":
					return TypeRef.REAL;
				case "random.choice":
					if (!call.args().isEmpty())
					{
						TypeRef element = infer(call.args().get(0)).element();
						return element != null ? element : fallback();
					}
					return fallback();
				default:
					break;
			}
		}
		TypeRef receiver = infer(method.value());
		if (receiver.is(DataType.ARRAY) && name.equals("pop"))
		{
			TypeRef element = receiver.element();
			return element != null ? element : fallback();
		}
		if (receiver.is(DataType.ARRAY) && (name.equals("index") || name.equals("count")))
		{
			return TypeRef.INTEGER;
		}
		if (STRING_METHODS.containsKey(name))
		{
			DataType type = STRING_METHODS.get(name);
			return type == DataType.ARRAY ? TypeRef.array(DataType.STRING) : TypeRef.of(type);
		}
		return fallback();
	}

	@Override
	public TypeRef visitAttribute(Expr.Attribute expr)
	{
		if (expr.value() instanceof Expr.Name module && module.id().equals("math")
				&& (expr.attr().equals("pi") || expr.attr().equals("e")))
		{
			return TypeRef.REAL;
		}
		TypeRef owner = infer(expr.value());
		if (owner.isInstance())
		{
			return classes.fieldType(owner.className(), expr.attr()).orElse(fallback());
		}
		return fallback();
	}

	@Override
	public TypeRef visitSubscript(Expr.Subscript expr)
	{
		TypeRef container = infer(expr.value());
		if (expr.index() instanceof Expr.Slice)
		{
			return container;
		}
		if (container.is(DataType.STRING))
		{
			return TypeRef.STRING;
		}
		if (container.is(DataType.ARRAY))
		{
			TypeRef element = container.element();
			return element != null ? element : fallback();
		}
		if (expr.value() instanceof Expr.Subscript)
		{
			// second index of a two-dimensional array: the first already produced the element
			return container;
		}
		return fallback();
	}

	@Override
	public TypeRef visitSlice(Expr.Slice expr)
	{
		return TypeRef.ANY;
	}

	@Override
	public TypeRef visitConditional(Expr.Conditional expr)
	{
		TypeRef body = infer(expr.body());
		TypeRef orElse = infer(expr.orElse());
		if (body.equals(orElse))
		{
			return body;
		}
		DataType promoted = DataType.promote(body.type(), orElse.type());
		return promoted != null ? TypeRef.of(promoted) : body;
	}

	@Override
	public TypeRef visitParen(Expr.Paren expr)
	{
		return infer(expr.inner());
	}

	@Override
	public TypeRef visitUnsupported(Expr.Unsupported expr)
	{
		return TypeRef.ANY;
	}
}
