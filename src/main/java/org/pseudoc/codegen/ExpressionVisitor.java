package org.pseudoc.codegen;

import org.pseudoc.ast.Expr;
import org.pseudoc.ast.ExprVisitor;
import org.pseudoc.semantic.symbol.VariableSymbol;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Renders expressions in pseudocode vocabulary: operators, literals, built-in functions and
 * string methods are mapped, and zero-based subscripts are rebased to one-based.
 */
public class ExpressionVisitor implements ExprVisitor<String>
{
	private static final Map<String, String> BINARY_OPERATORS = Map.of(
			"%", "MOD",
			"//", "DIV",
			"**", "^"
	);

	private static final Map<String, String> COMPARE_OPERATORS = Map.of(
			"==", "=",
			"!=", "≠",
			"<=", "≤",
			">=", "≥",
			"in", "IN",
			"not in", "NOT IN",
			"is", "=",
			"is not", "≠"
	);

	private static final Map<String, String> BUILTINS = Map.ofEntries(
			Map.entry("len", "LENGTH"),
			Map.entry("int", "INT"),
			Map.entry("float", "REAL"),
			Map.entry("str", "STRING"),
			Map.entry("bool", "BOOLEAN"),
			Map.entry("abs", "ABS"),
			Map.entry("min", "MIN"),
			Map.entry("max", "MAX"),
			Map.entry("round", "ROUND"),
			Map.entry("sum", "SUM"),
			Map.entry("ord", "ASC"),
			Map.entry("chr", "CHR"),
			Map.entry("input", "INPUT")
	);

	private static final Map<String, String> STRING_METHODS = Map.of(
			"upper", "UCASE",
			"lower", "LCASE",
			"strip", "TRIM",
			"split", "SPLIT",
			"find", "FIND",
			"replace", "REPLACE"
	);

	private static final Set<String> KNOWN_GLOBALS = Set.of(
			"print", "input", "len", "int", "float", "str", "bool", "abs", "min", "max", "round", "sum",
			"range", "list", "sorted", "reversed", "enumerate", "zip", "ord", "chr", "type", "isinstance",
			"math", "random", "self", "super", "__name__"
	);

	private final ConversionContext context;

	public ExpressionVisitor(ConversionContext context)
	{
		this.context = context;
	}

	public String render(Expr expr)
	{
		return expr == null ? "" : expr.accept(this);
	}

	public String renderList(List<Expr> exprs)
	{
		List<String> parts = new ArrayList<>();
		for (Expr e : exprs)
		{
			parts.add(render(e));
		}
		return String.join(", ", parts);
	}

	/**
	 * Arguments in call order; keyword arguments follow the positional ones by value.
	 */
	public String renderArguments(Expr.Call call)
	{
		List<String> parts = new ArrayList<>();
		for (Expr arg : call.args())
		{
			parts.add(render(arg));
		}
		for (Expr.Keyword keyword : call.keywords())
		{
			parts.add(render(keyword.value()));
		}
		return String.join(", ", parts);
	}

	// ------------------------------------------------------------------ rebasing

	/**
	 * One-based index for a zero-based source index: literals are shifted at build time,
	 * negative literals count from {@code LENGTH(base)}, anything else gets {@code + 1}.
	 */
	public String rebaseIndex(Expr index, String baseText)
	{
		Long literal = index instanceof Expr.Num num ? num.longValue() : null;
		if (literal != null && literal > Long.MIN_VALUE && literal < Long.MAX_VALUE)
		{
			long value = literal;
			if (value >= 0)
			{
				return Long.toString(value + 1);
			}
			long fromEnd = -value;
			return fromEnd == 1 ? "LENGTH(" + baseText + ")" : "LENGTH(" + baseText + ") - " + (fromEnd - 1);
		}
		if (index instanceof Expr.Str)
		{
			return render(index);
		}
		return render(index) + " + 1";
	}

	// ------------------------------------------------------------------ literals and names

	@Override
	public String visitName(Expr.Name expr)
	{
		String id = expr.id();
		Optional<String> substituted = context.substitution(id);
		if (substituted.isPresent())
		{
			return substituted.get();
		}
		if (!isKnown(id) && context.markReported(id))
		{
			context.getErrorHandler().logWarning(DiagnosticKind.NAME, context.getLine(),
					"Name '" + id + "' is used before it is defined");
		}
		return id;
	}

	private boolean isKnown(String id)
	{
		return KNOWN_GLOBALS.contains(id)
				|| context.getScopes().findVariable(id).isPresent()
				|| context.getScopes().findFunction(id).isPresent()
				|| context.getClasses().isClass(id);
	}

	@Override
	public String visitNum(Expr.Num expr)
	{
		return expr.text();
	}

	@Override
	public String visitStr(Expr.Str expr)
	{
		return quote(expr.value());
	}

	static String quote(String value)
	{
		return "\"" + value.replace("\n", "\\n") + "\"";
	}

	@Override
	public String visitFString(Expr.FString expr)
	{
		List<String> parts = new ArrayList<>();
		for (Expr part : expr.parts())
		{
			if (part instanceof Expr.Str str && str.value().isEmpty())
			{
				continue;
			}
			parts.add(render(part));
		}
		return parts.isEmpty() ? "\"\"" : String.join(" & ", parts);
	}

	@Override
	public String visitBool(Expr.Bool expr)
	{
		return expr.value() ? "TRUE" : "FALSE";
	}

	@Override
	public String visitNone(Expr.NoneLit expr)
	{
		return "NULL";
	}

	@Override
	public String visitList(Expr.ListDisplay expr)
	{
		return "[" + renderList(expr.elements()) + "]";
	}

	@Override
	public String visitTuple(Expr.TupleDisplay expr)
	{
		return renderList(expr.elements());
	}

	@Override
	public String visitSet(Expr.SetDisplay expr)
	{
		return "[" + renderList(expr.elements()) + "]";
	}

	@Override
	public String visitDict(Expr.DictDisplay expr)
	{
		List<String> entries = new ArrayList<>();
		for (int i = 0; i < expr.keys().size(); i++)
		{
			entries.add(render(expr.keys().get(i)) + " : " + render(expr.values().get(i)));
		}
		return "{" + String.join(", ", entries) + "}";
	}

	// ------------------------------------------------------------------ operators

	@Override
	public String visitBinary(Expr.Binary expr)
	{
		String op = expr.op();
		if (op.equals("+") && (isConcatenation(expr.left()) || isConcatenation(expr.right())))
		{
			op = "&";
		}
		else
		{
			op = BINARY_OPERATORS.getOrDefault(op, op);
		}
		return render(expr.left()) + " " + op + " " + render(expr.right());
	}

	private boolean isConcatenation(Expr operand)
	{
		return context.getTypes().isCertainlyString(operand);
	}

	@Override
	public String visitUnary(Expr.Unary expr)
	{
		return switch (expr.op())
		{
			case "not" -> "NOT " + render(expr.operand());
			case "+" -> render(expr.operand());
			default -> expr.op() + render(expr.operand());
		};
	}

	@Override
	public String visitCompare(Expr.Compare expr)
	{
		String op = COMPARE_OPERATORS.getOrDefault(expr.op(), expr.op());
		return render(expr.left()) + " " + op + " " + render(expr.right());
	}

	@Override
	public String visitBoolOp(Expr.BoolOp expr)
	{
		return render(expr.left()) + " " + expr.op().toUpperCase() + " " + render(expr.right());
	}

	// ------------------------------------------------------------------ calls

	@Override
	public String visitCall(Expr.Call expr)
	{
		String callee = expr.calleeName();
		if (callee != null)
		{
			if (context.getClasses().isClass(callee))
			{
				String prefix = context.getClasses().isRecord(callee) ? "" : "NEW ";
				return prefix + callee + "(" + renderArguments(expr) + ")";
			}
			boolean shadowed = context.getScopes().findFunction(callee).isPresent();
			if (!shadowed && callee.equals("print"))
			{
				return "OUTPUT " + renderArguments(expr);
			}
			if (!shadowed && BUILTINS.containsKey(callee))
			{
				return BUILTINS.get(callee) + "(" + renderArguments(expr) + ")";
			}
			if (!isKnown(callee) && context.markReported(callee))
			{
				context.getErrorHandler().logWarning(DiagnosticKind.NAME, context.getLine(),
						"Function '" + callee + "' is not defined in this file");
			}
			return callee + "(" + renderArguments(expr) + ")";
		}
		if (expr.func() instanceof Expr.Attribute method)
		{
			return renderMethodCall(method, expr);
		}
		return render(expr.func()) + "(" + renderArguments(expr) + ")";
	}

	private String renderMethodCall(Expr.Attribute method, Expr.Call call)
	{
		String name = method.attr();
		Expr receiver = method.value();

		if (receiver instanceof Expr.Call inner && "super".equals(inner.calleeName()))
		{
			return "SUPER." + (name.equals("__init__") ? "NEW" : name) + "(" + renderArguments(call) + ")";
		}
		if (receiver instanceof Expr.Name module && context.getScopes().findVariable(module.id()).isEmpty())
		{
			if (module.id().equals("random") && name.equals("randint"))
			{
				return "RANDOM_INT(" + renderArguments(call) + ")";
			}
			if (module.id().equals("random") && name.equals("random"))
			{
				return "RANDOM()";
			}
		}
		if (isSelf(receiver))
		{
			return name + "(" + renderArguments(call) + ")";
		}

		TypeRef receiverType = context.getTypes().infer(receiver);
		boolean userMethod = receiverType.isInstance() && context.getClasses().hasMethod(receiverType.className(), name);
		if (!userMethod && STRING_METHODS.containsKey(name) && !receiverType.is(DataType.ARRAY))
		{
			String args = renderArguments(call);
			return STRING_METHODS.get(name) + "(" + render(receiver) + (args.isEmpty() ? "" : ", " + args) + ")";
		}
		return render(receiver) + "." + name + "(" + renderArguments(call) + ")";
	}

	private boolean isSelf(Expr expr)
	{
		return context.isInClass() && expr instanceof Expr.Name name && name.id().equals("self");
	}

	// ------------------------------------------------------------------ access

	@Override
	public String visitAttribute(Expr.Attribute expr)
	{
		if (isSelf(expr.value()))
		{
			return expr.attr();
		}
		return render(expr.value()) + "." + expr.attr();
	}

	@Override
	public String visitSubscript(Expr.Subscript expr)
	{
		if (expr.index() instanceof Expr.Slice slice)
		{
			return renderSlice(expr.value(), slice);
		}
		if (expr.value() instanceof Expr.Subscript inner && !(inner.index() instanceof Expr.Slice)
				&& !(inner.value() instanceof Expr.Subscript) && isTable(inner.value()))
		{
			// a[i][j] -> a[i + 1, j + 1]
			String base = render(inner.value());
			return base + "[" + rebaseIndex(inner.index(), base) + ", " + rebaseIndex(expr.index(), base) + "]";
		}

		String base = render(expr.value());
		TypeRef containerType = context.getTypes().infer(expr.value());
		if (containerType.is(DataType.RECORD) && !containerType.isInstance())
		{
			// dictionary lookup, keys are not positions
			return base + "[" + render(expr.index()) + "]";
		}
		if (expr.index() instanceof Expr.TupleDisplay tuple)
		{
			List<String> indices = new ArrayList<>();
			for (Expr index : tuple.elements())
			{
				indices.add(rebaseIndex(index, base));
			}
			return base + "[" + String.join(", ", indices) + "]";
		}
		return base + "[" + rebaseIndex(expr.index(), base) + "]";
	}

	/**
	 * Whether {@code expr} is a two-dimensional array: declared with columns, or an array whose
	 * elements are arrays or unknown.
	 */
	private boolean isTable(Expr expr)
	{
		if (expr instanceof Expr.Name name)
		{
			Optional<VariableSymbol> symbol = context.getScopes().findVariable(name.id());
			if (symbol.isPresent() && symbol.get().getColumnsText() != null)
			{
				return true;
			}
		}
		TypeRef type = context.getTypes().infer(expr);
		return type.is(DataType.ARRAY) && (type.element() == null || type.element().is(DataType.ARRAY));
	}

	private boolean isArray(Expr expr)
	{
		return context.getTypes().infer(expr).is(DataType.ARRAY);
	}

	/**
	 * {@code s[a:b]} becomes {@code SUBSTRING(s, a + 1, b - a)}; missing bounds default to the
	 * start and the end of the string.
	 */
	private String renderSlice(Expr value, Expr.Slice slice)
	{
		String base = render(value);
		if (slice.step() != null)
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, context.getLine(),
					"Slice step is not supported and was ignored");
		}
		if (isArray(value))
		{
			context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, context.getLine(),
					"Array slices have no pseudocode equivalent; rendered as SUBSTRING");
		}

		Expr lower = slice.lower();
		Expr upper = slice.upper();
		String start = lower == null ? "1" : rebaseIndex(lower, base);
		String length;
		Long lowerValue = literal(lower);
		Long upperValue = literal(upper);
		if (upper == null)
		{
			if (lower == null)
			{
				length = "LENGTH(" + base + ")";
			}
			else if (lowerValue != null && lowerValue < 0)
			{
				length = Long.toString(-lowerValue);
			}
			else
			{
				length = "LENGTH(" + base + ") - " + render(lower);
			}
		}
		else if (upperValue != null && upperValue < 0)
		{
			String end = "LENGTH(" + base + ") - " + (-upperValue);
			length = lower == null ? end : end + " - " + render(lower);
		}
		else if (upperValue != null && (lower == null || lowerValue != null))
		{
			length = Long.toString(upperValue - (lowerValue == null ? 0 : lowerValue));
		}
		else
		{
			length = lower == null ? render(upper) : render(upper) + " - " + render(lower);
		}
		return "SUBSTRING(" + base + ", " + start + ", " + length + ")";
	}

	private static Long literal(Expr expr)
	{
		return expr instanceof Expr.Num num ? num.longValue() : null;
	}

	@Override
	public String visitSlice(Expr.Slice expr)
	{
		return render(expr.lower()) + ":" + render(expr.upper());
	}

	@Override
	public String visitConditional(Expr.Conditional expr)
	{
		context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, context.getLine(),
				"Conditional expressions have no pseudocode equivalent");
		return expr.text();
	}

	@Override
	public String visitParen(Expr.Paren expr)
	{
		return "(" + render(expr.inner()) + ")";
	}

	@Override
	public String visitUnsupported(Expr.Unsupported expr)
	{
		context.getErrorHandler().logWarning(DiagnosticKind.UNSUPPORTED_FEATURE, context.getLine(),
				"Unsupported expression (" + expr.description() + "): " + expr.text());
		return expr.text();
	}
}
