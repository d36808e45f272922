package org.pseudoc.semantic;

import org.pseudoc.ast.AstScanner;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.Stmt;
import org.pseudoc.semantic.type.TypeRef;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * First call site of every bare-named callee in a source unit. Literal arguments at that call
 * are the evidence used to type unannotated parameters.
 */
public final class CallSiteIndex
{
	private final Map<String, Expr.Call> firstCalls;

	private CallSiteIndex(Map<String, Expr.Call> firstCalls)
	{
		this.firstCalls = firstCalls;
	}

	public static CallSiteIndex build(List<Stmt> body)
	{
		Map<String, Expr.Call> calls = new HashMap<>();
		new AstScanner()
		{
			@Override
			protected boolean descendIntoDefinitions()
			{
				return true;
			}

			@Override
			protected void onExpr(Expr expr)
			{
				if (expr instanceof Expr.Call call && call.calleeName() != null)
				{
					calls.putIfAbsent(call.calleeName(), call);
				}
			}
		}.scan(body);
		return new CallSiteIndex(calls);
	}

	/**
	 * Literal type of the argument bound to a parameter at the first call, matched by keyword
	 * name first and then by position.
	 */
	public Optional<TypeRef> argumentType(String callee, String parameter, int position)
	{
		Expr.Call call = firstCalls.get(callee);
		if (call == null)
		{
			return Optional.empty();
		}
		for (Expr.Keyword keyword : call.keywords())
		{
			if (parameter.equals(keyword.name()))
			{
				return Optional.ofNullable(TypeInferrer.literalType(keyword.value()));
			}
		}
		if (position < call.args().size())
		{
			return Optional.ofNullable(TypeInferrer.literalType(call.args().get(position)));
		}
		return Optional.empty();
	}
}
