package org.pseudoc.codegen;

import org.pseudoc.ast.AstScanner;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.ModuleNode;
import org.pseudoc.ast.Stmt;
import org.pseudoc.config.ParseOptions;
import org.pseudoc.ir.IrNode;
import org.pseudoc.semantic.CallSiteIndex;
import org.pseudoc.semantic.ClassRegistry;
import org.pseudoc.semantic.ClassRegistryBuilder;
import org.pseudoc.semantic.ScopeManager;
import org.pseudoc.semantic.TypeInferrer;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.Debug;
import org.pseudoc.util.ErrorHandler;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the discovery passes (call sites, classes, functions) and then the main walk that
 * turns the statement tree into IR.
 */
public class IrGenerator
{
	private final ParseOptions options;
	private final ErrorHandler errorHandler;

	public IrGenerator(ParseOptions options, ErrorHandler errorHandler)
	{
		this.options = options;
		this.errorHandler = errorHandler;
	}

	public IrNode generate(ModuleNode module)
	{
		List<Stmt> body = module.body();
		CallSiteIndex callSites = CallSiteIndex.build(body);
		ClassRegistry classes = new ClassRegistryBuilder(errorHandler, options.getRecordPolicy(), callSites,
				options.isStrictTypes(), options.isDebug()).build(body);

		ScopeManager scopes = new ScopeManager(errorHandler, options.getMaxNestingDepth());
		TypeInferrer types = new TypeInferrer(scopes, classes, options.isStrictTypes());
		ConversionContext context = new ConversionContext(options, errorHandler, scopes, classes, types,
				appendedTypes(body, classes));
		StatementVisitor statements = new StatementVisitor(context, callSites);

		// functions are callable before their definition
		for (Stmt stmt : body)
		{
			if (stmt instanceof Stmt.FunctionDef def)
			{
				context.setLine(def.line());
				statements.getDefinitions().declare(def, null);
			}
		}
		Debug.trace(options.isDebug(), "Discovered " + classes.size() + " classes");

		return IrNode.module(statements.convertBody(body));
	}

	/**
	 * Element type of every list that is appended to, from the first appended value with a
	 * recognisable type. Used to declare {@code x = []} before any element is known.
	 */
	static Map<String, TypeRef> appendedTypes(List<Stmt> body, ClassRegistry classes)
	{
		Map<String, TypeRef> types = new HashMap<>();
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
				if (expr instanceof Expr.Call call && call.func() instanceof Expr.Attribute method
						&& method.attr().equals("append") && method.value() instanceof Expr.Name list
						&& call.args().size() == 1 && !types.containsKey(list.id()))
				{
					Expr value = call.args().get(0);
					TypeRef type = TypeInferrer.literalType(value);
					if (type == null && value instanceof Expr.Call created && created.calleeName() != null
							&& classes.isClass(created.calleeName()))
					{
						type = TypeRef.instance(created.calleeName());
					}
					if (type != null)
					{
						types.put(list.id(), type);
					}
				}
			}
		}.scan(body);
		return types;
	}
}
