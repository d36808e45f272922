package org.pseudoc.parser;

import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.pseudoc.ast.Expr;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;
import org.pseudoc.util.SyntaxErrorListener;

import java.util.Optional;

/**
 * Parses the expression text of one logical line with the generated PyExpr lexer/parser.
 * Syntax errors go to the conversion's {@link ErrorHandler}; on error the result is empty and
 * the caller decides what placeholder to use.
 */
public class ExpressionParser
{
	private final ErrorHandler errorHandler;

	public ExpressionParser(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * Parses an expression or a comma-separated expression list (which becomes a tuple).
	 */
	public Optional<Expr> parse(String text, int line)
	{
		if (text == null || text.isBlank())
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, line, "Expected an expression");
			return Optional.empty();
		}

		SyntaxErrorListener listener = new SyntaxErrorListener(errorHandler, line);
		PyExprLexer lexer = new PyExprLexer(CharStreams.fromString(text));
		lexer.removeErrorListeners();
		lexer.addErrorListener(listener);

		CommonTokenStream tokens = new CommonTokenStream(lexer);
		PyExprParser parser = new PyExprParser(tokens);
		parser.removeErrorListeners();
		parser.addErrorListener(listener);

		PyExprParser.ExpressionInputContext tree = parser.expressionInput();
		if (listener.getErrorCount() > 0)
		{
			return Optional.empty();
		}
		return Optional.of(new ExpressionBuilder(this, line).visit(tree));
	}

	/**
	 * Like {@link #parse} but never empty: an unparseable text becomes an
	 * {@link Expr.Unsupported} carrying the raw source, so block headers keep their structure.
	 */
	public Expr parseOrRaw(String text, int line)
	{
		return parse(text, line).orElseGet(() -> new Expr.Unsupported("unparsed expression", text == null ? "" : text.strip()));
	}
}
