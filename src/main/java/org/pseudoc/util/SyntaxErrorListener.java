package org.pseudoc.util;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;

/**
 * Routes ANTLR lexer and parser errors for one expression into the conversion's diagnostics.
 * The expression grammar sees a single logical line, so the reported line is the source line
 * the expression came from and the column is relative to the expression text.
 */
public class SyntaxErrorListener extends BaseErrorListener
{
	private final ErrorHandler errorHandler;
	private final int sourceLine;
	private int errorCount = 0;

	public SyntaxErrorListener(ErrorHandler errorHandler, int sourceLine)
	{
		this.errorHandler = errorHandler;
		this.sourceLine = sourceLine;
	}

	@Override
	public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine, String msg, RecognitionException e)
	{
		errorCount++;
		// only the first error of an expression is interesting; the rest is recovery noise
		if (errorCount == 1)
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, sourceLine, charPositionInLine + 1, msg);
		}
	}

	public int getErrorCount()
	{
		return errorCount;
	}
}
