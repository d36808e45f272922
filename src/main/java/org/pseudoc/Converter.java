package org.pseudoc;

import org.pseudoc.ast.ModuleNode;
import org.pseudoc.codegen.IrGenerator;
import org.pseudoc.config.ConversionOptions;
import org.pseudoc.config.OutputFormat;
import org.pseudoc.config.ParseOptions;
import org.pseudoc.config.RenderOptions;
import org.pseudoc.ir.IrNode;
import org.pseudoc.parser.StructuralParser;
import org.pseudoc.render.DocumentationRenderer;
import org.pseudoc.render.Renderer;
import org.pseudoc.render.TextRenderer;
import org.pseudoc.stats.ConversionStatistics;
import org.pseudoc.stats.ParseStatistics;
import org.pseudoc.stats.RenderStatistics;
import org.pseudoc.util.Debug;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.List;

/**
 * Entry point of the library: source text to IR ({@link #parse}), IR to text
 * ({@link #render}), or both ({@link #convert}). Every call is independent and never throws;
 * problems are reported as diagnostics on the result.
 */
public class Converter
{
	public ParseResult parse(String source, ParseOptions options)
	{
		ParseOptions opts = options == null ? new ParseOptions() : options;
		String text = source == null ? "" : source;
		ErrorHandler errorHandler = new ErrorHandler(opts.getMaxErrors(), opts.isDebug());
		long start = System.nanoTime();

		IrNode ir;
		int lineCount = (int) text.lines().count();
		try
		{
			StructuralParser parser = new StructuralParser(errorHandler, opts.getIndentSize(), opts.isIncludeComments(), opts.isDebug());
			ModuleNode module = parser.parse(text);
			ir = new IrGenerator(opts, errorHandler).generate(module);
		}
		catch (RuntimeException | StackOverflowError e)
		{
			errorHandler.logError(DiagnosticKind.SYNTAX, null, "Conversion failed: " + describe(e));
			Debug.trace(opts.isDebug(), "Parse aborted: " + e);
			ir = IrNode.module(List.of());
		}

		long elapsed = elapsedMs(start);
		if (opts.getTimeoutMs() > 0 && elapsed > opts.getTimeoutMs())
		{
			errorHandler.logWarning(DiagnosticKind.PERFORMANCE_HINT, null,
					"Parsing took " + elapsed + " ms (limit " + opts.getTimeoutMs() + " ms)");
		}
		return new ParseResult(ir, errorHandler.getErrors(), errorHandler.getWarnings(),
				ParseStatistics.of(ir, lineCount, elapsed));
	}

	public RenderResult render(IrNode ir, RenderOptions options)
	{
		RenderOptions opts = options == null ? new RenderOptions() : options;
		ErrorHandler errorHandler = new ErrorHandler();
		long start = System.nanoTime();

		String code;
		int lines;
		try
		{
			Renderer renderer = opts.getFormat() == OutputFormat.DOCUMENTATION
					? new DocumentationRenderer(opts, errorHandler)
					: new TextRenderer(opts, errorHandler);
			code = renderer.render(ir == null ? IrNode.module(List.of()) : ir);
			lines = renderer.getLineCount();
		}
		catch (RuntimeException | StackOverflowError e)
		{
			errorHandler.logError(DiagnosticKind.CONVERSION, null, "Rendering failed: " + describe(e));
			code = "";
			lines = 0;
		}

		RenderStatistics statistics = new RenderStatistics(lines, code.length(), elapsedMs(start));
		return new RenderResult(code, errorHandler.getErrors(), errorHandler.getWarnings(), statistics);
	}

	public ConversionResult convert(String source, ConversionOptions options)
	{
		ConversionOptions opts = options == null ? new ConversionOptions() : options;
		long start = System.nanoTime();
		ParseResult parsed = parse(source, opts.getParse());
		RenderResult rendered = render(parsed.ir(), opts.getRender());
		ConversionStatistics statistics = new ConversionStatistics(parsed.statistics(), rendered.statistics(), elapsedMs(start));
		return new ConversionResult(parsed, rendered, statistics);
	}

	public ConversionResult convert(String source)
	{
		return convert(source, new ConversionOptions());
	}

	private static long elapsedMs(long startNanos)
	{
		return (System.nanoTime() - startNanos) / 1_000_000;
	}

	private static String describe(Throwable e)
	{
		return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
	}
}
