package org.pseudoc.util;

import org.pseudoc.config.ConversionOptions;
import org.pseudoc.config.IndentStyle;
import org.pseudoc.config.LineEnding;
import org.pseudoc.config.OutputFormat;
import org.pseudoc.config.ParseOptions;
import org.pseudoc.config.RenderOptions;
import org.pseudoc.semantic.RecordPolicy;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds the command-line arguments of the converter. Layout and semantic flags are
 * kept as overrides and only applied on top of a configuration file by {@link #applyTo}.
 */
public class ConverterArguments
{
	private final List<Path> inputs = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	// set when parsing failed; help is printed and the exit status is non-zero
	private boolean invalid = false;
	private Path outputPath = null;
	private Path configPath = null;
	private Path emitIrPath = null;
	private boolean checkOnly = false;
	private boolean printStats = false;

	// render overrides
	private OutputFormat format = null;
	private Integer indentSize = null;
	private IndentStyle indentChar = null;
	private LineEnding lineEnding = null;
	private Integer maxLineLength = null;
	private boolean lineNumbers = false;
	private boolean noComments = false;
	private boolean lowercaseKeywords = false;
	private boolean noOperatorSpacing = false;
	private boolean noCommaSpacing = false;

	// parse overrides
	private boolean strictTypes = false;
	private boolean declareVariables = false;
	private RecordPolicy recordPolicy = null;
	private Integer maxErrors = null;
	private Integer maxDepth = null;

	private ConverterArguments()
	{
	}

	public static ConverterArguments parse(String[] args)
	{
		ConverterArguments parsedArgs = new ConverterArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true;
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs;
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true;
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				switch (arg)
				{
					case "--stats" -> parsedArgs.printStats = true;
					case "--line-numbers" -> parsedArgs.lineNumbers = true;
					case "--no-comments" -> parsedArgs.noComments = true;
					case "--lowercase-keywords" -> parsedArgs.lowercaseKeywords = true;
					case "--no-operator-spacing" -> parsedArgs.noOperatorSpacing = true;
					case "--no-comma-spacing" -> parsedArgs.noCommaSpacing = true;
					case "--strict-types" -> parsedArgs.strictTypes = true;
					case "--declare-variables" -> parsedArgs.declareVariables = true;
					default ->
					{
						i = parsedArgs.parseValued(args, i);
					}
				}
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true;
			parsedArgs.invalid = true;
		}

		return parsedArgs;
	}

	/**
	 * Handles an option that takes a value, or an input path.
	 *
	 * @return the index of the last argument consumed
	 */
	private int parseValued(String[] args, int i)
	{
		String arg = args[i];
		switch (arg)
		{
			case "-o", "--output" -> outputPath = Paths.get(getNextArg(args, ++i, arg));
			case "-c", "--config" -> configPath = Paths.get(getNextArg(args, ++i, arg));
			case "--emit-ir" -> emitIrPath = Paths.get(getNextArg(args, ++i, arg));
			case "-f", "--format" -> format = OutputFormat.fromString(getNextArg(args, ++i, arg));
			case "--indent-size" -> indentSize = getNextInt(args, ++i, arg, 0);
			case "--indent-char" -> indentChar = IndentStyle.fromString(getNextArg(args, ++i, arg));
			case "--line-ending" -> lineEnding = LineEnding.fromString(getNextArg(args, ++i, arg));
			case "--max-line-length" -> maxLineLength = getNextInt(args, ++i, arg, 0);
			case "--record-policy" -> recordPolicy = parseRecordPolicy(getNextArg(args, ++i, arg));
			case "--max-errors" -> maxErrors = getNextInt(args, ++i, arg, 1);
			case "--max-depth" -> maxDepth = getNextInt(args, ++i, arg, 1);
			default ->
			{
				if (arg.startsWith("-") && !arg.equals("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}
				inputs.add(Paths.get(arg));
			}
		}
		return i;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	private static int getNextInt(String[] args, int i, String flag, int min)
	{
		String value = getNextArg(args, i, flag);
		try
		{
			int parsed = Integer.parseInt(value);
			if (parsed < min)
			{
				throw new IllegalArgumentException("Value for " + flag + " must be at least " + min + ": " + value);
			}
			return parsed;
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("Expected a number after " + flag + ": " + value);
		}
	}

	private static RecordPolicy parseRecordPolicy(String value)
	{
		try
		{
			return RecordPolicy.valueOf(value.toUpperCase());
		}
		catch (IllegalArgumentException e)
		{
			throw new IllegalArgumentException("Invalid value for --record-policy: " + value + " (expected auto, class or record)");
		}
	}

	/**
	 * Overlays the flags given on the command line onto {@code options}, which usually come
	 * from a configuration file.
	 */
	public ConversionOptions applyTo(ConversionOptions options)
	{
		ParseOptions parse = options.getParse();
		RenderOptions render = options.getRender();

		if (verboseFlag)
		{
			parse.setDebug(true);
		}
		if (strictTypes)
		{
			parse.setStrictTypes(true);
		}
		if (declareVariables)
		{
			parse.setDeclareVariables(true);
		}
		if (recordPolicy != null)
		{
			parse.setRecordPolicy(recordPolicy);
		}
		if (maxErrors != null)
		{
			parse.setMaxErrors(maxErrors);
		}
		if (maxDepth != null)
		{
			parse.setMaxNestingDepth(maxDepth);
		}
		if (noComments)
		{
			parse.setIncludeComments(false);
			render.setIncludeComments(false);
		}

		if (format != null)
		{
			render.setFormat(format);
		}
		if (indentSize != null)
		{
			render.setIndentSize(indentSize);
		}
		if (indentChar != null)
		{
			render.setIndentChar(indentChar);
		}
		if (lineEnding != null)
		{
			render.setLineEnding(lineEnding);
		}
		if (maxLineLength != null)
		{
			render.setMaxLineLength(maxLineLength);
		}
		if (lineNumbers)
		{
			render.setIncludeLineNumbers(true);
		}
		if (lowercaseKeywords)
		{
			render.setUppercaseKeywords(false);
		}
		if (noOperatorSpacing)
		{
			render.setSpaceAroundOperators(false);
		}
		if (noCommaSpacing)
		{
			render.setSpaceAfterComma(false);
		}
		return options;
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Converts Python source files into IGCSE pseudocode.");
		System.out.println("\nUSAGE: pseudoc [options] <file|dir>...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                  Show this help message and exit.");
		System.out.println("  --version                   Show the converter version and exit.");
		System.out.println("  -v, --verbose               Enable verbose debug logging.");
		System.out.println("  -o, --output <path>         Output file (single input) or directory.");
		System.out.println("  -f, --format <format>       Output format: plain (default) or markdown.");
		System.out.println("  -c, --config <file>         Read options from a JSON configuration file.");
		System.out.println("  -k, --check                 Parse and report diagnostics only; write nothing.");
		System.out.println("  --stats                     Print conversion statistics.");
		System.out.println("  --emit-ir <file>            Write the intermediate representation as JSON.");
		System.out.println("\nLAYOUT:");
		System.out.println("  --indent-size <n>           Indentation units per level (default 3).");
		System.out.println("  --indent-char <space|tab>   Indentation character.");
		System.out.println("  --line-ending <lf|crlf>     Line terminator.");
		System.out.println("  --line-numbers              Prefix each output line with its number.");
		System.out.println("  --no-comments               Drop source comments.");
		System.out.println("  --lowercase-keywords        Write keywords in lower case.");
		System.out.println("  --no-operator-spacing       Do not put spaces around operators.");
		System.out.println("  --no-comma-spacing          Do not put a space after commas.");
		System.out.println("  --max-line-length <n>       Warn about longer lines; 0 disables (default 80).");
		System.out.println("\nSEMANTICS:");
		System.out.println("  --strict-types              Use ANY instead of STRING for unknown types.");
		System.out.println("  --declare-variables         Emit a DECLARE before the first assignment.");
		System.out.println("  --record-policy <policy>    auto (default), class or record.");
		System.out.println("  --max-errors <n>            Stop recording errors after n.");
		System.out.println("  --max-depth <n>             Maximum nesting depth of scopes.");
	}

	// --- Getters ---

	public List<Path> getInputs()
	{
		return inputs;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isInvalid()
	{
		return invalid;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getConfigPath()
	{
		return configPath;
	}

	public Path getEmitIrPath()
	{
		return emitIrPath;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isPrintStats()
	{
		return printStats;
	}

	public OutputFormat getFormat()
	{
		return format;
	}
}
