package org.pseudoc;

import org.pseudoc.config.ConversionOptions;
import org.pseudoc.dto.ConversionReportDTO;
import org.pseudoc.stats.ConversionStatistics;
import org.pseudoc.util.ConfigLoader;
import org.pseudoc.util.ConverterArguments;
import org.pseudoc.util.Debug;
import org.pseudoc.util.Diagnostic;
import org.pseudoc.util.ErrorHandler;
import org.pseudoc.util.FileUtils;
import org.pseudoc.util.IrDTOConverter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line front end: reads the inputs, converts them one after another and writes the
 * results next to them or under {@code -o}.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * Runs the converter with the given arguments.
	 *
	 * @return the process exit status: 0 when every input converted without errors, 1 otherwise
	 */
	public static int run(String[] args)
	{
		try
		{
			ConverterArguments arguments = ConverterArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				ConverterArguments.printUsage();
				return arguments.isInvalid() ? 1 : 0;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("pseudoc (Python to IGCSE pseudocode converter) version " + VERSION);
				return 0;
			}

			if (arguments.getInputs().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return 1;
			}

			ErrorHandler configErrors = new ErrorHandler();
			ConversionOptions options = arguments.applyTo(ConfigLoader.load(arguments.getConfigPath(), configErrors));
			configErrors.getErrors().forEach(d -> Debug.logError(d.format()));

			boolean success = convertAll(arguments, options) && !configErrors.hasErrors();
			return success ? 0 : 1;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Converter initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("Error reading file: " + e.getMessage());
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
		}
		return 1;
	}

	private static boolean convertAll(ConverterArguments args, ConversionOptions options) throws IOException
	{
		Converter converter = new Converter();
		List<ConversionReportDTO> reports = new ArrayList<>();
		boolean batch = args.getInputs().size() > 1 || args.getInputs().stream().anyMatch(Files::isDirectory);
		boolean success = true;
		int converted = 0;

		for (Path input : args.getInputs())
		{
			Path root = Files.isDirectory(input) ? input : null;
			List<Path> sources = FileUtils.collectSources(List.of(input));
			if (root != null && sources.isEmpty())
			{
				Debug.logWarning("No " + FileUtils.SOURCE_EXTENSION + " files found under " + input);
			}

			for (Path source : sources)
			{
				Debug.logDebug("Converting " + source);
				String text;
				try
				{
					text = FileUtils.load(source);
				}
				catch (IOException e)
				{
					Debug.logError(source + ": Error reading file: " + e.getMessage());
					success = false;
					continue;
				}
				ConversionResult result = converter.convert(text, options);
				report(source, result);
				converted++;

				if (result.hasErrors())
				{
					success = false;
				}
				if (args.isPrintStats())
				{
					printStatistics(source, result.statistics());
				}
				if (args.getEmitIrPath() != null)
				{
					reports.add(IrDTOConverter.toReport(source.toString(), result));
				}
				if (!args.isCheckOnly())
				{
					Path out = FileUtils.getOutputPath(source, args.getOutputPath(), batch, root, options.getRender().getFormat());
					FileUtils.write(out, result.code() + options.getRender().getLineEnding().getSequence());
					Debug.logInfo("Wrote " + out);
				}
			}
		}

		if (args.getEmitIrPath() != null)
		{
			Object json = reports.size() == 1 ? reports.get(0) : reports;
			FileUtils.write(args.getEmitIrPath(), ConfigLoader.toJson(json));
			Debug.logInfo("Wrote IR to: " + args.getEmitIrPath());
		}
		if (args.isCheckOnly())
		{
			if (success)
			{
				Debug.logInfo("Check passed for " + converted + " file(s). No output generated (-k flag).");
			}
			else
			{
				Debug.logError("Check failed.");
			}
		}
		return success;
	}

	private static void report(Path source, ConversionResult result)
	{
		for (Diagnostic d : result.errors())
		{
			Debug.logError(source + ": " + d.format());
		}
		for (Diagnostic d : result.warnings())
		{
			Debug.logWarning(source + ": " + d.format());
		}
	}

	private static void printStatistics(Path source, ConversionStatistics stats)
	{
		Debug.log("Statistics for " + source + ":");
		Debug.log("  source lines:   " + stats.parse().lineCount());
		Debug.log("  output lines:   " + stats.render().lineCount());
		Debug.log("  IR nodes:       " + stats.parse().nodeCount());
		Debug.log("  subroutines:    " + stats.parse().functionCount());
		Debug.log("  classes:        " + stats.parse().classCount());
		Debug.log("  variables:      " + stats.parse().variableCount());
		Debug.log("  time (ms):      " + stats.totalTimeMs() + " (parse " + stats.parse().parseTimeMs()
				+ ", render " + stats.render().renderTimeMs() + ")");
	}

	private static boolean validatePaths(ConverterArguments args)
	{
		boolean valid = true;

		for (Path input : args.getInputs())
		{
			if (!Files.exists(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
		}

		if (args.getConfigPath() != null && !Files.isRegularFile(args.getConfigPath()))
		{
			Debug.logError("Configuration file not found: " + args.getConfigPath());
			valid = false;
		}

		if (args.getOutputPath() != null && args.getInputs().size() == 1 && Files.isDirectory(args.getInputs().get(0))
				&& Files.isRegularFile(args.getOutputPath()))
		{
			Debug.logError("Output path must be a directory when converting a directory: " + args.getOutputPath());
			valid = false;
		}

		return valid;
	}
}
