package org.pseudoc.util;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.pseudoc.config.ConversionOptions;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads {@link ConversionOptions} from JSON. Keys mirror the option field names; unknown keys
 * are ignored. A file that cannot be read or parsed is reported and the defaults are returned.
 */
public class ConfigLoader
{
	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	public static ConversionOptions load(Path path, ErrorHandler errorHandler)
	{
		if (path == null)
		{
			return new ConversionOptions();
		}
		try
		{
			Debug.logDebug("Loading configuration from " + path);
			return parse(Files.readString(path), errorHandler);
		}
		catch (IOException e)
		{
			errorHandler.logError(DiagnosticKind.VALIDATION, null, "Cannot read configuration file " + path + ": " + e.getMessage());
			return new ConversionOptions();
		}
	}

	public static ConversionOptions parse(String json, ErrorHandler errorHandler)
	{
		try
		{
			ConversionOptions options = GSON.fromJson(json, ConversionOptions.class);
			return options == null ? new ConversionOptions() : options;
		}
		catch (JsonParseException e)
		{
			errorHandler.logError(DiagnosticKind.VALIDATION, null, "Malformed configuration: " + e.getMessage());
			return new ConversionOptions();
		}
	}

	public static String toJson(Object value)
	{
		return GSON.toJson(value);
	}
}
