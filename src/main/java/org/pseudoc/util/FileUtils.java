package org.pseudoc.util;

import org.pseudoc.config.OutputFormat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class FileUtils
{
	public static final String SOURCE_EXTENSION = ".py";

	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath);
	}

	/**
	 * Expands the command-line inputs: files are kept as given, directories are walked
	 * recursively for Python sources, in sorted order.
	 */
	public static List<Path> collectSources(List<Path> inputs) throws IOException
	{
		List<Path> sources = new ArrayList<>();
		for (Path input : inputs)
		{
			if (Files.isDirectory(input))
			{
				try (Stream<Path> walk = Files.walk(input))
				{
					sources.addAll(walk
							.filter(Files::isRegularFile)
							.filter(p -> SOURCE_EXTENSION.equals(getFileExtension(p)))
							.sorted()
							.collect(Collectors.toList()));
				}
			}
			else
			{
				sources.add(input);
			}
		}
		return sources;
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	public static String getBaseName(Path path)
	{
		return path.getFileName().toString().replaceFirst("[.][^.]+$", "");
	}

	/**
	 * Where the converted text of {@code source} goes.
	 *
	 * @param output    the {@code -o} value, or null
	 * @param batch     true when several sources are converted; {@code output} is then a directory
	 * @param inputRoot the directory the source was found under, or null; used to keep the
	 *                  relative layout when writing a batch into another directory
	 */
	public static Path getOutputPath(Path source, Path output, boolean batch, Path inputRoot, OutputFormat format)
	{
		String fileName = getBaseName(source) + format.getExtension();
		if (output == null)
		{
			return source.resolveSibling(fileName);
		}
		if (!batch && !Files.isDirectory(output))
		{
			return output;
		}
		if (inputRoot != null && source.startsWith(inputRoot))
		{
			Path relative = inputRoot.relativize(source);
			Path parent = relative.getParent();
			return parent == null ? output.resolve(fileName) : output.resolve(parent).resolve(fileName);
		}
		return output.resolve(fileName);
	}

	public static void write(Path path, String content) throws IOException
	{
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(path, content);
	}
}
