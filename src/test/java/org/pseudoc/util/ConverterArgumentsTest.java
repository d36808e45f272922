package org.pseudoc.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.pseudoc.config.ConversionOptions;
import org.pseudoc.config.IndentStyle;
import org.pseudoc.config.LineEnding;
import org.pseudoc.config.OutputFormat;
import org.pseudoc.semantic.RecordPolicy;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConverterArgumentsTest
{
	@AfterEach
	void resetDebug()
	{
		Debug.ENABLE_DEBUG = false;
	}

	@Test
	void noArgumentsShowsHelp()
	{
		ConverterArguments args = ConverterArguments.parse(new String[0]);

		assertTrue(args.isHelpFlag());
		assertFalse(args.isInvalid());
	}

	@Test
	void inputsAndOutput()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{"a.py", "-o", "out", "src"});

		assertEquals(List.of(Path.of("a.py"), Path.of("src")), args.getInputs());
		assertEquals(Path.of("out"), args.getOutputPath());
		assertFalse(args.isHelpFlag());
	}

	@Test
	void modeFlags()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{"-k", "--stats", "--emit-ir", "ir.json", "-c", "cfg.json", "x.py"});

		assertTrue(args.isCheckOnly());
		assertTrue(args.isPrintStats());
		assertEquals(Path.of("ir.json"), args.getEmitIrPath());
		assertEquals(Path.of("cfg.json"), args.getConfigPath());
	}

	@Test
	void helpAndVersionStopParsing()
	{
		assertTrue(ConverterArguments.parse(new String[]{"x.py", "--help", "--bogus"}).isHelpFlag());
		ConverterArguments version = ConverterArguments.parse(new String[]{"--version"});
		assertTrue(version.isVersionFlag());
		assertFalse(version.isHelpFlag());
	}

	@Test
	void verboseEnablesDebugOutput()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{"-v", "x.py"});

		assertTrue(args.isVerboseFlag());
		assertTrue(Debug.ENABLE_DEBUG);
		assertTrue(args.applyTo(new ConversionOptions()).getParse().isDebug());
	}

	@Test
	void overridesAreAppliedOnTopOfOptions()
	{
		ConverterArguments args = ConverterArguments.parse(new String[]{
				"-f", "markdown", "--indent-size", "2", "--indent-char", "tab", "--line-ending", "crlf",
				"--max-line-length", "0", "--line-numbers", "--no-comments", "--lowercase-keywords",
				"--no-operator-spacing", "--no-comma-spacing", "--strict-types", "--declare-variables",
				"--record-policy", "class", "--max-errors", "5", "--max-depth", "8", "x.py"});
		ConversionOptions options = args.applyTo(new ConversionOptions());

		assertEquals(OutputFormat.DOCUMENTATION, args.getFormat());
		assertEquals(OutputFormat.DOCUMENTATION, options.getRender().getFormat());
		assertEquals(2, options.getRender().getIndentSize());
		assertEquals(IndentStyle.TAB, options.getRender().getIndentChar());
		assertEquals(LineEnding.CRLF, options.getRender().getLineEnding());
		assertEquals(0, options.getRender().getMaxLineLength());
		assertTrue(options.getRender().isIncludeLineNumbers());
		assertFalse(options.getRender().isIncludeComments());
		assertFalse(options.getParse().isIncludeComments());
		assertFalse(options.getRender().isUppercaseKeywords());
		assertFalse(options.getRender().isSpaceAroundOperators());
		assertFalse(options.getRender().isSpaceAfterComma());
		assertTrue(options.getParse().isStrictTypes());
		assertTrue(options.getParse().isDeclareVariables());
		assertEquals(RecordPolicy.CLASS, options.getParse().getRecordPolicy());
		assertEquals(5, options.getParse().getMaxErrors());
		assertEquals(8, options.getParse().getMaxNestingDepth());
	}

	@Test
	void unsetFlagsKeepConfiguredValues()
	{
		ConversionOptions options = new ConversionOptions();
		options.getRender().setIndentSize(6);

		ConverterArguments.parse(new String[]{"x.py"}).applyTo(options);

		assertEquals(6, options.getRender().getIndentSize());
		assertTrue(options.getRender().isIncludeComments());
	}

	@Test
	void invalidArgumentsAreFlagged()
	{
		assertTrue(ConverterArguments.parse(new String[]{"--bogus"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"x.py", "-o"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"--indent-size", "two", "x.py"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"--max-errors", "0", "x.py"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"-f", "pdf", "x.py"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"--record-policy", "maybe", "x.py"}).isInvalid());
		assertTrue(ConverterArguments.parse(new String[]{"--bogus"}).isHelpFlag());
	}
}
