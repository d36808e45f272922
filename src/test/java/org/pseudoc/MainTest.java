package org.pseudoc;

import com.google.gson.JsonElement;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@TempDir
	Path dir;

	private Path source(String name, String text) throws IOException
	{
		Path path = dir.resolve(name);
		Files.createDirectories(path.getParent());
		Files.writeString(path, text);
		return path;
	}

	@Test
	void helpAndVersion()
	{
		assertEquals(0, Main.run(new String[]{"--help"}));
		assertEquals(0, Main.run(new String[]{"--version"}));
		assertEquals(0, Main.run(new String[0]));
		assertEquals(1, Main.run(new String[]{"--no-such-flag"}));
	}

	@Test
	void convertsNextToTheSource() throws IOException
	{
		Path input = source("hello.py", "print(\"hello\")\n");

		assertEquals(0, Main.run(new String[]{input.toString()}));

		assertEquals("OUTPUT \"hello\"\n", Files.readString(dir.resolve("hello.txt")));
	}

	@Test
	void explicitOutputAndFormat() throws IOException
	{
		Path input = source("loop.py", "for i in range(3):\n    print(i)\n");
		Path output = dir.resolve("result.md");

		assertEquals(0, Main.run(new String[]{"-f", "markdown", "-o", output.toString(), input.toString()}));

		String document = Files.readString(output);
		assertTrue(document.startsWith("# Pseudocode"));
		assertTrue(document.contains("FOR i ← 0 TO 2"));
	}

	@Test
	void directoryBatchKeepsLayout() throws IOException
	{
		Path src = dir.resolve("src");
		source("src/a.py", "x = 1\n");
		source("src/pkg/b.py", "y = 2\n");
		Path out = dir.resolve("out");

		assertEquals(0, Main.run(new String[]{src.toString(), "-o", out.toString()}));

		assertEquals("x ← 1\n", Files.readString(out.resolve("a.txt")));
		assertEquals("y ← 2\n", Files.readString(out.resolve("pkg/b.txt")));
	}

	@Test
	void checkModeWritesNothing() throws IOException
	{
		Path input = source("ok.py", "x = 1\n");

		assertEquals(0, Main.run(new String[]{"-k", input.toString()}));

		assertFalse(Files.exists(dir.resolve("ok.txt")));
	}

	@Test
	void conversionErrorsGiveNonZeroStatus() throws IOException
	{
		Path input = source("bad.py", "break\n");

		assertEquals(1, Main.run(new String[]{"-k", input.toString()}));
	}

	@Test
	void unreadableFileDoesNotStopTheBatch() throws IOException
	{
		Path sources = dir.resolve("src");
		Files.createDirectories(sources);
		Files.write(sources.resolve("a_bad.py"), new byte[]{(byte) 0xC3, (byte) 0x28});
		Files.writeString(sources.resolve("b_good.py"), "print(2)\n");
		Path ir = dir.resolve("ir.json");

		assertEquals(1, Main.run(new String[]{"--emit-ir", ir.toString(), sources.toString()}));

		assertEquals("OUTPUT 2\n", Files.readString(sources.resolve("b_good.txt")));
		assertFalse(Files.exists(sources.resolve("a_bad.txt")));
		JsonElement json = JsonParser.parseString(Files.readString(ir));
		assertTrue(json.isJsonObject());
		assertTrue(json.getAsJsonObject().get("source").getAsString().endsWith("b_good.py"));
	}

	@Test
	void missingInputFails()
	{
		assertEquals(1, Main.run(new String[]{dir.resolve("absent.py").toString()}));
	}

	@Test
	void configurationFileIsApplied() throws IOException
	{
		Path input = source("cfg.py", "if True:\n    x = 1\n");
		Path config = source("pseudoc.json", "{ \"render\": { \"indentSize\": 2 } }");

		assertEquals(0, Main.run(new String[]{"-c", config.toString(), input.toString()}));

		assertEquals("IF TRUE THEN\n  x ← 1\nENDIF\n", Files.readString(dir.resolve("cfg.txt")));
	}

	@Test
	void malformedConfigurationStillConvertsButFails() throws IOException
	{
		Path input = source("m.py", "x = 1\n");
		Path config = source("broken.json", "{ nope");

		assertEquals(1, Main.run(new String[]{"-c", config.toString(), input.toString()}));
		assertTrue(Files.exists(dir.resolve("m.txt")));
	}

	@Test
	void emitIrWritesJson() throws IOException
	{
		Path first = source("one.py", "x = 1\n");
		Path second = source("two.py", "y = 2\n");
		Path single = dir.resolve("single.json");
		Path batch = dir.resolve("batch.json");

		assertEquals(0, Main.run(new String[]{"-k", "--emit-ir", single.toString(), first.toString()}));
		assertEquals(0, Main.run(new String[]{"-k", "--emit-ir", batch.toString(), first.toString(), second.toString()}));

		JsonElement one = JsonParser.parseString(Files.readString(single));
		assertTrue(one.isJsonObject());
		assertEquals("MODULE", one.getAsJsonObject().getAsJsonObject("ir").get("kind").getAsString());
		JsonElement many = JsonParser.parseString(Files.readString(batch));
		assertTrue(many.isJsonArray());
		assertEquals(2, many.getAsJsonArray().size());
	}
}
