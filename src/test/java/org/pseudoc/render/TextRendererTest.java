package org.pseudoc.render;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pseudoc.config.IndentStyle;
import org.pseudoc.config.LineEnding;
import org.pseudoc.config.RenderOptions;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrMeta;
import org.pseudoc.ir.IrNode;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TextRenderer")
class TextRendererTest
{
	private ErrorHandler errors;

	private String render(RenderOptions options, IrNode... nodes)
	{
		errors = new ErrorHandler();
		return new TextRenderer(options, errors).render(IrNode.module(List.of(nodes)));
	}

	private String render(IrNode... nodes)
	{
		return render(new RenderOptions(), nodes);
	}

	private static IrNode output(String value, int line)
	{
		return IrNode.leaf(IrKind.OUTPUT, "OUTPUT " + value, line);
	}

	@Nested
	@DisplayName("Block structure")
	class Blocks
	{
		@Test
		void ifWithElseClosesOnce()
		{
			IrNode otherwise = IrNode.block(IrKind.ELSE, "ELSE", List.of(output("0", 4)), IrMeta.atLine(3));
			IrNode branch = IrNode.block(IrKind.IF, "IF x > 0 THEN", List.of(output("x", 2)),
					IrMeta.builder().condition("x > 0").alternate(List.of(otherwise)).line(1).build());

			assertEquals("IF x > 0 THEN\n   OUTPUT x\nELSE\n   OUTPUT 0\nENDIF", render(branch));
			assertTrue(errors.getWarnings().isEmpty());
		}

		@Test
		void elseIfChainSharesOneEndif()
		{
			IrNode elif = IrNode.block(IrKind.ELSEIF, "ELSE IF x < 0 THEN", List.of(output("-1", 4)), IrMeta.atLine(3));
			IrNode branch = IrNode.block(IrKind.IF, "IF x > 0 THEN", List.of(output("1", 2)),
					IrMeta.builder().alternate(List.of(elif)).line(1).build());

			assertEquals("IF x > 0 THEN\n   OUTPUT 1\nELSE IF x < 0 THEN\n   OUTPUT -1\nENDIF", render(branch));
		}

		@Test
		void groupingKindsAddNoLineOrIndent()
		{
			IrNode compound = IrNode.block(IrKind.COMPOUND, "", List.of(output("2", 2)), IrMeta.atLine(2));
			IrNode group = IrNode.block(IrKind.BLOCK, "", List.of(output("1", 1), compound), IrMeta.atLine(1));

			assertEquals("OUTPUT 1\nOUTPUT 2", render(group));
			assertTrue(errors.getWarnings().isEmpty());
		}

		@Test
		void forLoopClosesWithItsVariable()
		{
			IrNode loop = IrNode.block(IrKind.FOR, "FOR i ← 1 TO 10", List.of(output("i", 2)),
					IrMeta.builder().loopVariable("i").range("1", "10", null).line(1).build());

			assertEquals("FOR i ← 1 TO 10\n   OUTPUT i\nNEXT i", render(loop));
		}

		@Test
		void nestedBlocksIndentOneLevelEach()
		{
			IrNode inner = IrNode.block(IrKind.FOR, "FOR j ← 1 TO 2", List.of(output("j", 3)),
					IrMeta.builder().loopVariable("j").line(2).build());
			IrNode outer = IrNode.block(IrKind.FOR, "FOR i ← 1 TO 2", List.of(inner),
					IrMeta.builder().loopVariable("i").line(1).build());

			assertEquals("FOR i ← 1 TO 2\n   FOR j ← 1 TO 2\n      OUTPUT j\n   NEXT j\nNEXT i", render(outer));
		}

		@Test
		void whileTerminatorIsRenderedAtLoopLevel()
		{
			IrNode loop = IrNode.block(IrKind.WHILE, "WHILE x < 5",
					List.of(IrNode.leaf(IrKind.ASSIGN, "x ← x + 1", 2), IrNode.leaf(IrKind.ENDWHILE, "ENDWHILE", 1)),
					IrMeta.builder().condition("x < 5").line(1).build());

			assertEquals("WHILE x < 5\n   x ← x + 1\nENDWHILE", render(loop));
		}

		@Test
		void repeatEndsWithItsCondition()
		{
			IrNode loop = IrNode.block(IrKind.REPEAT, "REPEAT",
					List.of(IrNode.leaf(IrKind.INPUT, "INPUT x", 2), IrNode.leaf(IrKind.UNTIL, "UNTIL x > 5", 3)),
					IrMeta.atLine(1));

			assertEquals("REPEAT\n   INPUT x\nUNTIL x > 5", render(loop));
		}

		@Test
		void procedureAndTypeUseTheirClosingKeywords()
		{
			IrNode procedure = IrNode.block(IrKind.PROCEDURE, "PROCEDURE greet()", List.of(output("\"hi\"", 2)),
					IrMeta.builder().name("greet").line(1).build());
			IrNode type = IrNode.block(IrKind.TYPE, "TYPE POINT",
					List.of(IrNode.leaf(IrKind.STATEMENT, "DECLARE x : INTEGER", 4)), IrMeta.atLine(3));

			assertEquals("PROCEDURE greet()\n   OUTPUT \"hi\"\nENDPROCEDURE\nTYPE POINT\n   DECLARE x : INTEGER\nENDTYPE",
					render(procedure, type));
		}

		@Test
		void emptyModuleRendersNothing()
		{
			assertEquals("", render());
		}
	}

	@Nested
	@DisplayName("Malformed IR")
	class Malformed
	{
		@Test
		void missingWhileTerminatorIsAddedWithWarning()
		{
			IrNode loop = IrNode.block(IrKind.WHILE, "WHILE TRUE", List.of(output("1", 2)), IrMeta.atLine(1));

			assertEquals("WHILE TRUE\n   OUTPUT 1\nENDWHILE", render(loop));
			assertEquals(1, errors.getWarnings().size());
			assertEquals(DiagnosticKind.CONVERSION, errors.getWarnings().get(0).kind());
		}

		@Test
		void emptyIfTextFallsBack()
		{
			IrNode branch = IrNode.block(IrKind.IF, "", List.of(), IrMeta.atLine(1));

			assertEquals("IF TRUE THEN\nENDIF", render(branch));
			assertFalse(errors.getWarnings().isEmpty());
		}

		@Test
		void forWithoutVariableClosesWithBareNext()
		{
			IrNode loop = IrNode.block(IrKind.FOR, "FOR x IN items", List.of(), IrMeta.atLine(1));

			assertEquals("FOR x IN items\nNEXT", render(loop));
			assertFalse(errors.getWarnings().isEmpty());
		}
	}

	@Nested
	@DisplayName("Comments")
	class Comments
	{
		@Test
		void consecutiveCommentsKeepOneLineEach()
		{
			String code = render(IrNode.leaf(IrKind.COMMENT, "first", 1), IrNode.leaf(IrKind.COMMENT, "second", 2),
					IrNode.leaf(IrKind.ASSIGN, "x ← 1", 3));

			assertEquals("// first\n// second\nx ← 1", code);
		}

		@Test
		void commentsCanBeDropped()
		{
			String code = render(new RenderOptions().setIncludeComments(false),
					IrNode.leaf(IrKind.COMMENT, "note", 1), IrNode.leaf(IrKind.ASSIGN, "x ← 1", 2));

			assertEquals("x ← 1", code);
		}

		@Test
		void coalesceMergesOnlyAdjacentRuns()
		{
			List<IrNode> merged = Renderer.coalesceComments(List.of(
					IrNode.leaf(IrKind.COMMENT, "a", 1),
					IrNode.leaf(IrKind.COMMENT, "b", 2),
					IrNode.leaf(IrKind.ASSIGN, "x ← 1", 3),
					IrNode.leaf(IrKind.COMMENT, "c", 4)));

			assertEquals(3, merged.size());
			assertEquals("a\nb", merged.get(0).getText());
			assertEquals(1, merged.get(0).getMeta().getLine());
			assertEquals("c", merged.get(2).getText());
		}
	}

	@Nested
	@DisplayName("Layout options")
	class Layout
	{
		private IrNode loop()
		{
			return IrNode.block(IrKind.FOR, "FOR i ← 1 TO 3", List.of(output("i", 2)),
					IrMeta.builder().loopVariable("i").line(1).build());
		}

		@Test
		void tabIndentation()
		{
			RenderOptions options = new RenderOptions().setIndentChar(IndentStyle.TAB).setIndentSize(1);

			assertEquals("FOR i ← 1 TO 3\n\tOUTPUT i\nNEXT i", render(options, loop()));
		}

		@Test
		void windowsLineEndings()
		{
			RenderOptions options = new RenderOptions().setLineEnding(LineEnding.CRLF);

			assertEquals("FOR i ← 1 TO 3\r\n   OUTPUT i\r\nNEXT i", render(options, loop()));
		}

		@Test
		void lineNumbersArePaddedToTheWidestNumber()
		{
			IrNode[] nodes = new IrNode[10];
			for (int i = 0; i < nodes.length; i++)
			{
				nodes[i] = output(Integer.toString(i), i + 1);
			}
			String[] lines = render(new RenderOptions().setIncludeLineNumbers(true), nodes).split("\n");

			assertEquals(" 1  OUTPUT 0", lines[0]);
			assertEquals("10  OUTPUT 9", lines[9]);
		}

		@Test
		void longLinesAreReportedNotWrapped()
		{
			String code = render(new RenderOptions().setMaxLineLength(10), output("\"a rather long literal\"", 1));

			assertEquals("OUTPUT \"a rather long literal\"", code);
			assertEquals(DiagnosticKind.LONG_LINE, errors.getWarnings().get(0).kind());
			assertEquals(1, errors.getWarnings().get(0).line());
		}

		@Test
		void renderingTwiceGivesTheSameText()
		{
			TextRenderer renderer = new TextRenderer(new RenderOptions(), new ErrorHandler());
			IrNode module = IrNode.module(List.of(loop()));

			assertEquals(renderer.render(module), renderer.render(module));
			assertEquals(3, renderer.getLineCount());
		}
	}
}
