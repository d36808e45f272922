package org.pseudoc.codegen;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.pseudoc.ast.Stmt;
import org.pseudoc.config.ParseOptions;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrNode;
import org.pseudoc.parser.StructuralParser;
import org.pseudoc.semantic.ClassRegistry;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.ErrorHandler;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IR generation")
class IrGeneratorTest
{
	private ErrorHandler errors;

	private IrNode generate(String source, ParseOptions options)
	{
		errors = new ErrorHandler();
		StructuralParser parser = new StructuralParser(errors, 4, true, false);
		return new IrGenerator(options, errors).generate(parser.parse(source));
	}

	private IrNode generate(String source)
	{
		return generate(source, new ParseOptions());
	}

	@Test
	void ifCarriesItsBranchesAsAlternates()
	{
		IrNode module = generate("""
				x = 1
				if x > 1:
				    x = 2
				elif x < 0:
				    x = 3
				else:
				    x = 4
				""");

		IrNode branch = module.getChildren().get(1);
		assertEquals(IrKind.IF, branch.getKind());
		assertEquals("x > 1", branch.getMeta().getCondition());
		assertEquals(List.of(IrKind.ELSEIF, IrKind.ELSE),
				branch.getMeta().getAlternate().stream().map(IrNode::getKind).toList());
		assertEquals("x < 0", branch.getMeta().getAlternate().get(0).getMeta().getCondition());
	}

	@Test
	void forLoopMetadata()
	{
		IrNode loop = generate("for k in range(2, 20, 5):\n    print(k)\n").getChildren().get(0);

		assertEquals(IrKind.FOR, loop.getKind());
		assertEquals("k", loop.getMeta().getLoopVariable());
		assertEquals("2", loop.getMeta().getStart());
		assertEquals("17", loop.getMeta().getEnd());
		assertEquals("5", loop.getMeta().getStep());
	}

	@Test
	void whileEndsWithItsTerminatorNode()
	{
		IrNode loop = generate("n = 0\nwhile n < 2:\n    n = n + 1\n").getChildren().get(1);
		List<IrNode> children = loop.getChildren();

		assertEquals(IrKind.WHILE, loop.getKind());
		assertEquals(IrKind.ENDWHILE, children.get(children.size() - 1).getKind());
	}

	@Test
	void repeatDetectionCanBeSwitchedOff()
	{
		String source = "while True:\n    x = 1\n    if x == 1:\n        break\n";

		assertEquals(IrKind.REPEAT, generate(source).getChildren().get(0).getKind());
		IrNode loop = generate(source, new ParseOptions().setDetectRepeatUntil(false)).getChildren().get(0);
		assertEquals(IrKind.WHILE, loop.getKind());
		assertFalse(errors.getWarnings().isEmpty());
	}

	@Test
	void functionsAreCallableBeforeTheirDefinition()
	{
		IrNode module = generate("main()\n\ndef main():\n    print(1)\n");

		assertEquals("CALL main()", module.getChildren().get(0).getText());
		assertTrue(errors.getWarnings().isEmpty());
	}

	@Test
	void functionMetadataListsTypedParameters()
	{
		IrNode function = generate("def area(w: float, h: float) -> float:\n    return w * h\n").getChildren().get(0);

		assertEquals(IrKind.FUNCTION, function.getKind());
		assertEquals("area", function.getMeta().getName());
		assertEquals(List.of("w : REAL", "h : REAL"), function.getMeta().getParameters());
		assertEquals("REAL", function.getMeta().getReturnType());
	}

	@Test
	void arrayDeclarationMetadata()
	{
		IrNode array = generate("grid = [[0] * 3] * 2\n").getChildren().get(0);

		assertEquals(IrKind.ARRAY, array.getKind());
		assertEquals("DECLARE grid : ARRAY[1:2, 1:3] OF INTEGER", array.getText());
		assertEquals("grid", array.getMeta().getName());
		assertEquals("2", array.getMeta().getArraySize());
		assertEquals("INTEGER", array.getMeta().getElementType());
	}

	@Test
	void nestedListLiteralFillsATable()
	{
		IrNode module = generate("m = [[1, 2], [3, 4]]\nprint(m[1][0])\n");
		List<String> lines = module.getChildren().stream().map(IrNode::getText).toList();

		assertEquals(List.of("DECLARE m : ARRAY[1:2, 1:2] OF INTEGER", "m[1, 1] ← 1", "m[1, 2] ← 2", "m[2, 1] ← 3",
				"m[2, 2] ← 4", "OUTPUT m[2, 1]"), lines);
	}

	@Test
	void appendedTypesComeFromTheFirstTypedValue()
	{
		errors = new ErrorHandler();
		List<Stmt> body = new StructuralParser(errors, 4, true, false).parse("""
				names = []
				scores = []
				def add(x):
				    scores.append(x)
				    scores.append(3.5)
				names.append("Ann")
				""").body();

		Map<String, TypeRef> types = IrGenerator.appendedTypes(body, ClassRegistry.empty());

		assertEquals(TypeRef.STRING, types.get("names"));
		assertEquals(TypeRef.REAL, types.get("scores"));
	}
}
