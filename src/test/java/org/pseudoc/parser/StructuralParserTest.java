package org.pseudoc.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.ModuleNode;
import org.pseudoc.ast.Param;
import org.pseudoc.ast.Stmt;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Structural parser")
class StructuralParserTest
{
	private ErrorHandler errors;

	private List<Stmt> parse(String source)
	{
		errors = new ErrorHandler();
		ModuleNode module = new StructuralParser(errors, 4, true, false).parse(source);
		return module.body();
	}

	@Nested
	@DisplayName("Simple statements")
	class SimpleStatements
	{
		@Test
		void assignment()
		{
			List<Stmt> body = parse("x = 5\n");
			assertEquals(1, body.size());
			Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, body.get(0));
			assertEquals(List.of(new Expr.Name("x")), assign.targets());
			assertEquals(new Expr.Num("5", true), assign.value());
			assertEquals(1, assign.line());
			assertFalse(errors.hasErrors());
		}

		@Test
		void chainedAssignmentKeepsEveryTarget()
		{
			Stmt.Assign assign = assertInstanceOf(Stmt.Assign.class, parse("a = b = 0").get(0));
			assertEquals(List.of(new Expr.Name("a"), new Expr.Name("b")), assign.targets());
		}

		@Test
		void augmentedAssignment()
		{
			Stmt.AugAssign aug = assertInstanceOf(Stmt.AugAssign.class, parse("total += price * 2").get(0));
			assertEquals("+", aug.op());
			assertEquals(new Expr.Name("total"), aug.target());
			assertInstanceOf(Expr.Binary.class, aug.value());
		}

		@Test
		void annotatedAssignment()
		{
			Stmt.AnnAssign ann = assertInstanceOf(Stmt.AnnAssign.class, parse("count: int = 0").get(0));
			assertEquals(new Expr.Name("count"), ann.target());
			assertEquals(new Expr.Name("int"), ann.annotation());
			assertEquals(new Expr.Num("0", true), ann.value());
		}

		@Test
		void comparisonIsNotMistakenForAssignment()
		{
			Stmt.ExprStmt stmt = assertInstanceOf(Stmt.ExprStmt.class, parse("x == 5").get(0));
			assertInstanceOf(Expr.Compare.class, stmt.value());
		}

		@Test
		void keywordStatements()
		{
			List<Stmt> body = parse("pass\nbreak\ncontinue\nreturn\nreturn x\n");
			assertInstanceOf(Stmt.Pass.class, body.get(0));
			assertInstanceOf(Stmt.Break.class, body.get(1));
			assertInstanceOf(Stmt.Continue.class, body.get(2));
			assertNull(((Stmt.Return) body.get(3)).value());
			assertEquals(new Expr.Name("x"), ((Stmt.Return) body.get(4)).value());
		}

		@Test
		void semicolonsSplitSimpleStatements()
		{
			List<Stmt> body = parse("a = 1; b = 2");
			assertEquals(2, body.size());
			assertInstanceOf(Stmt.Assign.class, body.get(0));
			assertInstanceOf(Stmt.Assign.class, body.get(1));
		}

		@Test
		void importBecomesUnsupported()
		{
			Stmt.Unsupported stmt = assertInstanceOf(Stmt.Unsupported.class, parse("import math").get(0));
			assertEquals("import", stmt.keyword());
			assertEquals("import math", stmt.text());
		}

		@Test
		void docstringBecomesComment()
		{
			Stmt.Comment comment = assertInstanceOf(Stmt.Comment.class, parse("\"\"\"Module notes.\"\"\"").get(0));
			assertEquals("Module notes.", comment.text());
		}
	}

	@Nested
	@DisplayName("Comments")
	class Comments
	{
		@Test
		void standaloneAndTrailingComments()
		{
			List<Stmt> body = parse("# heading\nx = 1  # the answer\n");
			assertEquals(3, body.size());
			assertEquals(new Stmt.Comment("heading", 1), body.get(0));
			assertInstanceOf(Stmt.Assign.class, body.get(1));
			assertEquals(new Stmt.Comment("the answer", 2), body.get(2));
		}

		@Test
		void hashInsideStringIsNotAComment()
		{
			List<Stmt> body = parse("s = \"a # b\"");
			assertEquals(1, body.size());
			assertEquals(new Expr.Str("a # b"), ((Stmt.Assign) body.get(0)).value());
		}

		@Test
		void commentsAreDroppedWhenDisabled()
		{
			ErrorHandler handler = new ErrorHandler();
			ModuleNode module = new StructuralParser(handler, 4, false, false).parse("# note\nx = 1  # more\n");
			assertEquals(1, module.body().size());
		}
	}

	@Nested
	@DisplayName("Blocks")
	class Blocks
	{
		@Test
		void ifElifElseChainNestsInOrElse()
		{
			List<Stmt> body = parse("""
					if x > 0:
					    y = 1
					elif x < 0:
					    y = -1
					else:
					    y = 0
					""");
			assertEquals(1, body.size());
			Stmt.If outer = assertInstanceOf(Stmt.If.class, body.get(0));
			assertEquals(1, outer.body().size());
			assertEquals(1, outer.orElse().size());
			Stmt.If inner = assertInstanceOf(Stmt.If.class, outer.orElse().get(0));
			assertEquals(3, inner.line());
			assertEquals(1, inner.orElse().size());
			Stmt.Assign last = assertInstanceOf(Stmt.Assign.class, inner.orElse().get(0));
			assertEquals(new Expr.Num("0", true), last.value());
		}

		@Test
		void bodyEndsAtDedent()
		{
			List<Stmt> body = parse("""
					while n > 0:
					    n = n - 1
					    print(n)
					print("done")
					""");
			assertEquals(2, body.size());
			Stmt.While loop = assertInstanceOf(Stmt.While.class, body.get(0));
			assertEquals(2, loop.body().size());
			assertInstanceOf(Stmt.ExprStmt.class, body.get(1));
		}

		@Test
		void forLoopSplitsTargetAndIterable()
		{
			Stmt.For loop = assertInstanceOf(Stmt.For.class, parse("for i in range(1, 10):\n    print(i)\n").get(0));
			assertEquals(new Expr.Name("i"), loop.target());
			Expr.Call call = assertInstanceOf(Expr.Call.class, loop.iter());
			assertEquals("range", call.calleeName());
			assertEquals(2, call.args().size());
		}

		@Test
		void loopElseIsAttachedToTheLoop()
		{
			Stmt.For loop = assertInstanceOf(Stmt.For.class, parse("""
					for x in items:
					    pass
					else:
					    print("none")
					""").get(0));
			assertEquals(1, loop.orElse().size());
		}

		@Test
		void inlineBody()
		{
			Stmt.If stmt = assertInstanceOf(Stmt.If.class, parse("if ok: x = 1").get(0));
			assertEquals(1, stmt.body().size());
			assertInstanceOf(Stmt.Assign.class, stmt.body().get(0));
		}

		@Test
		void functionDefinitionWithParameters()
		{
			Stmt.FunctionDef def = assertInstanceOf(Stmt.FunctionDef.class, parse("""
					def area(width: float, height=2, *rest) -> float:
					    return width * height
					""").get(0));
			assertEquals("area", def.name());
			assertEquals(3, def.params().size());
			Param width = def.params().get(0);
			assertEquals("width", width.name());
			assertEquals(new Expr.Name("float"), width.annotation());
			Param height = def.params().get(1);
			assertEquals(new Expr.Num("2", true), height.defaultValue());
			assertTrue(def.params().get(2).variadic());
			assertEquals("rest", def.params().get(2).name());
			assertEquals(new Expr.Name("float"), def.returns());
			assertInstanceOf(Stmt.Return.class, def.body().get(0));
		}

		@Test
		void classDefinitionIgnoresObjectBase()
		{
			List<Stmt> body = parse("""
					class Dog(Animal):
					    pass
					class Point(object):
					    pass
					""");
			assertEquals(List.of("Animal"), ((Stmt.ClassDef) body.get(0)).bases());
			assertEquals(List.of(), ((Stmt.ClassDef) body.get(1)).bases());
		}

		@Test
		void matchWithWildcard()
		{
			Stmt.Match match = assertInstanceOf(Stmt.Match.class, parse("""
					match command:
					    case "go":
					        move()
					    case _:
					        stop()
					""").get(0));
			assertEquals(new Expr.Name("command"), match.subject());
			assertEquals(2, match.cases().size());
			assertEquals(new Expr.Str("go"), match.cases().get(0).pattern());
			assertNull(match.cases().get(1).pattern());
		}

		@Test
		void matchAsAVariableNameIsAnAssignment()
		{
			assertInstanceOf(Stmt.Assign.class, parse("match = 3").get(0));
		}

		@Test
		void tryBlockIsUnsupportedButKeepsItsBody()
		{
			List<Stmt> body = parse("""
					try:
					    x = 1
					except ValueError:
					    x = 0
					""");
			assertEquals(2, body.size());
			Stmt.Unsupported tryBlock = assertInstanceOf(Stmt.Unsupported.class, body.get(0));
			assertEquals("try", tryBlock.keyword());
			assertEquals(1, tryBlock.body().size());
			assertEquals("except", ((Stmt.Unsupported) body.get(1)).keyword());
		}
	}

	@Nested
	@DisplayName("Line joining")
	class LineJoining
	{
		@Test
		void openBracketsContinueTheLogicalLine()
		{
			List<Stmt> body = parse("values = [1,\n          2,\n          3]\ny = 0\n");
			assertEquals(2, body.size());
			Expr.ListDisplay list = assertInstanceOf(Expr.ListDisplay.class, ((Stmt.Assign) body.get(0)).value());
			assertEquals(3, list.elements().size());
			assertEquals(4, body.get(1).line());
		}

		@Test
		void backslashContinuation()
		{
			List<Stmt> body = parse("total = 1 + \\\n    2\n");
			assertEquals(1, body.size());
			assertInstanceOf(Expr.Binary.class, ((Stmt.Assign) body.get(0)).value());
		}
	}

	@Nested
	@DisplayName("Error recovery")
	class ErrorRecovery
	{
		@Test
		void missingColonIsReported()
		{
			List<Stmt> body = parse("if x > 0\n    y = 1\n");
			assertInstanceOf(Stmt.If.class, body.get(0));
			assertTrue(errors.getErrors().stream().anyMatch(d -> d.kind() == DiagnosticKind.SYNTAX));
		}

		@Test
		void missingBodyIsReported()
		{
			List<Stmt> body = parse("while True:\nx = 1\n");
			Stmt.While loop = assertInstanceOf(Stmt.While.class, body.get(0));
			assertTrue(loop.body().isEmpty());
			assertTrue(errors.hasErrors());
			assertEquals(2, body.size());
		}

		@Test
		void garbageLineBecomesUnknown()
		{
			List<Stmt> body = parse("x = = 3\ny = 2\n");
			assertEquals(2, body.size());
			Stmt.Unknown unknown = assertInstanceOf(Stmt.Unknown.class, body.get(0));
			assertEquals("x = = 3", unknown.text());
			assertTrue(errors.hasErrors());
		}

		@Test
		void strayElseIsReported()
		{
			List<Stmt> body = parse("else:\n    x = 1\n");
			assertInstanceOf(Stmt.Unsupported.class, body.get(0));
			assertTrue(errors.hasErrors());
		}

		@Test
		void unterminatedStringIsReported()
		{
			parse("s = \"abc\n");
			assertTrue(errors.hasErrors());
		}

		@Test
		void emptySourceGivesEmptyModule()
		{
			assertTrue(parse("").isEmpty());
			assertFalse(errors.hasErrors());
		}
	}
}
