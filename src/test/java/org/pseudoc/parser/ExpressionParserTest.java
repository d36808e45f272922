package org.pseudoc.parser;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pseudoc.ast.Expr;
import org.pseudoc.util.ErrorHandler;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Expression parser")
class ExpressionParserTest
{
	private ErrorHandler errors;
	private ExpressionParser parser;

	@BeforeEach
	void setUp()
	{
		errors = new ErrorHandler();
		parser = new ExpressionParser(errors);
	}

	private Expr parse(String text)
	{
		Optional<Expr> result = parser.parse(text, 1);
		assertTrue(result.isPresent(), () -> "failed to parse: " + text + " " + errors.getErrors());
		return result.get();
	}

	@Nested
	@DisplayName("Literals")
	class Literals
	{
		@Test
		void numbers()
		{
			assertEquals(new Expr.Num("42", true), parse("42"));
			assertEquals(new Expr.Num("3.5", false), parse("3.5"));
			assertEquals(new Expr.Num("1000", true), parse("1_000"));
			assertEquals(new Expr.Num("255", true), parse("0xff"));
			assertEquals(new Expr.Num("0.5", false), parse(".5"));
		}

		@Test
		void negativeNumberFoldsIntoTheLiteral()
		{
			assertEquals(new Expr.Num("-1", true), parse("-1"));
		}

		@Test
		void stringsAndConcatenation()
		{
			assertEquals(new Expr.Str("hi"), parse("'hi'"));
			assertEquals(new Expr.Str("ab"), parse("'a' \"b\""));
			assertEquals(new Expr.Str("it's"), parse("\"it's\""));
		}

		@Test
		void booleansAndNone()
		{
			assertEquals(new Expr.Bool(true), parse("True"));
			assertEquals(new Expr.Bool(false), parse("False"));
			assertEquals(new Expr.NoneLit(), parse("None"));
		}

		@Test
		void formattedString()
		{
			Expr.FString f = assertInstanceOf(Expr.FString.class, parse("f\"Hello {name}, you are {age:.1f}\""));
			assertEquals(List.of(
					new Expr.Str("Hello "),
					new Expr.Name("name"),
					new Expr.Str(", you are "),
					new Expr.Name("age")), f.parts());
		}

		@Test
		void displays()
		{
			assertEquals(new Expr.ListDisplay(List.of()), parse("[]"));
			assertEquals(3, assertInstanceOf(Expr.ListDisplay.class, parse("[1, 2, 3]")).elements().size());
			assertInstanceOf(Expr.TupleDisplay.class, parse("(1, 2)"));
			assertInstanceOf(Expr.TupleDisplay.class, parse("a, b"));
			assertInstanceOf(Expr.SetDisplay.class, parse("{1, 2}"));
			Expr.DictDisplay dict = assertInstanceOf(Expr.DictDisplay.class, parse("{'a': 1, 'b': 2}"));
			assertEquals(List.of(new Expr.Str("a"), new Expr.Str("b")), dict.keys());
		}
	}

	@Nested
	@DisplayName("Operators")
	class Operators
	{
		@Test
		void multiplicationBindsTighterThanAddition()
		{
			Expr.Binary sum = assertInstanceOf(Expr.Binary.class, parse("a + b * c"));
			assertEquals("+", sum.op());
			assertEquals("*", assertInstanceOf(Expr.Binary.class, sum.right()).op());
		}

		@Test
		void subtractionIsLeftAssociative()
		{
			Expr.Binary outer = assertInstanceOf(Expr.Binary.class, parse("a - b - c"));
			assertEquals(new Expr.Name("c"), outer.right());
			assertInstanceOf(Expr.Binary.class, outer.left());
		}

		@Test
		void powerIsRightAssociative()
		{
			Expr.Binary outer = assertInstanceOf(Expr.Binary.class, parse("2 ** 3 ** 2"));
			assertEquals(new Expr.Num("2", true), outer.left());
			assertInstanceOf(Expr.Binary.class, outer.right());
		}

		@Test
		void comparisonsAndBooleanOperators()
		{
			Expr.BoolOp or = assertInstanceOf(Expr.BoolOp.class, parse("a < 1 or not b and c"));
			assertEquals("or", or.op());
			assertInstanceOf(Expr.Compare.class, or.left());
			Expr.BoolOp and = assertInstanceOf(Expr.BoolOp.class, or.right());
			assertEquals(new Expr.Unary("not", new Expr.Name("b")), and.left());
		}

		@Test
		void multiWordComparisons()
		{
			assertEquals("not in", assertInstanceOf(Expr.Compare.class, parse("x not in items")).op());
			assertEquals("is not", assertInstanceOf(Expr.Compare.class, parse("x is not None")).op());
		}

		@Test
		void parenthesesArePreserved()
		{
			Expr.Binary product = assertInstanceOf(Expr.Binary.class, parse("(a + b) * 2"));
			assertInstanceOf(Expr.Paren.class, product.left());
		}

		@Test
		void conditionalExpression()
		{
			Expr.Conditional c = assertInstanceOf(Expr.Conditional.class, parse("a if ok else b"));
			assertEquals(new Expr.Name("ok"), c.test());
		}
	}

	@Nested
	@DisplayName("Trailers")
	class Trailers
	{
		@Test
		void callWithKeywords()
		{
			Expr.Call call = assertInstanceOf(Expr.Call.class, parse("print(a, b, sep='-')"));
			assertEquals("print", call.calleeName());
			assertEquals(2, call.args().size());
			assertEquals(List.of(new Expr.Keyword("sep", new Expr.Str("-"))), call.keywords());
		}

		@Test
		void methodCallOnAttribute()
		{
			Expr.Call call = assertInstanceOf(Expr.Call.class, parse("self.items.append(x)"));
			Expr.Attribute method = assertInstanceOf(Expr.Attribute.class, call.func());
			assertEquals("append", method.attr());
			assertEquals(new Expr.Attribute(new Expr.Name("self"), "items"), method.value());
		}

		@Test
		void subscriptsAndSlices()
		{
			Expr.Subscript nested = assertInstanceOf(Expr.Subscript.class, parse("grid[i][j]"));
			assertInstanceOf(Expr.Subscript.class, nested.value());

			Expr.Subscript slice = assertInstanceOf(Expr.Subscript.class, parse("s[1:3]"));
			assertEquals(new Expr.Slice(new Expr.Num("1", true), new Expr.Num("3", true), null), slice.index());

			Expr.Subscript open = assertInstanceOf(Expr.Subscript.class, parse("s[:n]"));
			assertNull(((Expr.Slice) open.index()).lower());
		}
	}

	@Nested
	@DisplayName("Unsupported shapes")
	class UnsupportedShapes
	{
		@Test
		void comprehensionsAndLambdasAreRecognised()
		{
			assertEquals("list comprehension",
					assertInstanceOf(Expr.Unsupported.class, parse("[x * 2 for x in items]")).description());
			assertEquals("lambda expression",
					assertInstanceOf(Expr.Unsupported.class, parse("lambda x: x + 1")).description());
			Expr.Call call = assertInstanceOf(Expr.Call.class, parse("f(*args)"));
			assertInstanceOf(Expr.Unsupported.class, call.args().get(0));
		}

		@Test
		void syntaxErrorGivesEmptyResultAndDiagnostic()
		{
			assertTrue(parser.parse("a +", 7).isEmpty());
			assertTrue(errors.hasErrors());
			assertEquals(7, errors.getErrors().get(0).line());
		}

		@Test
		void parseOrRawKeepsTheText()
		{
			Expr raw = parser.parseOrRaw("a $ b", 1);
			assertEquals(new Expr.Unsupported("unparsed expression", "a $ b"), raw);
		}
	}
}
