package org.pseudoc.semantic;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pseudoc.ast.Expr;
import org.pseudoc.ast.Stmt;
import org.pseudoc.parser.ExpressionParser;
import org.pseudoc.parser.StructuralParser;
import org.pseudoc.semantic.symbol.VariableSymbol;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.ErrorHandler;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Type inference")
class TypeInferrerTest
{
	private ErrorHandler errors;
	private ScopeManager scopes;
	private TypeInferrer inferrer;

	@BeforeEach
	void setUp()
	{
		errors = new ErrorHandler();
		scopes = new ScopeManager(errors, 50);
		inferrer = new TypeInferrer(scopes, ClassRegistry.empty(), false);
	}

	private Expr expr(String text)
	{
		return new ExpressionParser(errors).parse(text, 1).orElseThrow();
	}

	private TypeRef infer(String text)
	{
		return inferrer.infer(expr(text));
	}

	private void declare(String name, TypeRef type)
	{
		scopes.registerVariable(new VariableSymbol(name, type, 1));
	}

	@Nested
	@DisplayName("Literals and operators")
	class LiteralsAndOperators
	{
		@Test
		void literals()
		{
			assertEquals(TypeRef.INTEGER, infer("3"));
			assertEquals(TypeRef.REAL, infer("3.0"));
			assertEquals(TypeRef.STRING, infer("'x'"));
			assertEquals(TypeRef.STRING, infer("f'{x}!'"));
			assertEquals(TypeRef.BOOLEAN, infer("True"));
			assertEquals(TypeRef.array(DataType.INTEGER), infer("[1, 2, 3]"));
			assertEquals(TypeRef.array(DataType.REAL), infer("[1, 2.5]"));
			assertEquals(TypeRef.array(DataType.ANY), infer("[1, 'a']"));
			assertEquals(TypeRef.RECORD, infer("{'a': 1}"));
		}

		@Test
		void trueDivisionOfIntegersIsReal()
		{
			declare("a", TypeRef.INTEGER);
			declare("b", TypeRef.INTEGER);
			assertEquals(TypeRef.REAL, infer("a / b"));
			assertEquals(TypeRef.INTEGER, infer("a // b"));
			assertEquals(TypeRef.INTEGER, infer("a % b"));
		}

		@Test
		void additionWithAStringIsAString()
		{
			declare("name", TypeRef.STRING);
			assertEquals(TypeRef.STRING, infer("'Hello ' + name"));
			assertEquals(TypeRef.STRING, infer("name * 3"));
		}

		@Test
		void numericPromotion()
		{
			assertEquals(TypeRef.REAL, infer("1 + 2.5"));
			assertEquals(TypeRef.INTEGER, infer("2 * 3"));
		}

		@Test
		void comparisonsAndLogicAreBoolean()
		{
			assertEquals(TypeRef.BOOLEAN, infer("x > 3"));
			assertEquals(TypeRef.BOOLEAN, infer("a and b"));
			assertEquals(TypeRef.BOOLEAN, infer("not a"));
		}
	}

	@Nested
	@DisplayName("Calls and names")
	class CallsAndNames
	{
		@Test
		void builtins()
		{
			assertEquals(TypeRef.INTEGER, infer("len(items)"));
			assertEquals(TypeRef.STRING, infer("input('Name: ')"));
			assertEquals(TypeRef.REAL, infer("float(s)"));
			assertEquals(TypeRef.INTEGER, infer("round(x)"));
			assertEquals(TypeRef.REAL, infer("round(x, 2)"));
			assertEquals(TypeRef.INTEGER, infer("random.randint(1, 6)"));
		}

		@Test
		void stringMethods()
		{
			declare("s", TypeRef.STRING);
			assertEquals(TypeRef.STRING, infer("s.upper()"));
			assertEquals(TypeRef.array(DataType.STRING), infer("s.split(',')"));
			assertEquals(TypeRef.BOOLEAN, infer("s.isdigit()"));
		}

		@Test
		void arrayElementsAndSlices()
		{
			declare("scores", TypeRef.array(DataType.REAL));
			assertEquals(TypeRef.REAL, infer("scores[0]"));
			assertEquals(TypeRef.array(DataType.REAL), infer("scores[1:3]"));
			assertEquals(TypeRef.REAL, infer("max(scores)"));
		}

		@Test
		void unknownNameFallsBack()
		{
			assertEquals(TypeRef.STRING, infer("mystery"));
			TypeInferrer strict = new TypeInferrer(scopes, ClassRegistry.empty(), true);
			assertEquals(TypeRef.ANY, strict.infer(expr("mystery")));
		}

		@Test
		void certaintyOfStrings()
		{
			declare("known", TypeRef.STRING);
			VariableSymbol guessed = new VariableSymbol("guessed", TypeRef.STRING, 1);
			guessed.setCertain(false);
			scopes.registerVariable(guessed);

			assertTrue(inferrer.isCertainlyString(expr("known")));
			assertFalse(inferrer.isCertainlyString(expr("guessed")));
			assertFalse(inferrer.isCertainlyString(expr("unknown")));
			assertTrue(inferrer.isCertainlyString(expr("str(n) + x")));
		}
	}

	@Nested
	@DisplayName("Static helpers")
	class StaticHelpers
	{
		@Test
		void annotations()
		{
			assertEquals(TypeRef.INTEGER, TypeInferrer.annotationType(expr("int"), Set.of()));
			assertEquals(TypeRef.array(DataType.STRING), TypeInferrer.annotationType(expr("list[str]"), Set.of()));
			assertEquals(TypeRef.instance("Point"), TypeInferrer.annotationType(expr("Point"), Set.of("Point")));
			assertEquals(TypeRef.REAL, TypeInferrer.annotationType(expr("Optional[float]"), Set.of()));
			assertNull(TypeInferrer.annotationType(expr("Whatever"), Set.of()));
		}

		@Test
		void unify()
		{
			assertNull(TypeInferrer.unify(List.of()));
			assertEquals(TypeRef.INTEGER, TypeInferrer.unify(List.of(TypeRef.INTEGER, TypeRef.INTEGER)));
			assertEquals(TypeRef.REAL, TypeInferrer.unify(List.of(TypeRef.INTEGER, TypeRef.REAL)));
			assertEquals(TypeRef.ANY, TypeInferrer.unify(List.of(TypeRef.STRING, TypeRef.BOOLEAN)));
		}

		@Test
		void parameterTypeFromUsage()
		{
			List<Stmt> body = new StructuralParser(errors, 4, true, false).parse("""
					def f(n, word, items):
					    for i in range(n):
					        print(word.upper())
					    total = len(items)
					""").body();
			List<Stmt> fBody = ((Stmt.FunctionDef) body.get(0)).body();
			assertEquals(TypeRef.INTEGER, TypeInferrer.inferParameterType("n", fBody));
			assertEquals(TypeRef.STRING, TypeInferrer.inferParameterType("word", fBody));
			assertEquals(TypeRef.array(null), TypeInferrer.inferParameterType("items", fBody));
			assertNull(TypeInferrer.inferParameterType("other", fBody));
		}
	}
}
