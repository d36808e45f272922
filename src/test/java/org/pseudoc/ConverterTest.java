package org.pseudoc;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.pseudoc.config.ConversionOptions;
import org.pseudoc.config.OutputFormat;
import org.pseudoc.config.ParseOptions;
import org.pseudoc.config.RenderOptions;
import org.pseudoc.ir.IrKind;
import org.pseudoc.util.Diagnostic;
import org.pseudoc.util.DiagnosticKind;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Converter end to end")
class ConverterTest
{
	private final Converter converter = new Converter();

	private String convert(String source)
	{
		ConversionResult result = converter.convert(source);
		assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
		return result.code();
	}

	private static boolean hasWarning(ConversionResult result, DiagnosticKind kind)
	{
		return result.warnings().stream().map(Diagnostic::kind).anyMatch(kind::equals);
	}

	@Nested
	@DisplayName("Sequence and selection")
	class Basics
	{
		@Test
		void assignmentAndOutput()
		{
			assertEquals("x ← 5\nOUTPUT x", convert("x = 5\nprint(x)\n"));
		}

		@Test
		void ifElifElse()
		{
			String code = convert("""
					x = 3
					if x > 0:
					    print("positive")
					elif x == 0:
					    print("zero")
					else:
					    print("negative")
					""");

			assertEquals("""
					x ← 3
					IF x > 0 THEN
					   OUTPUT "positive"
					ELSE IF x = 0 THEN
					   OUTPUT "zero"
					ELSE
					   OUTPUT "negative"
					ENDIF""", code);
		}

		@Test
		void inputWithPromptBecomesOutputThenInput()
		{
			String code = convert("age = int(input(\"Age? \"))\nprint(age + 1)\n");

			assertEquals("OUTPUT \"Age? \"\nINPUT age\nOUTPUT age + 1", code);
		}

		@Test
		void matchBecomesCase()
		{
			String code = convert("""
					day = 2
					match day:
					    case 1:
					        print("Mon")
					    case _:
					        print("Other")
					""");

			assertEquals("""
					day ← 2
					CASE OF day
					   1 : OUTPUT "Mon"
					   OTHERWISE : OUTPUT "Other"
					ENDCASE""", code);
		}

		@Test
		void commentsAreCarriedOver()
		{
			assertEquals("// note\nx ← 1", convert("# note\nx = 1\n"));
		}

		@Test
		void swapGoesThroughATemporary()
		{
			assertEquals("a ← 1\nb ← 2\ntemp ← a\na ← b\nb ← temp", convert("a = 1\nb = 2\na, b = b, a\n"));
		}
	}

	@Nested
	@DisplayName("Loops")
	class Loops
	{
		@Test
		void rangeWithOneArgumentStartsAtZero()
		{
			assertEquals("FOR i ← 0 TO 4\n   OUTPUT i\nNEXT i", convert("for i in range(5):\n    print(i)\n"));
		}

		@Test
		void rangeBounds()
		{
			assertTrue(convert("for i in range(1, 11):\n    print(i)\n").startsWith("FOR i ← 1 TO 10\n"));
			assertTrue(convert("for i in range(10, 0, -1):\n    print(i)\n").startsWith("FOR i ← 10 TO 1 STEP -1\n"));
			assertTrue(convert("for i in range(0, 10, 3):\n    print(i)\n").startsWith("FOR i ← 0 TO 9 STEP 3\n"));
			assertTrue(convert("n = 4\nfor i in range(n):\n    print(i)\n").contains("FOR i ← 0 TO n - 1\n"));
		}

		@Test
		void oversizedRangeBoundStaysSymbolic()
		{
			String code = convert("print(1)\nfor i in range(99999999999999999999):\n    print(i)\nprint(2)\n");

			assertEquals("""
					OUTPUT 1
					FOR i ← 0 TO 99999999999999999999 - 1
					   OUTPUT i
					NEXT i
					OUTPUT 2""", code);
		}

		@Test
		void whileLoopEndsWithEndwhile()
		{
			String code = convert("count = 0\nwhile count < 3:\n    count += 1\n");

			assertEquals("count ← 0\nWHILE count < 3\n   count ← count + 1\nENDWHILE", code);
		}

		@Test
		void whileTrueWithFinalBreakBecomesRepeat()
		{
			String code = convert("""
					while True:
					    guess = int(input("Guess: "))
					    if guess == 7:
					        break
					""");

			assertEquals("REPEAT\n   OUTPUT \"Guess: \"\n   INPUT guess\nUNTIL guess = 7", code);
		}

		@Test
		void iteratingAListBecomesACountedLoop()
		{
			String code = convert("""
					names = ["Ann", "Bob"]
					for name in names:
					    print(name)
					""");

			assertTrue(code.endsWith("FOR i ← 1 TO 2\n   OUTPUT names[i]\nNEXT i"), code);
		}

		@Test
		void breakOutsideALoopIsAnError()
		{
			ConversionResult result = converter.convert("break\n");

			assertTrue(result.hasErrors());
			assertEquals(DiagnosticKind.SYNTAX, result.errors().get(0).kind());
		}
	}

	@Nested
	@DisplayName("Arrays and strings")
	class Arrays
	{
		@Test
		void listLiteralIsDeclaredAndFilled()
		{
			String code = convert("numbers = [3, 1, 2]\nprint(numbers[0])\n");

			assertEquals("""
					DECLARE numbers : ARRAY[1:3] OF INTEGER
					numbers[1] ← 3
					numbers[2] ← 1
					numbers[3] ← 2
					OUTPUT numbers[1]""", code);
		}

		@Test
		void repeatedListOnlyDeclares()
		{
			assertEquals("DECLARE scores : ARRAY[1:5] OF INTEGER", convert("scores = [0] * 5\n"));
		}

		@Test
		void oversizedLiteralsKeepTheRestOfTheFile()
		{
			String code = convert("b = [0] * 3000000000\na = [1, 2]\nprint(a[99999999999999999999])\nprint(3)\n");

			assertTrue(code.startsWith("DECLARE b : ARRAY[1:3000000000] OF INTEGER"), code);
			assertTrue(code.contains("OUTPUT a[99999999999999999999 + 1]"), code);
			assertTrue(code.endsWith("OUTPUT 3"), code);
		}

		@Test
		void appendFillsTheNextSlot()
		{
			String code = convert("names = []\nnames.append(\"Ann\")\nnames.append(\"Bob\")\n");

			assertEquals("DECLARE names : ARRAY[1:100] OF STRING\nnames[1] ← \"Ann\"\nnames[2] ← \"Bob\"", code);
		}

		@Test
		void stringMethodsAndInterpolation()
		{
			String code = convert("""
					name = "ann"
					print(name.upper())
					print(f"Hi {name}!")
					""");

			assertEquals("name ← \"ann\"\nOUTPUT UCASE(name)\nOUTPUT \"Hi \" & name & \"!\"", code);
		}

		@Test
		void randomIntegers()
		{
			assertTrue(convert("import random\nroll = random.randint(1, 6)\n").endsWith("roll ← RANDOM_INT(1, 6)"));
		}

		@Test
		void stringConcatenationAndSlicing()
		{
			String code = convert("""
					s = "hello"
					print("Say " + s)
					print(s[1:3])
					print(s[-1])
					""");

			assertEquals("s ← \"hello\"\nOUTPUT \"Say \" & s\nOUTPUT SUBSTRING(s, 2, 2)\nOUTPUT s[LENGTH(s)]", code);
		}
	}

	@Nested
	@DisplayName("Functions and classes")
	class Definitions
	{
		@Test
		void functionWithInferredTypes()
		{
			String code = convert("""
					def add_one(n):
					    return n + 1

					print(add_one(4))
					""");

			assertEquals("""
					FUNCTION add_one(n : INTEGER) RETURNS INTEGER
					   RETURN n + 1
					ENDFUNCTION
					OUTPUT add_one(4)""", code);
		}

		@Test
		void procedureCallUsesCall()
		{
			String code = convert("def greet():\n    print(\"hi\")\n\ngreet()\n");

			assertEquals("PROCEDURE greet()\n   OUTPUT \"hi\"\nENDPROCEDURE\nCALL greet()", code);
		}

		@Test
		void dataOnlyClassBecomesARecord()
		{
			String code = convert("""
					class Student:
					    def __init__(self, name, age):
					        self.name = name
					        self.age = age

					s = Student("Ann", 16)
					print(s.name)
					""");

			assertTrue(code.startsWith("TYPE StudentRecord\n"), code);
			assertTrue(code.contains("   DECLARE name : STRING\n   DECLARE age : INTEGER\nENDTYPE\n"), code);
			assertTrue(code.endsWith("DECLARE s : StudentRecord\ns.name ← \"Ann\"\ns.age ← 16\nOUTPUT s.name"), code);
		}

		@Test
		void classWithMethodsStaysAClass()
		{
			String code = convert("""
					class Dog:
					    def __init__(self, name):
					        self.name = name

					    def speak(self):
					        print(self.name + " says woof")

					d = Dog("Rex")
					d.speak()
					""");

			assertTrue(code.startsWith("CLASS Dog\n   PRIVATE name : STRING\n"), code);
			assertTrue(code.contains("   PUBLIC PROCEDURE NEW(name : STRING)\n      name ← name\n   ENDPROCEDURE\n"), code);
			assertTrue(code.contains("   PUBLIC PROCEDURE speak()\n      OUTPUT name & \" says woof\"\n   ENDPROCEDURE\nENDCLASS\n"), code);
			assertTrue(code.endsWith("DECLARE d : Dog\nd ← NEW Dog(\"Rex\")\nCALL d.speak()"), code);
		}

		@Test
		void subclassCallsTheBaseConstructor()
		{
			String code = convert("""
					class Animal:
					    def __init__(self, name):
					        self.name = name

					    def speak(self):
					        print("...")

					class Dog(Animal):
					    def __init__(self, name):
					        super().__init__(name)

					    def speak(self):
					        print("Woof")

					d = Dog("Rex")
					""");

			assertTrue(code.contains("CLASS Dog INHERITS Animal\n"), code);
			assertTrue(code.contains("      SUPER.NEW(name)\n"), code);
			assertTrue(code.endsWith("d ← NEW Dog(\"Rex\")"), code);
		}

		@Test
		void instantiatedVariableIsNotReportedAsUndefined()
		{
			ConversionResult result = converter.convert("""
					class Point:
					    def __init__(self, x):
					        self.x = x

					p = Point(1)
					print(p.x)
					""");

			assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
			assertFalse(hasWarning(result, DiagnosticKind.NAME), () -> "unexpected warnings: " + result.warnings());
			assertTrue(result.code().contains("p.x ← 1"), result.code());
		}

		@Test
		void undefinedFunctionIsReportedOnce()
		{
			ConversionResult result = converter.convert("foo(1)\nfoo(2)\n");

			assertFalse(result.hasErrors());
			assertEquals(1, result.warnings().stream().filter(w -> w.kind() == DiagnosticKind.NAME).count());
		}
	}

	@Nested
	@DisplayName("Options and robustness")
	class Options
	{
		@Test
		void declareVariablesAddsDeclarations()
		{
			ConversionOptions options = new ConversionOptions(new ParseOptions().setDeclareVariables(true), new RenderOptions());

			assertEquals("DECLARE x : INTEGER\nx ← 5", converter.convert("x = 5\n", options).code());
		}

		@Test
		void documentationFormatWrapsTheCode()
		{
			ConversionOptions options = new ConversionOptions(new ParseOptions(),
					new RenderOptions().setFormat(OutputFormat.DOCUMENTATION));
			String document = converter.convert("def f():\n    pass\n", options).code();

			assertTrue(document.startsWith("# Pseudocode\n"));
			assertTrue(document.contains("- PROCEDURE `f`"));
			assertTrue(document.contains("```pseudocode\nPROCEDURE f()\nENDPROCEDURE\n```"));
		}

		@Test
		void garbageNeverThrows()
		{
			ConversionResult result = assertDoesNotThrow(() -> converter.convert("def (:\n  ))) ===\n\tif\n"));

			assertNotNull(result.code());
			assertEquals(IrKind.MODULE, result.ir().getKind());
		}

		@Test
		void nullAndEmptySourcesGiveEmptyOutput()
		{
			assertEquals("", converter.convert(null).code());
			assertEquals("", converter.convert("").code());
		}

		@Test
		void conversionIsRepeatable()
		{
			String source = "total = 0\nfor i in range(3):\n    total += i\nprint(total)\n";

			assertEquals(converter.convert(source).code(), converter.convert(source).code());
		}

		@Test
		void renderingTheSameIrTwiceIsIdentical()
		{
			ParseResult parsed = converter.parse("x = [1, 2]\nprint(x[1])\n", null);

			assertEquals(converter.render(parsed.ir(), null).code(), converter.render(parsed.ir(), null).code());
		}

		@Test
		void statisticsDescribeTheConversion()
		{
			ConversionResult result = converter.convert("def f(a):\n    return a\n\nx = f(1)\n");

			assertEquals(4, result.statistics().parse().lineCount());
			assertEquals(1, result.statistics().parse().functionCount());
			assertEquals(1, result.statistics().parse().variableCount());
			assertEquals(4, result.statistics().render().lineCount());
		}

		@Test
		void unsupportedExpressionsBecomeComments()
		{
			ConversionResult result = converter.convert("""
					x = [i for i in range(3)]
					print(lambda y: y)
					print(x)
					""");

			assertFalse(result.hasErrors(), () -> "unexpected errors: " + result.errors());
			assertEquals("""
					// Unsupported: [i for i in range(3)]
					// Unsupported: lambda y: y
					OUTPUT x""", result.code());
			assertTrue(hasWarning(result, DiagnosticKind.UNSUPPORTED_FEATURE));
			assertFalse(hasWarning(result, DiagnosticKind.NAME));
		}

		@Test
		void conditionalExpressionBecomesAComment()
		{
			String code = convert("y = True\nx = 3 if y else 4\nprint(x)\n");

			assertEquals("y ← TRUE\n// Unsupported: 3 if y else 4\nOUTPUT x", code);
		}

		@Test
		void unsupportedConstructsWarnButConvert()
		{
			ConversionResult result = converter.convert("import math\nx = 1\n");

			assertFalse(result.hasErrors());
			assertTrue(hasWarning(result, DiagnosticKind.UNSUPPORTED_FEATURE));
			assertTrue(result.code().endsWith("x ← 1"));
		}
	}
}
