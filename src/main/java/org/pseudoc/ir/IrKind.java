package org.pseudoc.ir;

/**
 * Closed set of IR node kinds. The kind alone decides which closing keyword the renderer emits.
 * ENDIF and NEXT are not kinds of their own: they are the closing keywords of IF and FOR.
 * BLOCK and COMPOUND group nodes without adding a line or a nesting level.
 */
public enum IrKind
{
	MODULE,
	ASSIGN,
	ELEMENT_ASSIGN,
	ATTRIBUTE_ASSIGN,
	OUTPUT,
	INPUT,
	IF("ENDIF"),
	ELSEIF,
	ELSE,
	FOR("NEXT"),
	WHILE,
	ENDWHILE,
	REPEAT,
	UNTIL,
	BREAK,
	FUNCTION("ENDFUNCTION"),
	PROCEDURE("ENDPROCEDURE"),
	RETURN,
	ARRAY,
	ARRAY_LITERAL,
	TYPE("ENDTYPE"),
	CLASS("ENDCLASS"),
	BLOCK,
	CASE("ENDCASE"),
	STATEMENT,
	EXPRESSION,
	COMPOUND,
	COMMENT;

	private final String closingKeyword;

	IrKind()
	{
		this(null);
	}

	IrKind(String closingKeyword)
	{
		this.closingKeyword = closingKeyword;
	}

	/**
	 * Keyword that closes a block of this kind, or null. FOR is completed with the loop variable.
	 */
	public String getClosingKeyword()
	{
		return closingKeyword;
	}

	/**
	 * Kinds whose opening line must not be empty.
	 */
	public boolean requiresText()
	{
		return switch (this)
		{
			case MODULE, BLOCK, COMPOUND, ENDWHILE, REPEAT, BREAK, ELSE, COMMENT -> false;
			default -> true;
		};
	}
}
