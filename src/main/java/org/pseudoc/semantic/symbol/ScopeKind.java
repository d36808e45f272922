// File: src/main/java/org/pseudoc/semantic/symbol/ScopeKind.java
package org.pseudoc.semantic.symbol;

public enum ScopeKind
{
	GLOBAL,
	FUNCTION,
	CLASS,
	BLOCK,
	FOR,
	WHILE
}
