// File: src/main/java/org/pseudoc/semantic/symbol/Symbol.java
package org.pseudoc.semantic.symbol;

import org.pseudoc.semantic.type.TypeRef;

public interface Symbol
{
	String getName();

	TypeRef getType();
}
