// File: src/main/java/org/pseudoc/semantic/type/TypeRef.java
package org.pseudoc.semantic.type;

/**
 * An inferred type. {@code elementType} is only meaningful for ARRAY. {@code className} names
 * the user class of a RECORD instance, or of the elements of an ARRAY of instances.
 */
public record TypeRef(DataType type, DataType elementType, String className)
{
	public static final TypeRef INTEGER = new TypeRef(DataType.INTEGER, null, null);
	public static final TypeRef REAL = new TypeRef(DataType.REAL, null, null);
	public static final TypeRef STRING = new TypeRef(DataType.STRING, null, null);
	public static final TypeRef BOOLEAN = new TypeRef(DataType.BOOLEAN, null, null);
	public static final TypeRef ANY = new TypeRef(DataType.ANY, null, null);
	public static final TypeRef RECORD = new TypeRef(DataType.RECORD, null, null);

	public static TypeRef of(DataType type)
	{
		return switch (type)
		{
			case INTEGER -> INTEGER;
			case REAL -> REAL;
			case STRING -> STRING;
			case BOOLEAN -> BOOLEAN;
			case RECORD -> RECORD;
			case ARRAY -> array(null);
			default -> ANY;
		};
	}

	public static TypeRef array(DataType elementType)
	{
		return new TypeRef(DataType.ARRAY, elementType, null);
	}

	/**
	 * Array whose elements have the given type; null means unknown elements.
	 */
	public static TypeRef arrayOf(TypeRef element)
	{
		if (element == null)
		{
			return array(null);
		}
		return new TypeRef(DataType.ARRAY, element.type(), element.className());
	}

	/**
	 * Element type of an array, or null when this is not an array or its elements are unknown.
	 */
	public TypeRef element()
	{
		if (type != DataType.ARRAY || elementType == null)
		{
			return null;
		}
		return elementType == DataType.RECORD ? new TypeRef(DataType.RECORD, null, className) : of(elementType);
	}

	public static TypeRef instance(String className)
	{
		return new TypeRef(DataType.RECORD, null, className);
	}

	public boolean is(DataType other)
	{
		return type == other;
	}

	public boolean isNumeric()
	{
		return type.isNumeric();
	}

	public boolean isInstance()
	{
		return type == DataType.RECORD && className != null;
	}

	@Override
	public String toString()
	{
		if (type == DataType.ARRAY)
		{
			return elementType == null ? "ARRAY" : "ARRAY OF " + (className != null ? className : elementType.name());
		}
		return className != null ? className : type.name();
	}
}
