// File: src/main/java/org/pseudoc/semantic/type/DataType.java
package org.pseudoc.semantic.type;

/**
 * The pseudocode data types the inference engine can assign.
 */
public enum DataType
{
	INTEGER,
	REAL,
	STRING,
	BOOLEAN,
	ARRAY,
	RECORD,
	ANY;

	public boolean isNumeric()
	{
		return this == INTEGER || this == REAL;
	}

	/**
	 * Widest numeric type of the two, or null when either side is not numeric.
	 */
	public static DataType promote(DataType a, DataType b)
	{
		if (!a.isNumeric() || !b.isNumeric())
		{
			return null;
		}
		return a == REAL || b == REAL ? REAL : INTEGER;
	}
}
