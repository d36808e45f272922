package org.pseudoc.semantic;

import org.pseudoc.semantic.info.ClassInfo;

/**
 * Decides whether a class is rendered as a plain TYPE record or as a full CLASS.
 */
public enum RecordPolicy
{
	/**
	 * Record when the class has no bases, is not a base of another class, defines no methods
	 * or class-level attributes, and its constructor only copies parameters into fields.
	 */
	AUTO,
	/**
	 * Every class is a full class.
	 */
	CLASS,
	/**
	 * Record whenever the class has no inheritance relation and no methods besides the constructor.
	 */
	RECORD;

	public boolean isRecord(ClassInfo info, boolean usedAsBase)
	{
		boolean standalone = info.bases().isEmpty() && !usedAsBase && info.methods().isEmpty();
		return switch (this)
		{
			case AUTO -> standalone && info.hasConstructor() && info.plainConstructor() && !info.hasClassLevelFields();
			case RECORD -> standalone;
			case CLASS -> false;
		};
	}
}
