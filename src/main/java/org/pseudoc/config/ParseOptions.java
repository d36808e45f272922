package org.pseudoc.config;

import org.pseudoc.semantic.RecordPolicy;

/**
 * Options for {@code Converter.parse}. Field names double as the keys of the {@code parse}
 * section of a configuration file.
 */
public class ParseOptions
{
	private boolean debug = false;
	private boolean strictTypes = false;
	private boolean includeComments = true;
	// columns per tab when measuring the indentation of the input
	private int indentSize = 4;
	private int maxNestingDepth = 50;
	private int maxErrors = 100;
	private long timeoutMs = 5000;
	private RecordPolicy recordPolicy = RecordPolicy.AUTO;
	private boolean declareVariables = false;
	private boolean detectRepeatUntil = true;
	private int defaultArraySize = 100;

	public boolean isDebug()
	{
		return debug;
	}

	public ParseOptions setDebug(boolean debug)
	{
		this.debug = debug;
		return this;
	}

	public boolean isStrictTypes()
	{
		return strictTypes;
	}

	public ParseOptions setStrictTypes(boolean strictTypes)
	{
		this.strictTypes = strictTypes;
		return this;
	}

	public boolean isIncludeComments()
	{
		return includeComments;
	}

	public ParseOptions setIncludeComments(boolean includeComments)
	{
		this.includeComments = includeComments;
		return this;
	}

	public int getIndentSize()
	{
		return indentSize;
	}

	public ParseOptions setIndentSize(int indentSize)
	{
		this.indentSize = indentSize;
		return this;
	}

	public int getMaxNestingDepth()
	{
		return maxNestingDepth;
	}

	public ParseOptions setMaxNestingDepth(int maxNestingDepth)
	{
		this.maxNestingDepth = maxNestingDepth;
		return this;
	}

	public int getMaxErrors()
	{
		return maxErrors;
	}

	public ParseOptions setMaxErrors(int maxErrors)
	{
		this.maxErrors = maxErrors;
		return this;
	}

	public long getTimeoutMs()
	{
		return timeoutMs;
	}

	public ParseOptions setTimeoutMs(long timeoutMs)
	{
		this.timeoutMs = timeoutMs;
		return this;
	}

	public RecordPolicy getRecordPolicy()
	{
		return recordPolicy == null ? RecordPolicy.AUTO : recordPolicy;
	}

	public ParseOptions setRecordPolicy(RecordPolicy recordPolicy)
	{
		this.recordPolicy = recordPolicy;
		return this;
	}

	public boolean isDeclareVariables()
	{
		return declareVariables;
	}

	public ParseOptions setDeclareVariables(boolean declareVariables)
	{
		this.declareVariables = declareVariables;
		return this;
	}

	public boolean isDetectRepeatUntil()
	{
		return detectRepeatUntil;
	}

	public ParseOptions setDetectRepeatUntil(boolean detectRepeatUntil)
	{
		this.detectRepeatUntil = detectRepeatUntil;
		return this;
	}

	public int getDefaultArraySize()
	{
		return defaultArraySize > 0 ? defaultArraySize : 100;
	}

	public ParseOptions setDefaultArraySize(int defaultArraySize)
	{
		this.defaultArraySize = defaultArraySize;
		return this;
	}
}
