package org.pseudoc.ir;

import java.util.List;

/**
 * Optional structured information attached to an IR node. Every field may be null except
 * {@code parameters} and {@code alternate}, which default to empty lists.
 */
public final class IrMeta
{
	public static final IrMeta EMPTY = builder().build();

	private final String name;
	private final List<String> parameters;
	private final String condition;
	private final String start;
	private final String end;
	private final String step;
	private final String loopVariable;
	private final List<IrNode> alternate;
	private final String dataType;
	private final String returnType;
	private final String arraySize;
	private final String elementType;
	private final String baseClass;
	private final Integer line;

	private IrMeta(Builder b)
	{
		this.name = b.name;
		this.parameters = List.copyOf(b.parameters);
		this.condition = b.condition;
		this.start = b.start;
		this.end = b.end;
		this.step = b.step;
		this.loopVariable = b.loopVariable;
		this.alternate = List.copyOf(b.alternate);
		this.dataType = b.dataType;
		this.returnType = b.returnType;
		this.arraySize = b.arraySize;
		this.elementType = b.elementType;
		this.baseClass = b.baseClass;
		this.line = b.line;
	}

	public static Builder builder()
	{
		return new Builder();
	}

	public static IrMeta atLine(int line)
	{
		return builder().line(line).build();
	}

	public String getName()
	{
		return name;
	}

	public List<String> getParameters()
	{
		return parameters;
	}

	public String getCondition()
	{
		return condition;
	}

	public String getStart()
	{
		return start;
	}

	public String getEnd()
	{
		return end;
	}

	public String getStep()
	{
		return step;
	}

	public String getLoopVariable()
	{
		return loopVariable;
	}

	/**
	 * ELSEIF/ELSE branches of an IF, in source order.
	 */
	public List<IrNode> getAlternate()
	{
		return alternate;
	}

	public String getDataType()
	{
		return dataType;
	}

	public String getReturnType()
	{
		return returnType;
	}

	public String getArraySize()
	{
		return arraySize;
	}

	public String getElementType()
	{
		return elementType;
	}

	public String getBaseClass()
	{
		return baseClass;
	}

	public Integer getLine()
	{
		return line;
	}

	public static final class Builder
	{
		private String name;
		private List<String> parameters = List.of();
		private String condition;
		private String start;
		private String end;
		private String step;
		private String loopVariable;
		private List<IrNode> alternate = List.of();
		private String dataType;
		private String returnType;
		private String arraySize;
		private String elementType;
		private String baseClass;
		private Integer line;

		private Builder()
		{
		}

		public Builder name(String name)
		{
			this.name = name;
			return this;
		}

		public Builder parameters(List<String> parameters)
		{
			this.parameters = parameters;
			return this;
		}

		public Builder condition(String condition)
		{
			this.condition = condition;
			return this;
		}

		public Builder range(String start, String end, String step)
		{
			this.start = start;
			this.end = end;
			this.step = step;
			return this;
		}

		public Builder loopVariable(String loopVariable)
		{
			this.loopVariable = loopVariable;
			return this;
		}

		public Builder alternate(List<IrNode> alternate)
		{
			this.alternate = alternate;
			return this;
		}

		public Builder dataType(String dataType)
		{
			this.dataType = dataType;
			return this;
		}

		public Builder returnType(String returnType)
		{
			this.returnType = returnType;
			return this;
		}

		public Builder array(String arraySize, String elementType)
		{
			this.arraySize = arraySize;
			this.elementType = elementType;
			return this;
		}

		public Builder baseClass(String baseClass)
		{
			this.baseClass = baseClass;
			return this;
		}

		public Builder line(Integer line)
		{
			this.line = line;
			return this;
		}

		public IrMeta build()
		{
			return new IrMeta(this);
		}
	}
}
