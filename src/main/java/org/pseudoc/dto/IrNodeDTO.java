package org.pseudoc.dto;

import java.util.ArrayList;
import java.util.List;

public class IrNodeDTO
{
	public String kind;
	public String text;
	public Integer line;
	public String name;
	public List<String> parameters;
	public String condition;
	public String start;
	public String end;
	public String step;
	public String loopVariable;
	public String dataType;
	public String returnType;
	public String arraySize;
	public String elementType;
	public String baseClass;
	public List<IrNodeDTO> children = new ArrayList<>();
	public List<IrNodeDTO> alternate;
}
