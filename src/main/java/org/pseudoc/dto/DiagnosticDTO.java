package org.pseudoc.dto;

public class DiagnosticDTO
{
	public String severity;
	public String kind;
	public Integer line;
	public Integer column;
	public String message;
}
