package org.pseudoc.dto;

public class StatisticsDTO
{
	public int sourceLines;
	public int outputLines;
	public int outputCharacters;
	public int nodes;
	public int functions;
	public int classes;
	public int variables;
	public long parseTimeMs;
	public long renderTimeMs;
	public long totalTimeMs;
}
