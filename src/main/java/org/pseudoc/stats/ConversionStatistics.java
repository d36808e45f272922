package org.pseudoc.stats;

public record ConversionStatistics(ParseStatistics parse, RenderStatistics render, long totalTimeMs)
{
}
