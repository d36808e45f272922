package org.pseudoc.stats;

/**
 * Size of a rendered output.
 */
public record RenderStatistics(int lineCount, int characterCount, long renderTimeMs)
{
}
