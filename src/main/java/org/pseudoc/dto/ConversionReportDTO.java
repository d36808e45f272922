package org.pseudoc.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON shape written by {@code --emit-ir}: the IR tree plus everything reported while producing it.
 */
public class ConversionReportDTO
{
	public String source;
	public IrNodeDTO ir;
	public List<DiagnosticDTO> errors = new ArrayList<>();
	public List<DiagnosticDTO> warnings = new ArrayList<>();
	public StatisticsDTO statistics;
}
