// File: src/main/java/org/pseudoc/util/IrDTOConverter.java
package org.pseudoc.util;

import org.pseudoc.ConversionResult;
import org.pseudoc.dto.ConversionReportDTO;
import org.pseudoc.dto.DiagnosticDTO;
import org.pseudoc.dto.IrNodeDTO;
import org.pseudoc.dto.StatisticsDTO;
import org.pseudoc.ir.IrMeta;
import org.pseudoc.ir.IrNode;
import org.pseudoc.stats.ConversionStatistics;
import org.pseudoc.stats.ParseStatistics;
import org.pseudoc.stats.RenderStatistics;

import java.util.List;

public class IrDTOConverter
{
	public static ConversionReportDTO toReport(String source, ConversionResult result)
	{
		ConversionReportDTO dto = new ConversionReportDTO();
		dto.source = source;
		dto.ir = toDTO(result.ir());
		result.errors().forEach(d -> dto.errors.add(toDTO(d)));
		result.warnings().forEach(d -> dto.warnings.add(toDTO(d)));
		dto.statistics = toDTO(result.statistics());
		return dto;
	}

	public static IrNodeDTO toDTO(IrNode node)
	{
		IrNodeDTO dto = new IrNodeDTO();
		dto.kind = node.getKind().name();
		dto.text = node.getText().isEmpty() ? null : node.getText();

		IrMeta meta = node.getMeta();
		dto.line = meta.getLine();
		dto.name = meta.getName();
		dto.parameters = meta.getParameters().isEmpty() ? null : List.copyOf(meta.getParameters());
		dto.condition = meta.getCondition();
		dto.start = meta.getStart();
		dto.end = meta.getEnd();
		dto.step = meta.getStep();
		dto.loopVariable = meta.getLoopVariable();
		dto.dataType = meta.getDataType();
		dto.returnType = meta.getReturnType();
		dto.arraySize = meta.getArraySize();
		dto.elementType = meta.getElementType();
		dto.baseClass = meta.getBaseClass();

		for (IrNode child : node.getChildren())
		{
			dto.children.add(toDTO(child));
		}
		if (!meta.getAlternate().isEmpty())
		{
			dto.alternate = meta.getAlternate().stream().map(IrDTOConverter::toDTO).toList();
		}
		return dto;
	}

	public static DiagnosticDTO toDTO(Diagnostic diagnostic)
	{
		DiagnosticDTO dto = new DiagnosticDTO();
		dto.severity = diagnostic.severity().name();
		dto.kind = diagnostic.kind().name();
		dto.line = diagnostic.line();
		dto.column = diagnostic.column();
		dto.message = diagnostic.message();
		return dto;
	}

	public static StatisticsDTO toDTO(ConversionStatistics statistics)
	{
		StatisticsDTO dto = new StatisticsDTO();
		ParseStatistics parse = statistics.parse();
		RenderStatistics render = statistics.render();
		dto.sourceLines = parse.lineCount();
		dto.nodes = parse.nodeCount();
		dto.functions = parse.functionCount();
		dto.classes = parse.classCount();
		dto.variables = parse.variableCount();
		dto.parseTimeMs = parse.parseTimeMs();
		dto.outputLines = render.lineCount();
		dto.outputCharacters = render.characterCount();
		dto.renderTimeMs = render.renderTimeMs();
		dto.totalTimeMs = statistics.totalTimeMs();
		return dto;
	}
}
