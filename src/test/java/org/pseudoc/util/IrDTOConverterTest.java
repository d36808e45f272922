package org.pseudoc.util;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.pseudoc.ConversionResult;
import org.pseudoc.Converter;
import org.pseudoc.dto.ConversionReportDTO;
import org.pseudoc.dto.IrNodeDTO;
import org.pseudoc.ir.IrKind;
import org.pseudoc.ir.IrMeta;
import org.pseudoc.ir.IrNode;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IrDTOConverterTest
{
	@Test
	void nodeFieldsAreCopiedAndEmptiesDropped()
	{
		IrNode loop = IrNode.block(IrKind.FOR, "FOR i ← 1 TO 3", List.of(IrNode.leaf(IrKind.OUTPUT, "OUTPUT i", 2)),
				IrMeta.builder().loopVariable("i").range("1", "3", null).line(1).build());

		IrNodeDTO dto = IrDTOConverter.toDTO(IrNode.module(List.of(loop)));

		assertEquals("MODULE", dto.kind);
		assertNull(dto.text);
		IrNodeDTO forDto = dto.children.get(0);
		assertEquals("FOR", forDto.kind);
		assertEquals("i", forDto.loopVariable);
		assertEquals("3", forDto.end);
		assertNull(forDto.step);
		assertNull(forDto.parameters);
		assertNull(forDto.alternate);
		assertEquals(1, forDto.children.size());
		assertEquals(2, forDto.children.get(0).line);
	}

	@Test
	void reportSerializesWithAlternatesAndDiagnostics()
	{
		String source = "x = 1\nif x > 0:\n    print(x)\nelse:\n    continue_here = 1\nfoo()\n";
		ConversionResult result = new Converter().convert(source);

		ConversionReportDTO report = IrDTOConverter.toReport("prog.py", result);
		JsonObject json = JsonParser.parseString(ConfigLoader.toJson(report)).getAsJsonObject();

		assertEquals("prog.py", json.get("source").getAsString());
		JsonObject branch = json.getAsJsonObject("ir").getAsJsonArray("children").get(1).getAsJsonObject();
		assertEquals("IF", branch.get("kind").getAsString());
		assertEquals("ELSE", branch.getAsJsonArray("alternate").get(0).getAsJsonObject().get("kind").getAsString());
		assertFalse(json.getAsJsonArray("warnings").isEmpty());
		assertEquals("WARNING", json.getAsJsonArray("warnings").get(0).getAsJsonObject().get("severity").getAsString());
		assertEquals(6, json.getAsJsonObject("statistics").get("sourceLines").getAsInt());
	}
}
