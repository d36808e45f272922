package org.pseudoc.semantic.info;

import java.util.List;
import java.util.Optional;

/**
 * What the class pre-pass learned about one class definition.
 *
 * @param plainConstructor every constructor statement is {@code self.field = parameter}
 */
public record ClassInfo(
		String name,
		List<FieldInfo> fields,
		List<ParameterInfo> constructorParameters,
		List<String> bases,
		List<String> methods,
		boolean hasConstructor,
		boolean plainConstructor,
		int line
)
{
	public ClassInfo
	{
		fields = List.copyOf(fields);
		constructorParameters = List.copyOf(constructorParameters);
		bases = List.copyOf(bases);
		methods = List.copyOf(methods);
	}

	public Optional<FieldInfo> field(String fieldName)
	{
		return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
	}

	public boolean hasClassLevelFields()
	{
		return fields.stream().anyMatch(FieldInfo::classLevel);
	}
}
