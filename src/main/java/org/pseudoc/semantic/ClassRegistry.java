package org.pseudoc.semantic;

import org.pseudoc.semantic.info.ClassInfo;
import org.pseudoc.semantic.info.FieldInfo;
import org.pseudoc.semantic.type.TypeRef;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable table of the user classes of one source unit, built by {@link ClassRegistryBuilder}
 * before the main walk. Answers class questions independent of where in the file a class is defined.
 */
public final class ClassRegistry
{
	private static final ClassRegistry EMPTY = new ClassRegistry(Map.of(), Set.of(), Set.of());

	private final Map<String, ClassInfo> classes;
	private final Set<String> usedAsBase;
	private final Set<String> records;

	ClassRegistry(Map<String, ClassInfo> classes, Set<String> usedAsBase, Set<String> records)
	{
		this.classes = Collections.unmodifiableMap(new LinkedHashMap<>(classes));
		this.usedAsBase = Set.copyOf(usedAsBase);
		this.records = Set.copyOf(records);
	}

	public static ClassRegistry empty()
	{
		return EMPTY;
	}

	public boolean isClass(String name)
	{
		return name != null && classes.containsKey(name);
	}

	public Optional<ClassInfo> find(String name)
	{
		return Optional.ofNullable(name == null ? null : classes.get(name));
	}

	public boolean isUsedAsBase(String name)
	{
		return usedAsBase.contains(name);
	}

	public boolean isRecord(String name)
	{
		return records.contains(name);
	}

	/**
	 * Name the pseudocode uses for values of the class: {@code NameRecord} for records.
	 */
	public String typeName(String name)
	{
		return isRecord(name) ? name + "Record" : name;
	}

	/**
	 * Field lookup through the class and then its bases.
	 */
	public Optional<FieldInfo> findField(String className, String field)
	{
		Set<String> seen = new HashSet<>();
		String current = className;
		while (current != null && seen.add(current))
		{
			ClassInfo info = classes.get(current);
			if (info == null)
			{
				return Optional.empty();
			}
			Optional<FieldInfo> found = info.field(field);
			if (found.isPresent())
			{
				return found;
			}
			current = info.bases().isEmpty() ? null : info.bases().get(0);
		}
		return Optional.empty();
	}

	public Optional<TypeRef> fieldType(String className, String field)
	{
		return findField(className, field).map(FieldInfo::type);
	}

	public boolean hasMethod(String className, String method)
	{
		Set<String> seen = new HashSet<>();
		String current = className;
		while (current != null && seen.add(current))
		{
			ClassInfo info = classes.get(current);
			if (info == null)
			{
				return false;
			}
			if (info.methods().contains(method))
			{
				return true;
			}
			current = info.bases().isEmpty() ? null : info.bases().get(0);
		}
		return false;
	}

	public Collection<ClassInfo> getClasses()
	{
		return classes.values();
	}

	public int size()
	{
		return classes.size();
	}
}
