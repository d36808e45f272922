// File: src/main/java/org/pseudoc/semantic/ClassRegistryBuilder.java
package org.pseudoc.semantic;

import org.pseudoc.ast.Expr;
import org.pseudoc.ast.Param;
import org.pseudoc.ast.Stmt;
import org.pseudoc.semantic.info.ClassInfo;
import org.pseudoc.semantic.info.FieldInfo;
import org.pseudoc.semantic.info.ParameterInfo;
import org.pseudoc.semantic.type.DataType;
import org.pseudoc.semantic.type.TypeRef;
import org.pseudoc.util.Debug;
import org.pseudoc.util.DiagnosticKind;
import org.pseudoc.util.ErrorHandler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Discovery pass over the top-level statements. Collects every class with its fields,
 * constructor parameters, bases and methods, then fixes the record/class decision, so that
 * the main walk can ask class questions regardless of definition order.
 */
public class ClassRegistryBuilder
{
	private final ErrorHandler errorHandler;
	private final RecordPolicy policy;
	private final CallSiteIndex callSites;
	private final TypeRef fallback;
	private final boolean trace;

	public ClassRegistryBuilder(ErrorHandler errorHandler, RecordPolicy policy, CallSiteIndex callSites, boolean strictTypes, boolean trace)
	{
		this.errorHandler = errorHandler;
		this.policy = policy;
		this.callSites = callSites;
		this.fallback = strictTypes ? TypeRef.ANY : TypeRef.STRING;
		this.trace = trace;
	}

	public ClassRegistry build(List<Stmt> topLevel)
	{
		List<Stmt.ClassDef> definitions = new ArrayList<>();
		Set<String> classNames = new HashSet<>();
		for (Stmt stmt : topLevel)
		{
			if (stmt instanceof Stmt.ClassDef classDef)
			{
				if (!classNames.add(classDef.name()))
				{
					errorHandler.logWarning(DiagnosticKind.VALIDATION, classDef.line(),
							"Class '" + classDef.name() + "' is defined more than once; the last definition wins");
				}
				definitions.add(classDef);
			}
		}

		Map<String, ClassInfo> classes = new LinkedHashMap<>();
		Set<String> usedAsBase = new HashSet<>();
		for (Stmt.ClassDef classDef : definitions)
		{
			ClassInfo info = describe(classDef, classNames);
			classes.put(info.name(), info);
			usedAsBase.addAll(info.bases());
		}

		Set<String> records = new HashSet<>();
		for (ClassInfo info : classes.values())
		{
			for (String base : info.bases())
			{
				if (!classes.containsKey(base))
				{
					errorHandler.logWarning(DiagnosticKind.NAME, info.line(),
							"Base class '" + base + "' of '" + info.name() + "' is not defined in this file");
				}
			}
			if (policy.isRecord(info, usedAsBase.contains(info.name())))
			{
				records.add(info.name());
			}
			Debug.trace(trace, "Class " + info.name() + (records.contains(info.name()) ? " -> record" : " -> class")
					+ " fields=" + info.fields().size() + " methods=" + info.methods());
		}
		return new ClassRegistry(classes, usedAsBase, records);
	}

	private ClassInfo describe(Stmt.ClassDef classDef, Set<String> classNames)
	{
		List<FieldInfo> fields = new ArrayList<>();
		List<String> methods = new ArrayList<>();
		Stmt.FunctionDef constructor = null;

		for (Stmt stmt : classDef.body())
		{
			if (stmt instanceof Stmt.FunctionDef method)
			{
				if (method.name().equals("__init__"))
				{
					constructor = method;
				}
				else
				{
					methods.add(method.name());
				}
			}
			else if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1
					&& assign.targets().get(0) instanceof Expr.Name target)
			{
				TypeRef type = Optional.ofNullable(TypeInferrer.literalType(assign.value())).orElse(fallback);
				fields.add(new FieldInfo(target.id(), null, type, assign.value(), true));
			}
			else if (stmt instanceof Stmt.AnnAssign annotated && annotated.target() instanceof Expr.Name target)
			{
				TypeRef type = TypeInferrer.annotationType(annotated.annotation(), classNames);
				fields.add(new FieldInfo(target.id(), null, type != null ? type : fallback, annotated.value(), true));
			}
		}

		List<ParameterInfo> parameters = new ArrayList<>();
		boolean plain = true;
		if (constructor != null)
		{
			Map<String, TypeRef> parameterTypes = new HashMap<>();
			List<Param> params = constructor.params();
			for (int i = 1; i < params.size(); i++)
			{
				Param param = params.get(i);
				TypeRef type = parameterType(classDef.name(), param, i - 1, constructor.body(), classNames);
				parameterTypes.put(param.name(), type);
				parameters.add(new ParameterInfo(param.name(), type, param.defaultValue()));
			}
			plain = collectConstructorFields(constructor.body(), parameterTypes, classNames, fields);
		}

		return new ClassInfo(classDef.name(), fields, parameters, classDef.bases(), methods,
				constructor != null, plain, classDef.line());
	}

	private TypeRef parameterType(String className, Param param, int position, List<Stmt> body, Set<String> classNames)
	{
		TypeRef annotated = TypeInferrer.annotationType(param.annotation(), classNames);
		if (annotated != null)
		{
			return annotated;
		}
		TypeRef fromDefault = TypeInferrer.literalType(param.defaultValue());
		if (fromDefault != null && !fromDefault.is(DataType.ANY))
		{
			return fromDefault;
		}
		Optional<TypeRef> fromCall = callSites.argumentType(className, param.name(), position);
		if (fromCall.isPresent())
		{
			return fromCall.get();
		}
		TypeRef fromUsage = TypeInferrer.inferParameterType(param.name(), body);
		return fromUsage != null ? fromUsage : fallback;
	}

	/**
	 * Adds the {@code self.x} fields assigned in the constructor, in assignment order.
	 * Returns whether every statement is a plain {@code self.x = parameter} copy.
	 */
	private boolean collectConstructorFields(List<Stmt> body, Map<String, TypeRef> parameterTypes,
											 Set<String> classNames, List<FieldInfo> fields)
	{
		boolean plain = true;
		for (Stmt stmt : body)
		{
			if (stmt instanceof Stmt.Comment || stmt instanceof Stmt.Pass)
			{
				continue;
			}
			String field = null;
			Expr value = null;
			TypeRef declared = null;
			if (stmt instanceof Stmt.Assign assign && assign.targets().size() == 1)
			{
				field = selfField(assign.targets().get(0));
				value = assign.value();
			}
			else if (stmt instanceof Stmt.AnnAssign annotated)
			{
				field = selfField(annotated.target());
				value = annotated.value();
				declared = TypeInferrer.annotationType(annotated.annotation(), classNames);
			}

			if (field == null)
			{
				plain = false;
				if (stmt instanceof Stmt.If || stmt instanceof Stmt.For || stmt instanceof Stmt.While)
				{
					// fields assigned conditionally still belong to the class
					collectNested(stmt, parameterTypes, classNames, fields);
				}
				continue;
			}

			String source = value instanceof Expr.Name name && parameterTypes.containsKey(name.id()) ? name.id() : null;
			if (source == null)
			{
				plain = false;
			}
			TypeRef type = declared != null ? declared : valueType(value, parameterTypes, classNames);
			addField(fields, new FieldInfo(field, source, type, source == null ? value : null, false));
		}
		return plain;
	}

	private void collectNested(Stmt stmt, Map<String, TypeRef> parameterTypes, Set<String> classNames, List<FieldInfo> fields)
	{
		List<Stmt> nested = new ArrayList<>();
		if (stmt instanceof Stmt.If s)
		{
			nested.addAll(s.body());
			nested.addAll(s.orElse());
		}
		else if (stmt instanceof Stmt.For s)
		{
			nested.addAll(s.body());
		}
		else if (stmt instanceof Stmt.While s)
		{
			nested.addAll(s.body());
		}
		collectConstructorFields(nested, parameterTypes, classNames, fields);
	}

	private static void addField(List<FieldInfo> fields, FieldInfo field)
	{
		for (FieldInfo existing : fields)
		{
			if (existing.name().equals(field.name()))
			{
				return;
			}
		}
		fields.add(field);
	}

	private TypeRef valueType(Expr value, Map<String, TypeRef> parameterTypes, Set<String> classNames)
	{
		if (value == null)
		{
			return fallback;
		}
		if (value instanceof Expr.Name name && parameterTypes.containsKey(name.id()))
		{
			return parameterTypes.get(name.id());
		}
		if (value instanceof Expr.Call call && call.calleeName() != null && classNames.contains(call.calleeName()))
		{
			return TypeRef.instance(call.calleeName());
		}
		TypeRef literal = TypeInferrer.literalType(value);
		return literal != null ? literal : fallback;
	}

	private static String selfField(Expr target)
	{
		if (target instanceof Expr.Attribute attribute && attribute.value() instanceof Expr.Name owner
				&& owner.id().equals("self"))
		{
			return attribute.attr();
		}
		return null;
	}
}
