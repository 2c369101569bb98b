// File: src/main/java/com/juanpa/cpg/semantics/TypeParser.java
package com.juanpa.cpg.semantics;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Creates {@link Type}s from their textual spelling, as found in declaration specifiers or
 * IR type names.
 */
public final class TypeParser
{
	private static final Pattern INTEGER = Pattern.compile("u?i\\d+");

	private static final Set<String> PRIMITIVES = Set.of(
			"void", "bool", "char", "short", "int", "long", "long long", "float", "double", "long double",
			"signed char", "unsigned", "unsigned char", "unsigned short", "unsigned int", "unsigned long",
			"unsigned long long", "wchar_t", "size_t",
			"half", "bfloat", "fp128", "x86_fp80", "ppc_fp128", "ptr", "label", "metadata", "token");

	private TypeParser()
	{
	}

	/**
	 * Parses a type name such as {@code const struct foo *[]} or {@code i32}. A blank name yields
	 * the unknown type.
	 */
	public static Type createFrom(String typeString)
	{
		if (typeString == null || typeString.isBlank())
		{
			return UnknownType.getUnknownType();
		}

		String base = typeString.trim();
		StringBuilder adjustment = new StringBuilder();
		while (!base.isEmpty())
		{
			char last = base.charAt(base.length() - 1);
			if (last == '*' || last == '&')
			{
				adjustment.insert(0, last);
				base = base.substring(0, base.length() - 1).trim();
			}
			else if (last == ']' && base.lastIndexOf('[') > 0)
			{
				adjustment.insert(0, "[]");
				base = base.substring(0, base.lastIndexOf('[')).trim();
			}
			else
			{
				break;
			}
		}

		base = stripQualifiers(base);
		if (base.isEmpty())
		{
			return UnknownType.getUnknownType();
		}
		if (isPrimitive(base))
		{
			return new PrimitiveType(base, adjustment.toString());
		}
		return new ObjectType(base, adjustment.toString(), null);
	}

	/**
	 * @return The unsigned spelling of an integer type name, {@code i32} becomes {@code ui32}.
	 */
	public static String unsignedVariantOf(String typeName)
	{
		if (typeName.startsWith("u"))
		{
			return typeName;
		}
		return "u" + typeName;
	}

	public static boolean isPrimitive(String base)
	{
		if (PRIMITIVES.contains(base) || INTEGER.matcher(base).matches())
		{
			return true;
		}
		// unsigned variants of the above, e.g. "uint" or "ulong"
		return base.startsWith("u") && PRIMITIVES.contains(base.substring(1));
	}

	private static String stripQualifiers(String base)
	{
		String result = base;
		boolean changed = true;
		while (changed)
		{
			changed = false;
			for (String qualifier : new String[]{"const ", "volatile ", "struct ", "union ", "class ", "enum "})
			{
				if (result.startsWith(qualifier))
				{
					result = result.substring(qualifier.length()).trim();
					changed = true;
				}
			}
			if (result.endsWith(" const"))
			{
				result = result.substring(0, result.length() - " const".length()).trim();
				changed = true;
			}
		}
		return result;
	}
}
