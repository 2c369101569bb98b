// File: src/main/java/com/juanpa/cpg/semantics/Type.java
package com.juanpa.cpg.semantics;

import java.util.Objects;

/**
 * Base class for all types. A type is immutable: a base name plus a textual adjustment suffix
 * made of pointer ({@code *}) and array ({@code []}) markers, e.g. {@code i32*[]}.
 * Two types are equal if they are of the same kind and have the same full type name.
 */
public abstract class Type
{
	protected final String name;
	protected final String typeAdjustment;

	protected Type(String name, String typeAdjustment)
	{
		this.name = name;
		this.typeAdjustment = typeAdjustment == null ? "" : typeAdjustment;
	}

	/**
	 * @return The base name without any adjustment.
	 */
	public String getName()
	{
		return name;
	}

	public String getTypeAdjustment()
	{
		return typeAdjustment;
	}

	/**
	 * @return The full name, base name followed by the adjustment.
	 */
	public String getTypeName()
	{
		return name + typeAdjustment;
	}

	/**
	 * Returns a copy of this type with a different adjustment and everything else unchanged.
	 */
	public abstract Type withTypeAdjustment(String typeAdjustment);

	/**
	 * @return This type with all pointer and array markers removed.
	 */
	public Type getRoot()
	{
		return typeAdjustment.isEmpty() ? this : withTypeAdjustment("");
	}

	/**
	 * Appends a pointer or array marker.
	 */
	public Type reference(String suffix)
	{
		return withTypeAdjustment(typeAdjustment + suffix);
	}

	/**
	 * Removes the innermost pointer or array marker. Dereferencing a type without one yields the
	 * unknown type.
	 */
	public Type dereference()
	{
		if (typeAdjustment.endsWith("[]"))
		{
			return withTypeAdjustment(typeAdjustment.substring(0, typeAdjustment.length() - 2));
		}
		if (typeAdjustment.endsWith("*") || typeAdjustment.endsWith("&"))
		{
			return withTypeAdjustment(typeAdjustment.substring(0, typeAdjustment.length() - 1));
		}
		return UnknownType.getUnknownType();
	}

	public boolean isUnknown()
	{
		return false;
	}

	public boolean isPointerOrArray()
	{
		return !typeAdjustment.isEmpty();
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
		{
			return true;
		}
		if (o == null || getClass() != o.getClass())
		{
			return false;
		}
		return getTypeName().equals(((Type) o).getTypeName());
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(getClass(), getTypeName());
	}

	@Override
	public String toString()
	{
		return getTypeName();
	}
}
