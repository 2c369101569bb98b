// File: src/main/java/com/juanpa/cpg/semantics/PrimitiveType.java
package com.juanpa.cpg.semantics;

/**
 * Built-in scalar types like i32, double, unsigned int or void.
 */
public class PrimitiveType extends Type
{
	public PrimitiveType(String name)
	{
		this(name, "");
	}

	public PrimitiveType(String name, String typeAdjustment)
	{
		super(name, typeAdjustment);
	}

	/**
	 * @return True for the unsigned spelling of an integer type, e.g. {@code ui32} or {@code unsigned int}.
	 */
	public boolean isUnsigned()
	{
		return name.startsWith("u") || name.startsWith("unsigned");
	}

	@Override
	public Type withTypeAdjustment(String typeAdjustment)
	{
		return new PrimitiveType(name, typeAdjustment);
	}
}
