// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrConstant.java
package com.juanpa.cpg.frontend.llvm.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A constant operand. Scalars carry their value, aggregates their elements.
 */
public class IrConstant extends IrValue
{
	public enum Kind
	{
		INT,
		FLOAT,
		NULL,
		UNDEF,
		POISON,
		ZERO,
		STRUCT,
		ARRAY,
		VECTOR,
		STRING,
		OTHER
	}

	private final Kind kind;
	private final Object value;
	private final List<IrValue> elements = new ArrayList<>();

	public IrConstant(Kind kind, Object value, IrType type, String code)
	{
		super("", type, code);
		this.kind = kind;
		this.value = value;
	}

	public static IrConstant ofInt(long value, IrType type)
	{
		return new IrConstant(Kind.INT, value, type, type.getName() + " " + value);
	}

	public static IrConstant ofFloat(double value, IrType type)
	{
		return new IrConstant(Kind.FLOAT, value, type, type.getName() + " " + value);
	}

	public static IrConstant undef(IrType type)
	{
		return new IrConstant(Kind.UNDEF, null, type, type.getName() + " undef");
	}

	public static IrConstant nullPointer(IrType type)
	{
		return new IrConstant(Kind.NULL, null, type, type.getName() + " null");
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * @return A {@code Long} for integers, a {@code Double} for floats, a {@code String} for constant
	 * strings and null for everything else.
	 */
	public Object getValue()
	{
		return value;
	}

	public List<IrValue> getElements()
	{
		return Collections.unmodifiableList(elements);
	}

	public void addElement(IrValue element)
	{
		elements.add(element);
	}

	/**
	 * @return True for null, undef, poison and zero-initialized constants.
	 */
	public boolean isValueless()
	{
		return kind == Kind.NULL || kind == Kind.UNDEF || kind == Kind.POISON || kind == Kind.ZERO;
	}
}
