// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrType.java
package com.juanpa.cpg.frontend.llvm.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A type of the SSA IR, e.g. {@code i32}, {@code ptr}, {@code <4 x float>} or {@code %struct.pair}.
 */
public final class IrType
{
	public enum Kind
	{
		INTEGER,
		FLOAT,
		POINTER,
		VECTOR,
		ARRAY,
		STRUCT,
		VOID,
		LABEL,
		FUNCTION,
		OTHER
	}

	private final Kind kind;
	private final String name;
	private final int bitWidth;
	private final IrType elementType;
	private final int length;
	private final List<IrType> fields = new ArrayList<>();
	private final String structName;

	private IrType(Kind kind, String name, int bitWidth, IrType elementType, int length, String structName)
	{
		this.kind = kind;
		this.name = name;
		this.bitWidth = bitWidth;
		this.elementType = elementType;
		this.length = length;
		this.structName = structName;
	}

	public static IrType integer(int bitWidth)
	{
		return new IrType(Kind.INTEGER, "i" + bitWidth, bitWidth, null, 0, null);
	}

	/**
	 * @param name One of {@code half}, {@code float}, {@code double}, {@code fp128} and friends.
	 */
	public static IrType floating(String name)
	{
		return new IrType(Kind.FLOAT, name, 0, null, 0, null);
	}

	/**
	 * An opaque pointer.
	 */
	public static IrType pointer()
	{
		return new IrType(Kind.POINTER, "ptr", 0, null, 0, null);
	}

	/**
	 * A typed pointer, rendered as the pointee followed by {@code *}.
	 */
	public static IrType pointerTo(IrType pointee)
	{
		return new IrType(Kind.POINTER, pointee.getName() + "*", 0, pointee, 0, null);
	}

	public static IrType vector(IrType elementType, int length)
	{
		return new IrType(Kind.VECTOR, "<" + length + " x " + elementType.getName() + ">", 0, elementType, length, null);
	}

	public static IrType array(IrType elementType, int length)
	{
		return new IrType(Kind.ARRAY, "[" + length + " x " + elementType.getName() + "]", 0, elementType, length, null);
	}

	/**
	 * A named struct. Fields may be added after creation, so recursive structs can refer to themselves.
	 */
	public static IrType struct(String structName, List<IrType> fields)
	{
		IrType type = new IrType(Kind.STRUCT, "%" + structName, 0, null, 0, structName);
		type.fields.addAll(fields);
		return type;
	}

	public static IrType literalStruct(List<IrType> fields)
	{
		String name = "{ " + fields.stream().map(IrType::getName).collect(Collectors.joining(", ")) + " }";
		IrType type = new IrType(Kind.STRUCT, name, 0, null, 0, null);
		type.fields.addAll(fields);
		return type;
	}

	public static IrType voidType()
	{
		return new IrType(Kind.VOID, "void", 0, null, 0, null);
	}

	public static IrType label()
	{
		return new IrType(Kind.LABEL, "label", 0, null, 0, null);
	}

	public static IrType function(IrType returnType)
	{
		return new IrType(Kind.FUNCTION, returnType.getName() + " (...)", 0, returnType, 0, null);
	}

	public static IrType other(String name)
	{
		return new IrType(Kind.OTHER, name, 0, null, 0, null);
	}

	public Kind getKind()
	{
		return kind;
	}

	/**
	 * @return The IR spelling of this type.
	 */
	public String getName()
	{
		return name;
	}

	public int getBitWidth()
	{
		return bitWidth;
	}

	/**
	 * @return The element type of vectors and arrays, the pointee of typed pointers and the return
	 * type of function types. Null otherwise.
	 */
	public IrType getElementType()
	{
		return elementType;
	}

	/**
	 * @return The number of elements of a vector or array.
	 */
	public int getLength()
	{
		return length;
	}

	public List<IrType> getFields()
	{
		return Collections.unmodifiableList(fields);
	}

	public void addField(IrType field)
	{
		fields.add(field);
	}

	/**
	 * @return The name of a named struct without the leading {@code %}, or null for literal structs
	 * and all other kinds.
	 */
	public String getStructName()
	{
		return structName;
	}

	public boolean isLiteralStruct()
	{
		return kind == Kind.STRUCT && structName == null;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
