// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrValue.java
package com.juanpa.cpg.frontend.llvm.ir;

/**
 * Any value of the IR: instructions, arguments, globals, constants and basic blocks.
 * The {@code code} is the value's printed form, e.g. {@code %3 = add i32 %1, 2}.
 */
public class IrValue
{
	private String name;
	private IrType type;
	private String code;

	public IrValue(String name, IrType type, String code)
	{
		this.name = name == null ? "" : name;
		this.type = type;
		this.code = code;
	}

	/**
	 * @return The name without sigil, empty for unnamed values.
	 */
	public String getName()
	{
		return name;
	}

	public void setName(String name)
	{
		this.name = name == null ? "" : name;
	}

	public IrType getType()
	{
		return type;
	}

	public void setType(IrType type)
	{
		this.type = type;
	}

	public String getCode()
	{
		return code;
	}

	public void setCode(String code)
	{
		this.code = code;
	}

	/**
	 * Globals and functions live in the {@code @} namespace, everything else in the {@code %} one.
	 */
	public boolean isGlobalSymbol()
	{
		return false;
	}

	/**
	 * @return The identifier under which uses refer to this value, e.g. {@code %x} or {@code @main}.
	 */
	public String getSymbolName()
	{
		return (isGlobalSymbol() ? "@" : "%") + name;
	}

	@Override
	public String toString()
	{
		return code != null ? code : getSymbolName();
	}
}
