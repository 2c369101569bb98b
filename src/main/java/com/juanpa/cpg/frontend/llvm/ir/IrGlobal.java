// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrGlobal.java
package com.juanpa.cpg.frontend.llvm.ir;

/**
 * A global variable. Its own type is a pointer, {@link #getValueType()} is the type of the
 * stored value.
 */
public class IrGlobal extends IrValue
{
	private final IrType valueType;
	private IrValue initializer;

	public IrGlobal(String name, IrType valueType, String code)
	{
		super(name, IrType.pointer(), code);
		this.valueType = valueType;
	}

	public IrType getValueType()
	{
		return valueType;
	}

	/**
	 * @return The initializer constant, or null for external globals.
	 */
	public IrValue getInitializer()
	{
		return initializer;
	}

	public void setInitializer(IrValue initializer)
	{
		this.initializer = initializer;
	}

	@Override
	public boolean isGlobalSymbol()
	{
		return true;
	}
}
