package com.juanpa.cpg.frontend.llvm.ir;

public class IrArgument extends IrValue
{
	private final int index;

	public IrArgument(String name, IrType type, int index, String code)
	{
		super(name, type, code);
		this.index = index;
	}

	public int getIndex()
	{
		return index;
	}
}
