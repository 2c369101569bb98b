// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrFunction.java
package com.juanpa.cpg.frontend.llvm.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function definition or declaration. A function without blocks is only declared.
 */
public class IrFunction extends IrValue
{
	private final IrType returnType;
	private final List<IrArgument> arguments = new ArrayList<>();
	private final List<IrBasicBlock> blocks = new ArrayList<>();
	private boolean variadic;

	public IrFunction(String name, IrType returnType, String code)
	{
		super(name, IrType.pointer(), code);
		this.returnType = returnType;
	}

	public IrType getReturnType()
	{
		return returnType;
	}

	public List<IrArgument> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public IrArgument addArgument(String name, IrType type)
	{
		IrArgument argument = new IrArgument(name, type, arguments.size(), type.getName() + (name.isEmpty() ? "" : " %" + name));
		arguments.add(argument);
		return argument;
	}

	public List<IrBasicBlock> getBlocks()
	{
		return Collections.unmodifiableList(blocks);
	}

	/**
	 * Appends a new, empty basic block to this function.
	 */
	public IrBasicBlock addBlock(String name)
	{
		IrBasicBlock block = new IrBasicBlock(name, this);
		blocks.add(block);
		return block;
	}

	public boolean isDeclaration()
	{
		return blocks.isEmpty();
	}

	public boolean isVariadic()
	{
		return variadic;
	}

	public void setVariadic(boolean variadic)
	{
		this.variadic = variadic;
	}

	@Override
	public boolean isGlobalSymbol()
	{
		return true;
	}
}
