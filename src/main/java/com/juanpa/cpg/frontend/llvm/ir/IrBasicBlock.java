// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrBasicBlock.java
package com.juanpa.cpg.frontend.llvm.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A straight-line sequence of instructions ending in a terminator. Blocks are values themselves,
 * so they can appear as branch operands.
 */
public class IrBasicBlock extends IrValue
{
	private final IrFunction parent;
	private final List<IrInstruction> instructions = new ArrayList<>();

	public IrBasicBlock(String name, IrFunction parent)
	{
		super(name, IrType.label(), name.isEmpty() ? null : name + ":");
		this.parent = parent;
	}

	public IrFunction getParent()
	{
		return parent;
	}

	public List<IrInstruction> getInstructions()
	{
		return Collections.unmodifiableList(instructions);
	}

	public IrInstruction addInstruction(IrInstruction instruction)
	{
		instruction.setParent(this);
		instructions.add(instruction);
		return instruction;
	}
}
