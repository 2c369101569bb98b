// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/IrInstruction.java
package com.juanpa.cpg.frontend.llvm.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One instruction. Operands follow the IR's own layout, for example:
 * <ul>
 *     <li>{@code br}: condition, false target, true target (or just the target)</li>
 *     <li>{@code switch}: value, default target, then value/target pairs</li>
 *     <li>{@code call}: arguments, callee</li>
 *     <li>{@code invoke}: arguments, normal target, unwind target, callee</li>
 *     <li>{@code store}: value, pointer</li>
 *     <li>{@code cmpxchg}: pointer, compare value, new value</li>
 * </ul>
 */
public class IrInstruction extends IrValue
{
	private final Opcode opcode;
	private final List<IrValue> operands = new ArrayList<>();
	private IrBasicBlock parent;
	private IntPredicate intPredicate;
	private RealPredicate realPredicate;
	private AtomicRmwOp rmwOp;
	private int[] indices = new int[0];
	private int[] mask = new int[0];
	private final List<IrBasicBlock> incomingBlocks = new ArrayList<>();
	private final List<IrValue> clauses = new ArrayList<>();
	private IrType sourceElementType;

	public IrInstruction(Opcode opcode, String name, IrType type, String code)
	{
		super(name, type, code);
		this.opcode = opcode;
	}

	public Opcode getOpcode()
	{
		return opcode;
	}

	public List<IrValue> getOperands()
	{
		return Collections.unmodifiableList(operands);
	}

	public IrValue getOperand(int index)
	{
		return operands.get(index);
	}

	public int getNumOperands()
	{
		return operands.size();
	}

	public IrInstruction addOperand(IrValue operand)
	{
		operands.add(operand);
		return this;
	}

	public void setOperand(int index, IrValue operand)
	{
		operands.set(index, operand);
	}

	public IrBasicBlock getParent()
	{
		return parent;
	}

	void setParent(IrBasicBlock parent)
	{
		this.parent = parent;
	}

	public IntPredicate getIntPredicate()
	{
		return intPredicate;
	}

	public IrInstruction setIntPredicate(IntPredicate intPredicate)
	{
		this.intPredicate = intPredicate;
		return this;
	}

	public RealPredicate getRealPredicate()
	{
		return realPredicate;
	}

	public IrInstruction setRealPredicate(RealPredicate realPredicate)
	{
		this.realPredicate = realPredicate;
		return this;
	}

	public AtomicRmwOp getRmwOp()
	{
		return rmwOp;
	}

	public IrInstruction setRmwOp(AtomicRmwOp rmwOp)
	{
		this.rmwOp = rmwOp;
		return this;
	}

	/**
	 * @return The constant field indices of {@code extractvalue} and {@code insertvalue}.
	 */
	public int[] getIndices()
	{
		return indices.clone();
	}

	public IrInstruction setIndices(int... indices)
	{
		this.indices = indices.clone();
		return this;
	}

	/**
	 * @return The selection mask of {@code shufflevector}; negative entries are undefined lanes.
	 */
	public int[] getMask()
	{
		return mask.clone();
	}

	public IrInstruction setMask(int... mask)
	{
		this.mask = mask.clone();
		return this;
	}

	/**
	 * @return The predecessor block of every incoming value of a {@code phi}, index-aligned with the operands.
	 */
	public List<IrBasicBlock> getIncomingBlocks()
	{
		return Collections.unmodifiableList(incomingBlocks);
	}

	/**
	 * Adds one incoming value of a {@code phi} together with the block it comes from.
	 */
	public IrInstruction addIncoming(IrValue value, IrBasicBlock block)
	{
		operands.add(value);
		incomingBlocks.add(block);
		return this;
	}

	/**
	 * @return The clauses of a {@code landingpad}. Catch clauses are type infos (or null constants
	 * for catch-all), filter clauses are constant arrays.
	 */
	public List<IrValue> getClauses()
	{
		return Collections.unmodifiableList(clauses);
	}

	public IrInstruction addClause(IrValue clause)
	{
		clauses.add(clause);
		return this;
	}

	/**
	 * @return The type {@code getelementptr} indexes into, or null.
	 */
	public IrType getSourceElementType()
	{
		return sourceElementType;
	}

	public IrInstruction setSourceElementType(IrType sourceElementType)
	{
		this.sourceElementType = sourceElementType;
		return this;
	}

	@Override
	public String toString()
	{
		return getCode() != null ? getCode() : opcode + " " + Arrays.toString(operands.toArray());
	}
}
