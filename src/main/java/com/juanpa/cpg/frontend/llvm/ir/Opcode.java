// File: src/main/java/com/juanpa/cpg/frontend/llvm/ir/Opcode.java
package com.juanpa.cpg.frontend.llvm.ir;

/**
 * Instruction opcodes of the SSA IR.
 */
public enum Opcode
{
	// Terminators
	RET, BR, SWITCH, INDIRECTBR, INVOKE, UNREACHABLE, CALLBR, RESUME, CLEANUPRET, CATCHRET, CATCHSWITCH,
	// Unary and binary operators
	FNEG, ADD, FADD, SUB, FSUB, MUL, FMUL, UDIV, SDIV, FDIV, UREM, SREM, FREM,
	SHL, LSHR, ASHR, AND, OR, XOR,
	// Memory
	ALLOCA, LOAD, STORE, GETELEMENTPTR, FENCE, ATOMICCMPXCHG, ATOMICRMW,
	// Casts
	TRUNC, ZEXT, SEXT, FPTOUI, FPTOSI, UITOFP, SITOFP, FPTRUNC, FPEXT, PTRTOINT, INTTOPTR, BITCAST, ADDRSPACECAST,
	// Other
	ICMP, FCMP, PHI, CALL, SELECT, USEROP1, USEROP2, VAARG,
	EXTRACTELEMENT, INSERTELEMENT, SHUFFLEVECTOR, EXTRACTVALUE, INSERTVALUE, FREEZE,
	LANDINGPAD, CATCHPAD, CLEANUPPAD,
	UNKNOWN;

	public boolean isBinaryOperator()
	{
		return ordinal() >= ADD.ordinal() && ordinal() <= XOR.ordinal();
	}

	public boolean isCast()
	{
		return ordinal() >= TRUNC.ordinal() && ordinal() <= ADDRSPACECAST.ordinal();
	}

	public boolean isTerminator()
	{
		return ordinal() <= CATCHSWITCH.ordinal();
	}
}
