package com.juanpa.cpg.frontend.llvm.ir;

/**
 * Operations of the atomic read-modify-write instruction. {@link #UNKNOWN} stands for operations
 * newer than this model, lowering them is a translation error.
 */
public enum AtomicRmwOp
{
	XCHG,
	ADD,
	SUB,
	AND,
	NAND,
	OR,
	XOR,
	MAX,
	MIN,
	UMAX,
	UMIN,
	FADD,
	FSUB,
	FMAX,
	FMIN,
	UNKNOWN
}
