package com.juanpa.cpg.frontend.llvm.ir;

/**
 * Floating point comparison predicates. {@code O} predicates are ordered, {@code U} predicates are
 * also true if either operand is NaN.
 */
public enum RealPredicate
{
	FALSE,
	OEQ,
	OGT,
	OGE,
	OLT,
	OLE,
	ONE,
	ORD,
	UNO,
	UEQ,
	UGT,
	UGE,
	ULT,
	ULE,
	UNE,
	TRUE
}
