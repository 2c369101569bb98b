package com.juanpa.cpg.frontend.llvm.ir;

public enum IntPredicate
{
	EQ,
	NE,
	UGT,
	UGE,
	ULT,
	ULE,
	SGT,
	SGE,
	SLT,
	SLE
}
