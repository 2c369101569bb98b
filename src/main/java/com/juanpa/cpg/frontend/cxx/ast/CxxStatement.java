package com.juanpa.cpg.frontend.cxx.ast;

public abstract class CxxStatement extends CxxNode
{
	protected CxxStatement(String rawSignature)
	{
		super(rawSignature);
	}
}
