package com.juanpa.cpg.frontend.cxx.ast;

public abstract class CxxExpression extends CxxNode
{
	protected CxxExpression(String rawSignature)
	{
		super(rawSignature);
	}
}
