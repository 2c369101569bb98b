package com.juanpa.cpg.frontend.cxx.ast;

public abstract class CxxDeclaration extends CxxNode
{
	protected CxxDeclaration(String rawSignature)
	{
		super(rawSignature);
	}
}
