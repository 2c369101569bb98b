package com.juanpa.cpg.frontend.cxx.ast;

/**
 * The type part of a declaration, in front of its declarators.
 */
public abstract class DeclSpecifier extends CxxNode
{
	protected DeclSpecifier(String rawSignature)
	{
		super(rawSignature);
	}
}
