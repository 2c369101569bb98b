package com.juanpa.cpg.frontend.cxx.ast;

public class ParameterDecl extends CxxNode
{
	private final DeclSpecifier specifier;
	private final Declarator declarator;

	public ParameterDecl(String rawSignature, DeclSpecifier specifier, Declarator declarator)
	{
		super(rawSignature);
		this.specifier = specifier;
		this.declarator = declarator;
	}

	public DeclSpecifier getSpecifier()
	{
		return specifier;
	}

	public Declarator getDeclarator()
	{
		return declarator;
	}
}
