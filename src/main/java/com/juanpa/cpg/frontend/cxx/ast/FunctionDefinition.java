package com.juanpa.cpg.frontend.cxx.ast;

public class FunctionDefinition extends CxxDeclaration
{
	private final DeclSpecifier specifier;
	private final FunctionDeclarator declarator;
	private final CompoundStmt body;

	public FunctionDefinition(String rawSignature, DeclSpecifier specifier, FunctionDeclarator declarator, CompoundStmt body)
	{
		super(rawSignature);
		this.specifier = specifier;
		this.declarator = declarator;
		this.body = body;
	}

	public DeclSpecifier getSpecifier()
	{
		return specifier;
	}

	public FunctionDeclarator getDeclarator()
	{
		return declarator;
	}

	public CompoundStmt getBody()
	{
		return body;
	}
}
