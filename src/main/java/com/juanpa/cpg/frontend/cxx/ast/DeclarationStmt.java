package com.juanpa.cpg.frontend.cxx.ast;

public class DeclarationStmt extends CxxStatement
{
	private final SimpleDeclaration declaration;

	public DeclarationStmt(String rawSignature, SimpleDeclaration declaration)
	{
		super(rawSignature);
		this.declaration = declaration;
	}

	public SimpleDeclaration getDeclaration()
	{
		return declaration;
	}
}
