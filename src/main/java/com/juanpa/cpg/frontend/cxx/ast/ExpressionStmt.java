package com.juanpa.cpg.frontend.cxx.ast;

public class ExpressionStmt extends CxxStatement
{
	private final CxxExpression expression;

	public ExpressionStmt(String rawSignature, CxxExpression expression)
	{
		super(rawSignature);
		this.expression = expression;
	}

	public CxxExpression getExpression()
	{
		return expression;
	}
}
