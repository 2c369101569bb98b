package com.juanpa.cpg.frontend.cxx.ast;

public class BinaryExpr extends CxxExpression
{
	private final String operator;
	private final CxxExpression lhs;
	private final CxxExpression rhs;

	public BinaryExpr(String rawSignature, String operator, CxxExpression lhs, CxxExpression rhs)
	{
		super(rawSignature);
		this.operator = operator;
		this.lhs = lhs;
		this.rhs = rhs;
	}

	public String getOperator()
	{
		return operator;
	}

	public CxxExpression getLhs()
	{
		return lhs;
	}

	public CxxExpression getRhs()
	{
		return rhs;
	}
}
