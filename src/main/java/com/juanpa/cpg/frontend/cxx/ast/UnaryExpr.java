package com.juanpa.cpg.frontend.cxx.ast;

public class UnaryExpr extends CxxExpression
{
	private final String operator;
	private final boolean postfix;
	private final CxxExpression operand;

	public UnaryExpr(String rawSignature, String operator, boolean postfix, CxxExpression operand)
	{
		super(rawSignature);
		this.operator = operator;
		this.postfix = postfix;
		this.operand = operand;
	}

	public String getOperator()
	{
		return operator;
	}

	public boolean isPostfix()
	{
		return postfix;
	}

	public CxxExpression getOperand()
	{
		return operand;
	}
}
