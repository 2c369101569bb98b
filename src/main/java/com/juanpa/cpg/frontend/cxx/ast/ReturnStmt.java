package com.juanpa.cpg.frontend.cxx.ast;

public class ReturnStmt extends CxxStatement
{
	private final CxxExpression returnValue;

	public ReturnStmt(String rawSignature, CxxExpression returnValue)
	{
		super(rawSignature);
		this.returnValue = returnValue;
	}

	/**
	 * @return The returned expression, or null for a bare {@code return;}.
	 */
	public CxxExpression getReturnValue()
	{
		return returnValue;
	}
}
