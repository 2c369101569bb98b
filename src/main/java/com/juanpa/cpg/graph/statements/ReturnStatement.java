// File: src/main/java/com/juanpa/cpg/graph/statements/ReturnStatement.java
package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.expressions.Expression;

public class ReturnStatement extends Statement
{
	private Expression returnValue; // Can be null for 'return;'

	public ReturnStatement(String code)
	{
		super("", code);
	}

	public Expression getReturnValue()
	{
		return returnValue;
	}

	public void setReturnValue(Expression returnValue)
	{
		this.returnValue = returnValue;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitReturnStatement(this);
	}
}
