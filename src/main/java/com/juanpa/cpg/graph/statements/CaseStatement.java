// File: src/main/java/com/juanpa/cpg/graph/statements/CaseStatement.java
package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.expressions.Expression;

public class CaseStatement extends Statement
{
	private Expression caseExpression;

	public CaseStatement(String code)
	{
		super("", code);
	}

	public Expression getCaseExpression()
	{
		return caseExpression;
	}

	public void setCaseExpression(Expression caseExpression)
	{
		this.caseExpression = caseExpression;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitCaseStatement(this);
	}
}
