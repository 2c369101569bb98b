// File: src/main/java/com/juanpa/cpg/graph/expressions/ConditionalExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * The ternary {@code condition ? thenExpr : elseExpr}.
 */
public class ConditionalExpression extends Expression
{
	private Expression condition;
	private Expression thenExpr;
	private Expression elseExpr;

	public ConditionalExpression(String code)
	{
		super("", code);
	}

	public Expression getCondition()
	{
		return condition;
	}

	public void setCondition(Expression condition)
	{
		this.condition = condition;
	}

	public Expression getThenExpr()
	{
		return thenExpr;
	}

	public void setThenExpr(Expression thenExpr)
	{
		this.thenExpr = thenExpr;
	}

	public Expression getElseExpr()
	{
		return elseExpr;
	}

	public void setElseExpr(Expression elseExpr)
	{
		this.elseExpr = elseExpr;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitConditionalExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + condition + " ? " + thenExpr + " : " + elseExpr + ")";
	}
}
