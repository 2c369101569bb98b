// File: src/main/java/com/juanpa/cpg/graph/expressions/ArraySubscriptionExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.semantics.Type;

/**
 * An element access {@code array[index]}. Its type is the element type of the array expression.
 */
public class ArraySubscriptionExpression extends Expression
{
	private Expression arrayExpression;
	private Expression subscriptExpression;

	public ArraySubscriptionExpression(String code)
	{
		super("", code);
	}

	public Expression getArrayExpression()
	{
		return arrayExpression;
	}

	public void setArrayExpression(Expression arrayExpression)
	{
		this.arrayExpression = arrayExpression;
	}

	public Expression getSubscriptExpression()
	{
		return subscriptExpression;
	}

	public void setSubscriptExpression(Expression subscriptExpression)
	{
		this.subscriptExpression = subscriptExpression;
	}

	@Override
	public void typeChanged(HasType src, Type oldType)
	{
		if (src == arrayExpression)
		{
			applyType(src.getType().dereference());
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitArraySubscriptionExpression(this);
	}

	@Override
	public String toString()
	{
		return arrayExpression + "[" + subscriptExpression + "]";
	}
}
