// File: src/main/java/com/juanpa/cpg/graph/expressions/CastExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.semantics.Type;

/**
 * An explicit cast. Its type is always the cast type, whatever the operand turns out to be.
 */
public class CastExpression extends Expression
{
	private Type castType;
	private Expression expression;

	public CastExpression(String code)
	{
		super("", code);
	}

	public Type getCastType()
	{
		return castType;
	}

	public void setCastType(Type castType)
	{
		this.castType = castType;
		setName(castType == null ? "" : castType.getTypeName());
		applyType(castType);
	}

	public Expression getExpression()
	{
		return expression;
	}

	public void setExpression(Expression expression)
	{
		this.expression = expression;
	}

	@Override
	public void typeChanged(HasType src, Type oldType)
	{
		// the cast type is fixed
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitCastExpression(this);
	}
}
