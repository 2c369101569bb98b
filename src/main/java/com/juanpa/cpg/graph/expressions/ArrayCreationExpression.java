// File: src/main/java/com/juanpa/cpg/graph/expressions/ArrayCreationExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Creation of a fixed size block of elements, the closest equivalent of a stack allocation.
 */
public class ArrayCreationExpression extends Expression
{
	private final List<Expression> dimensions = new ArrayList<>();
	private InitializerListExpression initializer;

	public ArrayCreationExpression(String code)
	{
		super("", code);
	}

	public List<Expression> getDimensions()
	{
		return Collections.unmodifiableList(dimensions);
	}

	public void addDimension(Expression dimension)
	{
		dimensions.add(dimension);
	}

	public InitializerListExpression getInitializer()
	{
		return initializer;
	}

	public void setInitializer(InitializerListExpression initializer)
	{
		this.initializer = initializer;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitArrayCreationExpression(this);
	}
}
