// File: src/main/java/com/juanpa/cpg/graph/expressions/InitializerListExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A list of element initializers, e.g. {@code {1, 2, 3}}.
 */
public class InitializerListExpression extends Expression
{
	private final List<Expression> initializers = new ArrayList<>();

	public InitializerListExpression(String code)
	{
		super("", code);
	}

	public List<Expression> getInitializers()
	{
		return Collections.unmodifiableList(initializers);
	}

	public void addInitializer(Expression initializer)
	{
		initializers.add(initializer);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitInitializerListExpression(this);
	}
}
