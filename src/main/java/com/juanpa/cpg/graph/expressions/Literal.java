// File: src/main/java/com/juanpa/cpg/graph/expressions/Literal.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * A constant value. A literal without a value stands for an undefined or unknown value of its type.
 */
public class Literal<T> extends Expression
{
	private final T value;

	public Literal(T value, String code)
	{
		super(String.valueOf(value), code);
		this.value = value;
	}

	public T getValue()
	{
		return value;
	}

	public boolean hasValue()
	{
		return value != null;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitLiteral(this);
	}

	@Override
	public String toString()
	{
		return value == null ? "undef" : value.toString();
	}
}
