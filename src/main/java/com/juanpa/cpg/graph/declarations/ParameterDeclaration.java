package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * A parameter of a function. Variadic argument lists are modeled as one synthetic parameter
 * with {@link #isVariadic()} set.
 */
public class ParameterDeclaration extends VariableDeclaration
{
	private int argumentIndex;
	private final boolean variadic;

	public ParameterDeclaration(String name, boolean variadic, String code)
	{
		super(name, code);
		this.variadic = variadic;
	}

	public int getArgumentIndex()
	{
		return argumentIndex;
	}

	public void setArgumentIndex(int argumentIndex)
	{
		this.argumentIndex = argumentIndex;
	}

	public boolean isVariadic()
	{
		return variadic;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitParameterDeclaration(this);
	}
}
