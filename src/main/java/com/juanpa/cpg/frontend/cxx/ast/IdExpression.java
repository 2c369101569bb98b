package com.juanpa.cpg.frontend.cxx.ast;

public class IdExpression extends CxxExpression
{
	private final String name;

	public IdExpression(String name)
	{
		super(name);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}
}
