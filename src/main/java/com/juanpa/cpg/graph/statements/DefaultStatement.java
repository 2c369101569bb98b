package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;

public class DefaultStatement extends Statement
{
	public DefaultStatement(String code)
	{
		super("", code);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitDefaultStatement(this);
	}
}
