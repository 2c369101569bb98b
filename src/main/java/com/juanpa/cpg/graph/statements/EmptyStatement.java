package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * A statement without effect. Also used as the placeholder for constructs that could not be
 * lowered.
 */
public class EmptyStatement extends Statement
{
	public EmptyStatement(String code)
	{
		super("", code);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitEmptyStatement(this);
	}
}
