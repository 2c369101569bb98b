package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * A named jump target. For lowered IR every basic block is one label whose sub statement is the
 * block's body.
 */
public class LabelStatement extends Statement
{
	private final String label;
	private Statement subStatement;

	public LabelStatement(String label, String code)
	{
		super(label, code);
		this.label = label;
	}

	public String getLabel()
	{
		return label;
	}

	public Statement getSubStatement()
	{
		return subStatement;
	}

	public void setSubStatement(Statement subStatement)
	{
		this.subStatement = subStatement;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitLabelStatement(this);
	}
}
