package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;

public class GotoStatement extends Statement
{
	private String labelName;
	private LabelStatement targetLabel;

	public GotoStatement(String code)
	{
		super("", code);
	}

	public String getLabelName()
	{
		return labelName;
	}

	public LabelStatement getTargetLabel()
	{
		return targetLabel;
	}

	/**
	 * Points this goto at a label and takes over its name.
	 */
	public void setTargetLabel(LabelStatement targetLabel)
	{
		this.targetLabel = targetLabel;
		this.labelName = targetLabel == null ? null : targetLabel.getLabel();
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitGotoStatement(this);
	}
}
