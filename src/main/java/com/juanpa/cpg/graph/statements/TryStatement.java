package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TryStatement extends Statement
{
	private CompoundStatement tryBlock;
	private final List<CatchClause> catchClauses = new ArrayList<>();
	private CompoundStatement finallyBlock;

	public TryStatement(String code)
	{
		super("", code);
	}

	public CompoundStatement getTryBlock()
	{
		return tryBlock;
	}

	public void setTryBlock(CompoundStatement tryBlock)
	{
		this.tryBlock = tryBlock;
	}

	public List<CatchClause> getCatchClauses()
	{
		return Collections.unmodifiableList(catchClauses);
	}

	public void addCatchClause(CatchClause catchClause)
	{
		catchClauses.add(catchClause);
	}

	public CompoundStatement getFinallyBlock()
	{
		return finallyBlock;
	}

	public void setFinallyBlock(CompoundStatement finallyBlock)
	{
		this.finallyBlock = finallyBlock;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitTryStatement(this);
	}
}
