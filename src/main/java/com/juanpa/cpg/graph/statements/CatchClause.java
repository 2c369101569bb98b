package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.declarations.VariableDeclaration;

/**
 * A catch clause. The name of the clause is the textual union of the types it catches.
 */
public class CatchClause extends Statement
{
	private VariableDeclaration parameter;
	private CompoundStatement body;

	public CatchClause(String code)
	{
		super("", code);
	}

	public VariableDeclaration getParameter()
	{
		return parameter;
	}

	public void setParameter(VariableDeclaration parameter)
	{
		this.parameter = parameter;
	}

	public CompoundStatement getBody()
	{
		return body;
	}

	public void setBody(CompoundStatement body)
	{
		this.body = body;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitCatchClause(this);
	}
}
