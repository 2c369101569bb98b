// File: src/main/java/com/juanpa/cpg/graph/statements/SwitchStatement.java
package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.expressions.Expression;

/**
 * A switch statement. Case and default labels are flat entries of the body, each followed by the
 * statements belonging to it.
 */
public class SwitchStatement extends Statement
{
	private Expression selector;
	private CompoundStatement statement;

	public SwitchStatement(String code)
	{
		super("", code);
	}

	public Expression getSelector()
	{
		return selector;
	}

	public void setSelector(Expression selector)
	{
		this.selector = selector;
	}

	public CompoundStatement getStatement()
	{
		return statement;
	}

	public void setStatement(CompoundStatement statement)
	{
		this.statement = statement;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitSwitchStatement(this);
	}
}
