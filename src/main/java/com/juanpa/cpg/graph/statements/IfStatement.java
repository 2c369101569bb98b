// File: src/main/java/com/juanpa/cpg/graph/statements/IfStatement.java
package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.expressions.Expression;

/**
 * An 'if-else' statement with a condition, a 'then' statement and an optional 'else' statement.
 */
public class IfStatement extends Statement
{
	private Expression condition;
	private Statement thenStatement;
	private Statement elseStatement;

	public IfStatement(String code)
	{
		super("", code);
	}

	public Expression getCondition()
	{
		return condition;
	}

	public void setCondition(Expression condition)
	{
		this.condition = condition;
	}

	public Statement getThenStatement()
	{
		return thenStatement;
	}

	public void setThenStatement(Statement thenStatement)
	{
		this.thenStatement = thenStatement;
	}

	public Statement getElseStatement()
	{
		return elseStatement;
	}

	public void setElseStatement(Statement elseStatement)
	{
		this.elseStatement = elseStatement;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}
}
