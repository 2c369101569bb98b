// File: src/main/java/com/juanpa/cpg/graph/statements/CompoundStatement.java
package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An ordered block of statements. This is the only composite that supports structural insertion,
 * which the SSA lowering needs to splice statements in front of a block's terminator.
 */
public class CompoundStatement extends Statement
{
	private final List<Statement> statements = new ArrayList<>();

	public CompoundStatement(String code)
	{
		super("", code);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public void addStatement(Statement statement)
	{
		statements.add(statement);
	}

	public void insertStatement(int index, Statement statement)
	{
		statements.add(index, statement);
	}

	/**
	 * Inserts a statement directly before the last statement of this block, i.e. its terminator.
	 * An empty block just receives the statement.
	 */
	public void insertBeforeTerminator(Statement statement)
	{
		if (statements.isEmpty())
		{
			statements.add(statement);
		}
		else
		{
			statements.add(statements.size() - 1, statement);
		}
	}

	/**
	 * @return The last statement of this block, or null if the block is empty.
	 */
	public Statement getTerminator()
	{
		return statements.isEmpty() ? null : statements.get(statements.size() - 1);
	}

	public void setStatements(List<Statement> statements)
	{
		this.statements.clear();
		this.statements.addAll(statements);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitCompoundStatement(this);
	}
}
