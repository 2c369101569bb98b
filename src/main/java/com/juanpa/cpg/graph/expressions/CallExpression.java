// File: src/main/java/com/juanpa/cpg/graph/expressions/CallExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.declarations.FunctionDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A call to a function. Arguments are positional.
 */
public class CallExpression extends Expression
{
	private String fqn;
	private final List<Expression> arguments = new ArrayList<>();
	private final List<FunctionDeclaration> invokes = new ArrayList<>();

	public CallExpression(String name, String fqn, String code)
	{
		super(name, code);
		this.fqn = fqn;
	}

	/**
	 * @return The fully qualified name of the called function, e.g. {@code Type.member}.
	 */
	public String getFqn()
	{
		return fqn;
	}

	public void setFqn(String fqn)
	{
		this.fqn = fqn;
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public void addArgument(Expression argument)
	{
		arguments.add(argument);
	}

	public List<FunctionDeclaration> getInvokes()
	{
		return Collections.unmodifiableList(invokes);
	}

	public void addInvoke(FunctionDeclaration function)
	{
		invokes.add(function);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return fqn + "(" + arguments.size() + " args)";
	}
}
