// File: src/main/java/com/juanpa/cpg/graph/declarations/FunctionDeclaration.java
package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A function. Its type is the return type. A function without a body is a declaration only.
 */
public class FunctionDeclaration extends ValueDeclaration
{
	private final List<ParameterDeclaration> parameters = new ArrayList<>();
	private Statement body;

	public FunctionDeclaration(String name, String code)
	{
		super(name, code);
	}

	public List<ParameterDeclaration> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public void addParameter(ParameterDeclaration parameter)
	{
		parameters.add(parameter);
	}

	public Statement getBody()
	{
		return body;
	}

	public void setBody(Statement body)
	{
		this.body = body;
	}

	public boolean hasBody()
	{
		return body != null;
	}

	public boolean isVariadic()
	{
		return !parameters.isEmpty() && parameters.get(parameters.size() - 1).isVariadic();
	}

	/**
	 * Copies name, code, parameters, body and type into another function-like declaration.
	 */
	protected void copyInto(FunctionDeclaration target)
	{
		target.setLine(getLine());
		target.applyType(getType());
		target.setBody(body);
		for (ParameterDeclaration parameter : parameters)
		{
			target.addParameter(parameter);
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}
}
