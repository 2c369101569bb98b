package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Construction of a record value from positional arguments.
 */
public class ConstructExpression extends Expression
{
	private final List<Expression> arguments = new ArrayList<>();
	private RecordDeclaration instantiates;

	public ConstructExpression(String code)
	{
		super("", code);
	}

	public List<Expression> getArguments()
	{
		return Collections.unmodifiableList(arguments);
	}

	public void addArgument(Expression argument)
	{
		arguments.add(argument);
	}

	/**
	 * Replaces the positional argument at {@code index}. Missing positions in between are filled
	 * with nothing, so the index must be at most the current argument count.
	 */
	public void setArgument(int index, Expression argument)
	{
		if (index == arguments.size())
		{
			arguments.add(argument);
		}
		else
		{
			arguments.set(index, argument);
		}
	}

	public RecordDeclaration getInstantiates()
	{
		return instantiates;
	}

	public void setInstantiates(RecordDeclaration instantiates)
	{
		this.instantiates = instantiates;
		if (instantiates != null)
		{
			setName(instantiates.getName());
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitConstructExpression(this);
	}
}
