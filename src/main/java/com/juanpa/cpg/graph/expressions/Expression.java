// File: src/main/java/com/juanpa/cpg/graph/expressions/Expression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.graph.statements.Statement;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.UnknownType;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Base class for all value-producing nodes.
 */
public abstract class Expression extends Statement implements HasType
{
	private Type type = UnknownType.getUnknownType();
	private Set<Type> possibleSubTypes = new LinkedHashSet<>();
	private int typeGraphId = -1;

	protected Expression(String name, String code)
	{
		super(name, code);
	}

	@Override
	public Type getType()
	{
		return type;
	}

	@Override
	public void applyType(Type type)
	{
		this.type = type == null ? UnknownType.getUnknownType() : type;
	}

	@Override
	public Set<Type> getPossibleSubTypes()
	{
		return Collections.unmodifiableSet(possibleSubTypes);
	}

	@Override
	public void applyPossibleSubTypes(Set<Type> possibleSubTypes)
	{
		this.possibleSubTypes = new LinkedHashSet<>(possibleSubTypes);
	}

	@Override
	public int getTypeGraphId()
	{
		return typeGraphId;
	}

	@Override
	public void setTypeGraphId(int typeGraphId)
	{
		this.typeGraphId = typeGraphId;
	}
}
