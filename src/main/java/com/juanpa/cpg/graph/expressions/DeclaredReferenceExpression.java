package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.declarations.Declaration;

/**
 * A use of a declared name. An unresolved reference keeps a null target and an unknown type until
 * a later pass resolves it.
 */
public class DeclaredReferenceExpression extends Expression
{
	private Declaration refersTo;

	public DeclaredReferenceExpression(String name, String code)
	{
		super(name, code);
	}

	public Declaration getRefersTo()
	{
		return refersTo;
	}

	public void setRefersTo(Declaration refersTo)
	{
		this.refersTo = refersTo;
	}

	public boolean isResolved()
	{
		return refersTo != null;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitDeclaredReferenceExpression(this);
	}

	@Override
	public String toString()
	{
		return getName();
	}
}
