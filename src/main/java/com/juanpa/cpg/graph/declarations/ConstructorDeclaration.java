package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;

public class ConstructorDeclaration extends MethodDeclaration
{
	private final boolean implicit;

	public ConstructorDeclaration(String name, String code, RecordDeclaration recordDeclaration, boolean implicit)
	{
		super(name, code, false, recordDeclaration);
		this.implicit = implicit;
	}

	public static ConstructorDeclaration from(MethodDeclaration method)
	{
		ConstructorDeclaration constructor = new ConstructorDeclaration(method.getName(), method.getCode(), method.getRecordDeclaration(), false);
		method.copyInto(constructor);
		return constructor;
	}

	/**
	 * @return True if this constructor was synthesized because the record declared none.
	 */
	public boolean isImplicit()
	{
		return implicit;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitConstructorDeclaration(this);
	}
}
