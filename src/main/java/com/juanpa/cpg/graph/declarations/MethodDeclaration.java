package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * A function that is a member of a {@link RecordDeclaration}.
 */
public class MethodDeclaration extends FunctionDeclaration
{
	private final boolean isStatic;
	private RecordDeclaration recordDeclaration;

	public MethodDeclaration(String name, String code, boolean isStatic, RecordDeclaration recordDeclaration)
	{
		super(name, code);
		this.isStatic = isStatic;
		this.recordDeclaration = recordDeclaration;
	}

	/**
	 * Turns a function that was lowered inside a record body into a method of that record.
	 */
	public static MethodDeclaration from(FunctionDeclaration function, RecordDeclaration recordDeclaration)
	{
		MethodDeclaration method = new MethodDeclaration(function.getName(), function.getCode(), false, recordDeclaration);
		function.copyInto(method);
		return method;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	/**
	 * @return The record this method belongs to, or null if it could not be resolved.
	 */
	public RecordDeclaration getRecordDeclaration()
	{
		return recordDeclaration;
	}

	public void setRecordDeclaration(RecordDeclaration recordDeclaration)
	{
		this.recordDeclaration = recordDeclaration;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitMethodDeclaration(this);
	}
}
