// File: src/main/java/com/juanpa/cpg/semantics/ObjectType.java
package com.juanpa.cpg.semantics;

import com.juanpa.cpg.graph.declarations.RecordDeclaration;

/**
 * A type backed by a record (struct, union or class). The record may be unknown at creation time
 * and is bound later by {@link TypeGraph#resolveRecord}.
 */
public class ObjectType extends Type
{
	private final RecordDeclaration recordDeclaration;

	public ObjectType(String name)
	{
		this(name, "", null);
	}

	public ObjectType(String name, String typeAdjustment, RecordDeclaration recordDeclaration)
	{
		super(name, typeAdjustment);
		this.recordDeclaration = recordDeclaration;
	}

	/**
	 * @return The backing record, or null if it has not been resolved yet.
	 */
	public RecordDeclaration getRecordDeclaration()
	{
		return recordDeclaration;
	}

	public ObjectType withRecord(RecordDeclaration record)
	{
		return new ObjectType(name, typeAdjustment, record);
	}

	@Override
	public Type withTypeAdjustment(String typeAdjustment)
	{
		return new ObjectType(name, typeAdjustment, recordDeclaration);
	}
}
