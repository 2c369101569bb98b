package com.juanpa.cpg.frontend.cxx.ast;

/**
 * {@code owner.field} or, if {@code pointerDereference} is set, {@code owner->field}.
 */
public class FieldReference extends CxxExpression
{
	private final CxxExpression owner;
	private final String fieldName;
	private final boolean pointerDereference;

	public FieldReference(String rawSignature, CxxExpression owner, String fieldName, boolean pointerDereference)
	{
		super(rawSignature);
		this.owner = owner;
		this.fieldName = fieldName;
		this.pointerDereference = pointerDereference;
	}

	public CxxExpression getOwner()
	{
		return owner;
	}

	public String getFieldName()
	{
		return fieldName;
	}

	public boolean isPointerDereference()
	{
		return pointerDereference;
	}
}
