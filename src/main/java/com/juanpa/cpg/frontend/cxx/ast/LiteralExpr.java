package com.juanpa.cpg.frontend.cxx.ast;

/**
 * A literal with its already evaluated value and the name of its type, e.g. {@code 42} of
 * {@code int}.
 */
public class LiteralExpr extends CxxExpression
{
	private final Object value;
	private final String typeName;

	public LiteralExpr(String rawSignature, Object value, String typeName)
	{
		super(rawSignature);
		this.value = value;
		this.typeName = typeName;
	}

	public Object getValue()
	{
		return value;
	}

	public String getTypeName()
	{
		return typeName;
	}
}
