package com.juanpa.cpg.frontend.cxx.ast;

/**
 * A type given by name, e.g. {@code unsigned int} or {@code ns::Point}.
 */
public class NamedTypeSpecifier extends DeclSpecifier
{
	private final String typeName;

	public NamedTypeSpecifier(String typeName)
	{
		super(typeName);
		this.typeName = typeName;
	}

	public String getTypeName()
	{
		return typeName;
	}
}
