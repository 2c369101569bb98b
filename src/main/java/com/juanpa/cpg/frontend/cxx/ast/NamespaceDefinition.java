package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class NamespaceDefinition extends CxxDeclaration
{
	private final String name;
	private final List<CxxDeclaration> declarations;

	public NamespaceDefinition(String rawSignature, String name, List<CxxDeclaration> declarations)
	{
		super(rawSignature);
		this.name = name;
		this.declarations = new ArrayList<>(declarations);
	}

	public String getName()
	{
		return name;
	}

	public List<CxxDeclaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}
}
