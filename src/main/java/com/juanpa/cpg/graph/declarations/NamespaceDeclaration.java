// File: src/main/java/com/juanpa/cpg/graph/declarations/NamespaceDeclaration.java
package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A namespace and the declarations directly contained in it. The name is fully qualified.
 */
public class NamespaceDeclaration extends Declaration
{
	private final List<Declaration> declarations = new ArrayList<>();

	public NamespaceDeclaration(String name, String code)
	{
		super(name, code);
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	public void addDeclaration(Declaration declaration)
	{
		declarations.add(declaration);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitNamespaceDeclaration(this);
	}
}
