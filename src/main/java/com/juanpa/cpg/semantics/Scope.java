// File: src/main/java/com/juanpa/cpg/semantics/Scope.java
package com.juanpa.cpg.semantics;

import com.juanpa.cpg.graph.Node;
import com.juanpa.cpg.graph.declarations.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One level of lexical nesting. Declarations keep their insertion order; a name declared twice in
 * the same scope resolves to the latest declaration.
 */
public class Scope
{
	private final ScopeKind kind;
	private final Node owner;
	private final Scope parent;
	private final String scopedName;
	private final List<Declaration> declarations = new ArrayList<>();

	public Scope(ScopeKind kind, Node owner, Scope parent, String scopedName)
	{
		this.kind = kind;
		this.owner = owner;
		this.parent = parent;
		this.scopedName = scopedName == null ? "" : scopedName;
	}

	public ScopeKind getKind()
	{
		return kind;
	}

	/**
	 * @return The node that opened this scope, or null for the global scope.
	 */
	public Node getOwner()
	{
		return owner;
	}

	public Scope getParent()
	{
		return parent;
	}

	/**
	 * @return The qualified name of the innermost enclosing namespace or record, empty at top level.
	 */
	public String getScopedName()
	{
		return scopedName;
	}

	/**
	 * Adds a declaration to this scope. A declaration that is already defined here is kept once.
	 */
	public void define(Declaration declaration)
	{
		if (!declarations.contains(declaration))
		{
			declarations.add(declaration);
		}
	}

	public boolean remove(Declaration declaration)
	{
		return declarations.remove(declaration);
	}

	/**
	 * Resolves a name within this scope only.
	 *
	 * @return The latest declaration with that name, or null.
	 */
	public Declaration resolve(String name)
	{
		for (int i = declarations.size() - 1; i >= 0; i--)
		{
			if (declarations.get(i).getName().equals(name))
			{
				return declarations.get(i);
			}
		}
		return null;
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	@Override
	public String toString()
	{
		return "Scope[" + kind + (scopedName.isEmpty() ? "" : " " + scopedName) + "]";
	}
}
