// File: src/main/java/com/juanpa/cpg/frontend/cxx/ast/CompositeTypeSpecifier.java
package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A struct, union or class body together with its name and base specifiers.
 */
public class CompositeTypeSpecifier extends DeclSpecifier
{
	public enum Key
	{
		STRUCT,
		UNION,
		CLASS
	}

	private final Key key;
	private final String name;
	private final List<String> baseSpecifiers;
	private final List<CxxDeclaration> members;

	public CompositeTypeSpecifier(String rawSignature, Key key, String name, List<String> baseSpecifiers, List<CxxDeclaration> members)
	{
		super(rawSignature);
		this.key = key;
		this.name = name;
		this.baseSpecifiers = new ArrayList<>(baseSpecifiers);
		this.members = new ArrayList<>(members);
	}

	public Key getKey()
	{
		return key;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return The base names as written, possibly qualified with a namespace.
	 */
	public List<String> getBaseSpecifiers()
	{
		return Collections.unmodifiableList(baseSpecifiers);
	}

	public List<CxxDeclaration> getMembers()
	{
		return Collections.unmodifiableList(members);
	}
}
