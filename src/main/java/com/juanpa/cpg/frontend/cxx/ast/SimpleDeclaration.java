// File: src/main/java/com/juanpa/cpg/frontend/cxx/ast/SimpleDeclaration.java
package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declaration of zero or more entities sharing one specifier, e.g. {@code int a, *b;} or a
 * record definition {@code struct S { ... };}.
 */
public class SimpleDeclaration extends CxxDeclaration
{
	private final DeclSpecifier specifier;
	private final List<Declarator> declarators;

	public SimpleDeclaration(String rawSignature, DeclSpecifier specifier, List<Declarator> declarators)
	{
		super(rawSignature);
		this.specifier = specifier;
		this.declarators = new ArrayList<>(declarators);
	}

	public DeclSpecifier getSpecifier()
	{
		return specifier;
	}

	public List<Declarator> getDeclarators()
	{
		return Collections.unmodifiableList(declarators);
	}
}
