// File: src/main/java/com/juanpa/cpg/frontend/cxx/ast/CxxTranslationUnit.java
package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class CxxTranslationUnit extends CxxNode
{
	private final String name;
	private final List<CxxDeclaration> declarations;

	public CxxTranslationUnit(String name, List<CxxDeclaration> declarations)
	{
		super(null);
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
