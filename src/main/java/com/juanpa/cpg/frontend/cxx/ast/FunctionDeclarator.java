// File: src/main/java/com/juanpa/cpg/frontend/cxx/ast/FunctionDeclarator.java
package com.juanpa.cpg.frontend.cxx.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declarator with a parameter list. With an empty name it declares a function pointer whose
 * name sits in the nested declarator, e.g. {@code (*callback)(int)}.
 */
public class FunctionDeclarator extends Declarator
{
	private final List<ParameterDecl> parameters;
	private final boolean takesVarArgs;
	private final Declarator nestedDeclarator;

	public FunctionDeclarator(String rawSignature, String name, String pointerOperators, List<ParameterDecl> parameters,
			boolean takesVarArgs, Declarator nestedDeclarator, CxxExpression initializer)
	{
		super(rawSignature, name, pointerOperators, initializer);
		this.parameters = new ArrayList<>(parameters);
		this.takesVarArgs = takesVarArgs;
		this.nestedDeclarator = nestedDeclarator;
	}

	public List<ParameterDecl> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public boolean takesVarArgs()
	{
		return takesVarArgs;
	}

	public Declarator getNestedDeclarator()
	{
		return nestedDeclarator;
	}
}
