// File: src/main/java/com/juanpa/cpg/frontend/cxx/ast/Declarator.java
package com.juanpa.cpg.frontend.cxx.ast;

/**
 * The part of a declaration that names one entity, with its pointer operators and initializer,
 * e.g. {@code *p = nullptr} in {@code int *p = nullptr;}.
 */
public class Declarator extends CxxNode
{
	private final String name;
	private final String pointerOperators;
	private final CxxExpression initializer;

	public Declarator(String rawSignature, String name, String pointerOperators, CxxExpression initializer)
	{
		super(rawSignature);
		this.name = name == null ? "" : name;
		this.pointerOperators = pointerOperators == null ? "" : pointerOperators;
		this.initializer = initializer;
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return The pointer and reference operators in source order, e.g. {@code "*&"}.
	 */
	public String getPointerOperators()
	{
		return pointerOperators;
	}

	public CxxExpression getInitializer()
	{
		return initializer;
	}
}
