// File: src/main/java/com/juanpa/cpg/frontend/cxx/ast/CxxNode.java
package com.juanpa.cpg.frontend.cxx.ast;

/**
 * Base of the C++-family input tree. Every node keeps the source text it was parsed from.
 */
public abstract class CxxNode
{
	private final String rawSignature;

	protected CxxNode(String rawSignature)
	{
		this.rawSignature = rawSignature;
	}

	public String getRawSignature()
	{
		return rawSignature;
	}

	@Override
	public String toString()
	{
		return rawSignature;
	}
}
