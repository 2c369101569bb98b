package com.juanpa.cpg.frontend.cxx.ast;

/**
 * A declarator with array modifiers, e.g. {@code buf[16]}. Dimensions are not modeled.
 */
public class ArrayDeclarator extends Declarator
{
	public ArrayDeclarator(String rawSignature, String name, String pointerOperators, CxxExpression initializer)
	{
		super(rawSignature, name, pointerOperators, initializer);
	}
}
