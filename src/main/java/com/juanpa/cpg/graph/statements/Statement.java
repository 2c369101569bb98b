// File: src/main/java/com/juanpa/cpg/graph/statements/Statement.java
package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.Node;

/**
 * Base class for all statement nodes. Expressions are statements too, so a bare value-producing
 * instruction can sit directly in a block.
 */
public abstract class Statement extends Node
{
	protected Statement(String name, String code)
	{
		super(name, code);
	}
}
