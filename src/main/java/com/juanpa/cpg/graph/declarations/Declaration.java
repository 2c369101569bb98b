package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.Node;

/**
 * Base class of every node that introduces a named binding.
 */
public abstract class Declaration extends Node
{
	protected Declaration(String name, String code)
	{
		super(name, code);
	}
}
