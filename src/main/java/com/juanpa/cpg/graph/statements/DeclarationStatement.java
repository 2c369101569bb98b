package com.juanpa.cpg.graph.statements;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.declarations.Declaration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Wraps declarations so that they can appear inside a block.
 */
public class DeclarationStatement extends Statement
{
	private final List<Declaration> declarations = new ArrayList<>();

	public DeclarationStatement(String code)
	{
		super("", code);
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	public void addDeclaration(Declaration declaration)
	{
		declarations.add(declaration);
	}

	public boolean isSingleDeclaration()
	{
		return declarations.size() == 1;
	}

	public Declaration getSingleDeclaration()
	{
		return isSingleDeclaration() ? declarations.get(0) : null;
	}

	public void setSingleDeclaration(Declaration declaration)
	{
		declarations.clear();
		declarations.add(declaration);
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitDeclarationStatement(this);
	}
}
