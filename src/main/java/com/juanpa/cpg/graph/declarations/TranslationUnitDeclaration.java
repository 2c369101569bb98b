package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The root node of one lowered unit. This is what gets handed to later passes.
 */
public class TranslationUnitDeclaration extends Declaration
{
	private final List<Declaration> declarations = new ArrayList<>();

	public TranslationUnitDeclaration(String name, String code)
	{
		super(name, code);
	}

	public List<Declaration> getDeclarations()
	{
		return Collections.unmodifiableList(declarations);
	}

	public void addDeclaration(Declaration declaration)
	{
		if (!declarations.contains(declaration))
		{
			declarations.add(declaration);
		}
	}

	public <T extends Declaration> List<T> getDeclarationsByType(Class<T> type)
	{
		return declarations.stream()
				.filter(type::isInstance)
				.map(type::cast)
				.collect(Collectors.toList());
	}

	/**
	 * @return The top-level function with the given name, or null.
	 */
	public FunctionDeclaration getFunction(String name)
	{
		for (FunctionDeclaration function : getDeclarationsByType(FunctionDeclaration.class))
		{
			if (function.getName().equals(name))
			{
				return function;
			}
		}
		return null;
	}

	/**
	 * @return The top-level record with the given name, or null.
	 */
	public RecordDeclaration getRecord(String name)
	{
		for (RecordDeclaration record : getDeclarationsByType(RecordDeclaration.class))
		{
			if (record.getName().equals(name))
			{
				return record;
			}
		}
		return null;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitTranslationUnit(this);
	}
}
