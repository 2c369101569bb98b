// File: src/main/java/com/juanpa/cpg/graph/declarations/FieldDeclaration.java
package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.expressions.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A member variable of a {@link RecordDeclaration}.
 */
public class FieldDeclaration extends ValueDeclaration
{
	private final List<String> modifiers;
	private Expression initializer;

	public FieldDeclaration(String name, List<String> modifiers, String code)
	{
		super(name, code);
		this.modifiers = new ArrayList<>(modifiers);
	}

	/**
	 * Turns a variable that was lowered inside a record body into a field of that record.
	 */
	public static FieldDeclaration from(VariableDeclaration variable)
	{
		FieldDeclaration field = new FieldDeclaration(variable.getName(), Collections.emptyList(), variable.getCode());
		field.setLine(variable.getLine());
		field.applyType(variable.getType());
		field.setInitializer(variable.getInitializer());
		return field;
	}

	public List<String> getModifiers()
	{
		return Collections.unmodifiableList(modifiers);
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	public void setInitializer(Expression initializer)
	{
		this.initializer = initializer;
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitFieldDeclaration(this);
	}
}
