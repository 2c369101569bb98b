// File: src/main/java/com/juanpa/cpg/graph/declarations/VariableDeclaration.java
package com.juanpa.cpg.graph.declarations;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.graph.expressions.Expression;
import com.juanpa.cpg.semantics.Type;

/**
 * A local or global variable. SSA registers are lowered into variables typed with the register's
 * IR type; source-level variables get their type from the declaration specifier. A variable of
 * unknown type takes over the type of its initializer.
 */
public class VariableDeclaration extends ValueDeclaration
{
	private Expression initializer;
	private boolean inferTypeFromInitializer;

	public VariableDeclaration(String name, String code)
	{
		super(name, code);
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	/**
	 * Sets the initializer without any type wiring, see
	 * {@link com.juanpa.cpg.graph.NodeBuilder#initialize}.
	 */
	public void setInitializer(Expression initializer)
	{
		this.initializer = initializer;
	}

	public boolean isInferTypeFromInitializer()
	{
		return inferTypeFromInitializer;
	}

	public void setInferTypeFromInitializer(boolean inferTypeFromInitializer)
	{
		this.inferTypeFromInitializer = inferTypeFromInitializer;
	}

	@Override
	public void typeChanged(HasType src, Type oldType)
	{
		// A declared type wins over the initializer unless the declared type is still unknown
		if (src == initializer && !inferTypeFromInitializer && !getType().isUnknown())
		{
			return;
		}
		applyType(src.getType());
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitVariableDeclaration(this);
	}
}
