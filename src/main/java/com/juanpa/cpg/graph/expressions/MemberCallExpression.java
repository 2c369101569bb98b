// File: src/main/java/com/juanpa/cpg/graph/expressions/MemberCallExpression.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.semantics.Type;

import java.util.Set;

/**
 * A call to a function that is a member of an object, e.g. {@code obj.toString()}.
 * The fully qualified name follows the type of the base: whenever the base is re-typed, the FQN
 * becomes {@code <base root type>.<member name>}.
 */
public class MemberCallExpression extends CallExpression
{
	private MemberExpression member;

	public MemberCallExpression(String name, String fqn, String code)
	{
		super(name, fqn, code);
	}

	public MemberExpression getMember()
	{
		return member;
	}

	public void setMember(MemberExpression member)
	{
		this.member = member;
	}

	/**
	 * Returns the base of this member call. The base is not part of the call itself but of its
	 * member expression.
	 */
	public Expression getBase()
	{
		return member != null ? member.getBase() : null;
	}

	@Override
	public void typeChanged(HasType src, Type oldType)
	{
		if (src == getBase())
		{
			setFqn(src.getType().getRoot().getTypeName() + "." + getName());
		}
		else
		{
			super.typeChanged(src, oldType);
		}
	}

	@Override
	public void possibleSubTypesChanged(HasType src, Set<Type> oldSubTypes)
	{
		if (src != getBase())
		{
			super.possibleSubTypesChanged(src, oldSubTypes);
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitMemberCallExpression(this);
	}
}
