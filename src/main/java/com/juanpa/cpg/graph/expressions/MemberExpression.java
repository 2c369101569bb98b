package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.graph.declarations.FieldDeclaration;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;
import com.juanpa.cpg.semantics.ObjectType;
import com.juanpa.cpg.semantics.Type;
import com.juanpa.cpg.semantics.UnknownType;

/**
 * Access to a member of a base expression, e.g. {@code obj.field}. The field is resolved through
 * the record that backs the base's type, never by re-parsing a name.
 */
public class MemberExpression extends Expression
{
	private Expression base;
	private final String operatorCode;
	private FieldDeclaration refersTo;

	public MemberExpression(String memberName, String operatorCode, String code)
	{
		super(memberName, code);
		this.operatorCode = operatorCode;
	}

	public Expression getBase()
	{
		return base;
	}

	public void setBase(Expression base)
	{
		this.base = base;
	}

	public String getOperatorCode()
	{
		return operatorCode;
	}

	/**
	 * @return The resolved field, or null while the base type's record is unknown.
	 */
	public FieldDeclaration getRefersTo()
	{
		return refersTo;
	}

	public void setRefersTo(FieldDeclaration refersTo)
	{
		this.refersTo = refersTo;
	}

	/**
	 * Looks the member up in the record backing the current type of the base.
	 */
	public FieldDeclaration resolveField()
	{
		if (base == null)
		{
			return null;
		}
		Type root = base.getType().getRoot();
		if (root instanceof ObjectType)
		{
			RecordDeclaration record = ((ObjectType) root).getRecordDeclaration();
			if (record != null)
			{
				return record.getField(getName());
			}
		}
		return null;
	}

	@Override
	public void typeChanged(HasType src, Type oldType)
	{
		if (src == base)
		{
			FieldDeclaration field = resolveField();
			if (field != null)
			{
				refersTo = field;
				applyType(field.getType());
			}
			else if (refersTo == null)
			{
				applyType(UnknownType.getUnknownType());
			}
		}
		else
		{
			applyType(src.getType());
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitMemberExpression(this);
	}

	@Override
	public String toString()
	{
		return base + operatorCode + getName();
	}
}
