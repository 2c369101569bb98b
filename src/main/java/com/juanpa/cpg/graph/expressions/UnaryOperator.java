package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;
import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.semantics.Type;

/**
 * A unary operation such as a dereference (*p), address-of (&x), negation or logical not.
 */
public class UnaryOperator extends Expression
{
	private final String operatorCode;
	private final boolean postfix;
	private final boolean prefix;
	private Expression input;

	public UnaryOperator(String operatorCode, boolean postfix, boolean prefix, String code)
	{
		super(operatorCode, code);
		this.operatorCode = operatorCode;
		this.postfix = postfix;
		this.prefix = prefix;
	}

	public String getOperatorCode()
	{
		return operatorCode;
	}

	public boolean isPostfix()
	{
		return postfix;
	}

	public boolean isPrefix()
	{
		return prefix;
	}

	public Expression getInput()
	{
		return input;
	}

	public void setInput(Expression input)
	{
		this.input = input;
	}

	@Override
	public void typeChanged(HasType src, Type oldType)
	{
		if (src != input)
		{
			applyType(src.getType());
			return;
		}

		switch (operatorCode)
		{
			case "*":
				applyType(src.getType().dereference());
				break;
			case "&":
				applyType(src.getType().reference("*"));
				break;
			default:
				applyType(src.getType());
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitUnaryOperator(this);
	}

	@Override
	public String toString()
	{
		return postfix ? input + operatorCode : operatorCode + input;
	}
}
