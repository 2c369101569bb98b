// File: src/main/java/com/juanpa/cpg/graph/expressions/BinaryOperator.java
package com.juanpa.cpg.graph.expressions;

import com.juanpa.cpg.graph.GraphVisitor;

/**
 * A binary operation (e.g. a + b, x == y) and also the assignment a = b.
 */
public class BinaryOperator extends Expression
{
	private final String operatorCode;
	private Expression lhs;
	private Expression rhs;

	public BinaryOperator(String operatorCode, String code)
	{
		super(operatorCode, code);
		this.operatorCode = operatorCode;
	}

	public String getOperatorCode()
	{
		return operatorCode;
	}

	public Expression getLhs()
	{
		return lhs;
	}

	public void setLhs(Expression lhs)
	{
		this.lhs = lhs;
	}

	public Expression getRhs()
	{
		return rhs;
	}

	public void setRhs(Expression rhs)
	{
		this.rhs = rhs;
	}

	public boolean isAssignment()
	{
		return operatorCode.equals("=");
	}

	/**
	 * @return True for operators whose result is a truth value rather than an operand value.
	 */
	public boolean isComparisonOrLogical()
	{
		switch (operatorCode)
		{
			case "==":
			case "!=":
			case "<":
			case "<=":
			case ">":
			case ">=":
			case "&&":
			case "||":
				return true;
			default:
				return false;
		}
	}

	@Override
	public <R> R accept(GraphVisitor<R> visitor)
	{
		return visitor.visitBinaryOperator(this);
	}

	@Override
	public String toString()
	{
		return "(" + lhs + " " + operatorCode + " " + rhs + ")";
	}
}
