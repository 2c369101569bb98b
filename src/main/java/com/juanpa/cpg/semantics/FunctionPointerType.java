// File: src/main/java/com/juanpa/cpg/semantics/FunctionPointerType.java
package com.juanpa.cpg.semantics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The type of a variable or field that points to a function, e.g. {@code int (*cb)(char)}.
 */
public class FunctionPointerType extends Type
{
	private final Type returnType;
	private final List<Type> parameters;

	public FunctionPointerType(Type returnType, List<Type> parameters)
	{
		this(returnType, parameters, "");
	}

	private FunctionPointerType(Type returnType, List<Type> parameters, String typeAdjustment)
	{
		super(returnType.getTypeName() + "(*)(" + parameters.stream().map(Type::getTypeName).collect(Collectors.joining(", ")) + ")", typeAdjustment);
		this.returnType = returnType;
		this.parameters = new ArrayList<>(parameters);
	}

	public Type getReturnType()
	{
		return returnType;
	}

	public List<Type> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	@Override
	public Type withTypeAdjustment(String typeAdjustment)
	{
		return new FunctionPointerType(returnType, parameters, typeAdjustment);
	}
}
