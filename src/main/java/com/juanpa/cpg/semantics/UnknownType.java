package com.juanpa.cpg.semantics;

/**
 * Placeholder for a type that could not be resolved (yet). There is exactly one instance.
 */
public final class UnknownType extends Type
{
	private static final UnknownType UNKNOWN = new UnknownType();

	private UnknownType()
	{
		super("UNKNOWN", "");
	}

	public static UnknownType getUnknownType()
	{
		return UNKNOWN;
	}

	@Override
	public Type withTypeAdjustment(String typeAdjustment)
	{
		return this;
	}

	@Override
	public Type dereference()
	{
		return this;
	}

	@Override
	public boolean isUnknown()
	{
		return true;
	}
}
