package com.juanpa.cpg.graph;

import com.juanpa.cpg.semantics.Type;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Implemented by every node that carries a {@link Type}. Such nodes can be wired into the
 * {@link com.juanpa.cpg.semantics.TypeGraph}, which calls {@link #typeChanged} on a dependent
 * whenever the resolved type of one of its sources changes.
 */
public interface HasType
{
	Type getType();

	/**
	 * Sets the type without notifying any dependents. Use
	 * {@link com.juanpa.cpg.semantics.TypeGraph#setType} to propagate a change.
	 */
	void applyType(Type type);

	Set<Type> getPossibleSubTypes();

	void applyPossibleSubTypes(Set<Type> possibleSubTypes);

	/**
	 * @return The stable index of this node in its type graph, or -1 if it was never registered.
	 */
	int getTypeGraphId();

	void setTypeGraphId(int typeGraphId);

	/**
	 * Called when the type of {@code src}, which this node depends on, has changed.
	 * The default is to adopt the type of the source.
	 *
	 * @param src     The node whose type changed.
	 * @param oldType The type {@code src} had before the change.
	 */
	default void typeChanged(HasType src, Type oldType)
	{
		applyType(src.getType());
	}

	/**
	 * Called when the possible sub types of {@code src} have changed. The default merges them into
	 * this node's own set.
	 */
	default void possibleSubTypesChanged(HasType src, Set<Type> oldSubTypes)
	{
		Set<Type> merged = new LinkedHashSet<>(getPossibleSubTypes());
		merged.addAll(src.getPossibleSubTypes());
		applyPossibleSubTypes(merged);
	}
}
