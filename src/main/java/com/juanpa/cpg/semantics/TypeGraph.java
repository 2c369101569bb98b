// File: src/main/java/com/juanpa/cpg/semantics/TypeGraph.java
package com.juanpa.cpg.semantics;

import com.juanpa.cpg.graph.HasType;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;
import com.juanpa.cpg.util.Debug;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The type dependency graph of one translation unit.
 * Every typed node is registered under a stable index. An edge {@code source -> dependent} means
 * the dependent derives its type (or some derived state, like a call's FQN) from the source.
 * Changes are pushed through a worklist that only continues from nodes whose resolved type
 * really changed, so cyclic dependencies terminate.
 */
public class TypeGraph
{
	/**
	 * Upper bound on how often one node may be re-typed within a single propagation.
	 * Only reached by cycles that keep producing new types, e.g. an address-of inside a loop.
	 */
	private static final int MAX_UPDATES_PER_NODE = 32;

	private final List<HasType> nodes = new ArrayList<>();
	private final Map<Integer, Set<Integer>> dependents = new HashMap<>();

	private static final class Change
	{
		final HasType source;
		final Type oldType;
		final Set<Type> oldSubTypes;

		Change(HasType source, Type oldType, Set<Type> oldSubTypes)
		{
			this.source = source;
			this.oldType = oldType;
			this.oldSubTypes = oldSubTypes;
		}
	}

	/**
	 * Registers a node and returns its index. Registering a node twice returns the same index.
	 */
	public int register(HasType node)
	{
		int id = node.getTypeGraphId();
		if (id >= 0 && id < nodes.size() && nodes.get(id) == node)
		{
			return id;
		}
		id = nodes.size();
		nodes.add(node);
		node.setTypeGraphId(id);
		return id;
	}

	public int size()
	{
		return nodes.size();
	}

	/**
	 * @return The nodes that depend on {@code source}, in registration order of the edges.
	 */
	public List<HasType> getDependents(HasType source)
	{
		Set<Integer> ids = dependents.get(register(source));
		if (ids == null)
		{
			return Collections.emptyList();
		}
		List<HasType> result = new ArrayList<>();
		for (Integer id : ids)
		{
			result.add(nodes.get(id));
		}
		return result;
	}

	/**
	 * Makes {@code dependent} observe {@code source}. If the source already has a known type it is
	 * pushed to the new dependent right away.
	 */
	public void addTypeObserver(HasType source, HasType dependent)
	{
		int sourceId = register(source);
		int dependentId = register(dependent);
		if (!dependents.computeIfAbsent(sourceId, k -> new LinkedHashSet<>()).add(dependentId))
		{
			return;
		}

		Deque<Change> worklist = new ArrayDeque<>();
		if (!source.getType().isUnknown())
		{
			Type before = dependent.getType();
			dependent.typeChanged(source, source.getType());
			if (!sameResolution(before, dependent.getType()))
			{
				worklist.add(new Change(dependent, before, null));
			}
		}
		if (!source.getPossibleSubTypes().isEmpty())
		{
			Set<Type> before = new LinkedHashSet<>(dependent.getPossibleSubTypes());
			dependent.possibleSubTypesChanged(source, source.getPossibleSubTypes());
			if (!before.equals(dependent.getPossibleSubTypes()))
			{
				worklist.add(new Change(dependent, null, before));
			}
		}
		propagate(worklist);
	}

	/**
	 * Sets the type of a node and propagates the change to everything that depends on it.
	 */
	public void setType(HasType node, Type type)
	{
		register(node);
		Type old = node.getType();
		node.applyType(type);
		if (sameResolution(old, node.getType()))
		{
			return;
		}
		Debug.log("Type of %s changed from %s to %s", node, old, node.getType());
		Deque<Change> worklist = new ArrayDeque<>();
		worklist.add(new Change(node, old, null));
		propagate(worklist);
	}

	/**
	 * Sets the possible sub types of a node and propagates the change.
	 */
	public void setPossibleSubTypes(HasType node, Set<Type> possibleSubTypes)
	{
		register(node);
		Set<Type> old = new LinkedHashSet<>(node.getPossibleSubTypes());
		node.applyPossibleSubTypes(possibleSubTypes);
		if (old.equals(node.getPossibleSubTypes()))
		{
			return;
		}
		Deque<Change> worklist = new ArrayDeque<>();
		worklist.add(new Change(node, null, old));
		propagate(worklist);
	}

	/**
	 * Binds a record to every registered node whose type names that record but is not bound to it
	 * yet, and propagates the new types.
	 */
	public void resolveRecord(RecordDeclaration record)
	{
		List<HasType> snapshot = new ArrayList<>(nodes);
		for (HasType node : snapshot)
		{
			Type type = node.getType();
			if (type instanceof ObjectType
					&& type.getName().equals(record.getName())
					&& ((ObjectType) type).getRecordDeclaration() != record)
			{
				setType(node, ((ObjectType) type).withRecord(record));
			}
		}
	}

	private void propagate(Deque<Change> worklist)
	{
		Map<Integer, Integer> updates = new HashMap<>();
		while (!worklist.isEmpty())
		{
			Change change = worklist.poll();
			for (HasType dependent : getDependents(change.source))
			{
				if (change.oldSubTypes == null)
				{
					Type before = dependent.getType();
					dependent.typeChanged(change.source, change.oldType);
					if (!sameResolution(before, dependent.getType()) && mayUpdate(updates, dependent))
					{
						worklist.add(new Change(dependent, before, null));
					}
				}
				else
				{
					Set<Type> before = new LinkedHashSet<>(dependent.getPossibleSubTypes());
					dependent.possibleSubTypesChanged(change.source, change.oldSubTypes);
					if (!before.equals(dependent.getPossibleSubTypes()) && mayUpdate(updates, dependent))
					{
						worklist.add(new Change(dependent, null, before));
					}
				}
			}
		}
	}

	private boolean mayUpdate(Map<Integer, Integer> updates, HasType node)
	{
		int count = updates.merge(node.getTypeGraphId(), 1, Integer::sum);
		if (count > MAX_UPDATES_PER_NODE)
		{
			Debug.log("Stopping type propagation at %s, its type does not settle", node);
			return false;
		}
		return true;
	}

	/**
	 * Two types resolve the same if they have the same full name and, for object types, the same
	 * backing record.
	 */
	static boolean sameResolution(Type a, Type b)
	{
		if (!Objects.equals(a, b))
		{
			return false;
		}
		if (a instanceof ObjectType && b instanceof ObjectType)
		{
			return ((ObjectType) a).getRecordDeclaration() == ((ObjectType) b).getRecordDeclaration();
		}
		return true;
	}
}
