// File: src/main/java/com/juanpa/cpg/graph/Node.java
package com.juanpa.cpg.graph;

/**
 * Base class for all vertices of the code property graph.
 * Every node carries a human-readable name, the raw source text it was lowered from and,
 * where known, the line it started on. Nodes are never destroyed once created, only rewired.
 */
public abstract class Node
{
	private String name;
	private String code;
	private int line = -1;

	protected Node(String name, String code)
	{
		this.name = name == null ? "" : name;
		this.code = code;
	}

	public String getName()
	{
		return name;
	}

	public void setName(String name)
	{
		this.name = name == null ? "" : name;
	}

	/**
	 * @return The raw source or IR text this node was lowered from, may be null.
	 */
	public String getCode()
	{
		return code;
	}

	public void setCode(String code)
	{
		this.code = code;
	}

	public int getLine()
	{
		return line;
	}

	public void setLine(int line)
	{
		this.line = line;
	}

	/**
	 * Accepts a GraphVisitor to traverse this node.
	 *
	 * @param visitor The GraphVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	public abstract <R> R accept(GraphVisitor<R> visitor);

	@Override
	public String toString()
	{
		return getClass().getSimpleName() + "[name=" + name + "]";
	}
}
