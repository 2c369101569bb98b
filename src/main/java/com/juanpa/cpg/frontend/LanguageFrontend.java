// File: src/main/java/com/juanpa/cpg/frontend/LanguageFrontend.java
package com.juanpa.cpg.frontend;

import com.juanpa.cpg.graph.NodeBuilder;
import com.juanpa.cpg.graph.declarations.RecordDeclaration;
import com.juanpa.cpg.semantics.ScopeManager;
import com.juanpa.cpg.semantics.TypeGraph;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The lowering context of exactly one translation unit. It owns all mutable state of a lowering
 * run (scopes, type graph, records, diagnostics), so independent units can be lowered by
 * independent frontends at the same time.
 */
public abstract class LanguageFrontend
{
	protected final LoweringConfig config;
	protected final ErrorReporter errorReporter;
	protected final TypeGraph typeGraph;
	protected final NodeBuilder builder;
	protected final ScopeManager scopeManager;
	private final Map<String, RecordDeclaration> records = new LinkedHashMap<>();

	protected LanguageFrontend(LoweringConfig config, ErrorReporter errorReporter)
	{
		this.config = config;
		this.errorReporter = errorReporter;
		this.typeGraph = new TypeGraph();
		this.builder = new NodeBuilder(typeGraph);
		this.scopeManager = new ScopeManager(config.getNamespaceDelimiter());
	}

	/**
	 * @return The raw text of an input construct, used for node code and diagnostics.
	 */
	public abstract String getCodeFromRawNode(Object astNode);

	/**
	 * Makes a record known under its qualified name and binds it to every type that already names it.
	 */
	public void addRecord(RecordDeclaration record)
	{
		records.put(record.getName(), record);
		typeGraph.resolveRecord(record);
	}

	public Optional<RecordDeclaration> getRecordForName(String name)
	{
		return Optional.ofNullable(records.get(name));
	}

	public Map<String, RecordDeclaration> getRecords()
	{
		return Collections.unmodifiableMap(records);
	}

	public LoweringConfig getConfig()
	{
		return config;
	}

	public ErrorReporter getErrorReporter()
	{
		return errorReporter;
	}

	public TypeGraph getTypeGraph()
	{
		return typeGraph;
	}

	public NodeBuilder getBuilder()
	{
		return builder;
	}

	public ScopeManager getScopeManager()
	{
		return scopeManager;
	}
}
