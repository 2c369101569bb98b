package com.juanpa.cpg.util;

import java.util.Properties;

/**
 * Holds configuration settings for the lowering engine, loaded from a properties file.
 * Provides sensible defaults if settings are not specified.
 */
public class LoweringConfig
{
	private final boolean debug;
	private final int threads;
	private final boolean printGraph;
	private final String namespaceDelimiter;
	private final String irFileExtension;

	public LoweringConfig(Properties props)
	{
		this.debug = Boolean.parseBoolean(props.getProperty("lowering.debug", "false").trim());
		this.printGraph = Boolean.parseBoolean(props.getProperty("lowering.print_graph", "false").trim());
		this.threads = parseThreads(props.getProperty("lowering.threads", "1"));
		this.namespaceDelimiter = props.getProperty("cxx.namespace_delimiter", "::").trim();
		this.irFileExtension = props.getProperty("llvm.file_extension", ".ll").trim();
	}

	/**
	 * A configuration with every setting at its default.
	 */
	public static LoweringConfig defaults()
	{
		return new LoweringConfig(new Properties());
	}

	private static int parseThreads(String value)
	{
		try
		{
			return Math.max(1, Integer.parseInt(value.trim()));
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException("lowering.threads must be a number, got '" + value + "'", e);
		}
	}

	public boolean isDebug()
	{
		return debug;
	}

	public int getThreads()
	{
		return threads;
	}

	public boolean isPrintGraph()
	{
		return printGraph;
	}

	public String getNamespaceDelimiter()
	{
		return namespaceDelimiter;
	}

	public String getIrFileExtension()
	{
		return irFileExtension;
	}
}
