package com.juanpa.cpg.util;

/**
 * A single entry of the diagnostic channel: a severity, a message and the source text of the
 * construct that caused it.
 */
public class Diagnostic
{
	public enum Severity
	{
		INFO,
		WARNING,
		ERROR
	}

	private final Severity severity;
	private final String message;
	private final String construct;

	public Diagnostic(Severity severity, String message, String construct)
	{
		this.severity = severity;
		this.message = message;
		this.construct = construct;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public String getMessage()
	{
		return message;
	}

	/**
	 * @return The raw text of the offending construct, or null if the diagnostic is not tied to one.
	 */
	public String getConstruct()
	{
		return construct;
	}

	@Override
	public String toString()
	{
		String label = severity.name().charAt(0) + severity.name().substring(1).toLowerCase();
		StringBuilder sb = new StringBuilder("[").append(label).append("] ").append(message);
		if (construct != null && !construct.isBlank())
		{
			sb.append(" (at: ").append(construct.strip()).append(")");
		}
		return sb.toString();
	}
}
