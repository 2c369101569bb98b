package com.juanpa.cpg.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one translation unit. Unsupported or unresolved constructs are
 * reported here instead of aborting the whole unit.
 */
public class ErrorReporter
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private boolean hasErrors = false; // Flag to indicate if any errors have been reported
	private boolean echo = true;

	/**
	 * Reports a diagnostic for a construct.
	 *
	 * @param severity  How severe the problem is.
	 * @param message   The diagnostic message.
	 * @param construct The raw text of the offending construct, may be null.
	 */
	public void report(Diagnostic.Severity severity, String message, String construct)
	{
		Diagnostic diagnostic = new Diagnostic(severity, message, construct);
		diagnostics.add(diagnostic);
		if (severity == Diagnostic.Severity.ERROR)
		{
			hasErrors = true;
		}

		if (severity == Diagnostic.Severity.INFO)
		{
			Debug.log("%s", diagnostic);
		}
		else if (echo)
		{
			System.err.println(diagnostic);
		}
	}

	public void info(String message, String construct)
	{
		report(Diagnostic.Severity.INFO, message, construct);
	}

	public void warning(String message, String construct)
	{
		report(Diagnostic.Severity.WARNING, message, construct);
	}

	public void error(String message, String construct)
	{
		report(Diagnostic.Severity.ERROR, message, construct);
	}

	/**
	 * Controls whether warnings and errors are also printed to standard error.
	 */
	public void setEcho(boolean echo)
	{
		this.echo = echo;
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	/**
	 * Resets the error flag and forgets all collected diagnostics.
	 */
	public void reset()
	{
		diagnostics.clear();
		hasErrors = false;
	}
}
