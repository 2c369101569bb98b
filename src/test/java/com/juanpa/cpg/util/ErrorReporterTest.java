package com.juanpa.cpg.util;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ErrorReporterTest
{
	private ErrorReporter reporter;

	@BeforeEach
	void setUp()
	{
		reporter = new ErrorReporter();
		reporter.setEcho(false);
	}

	@Test
	void onlyErrorsSetTheErrorFlag()
	{
		reporter.info("lowered", null);
		reporter.warning("no handler", "fence seq_cst");
		assertFalse(reporter.hasErrors());

		reporter.error("Cannot parse fence instruction yet", "fence seq_cst");
		assertTrue(reporter.hasErrors());
		assertEquals(3, reporter.getDiagnostics().size());
	}

	@Test
	void diagnosticsNameTheirConstruct()
	{
		reporter.error("Cannot parse fence instruction yet", "  fence seq_cst  ");

		Diagnostic diagnostic = reporter.getDiagnostics().get(0);
		assertEquals(Diagnostic.Severity.ERROR, diagnostic.getSeverity());
		assertEquals("[Error] Cannot parse fence instruction yet (at: fence seq_cst)", diagnostic.toString());
		assertEquals("[Warning] unresolved", new Diagnostic(Diagnostic.Severity.WARNING, "unresolved", null).toString());
	}

	@Test
	void resetForgetsEverything()
	{
		reporter.error("broken", null);

		reporter.reset();

		assertFalse(reporter.hasErrors());
		assertTrue(reporter.getDiagnostics().isEmpty());
	}
}
