// File: src/main/java/com/juanpa/cpg/TranslationResult.java
package com.juanpa.cpg;

import com.juanpa.cpg.graph.declarations.TranslationUnitDeclaration;
import com.juanpa.cpg.util.Diagnostic;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * The outcome of lowering a set of IR files, one entry per file in input order.
 */
public class TranslationResult
{
	/**
	 * One lowered file. Either {@code translationUnit} or {@code failure} is set.
	 */
	public static final class Unit
	{
		private final Path path;
		private final TranslationUnitDeclaration translationUnit;
		private final List<Diagnostic> diagnostics;
		private final String failure;

		private Unit(Path path, TranslationUnitDeclaration translationUnit, List<Diagnostic> diagnostics, String failure)
		{
			this.path = path;
			this.translationUnit = translationUnit;
			this.diagnostics = new ArrayList<>(diagnostics);
			this.failure = failure;
		}

		public static Unit success(Path path, TranslationUnitDeclaration translationUnit, List<Diagnostic> diagnostics)
		{
			return new Unit(path, translationUnit, diagnostics, null);
		}

		public static Unit failure(Path path, String failure, List<Diagnostic> diagnostics)
		{
			return new Unit(path, null, diagnostics, failure);
		}

		public Path getPath()
		{
			return path;
		}

		public TranslationUnitDeclaration getTranslationUnit()
		{
			return translationUnit;
		}

		public List<Diagnostic> getDiagnostics()
		{
			return Collections.unmodifiableList(diagnostics);
		}

		public String getFailure()
		{
			return failure;
		}

		public boolean isFailed()
		{
			return failure != null;
		}
	}

	private final List<Unit> units = new ArrayList<>();

	void add(Unit unit)
	{
		units.add(unit);
	}

	public List<Unit> getUnits()
	{
		return Collections.unmodifiableList(units);
	}

	public List<TranslationUnitDeclaration> getTranslationUnits()
	{
		return units.stream()
				.filter(unit -> !unit.isFailed())
				.map(Unit::getTranslationUnit)
				.collect(Collectors.toList());
	}

	public List<Unit> getFailures()
	{
		return units.stream().filter(Unit::isFailed).collect(Collectors.toList());
	}

	public boolean hasFailures()
	{
		return units.stream().anyMatch(Unit::isFailed);
	}
}
