// File: src/main/java/com/juanpa/cpg/ProjectLoader.java
package com.juanpa.cpg;

import com.juanpa.cpg.frontend.llvm.LlvmIrFrontend;
import com.juanpa.cpg.frontend.llvm.ModuleReader;
import com.juanpa.cpg.frontend.llvm.ir.IrModule;
import com.juanpa.cpg.graph.declarations.TranslationUnitDeclaration;
import com.juanpa.cpg.semantics.TranslationException;
import com.juanpa.cpg.util.Debug;
import com.juanpa.cpg.util.ErrorReporter;
import com.juanpa.cpg.util.LoweringConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Discovers IR files and lowers each of them into its own translation unit.
 * Every unit gets its own reader, frontend and error reporter, so units share no state and a
 * failing unit does not stop the others.
 */
public class ProjectLoader
{
	private final LoweringConfig config;
	private final Supplier<ModuleReader> readerFactory;

	public ProjectLoader(LoweringConfig config, Supplier<ModuleReader> readerFactory)
	{
		this.config = config;
		this.readerFactory = readerFactory;
	}

	/**
	 * @return The file itself, or every file below the directory with the configured IR extension,
	 * sorted by path.
	 */
	public List<Path> discover(Path root) throws IOException
	{
		if (!Files.isDirectory(root))
		{
			return List.of(root);
		}
		try (Stream<Path> stream = Files.walk(root))
		{
			return stream.filter(path -> !Files.isDirectory(path) && path.toString().endsWith(config.getIrFileExtension()))
					.sorted()
					.collect(Collectors.toList());
		}
	}

	/**
	 * Lowers all files, concurrently if more than one thread is configured.
	 */
	public TranslationResult lowerAll(List<Path> files)
	{
		TranslationResult result = new TranslationResult();
		if (config.getThreads() <= 1 || files.size() <= 1)
		{
			for (Path file : files)
			{
				result.add(lowerUnit(file));
			}
			return result;
		}

		ExecutorService executor = Executors.newFixedThreadPool(Math.min(config.getThreads(), files.size()));
		try
		{
			List<Future<TranslationResult.Unit>> futures = new ArrayList<>();
			for (Path file : files)
			{
				futures.add(executor.submit(() -> lowerUnit(file)));
			}
			for (int i = 0; i < futures.size(); i++)
			{
				result.add(await(futures.get(i), files.get(i)));
			}
		}
		finally
		{
			executor.shutdownNow();
		}
		return result;
	}

	private TranslationResult.Unit await(Future<TranslationResult.Unit> future, Path file)
	{
		try
		{
			return future.get();
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			return TranslationResult.Unit.failure(file, "Interrupted", List.of());
		}
		catch (ExecutionException e)
		{
			return TranslationResult.Unit.failure(file, String.valueOf(e.getCause()), List.of());
		}
	}

	/**
	 * Reads and lowers one file. Read errors and fatal lowering errors are recorded as the unit's
	 * failure.
	 */
	public TranslationResult.Unit lowerUnit(Path file)
	{
		ErrorReporter errorReporter = new ErrorReporter();
		Debug.log("Lowering unit %s", file);
		try
		{
			IrModule module = readerFactory.get().read(file);
			LlvmIrFrontend frontend = new LlvmIrFrontend(config, errorReporter);
			TranslationUnitDeclaration translationUnit = frontend.translate(module);
			return TranslationResult.Unit.success(file, translationUnit, errorReporter.getDiagnostics());
		}
		catch (IOException | TranslationException e)
		{
			errorReporter.error(e.getMessage(), file.toString());
			return TranslationResult.Unit.failure(file, e.getMessage(), errorReporter.getDiagnostics());
		}
	}
}
