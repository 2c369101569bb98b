// File: src/main/java/com/juanpa/cpg/Main.java
package com.juanpa.cpg;

import com.juanpa.cpg.frontend.llvm.BytedecoModuleReader;
import com.juanpa.cpg.graph.GraphPrinter;
import com.juanpa.cpg.util.Debug;
import com.juanpa.cpg.util.LoweringConfig;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;

/**
 * Command line entry point: lowers one IR file or every IR file below a directory.
 */
public class Main
{
	public static void main(String[] args)
	{
		Properties props = loadProperties();

		List<String> positional = new ArrayList<>();
		for (String arg : args)
		{
			if (arg.equals("--print-graph"))
			{
				props.setProperty("lowering.print_graph", "true");
			}
			else if (arg.equals("--debug"))
			{
				props.setProperty("lowering.debug", "true");
			}
			else
			{
				positional.add(arg);
			}
		}

		if (positional.size() != 1)
		{
			System.err.println("Usage: cpgl [--print-graph] [--debug] <file.ll | directory>");
			System.exit(2);
			return;
		}

		LoweringConfig config = new LoweringConfig(props);
		Debug.setEnabled(config.isDebug());

		Path input = Paths.get(positional.get(0));
		if (!Files.exists(input))
		{
			System.err.println("Error: Input not found: " + input);
			System.exit(2);
			return;
		}

		ProjectLoader loader = new ProjectLoader(config, BytedecoModuleReader::new);
		TranslationResult result;
		try
		{
			result = loader.lowerAll(loader.discover(input));
		}
		catch (IOException e)
		{
			System.err.println("Error: Could not list " + input + ": " + e.getMessage());
			System.exit(1);
			return;
		}

		for (TranslationResult.Unit unit : result.getUnits())
		{
			if (unit.isFailed())
			{
				System.out.println("FAILED  " + unit.getPath() + ": " + unit.getFailure());
				continue;
			}
			System.out.println("lowered " + unit.getPath() + ": "
					+ unit.getTranslationUnit().getDeclarations().size() + " declarations, "
					+ unit.getDiagnostics().size() + " diagnostics");
			if (config.isPrintGraph())
			{
				System.out.println(GraphPrinter.print(unit.getTranslationUnit()));
			}
		}

		if (result.hasFailures())
		{
			System.exit(1);
		}
	}

	private static Properties loadProperties()
	{
		Properties props = new Properties();
		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "cpg-lowering", "lowering.conf");
		if (Files.exists(configPath))
		{
			try (InputStream input = new FileInputStream(configPath.toFile()))
			{
				props.load(input);
				System.out.println("--- Loaded configuration from: " + configPath + " ---");
			}
			catch (IOException e)
			{
				System.err.println("Warning: Could not read config file at " + configPath + ". Using default settings.");
			}
		}
		return props;
	}
}
