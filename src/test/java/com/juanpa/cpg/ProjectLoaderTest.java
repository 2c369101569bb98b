package com.juanpa.cpg;

import com.juanpa.cpg.frontend.llvm.ModuleReader;
import com.juanpa.cpg.frontend.llvm.ir.*;
import com.juanpa.cpg.util.Diagnostic;
import com.juanpa.cpg.util.LoweringConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class ProjectLoaderTest
{
	@TempDir
	Path dir;

	@Test
	void discoversIrFilesSortedByPath() throws IOException
	{
		Files.createDirectories(dir.resolve("sub"));
		Files.writeString(dir.resolve("sub/b.ll"), "");
		Files.writeString(dir.resolve("a.ll"), "");
		Files.writeString(dir.resolve("notes.txt"), "");

		ProjectLoader loader = new ProjectLoader(LoweringConfig.defaults(), () -> ProjectLoaderTest::moduleNamedAfter);

		assertEquals(List.of(dir.resolve("a.ll"), dir.resolve("sub/b.ll")), loader.discover(dir));
		assertEquals(List.of(dir.resolve("a.ll")), loader.discover(dir.resolve("a.ll")));
	}

	@Test
	void failingUnitDoesNotStopTheOthers()
	{
		ModuleReader reader = path ->
		{
			if (path.toString().contains("broken"))
			{
				throw new IOException("expected top-level entity");
			}
			return moduleNamedAfter(path);
		};
		ProjectLoader loader = new ProjectLoader(LoweringConfig.defaults(), () -> reader);

		TranslationResult result = loader.lowerAll(List.of(Path.of("ok.ll"), Path.of("broken.ll"), Path.of("fine.ll")));

		assertEquals(3, result.getUnits().size());
		assertTrue(result.hasFailures());
		TranslationResult.Unit broken = result.getFailures().get(0);
		assertEquals(Path.of("broken.ll"), broken.getPath());
		assertEquals("expected top-level entity", broken.getFailure());
		assertEquals(Diagnostic.Severity.ERROR, broken.getDiagnostics().get(0).getSeverity());
		assertEquals(2, result.getTranslationUnits().size());
		assertNotNull(result.getTranslationUnits().get(1).getFunction("fine"));
	}

	@Test
	void fatalLoweringErrorFailsOnlyItsUnit()
	{
		ModuleReader reader = path ->
		{
			if (!path.toString().contains("switch"))
			{
				return moduleNamedAfter(path);
			}
			IrModule module = new IrModule("switch.ll");
			IrFunction function = module.addFunction(new IrFunction("select", IrType.voidType(), "define void @select()"));
			function.addBlock("entry").addInstruction(new IrInstruction(Opcode.SWITCH, "", IrType.voidType(), "switch i32 0, label %entry []")
					.addOperand(IrConstant.ofInt(0, IrType.integer(32))));
			return module;
		};
		ProjectLoader loader = new ProjectLoader(LoweringConfig.defaults(), () -> reader);

		TranslationResult result = loader.lowerAll(List.of(Path.of("switch.ll"), Path.of("plain.ll")));

		assertTrue(result.getUnits().get(0).isFailed());
		assertFalse(result.getUnits().get(1).isFailed());
	}

	@Test
	void unitsKeepInputOrderWhenLoweredConcurrently()
	{
		Properties props = new Properties();
		props.setProperty("lowering.threads", "3");
		ProjectLoader loader = new ProjectLoader(new LoweringConfig(props), () -> ProjectLoaderTest::moduleNamedAfter);
		List<Path> files = List.of(Path.of("u1.ll"), Path.of("u2.ll"), Path.of("u3.ll"), Path.of("u4.ll"));

		TranslationResult result = loader.lowerAll(files);

		assertFalse(result.hasFailures());
		for (int i = 0; i < files.size(); i++)
		{
			TranslationResult.Unit unit = result.getUnits().get(i);
			assertEquals(files.get(i), unit.getPath());
			assertNotNull(unit.getTranslationUnit().getFunction("u" + (i + 1)));
		}
	}

	/**
	 * A module with one function named after the file: {@code define void @name() { entry: ret void }}.
	 */
	private static IrModule moduleNamedAfter(Path path)
	{
		String name = path.getFileName().toString().replace(".ll", "");
		IrModule module = new IrModule(path.getFileName().toString());
		IrFunction function = module.addFunction(new IrFunction(name, IrType.voidType(), "define void @" + name + "()"));
		function.addBlock("entry").addInstruction(new IrInstruction(Opcode.RET, "", IrType.voidType(), "ret void"));
		return module;
	}
}
