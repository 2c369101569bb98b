package com.juanpa.cpg.util;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class LoweringConfigTest
{
	@Test
	void defaultsApplyWhenNothingIsSet()
	{
		LoweringConfig config = LoweringConfig.defaults();

		assertFalse(config.isDebug());
		assertFalse(config.isPrintGraph());
		assertEquals(1, config.getThreads());
		assertEquals("::", config.getNamespaceDelimiter());
		assertEquals(".ll", config.getIrFileExtension());
	}

	@Test
	void propertiesOverrideDefaults()
	{
		Properties props = new Properties();
		props.setProperty("lowering.debug", " true ");
		props.setProperty("lowering.threads", "4");
		props.setProperty("cxx.namespace_delimiter", ".");
		props.setProperty("llvm.file_extension", ".bc");

		LoweringConfig config = new LoweringConfig(props);

		assertTrue(config.isDebug());
		assertEquals(4, config.getThreads());
		assertEquals(".", config.getNamespaceDelimiter());
		assertEquals(".bc", config.getIrFileExtension());
	}

	@Test
	void threadCountIsAtLeastOne()
	{
		Properties props = new Properties();
		props.setProperty("lowering.threads", "0");

		assertEquals(1, new LoweringConfig(props).getThreads());
	}

	@Test
	void malformedThreadCountIsRejected()
	{
		Properties props = new Properties();
		props.setProperty("lowering.threads", "many");

		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new LoweringConfig(props));
		assertTrue(e.getMessage().contains("lowering.threads"));
	}
}
