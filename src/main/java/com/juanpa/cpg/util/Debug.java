// File: src/main/java/com/juanpa/cpg/util/Debug.java
package com.juanpa.cpg.util;

public class Debug
{
	/**
	 * Master switch for all debug logging. Set from the configuration at start-up.
	 */
	private static volatile boolean enabled = false;

	private static final ThreadLocal<Integer> indentLevel = ThreadLocal.withInitial(() -> 0);

	public static void setEnabled(boolean value)
	{
		enabled = value;
	}

	public static boolean isEnabled()
	{
		return enabled;
	}

	/**
	 * Logs a formatted message if debugging is enabled.
	 *
	 * @param format The message format string (e.g., "Lowering instruction: %s").
	 * @param args   The arguments to format into the message.
	 */
	public static void log(String format, Object... args)
	{
		if (enabled)
		{
			String indent = "  ".repeat(indentLevel.get());
			System.out.println("[DEBUG] " + indent + String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages of the current thread.
	 */
	public static void indent()
	{
		if (enabled)
		{
			indentLevel.set(indentLevel.get() + 1);
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages of the current thread.
	 */
	public static void dedent()
	{
		if (enabled)
		{
			indentLevel.set(Math.max(0, indentLevel.get() - 1));
		}
	}
}
