// File: src/main/java/com/juanpa/cpg/semantics/TranslationException.java
package com.juanpa.cpg.semantics;

/**
 * Thrown when the input is structurally impossible to lower. Aborts the current translation unit
 * only; the driver continues with the next one.
 */
public class TranslationException extends RuntimeException
{
	public TranslationException(String message)
	{
		super(message);
	}

	public TranslationException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
