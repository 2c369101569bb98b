// File: src/main/java/com/juanpa/cpg/frontend/Handler.java
package com.juanpa.cpg.frontend;

import com.juanpa.cpg.graph.Node;
import com.juanpa.cpg.util.Debug;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An open registry that dispatches input constructs of type {@code T} to lowering functions by
 * their runtime class. A construct whose class (and superclasses) has no registered function is
 * reported and replaced by the configured placeholder.
 *
 * @param <S> The kind of graph node produced.
 * @param <T> The kind of input construct consumed.
 * @param <L> The frontend this handler belongs to.
 */
public abstract class Handler<S extends Node, T, L extends LanguageFrontend>
{
	protected final Map<Class<?>, Function<T, S>> map = new HashMap<>();
	protected final L lang;
	private final Supplier<S> placeholder;

	protected Handler(Supplier<S> placeholder, L lang)
	{
		this.placeholder = placeholder;
		this.lang = lang;
	}

	/**
	 * Lowers one construct.
	 *
	 * @return The produced node, or the placeholder if the construct's kind is not supported.
	 */
	public S handle(T construct)
	{
		if (construct == null)
		{
			return null;
		}

		Class<?> toHandle = construct.getClass();
		Function<T, S> handler = map.get(toHandle);
		while (handler == null && toHandle.getSuperclass() != null)
		{
			toHandle = toHandle.getSuperclass();
			handler = map.get(toHandle);
		}

		if (handler == null)
		{
			lang.getErrorReporter().warning("Parsing of type " + construct.getClass().getSimpleName() + " is not supported (yet)",
					lang.getCodeFromRawNode(construct));
			S result = placeholder.get();
			if (result != null)
			{
				result.setCode(lang.getCodeFromRawNode(construct));
			}
			return result;
		}

		Debug.log("Handling %s", construct.getClass().getSimpleName());
		Debug.indent();
		try
		{
			S result = handler.apply(construct);
			if (result != null && result.getCode() == null)
			{
				result.setCode(lang.getCodeFromRawNode(construct));
			}
			return result;
		}
		finally
		{
			Debug.dedent();
		}
	}
}
