package org.vexpand.error;

import org.vexpand.ast.SourcePosition;

/**
 * Base class of user-facing errors found while expanding a statement.
 * Carries the position of the offending node; the message does not repeat it.
 */
public abstract class ExpansionException extends RuntimeException
{
	private final SourcePosition sourcePos;

	protected ExpansionException(SourcePosition sourcePos, String message)
	{
		super(message);
		this.sourcePos = sourcePos;
	}

	public SourcePosition getSourcePos()
	{
		return sourcePos;
	}
}
