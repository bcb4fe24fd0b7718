package org.vexpand.util;

import org.vexpand.ast.SourcePosition;

/**
 * One reported error: where it happened and what went wrong.
 */
public record Diagnostic(SourcePosition sourcePos, String message)
{
	@Override
	public String toString()
	{
		return String.format("line %d:%d - %s", sourcePos.line(), sourcePos.column(), message);
	}
}
