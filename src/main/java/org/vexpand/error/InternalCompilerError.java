package org.vexpand.error;

import org.vexpand.ast.SourcePosition;

/**
 * Raised when the tree handed to the pass breaks a structural invariant that upstream stages
 * guarantee (an index out of range during expansion, a variant with the wrong number of
 * children, a non-scalar leaf left in the output). It signals a compiler bug, not bad input,
 * so it is an {@link Error} and is never turned into a user diagnostic.
 */
public class InternalCompilerError extends Error
{
	private final SourcePosition sourcePos;

	public InternalCompilerError(SourcePosition sourcePos, String message)
	{
		super("Internal compiler error at " + sourcePos + ": " + message);
		this.sourcePos = sourcePos;
	}

	public SourcePosition getSourcePos()
	{
		return sourcePos;
	}
}
