package org.vexpand.error;

import org.vexpand.ast.SourcePosition;

/**
 * Two operands of an assignment or binary operation resolve to different memory sizes.
 */
public class SizeMismatchException extends ExpansionException
{
	private final int leftSize;
	private final int rightSize;

	public SizeMismatchException(SourcePosition sourcePos, int leftSize, int rightSize)
	{
		this(sourcePos, leftSize, rightSize,
				String.format("Inconsistent size! Left size: %d, right size: %d", leftSize, rightSize));
	}

	public SizeMismatchException(SourcePosition sourcePos, int leftSize, int rightSize, String message)
	{
		super(sourcePos, message);
		this.leftSize = leftSize;
		this.rightSize = rightSize;
	}

	public int getLeftSize()
	{
		return leftSize;
	}

	public int getRightSize()
	{
		return rightSize;
	}
}
