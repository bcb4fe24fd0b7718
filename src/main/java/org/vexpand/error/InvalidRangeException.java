package org.vexpand.error;

import org.vexpand.ast.SourcePosition;

/**
 * A constant index range that cannot be lowered: its upper bound lies below its lower bound,
 * e.g. {@code v[3:1]}, or its cells do not fit in the addressable memory.
 */
public class InvalidRangeException extends ExpansionException
{
	private final int low;
	private final int high;

	public InvalidRangeException(SourcePosition sourcePos, int low, int high)
	{
		this(sourcePos, low, high, String.format("Invalid index range [%d:%d], end index is before start index", low, high));
	}

	public InvalidRangeException(SourcePosition sourcePos, int low, int high, String message)
	{
		super(sourcePos, message);
		this.low = low;
		this.high = high;
	}

	public int getLow()
	{
		return low;
	}

	public int getHigh()
	{
		return high;
	}
}
