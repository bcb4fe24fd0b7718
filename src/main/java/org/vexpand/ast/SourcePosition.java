package org.vexpand.ast;

/**
 * Location of a node in the compiled source file, used to tag diagnostics.
 * Lines and columns are 1-based; {@link #UNKNOWN} marks synthesized nodes without a location.
 */
public record SourcePosition(int line, int column)
{
	public static final SourcePosition UNKNOWN = new SourcePosition(-1, -1);

	public boolean isKnown()
	{
		return line >= 0;
	}

	@Override
	public String toString()
	{
		return isKnown() ? line + ":" + column : "?:?";
	}
}
