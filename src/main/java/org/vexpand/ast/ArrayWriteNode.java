package org.vexpand.ast;

import java.util.List;

/**
 * Write of one array cell whose index is computed at run time.
 *
 * @see ArrayReadNode
 */
public final class ArrayWriteNode extends Node
{
	private final String arrayName;
	private final int arrayAddr;
	private final int arraySize;

	public ArrayWriteNode(SourcePosition sourcePos, String arrayName, int arrayAddr, int arraySize, Node index)
	{
		super(sourcePos, List.of(index));
		this.arrayName = arrayName;
		this.arrayAddr = arrayAddr;
		this.arraySize = arraySize;
	}

	public String getArrayName()
	{
		return arrayName;
	}

	public int getArrayAddr()
	{
		return arrayAddr;
	}

	public int getArraySize()
	{
		return arraySize;
	}

	public Node getIndex()
	{
		return getChild(0);
	}

	@Override
	public boolean isScalar()
	{
		return true;
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitArrayWrite(this, arg);
	}

	@Override
	public String toString()
	{
		return "ArrayWrite: " + (arrayName != null ? arrayName + " " : "") + "addr " + arrayAddr + " size " + arraySize;
	}
}
