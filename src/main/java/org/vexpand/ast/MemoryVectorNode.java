// File: src/main/java/org/vexpand/ast/MemoryVectorNode.java
package org.vexpand.ast;

import java.util.List;
import java.util.Objects;

/**
 * Reference to a memory-backed variable or array, possibly indexed.
 * <ul>
 *     <li>no index: the whole array, {@code arraySize} cells from {@code arrayAddr}</li>
 *     <li>a {@link StaticVectorNode} index of one value {@code k}: the single cell {@code arrayAddr + k}</li>
 *     <li>a {@link StaticVectorNode} index of two values {@code [lo, hi]}: the cells {@code lo..hi}</li>
 *     <li>any other index expression: one cell whose address is only known at run time</li>
 * </ul>
 * {@code arrayAddr} and {@code arraySize} are resolved by the symbol table before this pass runs.
 */
public final class MemoryVectorNode extends Node
{
	private final String arrayName;
	private final int arrayAddr;
	private final int arraySize;
	private final Access access;

	public MemoryVectorNode(SourcePosition sourcePos, String arrayName, int arrayAddr, int arraySize, Node index, Access access)
	{
		super(sourcePos, index == null ? List.of() : List.of(index));
		this.arrayName = arrayName;
		this.arrayAddr = arrayAddr;
		this.arraySize = arraySize;
		this.access = Objects.requireNonNull(access, "access");
	}

	public MemoryVectorNode(SourcePosition sourcePos, String arrayName, int arrayAddr, int arraySize, Node index)
	{
		this(sourcePos, arrayName, arrayAddr, arraySize, index, Access.READ);
	}

	public MemoryVectorNode(SourcePosition sourcePos, String arrayName, int arrayAddr, int arraySize)
	{
		this(sourcePos, arrayName, arrayAddr, arraySize, null, Access.READ);
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

	public Access getAccess()
	{
		return access;
	}

	public boolean isWrite()
	{
		return access == Access.WRITE;
	}

	public boolean hasIndex()
	{
		return getChildCount() > 0;
	}

	/**
	 * @return the index expression, or null for a whole-array reference
	 */
	public Node getIndex()
	{
		return hasIndex() ? getChild(0) : null;
	}

	/**
	 * True when the index is known at compile time (or absent).
	 */
	public boolean hasConstantIndex()
	{
		return !hasIndex() || getIndex() instanceof StaticVectorNode;
	}

	public MemoryVectorNode withAccess(Access newAccess)
	{
		if (newAccess == access)
		{
			return this;
		}
		return new MemoryVectorNode(getSourcePos(), arrayName, arrayAddr, arraySize, getIndex(), newAccess);
	}

	@Override
	public <R, P> R accept(NodeVisitor<R, P> visitor, P arg)
	{
		return visitor.visitMemoryVector(this, arg);
	}

	@Override
	public String toString()
	{
		return "MemoryVector: " + (arrayName != null ? arrayName + " " : "")
				+ "addr " + arrayAddr + " size " + arraySize
				+ (isWrite() ? " (write)" : "");
	}
}
