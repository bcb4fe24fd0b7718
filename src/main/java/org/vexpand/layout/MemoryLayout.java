// File: src/main/java/org/vexpand/layout/MemoryLayout.java
package org.vexpand.layout;

import org.vexpand.ast.*;
import org.vexpand.error.InternalCompilerError;
import org.vexpand.error.InvalidRangeException;
import org.vexpand.error.SizeMismatchException;

import java.util.OptionalInt;

/**
 * Read-only queries resolving how many memory cells a sub-tree spans and where it starts.
 * <p>
 * Both queries recurse through children, never modify the tree and always return the same
 * answer for the same node. Neither uses a sentinel: a node without a single size (a block) or
 * without a compile-time address (a literal, a dynamically indexed array) yields an empty
 * {@link OptionalInt}.
 */
public final class MemoryLayout
{
	private static final SizeResolver SIZE_RESOLVER = new SizeResolver();
	private static final AddressResolver ADDRESS_RESOLVER = new AddressResolver();

	private MemoryLayout()
	{
	}

	/**
	 * Number of scalar cells spanned by {@code node}, empty for nodes that have no single size.
	 *
	 * @throws SizeMismatchException  if two children of a composite node disagree
	 * @throws InvalidRangeException  if a constant index range is reversed or not addressable
	 * @throws InternalCompilerError  if a constant index lies outside the array
	 */
	public static OptionalInt memorySize(Node node)
	{
		return node.accept(SIZE_RESOLVER, null);
	}

	/**
	 * Same as {@link #memorySize(Node)} for nodes that must have a size, such as the operands of
	 * an assignment or of a binary operation.
	 */
	public static int sizeOf(Node node)
	{
		OptionalInt size = memorySize(node);
		if (size.isEmpty())
		{
			throw new InternalCompilerError(node.getSourcePos(), node + " has no memory size");
		}
		return size.getAsInt();
	}

	/**
	 * Base cell address of {@code node}, empty when it is not known at compile time. A constant
	 * index is validated as in {@link #memorySize(Node)}.
	 */
	public static OptionalInt memoryAddress(Node node)
	{
		return node.accept(ADDRESS_RESOLVER, null);
	}

	/**
	 * Same as {@link #memoryAddress(Node)} for callers about to do arithmetic on the address.
	 * An unresolved address here is an invariant violation.
	 */
	public static int addressOf(Node node)
	{
		OptionalInt address = memoryAddress(node);
		if (address.isEmpty())
		{
			throw new InternalCompilerError(node.getSourcePos(), node + " has no address known at compile time");
		}
		return address.getAsInt();
	}

	/**
	 * The {@code [lo, hi]} cells selected by a constant index; a single index {@code k} gives
	 * {@code [k, k]}. The range has to lie inside the array and every cell of it must be
	 * addressable.
	 */
	static int[] constantRange(MemoryVectorNode node, StaticVectorNode index)
	{
		int low;
		int high;
		switch (index.size())
		{
			case 1:
				low = index.getValue(0);
				high = low;
				break;
			case 2:
				low = index.getValue(0);
				high = index.getValue(1);
				if (high < low)
				{
					throw new InvalidRangeException(node.getSourcePos(), low, high);
				}
				break;
			default:
				throw new InternalCompilerError(node.getSourcePos(), "index of " + node + " must have 1 or 2 values, got " + index.size());
		}

		cellCount(node, low, high);
		// bounds are checked upstream
		if (low < 0 || high >= node.getArraySize())
		{
			throw new InternalCompilerError(node.getSourcePos(), "index range [" + low + ":" + high + "] lies outside " + node);
		}
		return new int[]{low, high};
	}

	/**
	 * Number of cells from {@code low} to {@code high} of the array referenced by {@code node}.
	 *
	 * @throws InvalidRangeException if the count or the address of the last cell does not fit in an int
	 */
	private static int cellCount(MemoryVectorNode node, int low, int high)
	{
		try
		{
			Math.addExact(node.getArrayAddr(), high);
			return Math.addExact(Math.subtractExact(high, low), 1);
		}
		catch (ArithmeticException e)
		{
			throw new InvalidRangeException(node.getSourcePos(), low, high,
					String.format("Index range [%d:%d] of the array at address %d exceeds the addressable memory", low, high, node.getArrayAddr()));
		}
	}

	private static final class SizeResolver implements NodeVisitor<OptionalInt, Void>
	{
		// Every child must agree on its size.
		private OptionalInt commonChildSize(Node node)
		{
			OptionalInt size = OptionalInt.empty();
			for (Node child : node.getChildren())
			{
				OptionalInt childSize = child.accept(this, null);
				if (childSize.isEmpty())
				{
					continue;
				}
				if (size.isEmpty())
				{
					size = childSize;
				}
				else if (size.getAsInt() != childSize.getAsInt())
				{
					throw new SizeMismatchException(node.getSourcePos(), size.getAsInt(), childSize.getAsInt(), "Size mismatch between vectors");
				}
			}
			return size;
		}

		@Override
		public OptionalInt visitBlock(BlockNode node, Void arg)
		{
			return OptionalInt.empty();
		}

		@Override
		public OptionalInt visitAssignment(AssignmentNode node, Void arg)
		{
			return commonChildSize(node);
		}

		@Override
		public OptionalInt visitBinaryArithmetic(BinaryArithmeticNode node, Void arg)
		{
			return commonChildSize(node);
		}

		@Override
		public OptionalInt visitUnaryArithmetic(UnaryArithmeticNode node, Void arg)
		{
			return commonChildSize(node);
		}

		@Override
		public OptionalInt visitMemoryVector(MemoryVectorNode node, Void arg)
		{
			if (!node.hasIndex())
			{
				// full array access
				return OptionalInt.of(cellCount(node, 0, node.getArraySize() - 1));
			}
			if (node.getIndex() instanceof StaticVectorNode index)
			{
				int[] range = constantRange(node, index);
				return OptionalInt.of(cellCount(node, range[0], range[1]));
			}
			// one cell, random access
			return OptionalInt.of(1);
		}

		@Override
		public OptionalInt visitStaticVector(StaticVectorNode node, Void arg)
		{
			return OptionalInt.of(node.size());
		}

		@Override
		public OptionalInt visitImmediate(ImmediateNode node, Void arg)
		{
			return OptionalInt.of(1);
		}

		@Override
		public OptionalInt visitLoad(LoadNode node, Void arg)
		{
			return OptionalInt.of(1);
		}

		@Override
		public OptionalInt visitStore(StoreNode node, Void arg)
		{
			return OptionalInt.of(1);
		}

		@Override
		public OptionalInt visitArrayRead(ArrayReadNode node, Void arg)
		{
			return OptionalInt.of(1);
		}

		@Override
		public OptionalInt visitArrayWrite(ArrayWriteNode node, Void arg)
		{
			return OptionalInt.of(1);
		}
	}

	private static final class AddressResolver implements NodeVisitor<OptionalInt, Void>
	{
		// By convention the first child (the target or left operand) carries the address.
		private OptionalInt firstChildAddress(Node node)
		{
			if (node.getChildCount() == 0)
			{
				return OptionalInt.empty();
			}
			return node.getChild(0).accept(this, null);
		}

		@Override
		public OptionalInt visitBlock(BlockNode node, Void arg)
		{
			return firstChildAddress(node);
		}

		@Override
		public OptionalInt visitAssignment(AssignmentNode node, Void arg)
		{
			return firstChildAddress(node);
		}

		@Override
		public OptionalInt visitBinaryArithmetic(BinaryArithmeticNode node, Void arg)
		{
			return firstChildAddress(node);
		}

		@Override
		public OptionalInt visitUnaryArithmetic(UnaryArithmeticNode node, Void arg)
		{
			return firstChildAddress(node);
		}

		@Override
		public OptionalInt visitMemoryVector(MemoryVectorNode node, Void arg)
		{
			if (!node.hasIndex())
			{
				return OptionalInt.of(node.getArrayAddr());
			}
			if (node.getIndex() instanceof StaticVectorNode index)
			{
				int[] range = constantRange(node, index);
				return OptionalInt.of(Math.addExact(node.getArrayAddr(), range[0]));
			}
			// not known at compile time
			return OptionalInt.empty();
		}

		@Override
		public OptionalInt visitStaticVector(StaticVectorNode node, Void arg)
		{
			return OptionalInt.empty();
		}

		@Override
		public OptionalInt visitImmediate(ImmediateNode node, Void arg)
		{
			return OptionalInt.empty();
		}

		@Override
		public OptionalInt visitLoad(LoadNode node, Void arg)
		{
			return OptionalInt.of(node.getVarAddr());
		}

		@Override
		public OptionalInt visitStore(StoreNode node, Void arg)
		{
			return OptionalInt.of(node.getVarAddr());
		}

		@Override
		public OptionalInt visitArrayRead(ArrayReadNode node, Void arg)
		{
			return OptionalInt.empty();
		}

		@Override
		public OptionalInt visitArrayWrite(ArrayWriteNode node, Void arg)
		{
			return OptionalInt.empty();
		}
	}
}
