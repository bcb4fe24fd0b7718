package org.vexpand.expand;

import org.vexpand.ast.BlockNode;
import org.vexpand.ast.MemoryVectorNode;
import org.vexpand.ast.Node;
import org.vexpand.ast.StaticVectorNode;
import org.vexpand.error.InternalCompilerError;

/**
 * Verifies that an expanded tree only contains scalar-granularity nodes: no vector node is left
 * anywhere and every leaf is an immediate, a load or a store.
 */
public class ScalarizationChecker
{
	public static void verify(Node node)
	{
		Node offending = findViolation(node);
		if (offending != null)
		{
			throw new InternalCompilerError(offending.getSourcePos(), "non-scalar node left after expansion: " + offending);
		}
	}

	public static boolean isScalarized(Node node)
	{
		return findViolation(node) == null;
	}

	// Depth-first, first offending node wins.
	private static Node findViolation(Node node)
	{
		if (node instanceof MemoryVectorNode || node instanceof StaticVectorNode)
		{
			return node;
		}
		if (node.getChildCount() == 0 && !(node instanceof BlockNode) && !node.isScalar())
		{
			return node;
		}
		for (Node child : node.getChildren())
		{
			Node offending = findViolation(child);
			if (offending != null)
			{
				return offending;
			}
		}
		return null;
	}
}
