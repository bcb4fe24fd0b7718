package org.vexpand.util;

import org.vexpand.ast.Node;

import java.util.List;

/**
 * Renders a tree as indented text, one node per line, children indented under their parent.
 * Used for {@code --print} and for the expansion trace.
 */
public class TreePrinter
{
	private static final String INDENT = "  ";

	public static String print(Node node)
	{
		StringBuilder sb = new StringBuilder();
		print(node, 0, sb);
		return sb.toString();
	}

	public static String print(List<Node> statements)
	{
		StringBuilder sb = new StringBuilder();
		for (Node statement : statements)
		{
			print(statement, 0, sb);
		}
		return sb.toString();
	}

	private static void print(Node node, int level, StringBuilder sb)
	{
		sb.append(INDENT.repeat(level)).append(node).append('\n');
		for (Node child : node.getChildren())
		{
			print(child, level + 1, sb);
		}
	}
}
