// File: src/main/java/org/vexpand/dto/NodeDTOConverter.java
package org.vexpand.dto;

import org.vexpand.ast.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Converts between the JSON interchange DTOs and tree nodes.
 * Malformed DTOs are rejected with an {@link IllegalArgumentException} naming their position.
 */
public class NodeDTOConverter
{
	private static final ToDTOVisitor TO_DTO = new ToDTOVisitor();

	public static List<Node> toStatements(ProgramDTO program)
	{
		List<Node> statements = new ArrayList<>();
		for (NodeDTO dto : program.statements)
		{
			statements.add(toNode(dto));
		}
		return statements;
	}

	public static ProgramDTO toProgram(String name, List<Node> statements)
	{
		ProgramDTO program = new ProgramDTO();
		program.name = name;
		statements.forEach(s -> program.statements.add(toDTO(s)));
		return program;
	}

	public static Node toNode(NodeDTO dto)
	{
		if (dto == null)
		{
			throw new IllegalArgumentException("Null node in tree");
		}
		SourcePosition pos = new SourcePosition(dto.line != null ? dto.line : -1, dto.column != null ? dto.column : -1);
		if (dto.kind == null)
		{
			throw error(pos, "missing or unknown node kind");
		}

		List<NodeDTO> children = dto.children != null ? dto.children : List.of();

		switch (dto.kind)
		{
			case BLOCK:
			{
				List<Node> statements = new ArrayList<>();
				for (NodeDTO child : children)
				{
					statements.add(toNode(child));
				}
				return new BlockNode(pos, statements);
			}
			case ASSIGNMENT:
				expectChildren(pos, dto, children, 2);
				return new AssignmentNode(pos, toNode(children.get(0)), toNode(children.get(1)));
			case BINARY_ARITHMETIC:
				expectChildren(pos, dto, children, 2);
				return new BinaryArithmeticNode(pos, BinaryOperator.fromSymbol(require(pos, dto, dto.operator, "operator")),
						toNode(children.get(0)), toNode(children.get(1)));
			case UNARY_ARITHMETIC:
				expectChildren(pos, dto, children, 1);
				return new UnaryArithmeticNode(pos, UnaryOperator.fromSymbol(require(pos, dto, dto.operator, "operator")),
						toNode(children.get(0)));
			case MEMORY_VECTOR:
			{
				if (children.size() > 1)
				{
					throw error(pos, "memory reference takes at most one index, got " + children.size());
				}
				Node index = children.isEmpty() ? null : toNode(children.get(0));
				return new MemoryVectorNode(pos, dto.name, require(pos, dto, dto.address, "address"),
						require(pos, dto, dto.size, "size"), index, parseAccess(pos, dto.access));
			}
			case STATIC_VECTOR:
			{
				List<Integer> values = require(pos, dto, dto.values, "values");
				int missing = values.indexOf(null);
				if (missing >= 0)
				{
					throw error(pos, "static vector value " + missing + " is null");
				}
				return new StaticVectorNode(pos, values);
			}
			case IMMEDIATE:
				return new ImmediateNode(pos, require(pos, dto, dto.value, "value"));
			case LOAD:
				return new LoadNode(pos, require(pos, dto, dto.address, "address"));
			case STORE:
				return new StoreNode(pos, require(pos, dto, dto.address, "address"));
			case ARRAY_READ:
				expectChildren(pos, dto, children, 1);
				return new ArrayReadNode(pos, dto.name, require(pos, dto, dto.address, "address"),
						require(pos, dto, dto.size, "size"), toNode(children.get(0)));
			case ARRAY_WRITE:
				expectChildren(pos, dto, children, 1);
				return new ArrayWriteNode(pos, dto.name, require(pos, dto, dto.address, "address"),
						require(pos, dto, dto.size, "size"), toNode(children.get(0)));
			default:
				throw error(pos, "unsupported node kind " + dto.kind);
		}
	}

	public static NodeDTO toDTO(Node node)
	{
		return node.accept(TO_DTO, null);
	}

	private static Access parseAccess(SourcePosition pos, String access)
	{
		if (access == null || access.equalsIgnoreCase("read"))
		{
			return Access.READ;
		}
		if (access.equalsIgnoreCase("write"))
		{
			return Access.WRITE;
		}
		throw error(pos, "invalid access '" + access + "', expected read or write");
	}

	private static void expectChildren(SourcePosition pos, NodeDTO dto, List<NodeDTO> children, int expected)
	{
		if (children.size() != expected)
		{
			throw error(pos, dto.kind + " node needs " + expected + " children, got " + children.size());
		}
	}

	private static <T> T require(SourcePosition pos, NodeDTO dto, T field, String fieldName)
	{
		if (field == null)
		{
			throw error(pos, dto.kind + " node is missing '" + fieldName + "'");
		}
		return field;
	}

	private static IllegalArgumentException error(SourcePosition pos, String msg)
	{
		return new IllegalArgumentException("Malformed tree at line " + pos + ": " + msg);
	}

	private static final class ToDTOVisitor implements NodeVisitor<NodeDTO, Void>
	{
		private NodeDTO create(NodeKind kind, Node node)
		{
			NodeDTO dto = new NodeDTO();
			dto.kind = kind;
			if (node.getSourcePos().isKnown())
			{
				dto.line = node.getSourcePos().line();
				dto.column = node.getSourcePos().column();
			}
			for (Node child : node.getChildren())
			{
				dto.children.add(child.accept(this, null));
			}
			return dto;
		}

		@Override
		public NodeDTO visitBlock(BlockNode node, Void arg)
		{
			return create(NodeKind.BLOCK, node);
		}

		@Override
		public NodeDTO visitAssignment(AssignmentNode node, Void arg)
		{
			return create(NodeKind.ASSIGNMENT, node);
		}

		@Override
		public NodeDTO visitBinaryArithmetic(BinaryArithmeticNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.BINARY_ARITHMETIC, node);
			dto.operator = node.getOp().getSymbol();
			return dto;
		}

		@Override
		public NodeDTO visitUnaryArithmetic(UnaryArithmeticNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.UNARY_ARITHMETIC, node);
			dto.operator = node.getOp().getSymbol();
			return dto;
		}

		@Override
		public NodeDTO visitMemoryVector(MemoryVectorNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.MEMORY_VECTOR, node);
			dto.name = node.getArrayName();
			dto.address = node.getArrayAddr();
			dto.size = node.getArraySize();
			// read is the default and is left out
			if (node.getAccess() != Access.READ)
			{
				dto.access = node.getAccess().name().toLowerCase(Locale.ROOT);
			}
			return dto;
		}

		@Override
		public NodeDTO visitStaticVector(StaticVectorNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.STATIC_VECTOR, node);
			dto.values = new ArrayList<>();
			Arrays.stream(node.getValues()).forEach(dto.values::add);
			return dto;
		}

		@Override
		public NodeDTO visitImmediate(ImmediateNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.IMMEDIATE, node);
			dto.value = node.getValue();
			return dto;
		}

		@Override
		public NodeDTO visitLoad(LoadNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.LOAD, node);
			dto.address = node.getVarAddr();
			return dto;
		}

		@Override
		public NodeDTO visitStore(StoreNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.STORE, node);
			dto.address = node.getVarAddr();
			return dto;
		}

		@Override
		public NodeDTO visitArrayRead(ArrayReadNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.ARRAY_READ, node);
			dto.name = node.getArrayName();
			dto.address = node.getArrayAddr();
			dto.size = node.getArraySize();
			return dto;
		}

		@Override
		public NodeDTO visitArrayWrite(ArrayWriteNode node, Void arg)
		{
			NodeDTO dto = create(NodeKind.ARRAY_WRITE, node);
			dto.name = node.getArrayName();
			dto.address = node.getArrayAddr();
			dto.size = node.getArraySize();
			return dto;
		}
	}
}
