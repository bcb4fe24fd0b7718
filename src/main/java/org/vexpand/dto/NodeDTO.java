package org.vexpand.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON form of a tree node. Only the fields meaningful for {@link #kind} are set.
 */
public class NodeDTO
{
	public NodeKind kind;
	public Integer line;
	public Integer column;
	public String operator;
	public String name;
	public Integer address;
	public Integer size;
	public String access; // "read" or "write", read when absent
	public Integer value;
	public List<Integer> values;
	public List<NodeDTO> children = new ArrayList<>();
}
