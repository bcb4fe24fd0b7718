package org.vexpand.dto;

import java.util.ArrayList;
import java.util.List;

public class ProgramDTO
{
	public String name;
	public List<NodeDTO> statements = new ArrayList<>();
}
