package org.vexpand.dto;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.util.ArrayList;

/**
 * Reads and writes {@link ProgramDTO}s as JSON.
 */
public class TreeSerializer
{
	private final Gson gson;

	public TreeSerializer()
	{
		this.gson = new GsonBuilder().setPrettyPrinting().create();
	}

	/**
	 * @throws JsonParseException if {@code json} is not a valid program
	 */
	public ProgramDTO read(String json)
	{
		ProgramDTO program = gson.fromJson(json, ProgramDTO.class);
		if (program == null)
		{
			throw new JsonParseException("Empty tree document");
		}
		if (program.statements == null)
		{
			program.statements = new ArrayList<>();
		}
		return program;
	}

	public String write(ProgramDTO program)
	{
		return gson.toJson(program);
	}
}
