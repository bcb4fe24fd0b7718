package org.vexpand;

import com.google.gson.JsonParseException;
import org.vexpand.ast.Node;
import org.vexpand.dto.NodeDTOConverter;
import org.vexpand.dto.ProgramDTO;
import org.vexpand.dto.TreeSerializer;
import org.vexpand.expand.ExpansionResult;
import org.vexpand.expand.ExpansionTrace;
import org.vexpand.expand.VectorExpansionPass;
import org.vexpand.util.*;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Command-line driver: reads type-checked trees as JSON, runs the vector expansion pass and
 * writes the scalarized trees next to the inputs (or to {@code -o}).
 */
public class Main
{
	public static final String VERSION = "0.1.0";
	private static final String EXPANDED_EXTENSION = ".expanded.json";

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	/**
	 * @return the process exit code: 0 on success, 1 on compilation errors, 2 on usage or I/O errors
	 */
	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return args.length == 0 || isHelpRequest(args) ? 0 : 2;
			}
			if (arguments.isVersionFlag())
			{
				System.out.println("vexpand (vector expansion pass) version " + VERSION);
				return 0;
			}

			if (arguments.getInputFiles().isEmpty())
			{
				throw new IllegalArgumentException("No input files provided. Use -h for help.");
			}

			if (!validatePaths(arguments))
			{
				Debug.logError("Aborting.");
				return 2;
			}

			ErrorHandler errorHandler = new ErrorHandler();
			try (Writer traceWriter = openTrace(arguments))
			{
				ExpansionTrace trace = traceWriter != null ? ExpansionTrace.to(traceWriter) : ExpansionTrace.NONE;
				VectorExpansionPass pass = new VectorExpansionPass(errorHandler, trace);

				for (Path input : arguments.getInputFiles())
				{
					expandFile(input, arguments, pass);
				}
			}

			if (errorHandler.hasErrors())
			{
				Debug.logError("Expansion failed with " + errorHandler.getDiagnostics().size() + " error(s).");
				return 1;
			}
			Debug.logInfo("Expansion successful.");
			return 0;
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Expansion failed: " + e.getMessage());
			return 2;
		}
		catch (JsonParseException e)
		{
			Debug.logError("Invalid tree file: " + e.getMessage());
			return 2;
		}
		catch (IOException e)
		{
			Debug.logError("Error reading or writing file: " + e.getMessage());
			return 2;
		}
	}

	private static void expandFile(Path input, CompilerArguments args, VectorExpansionPass pass) throws IOException
	{
		Debug.logDebug("\nReading tree from " + input);
		TreeSerializer serializer = new TreeSerializer();
		ProgramDTO program = serializer.read(FileUtils.load(input));
		List<Node> statements = NodeDTOConverter.toStatements(program);

		ExpansionResult result = pass.run(statements);
		if (!result.isSuccess())
		{
			Debug.logError("Expansion of " + input + " failed.");
			return;
		}

		if (args.isPrintTree())
		{
			Debug.log(TreePrinter.print(result.statements()));
		}

		if (args.isCheckOnly())
		{
			Debug.logInfo("Size check passed for " + input + ". No output generated (-k flag).");
			return;
		}

		String name = program.name != null ? program.name : input.getFileName().toString();
		Path outputPath = getOutputPath(args, input);
		writeTree(NodeDTOConverter.toProgram(name, result.statements()), outputPath, serializer);
	}

	private static void writeTree(ProgramDTO program, Path outPath, TreeSerializer serializer) throws IOException
	{
		if (outPath.getParent() != null)
		{
			Files.createDirectories(outPath.getParent());
		}
		Files.writeString(outPath, serializer.write(program), StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote expanded tree to: " + outPath);
	}

	// null when no trace was requested
	private static Writer openTrace(CompilerArguments args) throws IOException
	{
		if (!args.isTraceEnabled())
		{
			return null;
		}
		if (CompilerArguments.STDOUT.equals(args.getTracePath()))
		{
			// do not close System.out with the trace
			return new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8))
			{
				@Override
				public void close()
				{
					flush();
				}
			};
		}
		Path tracePath = Path.of(args.getTracePath());
		if (tracePath.getParent() != null)
		{
			Files.createDirectories(tracePath.getParent());
		}
		return Files.newBufferedWriter(tracePath, StandardCharsets.UTF_8);
	}

	/**
	 * Determines where the expanded tree of {@code inputFile} is written.
	 */
	static Path getOutputPath(CompilerArguments args, Path inputFile)
	{
		if (args.getOutputPath() != null)
		{
			return args.getOutputPath();
		}
		return FileUtils.withExtension(inputFile, EXPANDED_EXTENSION);
	}

	private static boolean isHelpRequest(String[] args)
	{
		for (String arg : args)
		{
			if (arg.equals("-h") || arg.equals("--help"))
			{
				return true;
			}
		}
		return false;
	}

	private static boolean validatePaths(CompilerArguments args)
	{
		boolean valid = true;

		for (Path input : args.getInputFiles())
		{
			if (!Files.exists(input))
			{
				Debug.logError("Input file not found: " + input);
				valid = false;
			}
			else if (!".json".equals(FileUtils.getFileExtension(input)))
			{
				Debug.logWarning("Input file does not have a .json extension: " + input);
			}
		}

		return valid;
	}
}
