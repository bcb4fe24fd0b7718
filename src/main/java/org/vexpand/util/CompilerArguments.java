package org.vexpand.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses and holds all command-line arguments of the expansion driver.
 */
public class CompilerArguments
{
	public static final String STDOUT = "-";

	private final List<Path> inputFiles = new ArrayList<>();
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean printTree = false;
	private Path outputPath = null;
	private String tracePath = null; // "-" writes the trace to stdout

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				if (arg.equals("-h") || arg.equals("--help"))
				{
					parsedArgs.helpFlag = true;
					return parsedArgs; // Help flag overrides all else
				}
				if (arg.equals("--version"))
				{
					parsedArgs.versionFlag = true;
					return parsedArgs;
				}
				if (arg.equals("-v") || arg.equals("--verbose"))
				{
					parsedArgs.verboseFlag = true;
					Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					continue;
				}
				if (arg.equals("-k") || arg.equals("--check"))
				{
					parsedArgs.checkOnly = true;
					continue;
				}
				if (arg.equals("-p") || arg.equals("--print"))
				{
					parsedArgs.printTree = true;
					continue;
				}

				// --- Flags with one argument ---
				if (arg.equals("-o") || arg.equals("--output"))
				{
					parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					continue;
				}
				if (arg.equals("-t") || arg.equals("--trace"))
				{
					parsedArgs.tracePath = getTraceArg(args, ++i, arg);
					continue;
				}

				// --- Handle file inputs ---
				if (arg.startsWith("-"))
				{
					throw new IllegalArgumentException("Unknown option: " + arg);
				}

				parsedArgs.inputFiles.add(Paths.get(arg));
			}

			if (parsedArgs.outputPath != null && parsedArgs.inputFiles.size() > 1)
			{
				throw new IllegalArgumentException("-o cannot be used with more than one input file");
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	// Like getNextArg, but a lone "-" is a valid value.
	private static String getTraceArg(String[] args, int i, String flag)
	{
		if (i < args.length && args[i].equals(STDOUT))
		{
			return STDOUT;
		}
		return getNextArg(args, i, flag);
	}

	public static void printUsage()
	{
		System.out.println("OVERVIEW: Vector expansion pass. Rewrites vector operations into scalar ones.");
		System.out.println("\nUSAGE: vexpand [options] tree.json...");
		System.out.println("\nOPTIONS:");
		System.out.println("  -h, --help                Show this help message and exit.");
		System.out.println("  --version                 Show version and exit.");
		System.out.println("  -v, --verbose             Enable verbose debug logging.");
		System.out.println("  -o, --output <file>       Write the expanded tree to <file> (single input only).");
		System.out.println("  -k, --check               Run size checks only; do not write output.");
		System.out.println("  -p, --print               Print the expanded tree as indented text.");
		System.out.println("  -t, --trace <file|->      Write a trace of each expansion step ('-' for stdout).");
	}

	// --- Getters ---

	public List<Path> getInputFiles()
	{
		return inputFiles;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isPrintTree()
	{
		return printTree;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public String getTracePath()
	{
		return tracePath;
	}

	public boolean isTraceEnabled()
	{
		return tracePath != null;
	}
}
