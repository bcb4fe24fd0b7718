package org.vexpand.expand;

import org.vexpand.ast.Node;
import org.vexpand.error.ExpansionException;
import org.vexpand.util.Debug;
import org.vexpand.util.Diagnostic;
import org.vexpand.util.ErrorHandler;
import org.vexpand.util.TreePrinter;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the vector expansion over every top-level statement of a compilation unit.
 * <p>
 * A user-facing error aborts the statement it was found in and is reported through the
 * {@link ErrorHandler}; the following statements are still checked so that every error of the
 * unit gets reported, but a unit with any error yields no tree at all.
 * {@link org.vexpand.error.InternalCompilerError}s are not reported here and abort the run.
 */
public class VectorExpansionPass
{
	private final ErrorHandler errorHandler;
	private final ExpansionTrace trace;

	public VectorExpansionPass(ErrorHandler errorHandler)
	{
		this(errorHandler, ExpansionTrace.NONE);
	}

	public VectorExpansionPass(ErrorHandler errorHandler, ExpansionTrace trace)
	{
		this.errorHandler = errorHandler;
		this.trace = trace;
	}

	public ExpansionResult run(List<Node> statements)
	{
		int previousErrors = errorHandler.getDiagnostics().size();
		TreeExpander expander = new TreeExpander(trace);
		List<Node> expanded = new ArrayList<>(statements.size());

		for (Node statement : statements)
		{
			Debug.logDebug(() -> "Expanding statement at " + statement.getSourcePos() + ":\n" + TreePrinter.print(statement));
			trace.record(0, "statement at " + statement.getSourcePos());
			try
			{
				Node result = expander.expandStatement(statement);
				ScalarizationChecker.verify(result);
				expanded.add(result);
			}
			catch (ExpansionException e)
			{
				errorHandler.logError(e.getSourcePos(), e.getMessage());
				trace.record(1, "failed: " + e.getMessage());
			}
		}
		trace.flush();

		List<Diagnostic> all = errorHandler.getDiagnostics();
		if (all.size() > previousErrors)
		{
			Debug.logDebug("Vector expansion failed with " + (all.size() - previousErrors) + " error(s).");
			return ExpansionResult.failed(all.subList(previousErrors, all.size()));
		}

		Debug.logDebug("Vector expansion done, " + expanded.size() + " statement(s).");
		return ExpansionResult.succeeded(expanded);
	}
}
