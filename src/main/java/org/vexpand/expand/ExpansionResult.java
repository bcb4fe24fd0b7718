package org.vexpand.expand;

import org.vexpand.ast.Node;
import org.vexpand.util.Diagnostic;

import java.util.List;

/**
 * Outcome of running the pass over one compilation unit: either the scalarized statements, or
 * the diagnostics that made the unit fail. A failed result never carries a partial tree.
 */
public record ExpansionResult(List<Node> statements, List<Diagnostic> diagnostics)
{
	public ExpansionResult
	{
		statements = List.copyOf(statements);
		diagnostics = List.copyOf(diagnostics);
	}

	public static ExpansionResult succeeded(List<Node> statements)
	{
		return new ExpansionResult(statements, List.of());
	}

	public static ExpansionResult failed(List<Diagnostic> diagnostics)
	{
		return new ExpansionResult(List.of(), diagnostics);
	}

	public boolean isSuccess()
	{
		return diagnostics.isEmpty();
	}
}
