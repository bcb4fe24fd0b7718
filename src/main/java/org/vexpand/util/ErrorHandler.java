// File: src/main/java/org/vexpand/util/ErrorHandler.java
package org.vexpand.util;

import org.vexpand.ast.SourcePosition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public void logError(SourcePosition sourcePos, String msg)
	{
		Diagnostic diagnostic = new Diagnostic(sourcePos, msg);
		Debug.logError("[Expansion Error] " + diagnostic);
		diagnostics.add(diagnostic);
	}

	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
