package org.vexpand.expand;

import java.io.PrintWriter;
import java.io.Writer;

/**
 * Optional diagnostic sink receiving a human-readable record of each expansion step.
 * Writing to it never influences the produced tree; {@link #NONE} drops everything.
 */
public class ExpansionTrace
{
	public static final ExpansionTrace NONE = new ExpansionTrace(null);

	private final PrintWriter sink;

	private ExpansionTrace(PrintWriter sink)
	{
		this.sink = sink;
	}

	public static ExpansionTrace to(Writer writer)
	{
		if (writer instanceof PrintWriter printWriter)
		{
			return new ExpansionTrace(printWriter);
		}
		return new ExpansionTrace(new PrintWriter(writer));
	}

	public boolean isEnabled()
	{
		return sink != null;
	}

	public void record(int depth, String message)
	{
		if (sink != null)
		{
			sink.println("  ".repeat(Math.max(depth, 0)) + message);
		}
	}

	public void flush()
	{
		if (sink != null)
		{
			sink.flush();
		}
	}
}
