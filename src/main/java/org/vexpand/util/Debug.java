package org.vexpand.util;

import java.util.function.Supplier;

public class Debug {
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v/--verbose. DEBUG logs are dropped while this is false.
	public static boolean ENABLE_DEBUG = false;

	// https://no-color.org
	public static boolean ENABLE_COLORS = System.getenv("NO_COLOR") == null;

	public static void log(String log) {
		System.out.println(log);
	}

	public static void logInfo(String log) {
		System.out.println(colored(ANSI_GREEN, log));
	}

	public static void logDebug(String log) {
		if (ENABLE_DEBUG) {
			System.out.println(log);
		}
	}

	// Builds the message only when debug output is on.
	public static void logDebug(Supplier<String> log) {
		if (ENABLE_DEBUG) {
			System.out.println(log.get());
		}
	}

	public static void logWarning(String log) {
		System.out.println(colored(ANSI_YELLOW, log));
	}

	public static void logError(String log) {
		System.err.println(colored(ANSI_RED, log));
	}

	private static String colored(String color, String log) {
		return ENABLE_COLORS ? color + log + ANSI_RESET : log;
	}
}
