package dev.paratest.protocol;

import java.util.Locale;

public enum ReportFormat {
	CONSOLE,
	JSON,
	JUNIT,
	;

	/**
	 * Machine readable formats must not have anything but the report itself on standard output.
	 */
	public boolean isMachineReadable() {
		return this != CONSOLE;
	}

	public String wireName(boolean color) {
		return switch(this) {
			case CONSOLE -> color ? "console-color" : "console-monochrome";
			case JSON -> "json";
			case JUNIT -> "junit";
		};
	}

	public static ReportFormat fromWireName(String name) {
		return switch(name) {
			case "console-color", "console-monochrome" -> CONSOLE;
			case "json" -> JSON;
			case "junit" -> JUNIT;
			default -> throw new IllegalArgumentException("Unknown report format: " + name);
		};
	}

	public static boolean isColorWireName(String name) {
		return name.equals("console-color");
	}

	public static ReportFormat parse(String name) {
		return switch(name.toLowerCase(Locale.ROOT)) {
			case "console" -> CONSOLE;
			case "json" -> JSON;
			case "junit" -> JUNIT;
			default -> throw new IllegalArgumentException("Unknown report format: " + name + " (expected console, json or junit)");
		};
	}
}
