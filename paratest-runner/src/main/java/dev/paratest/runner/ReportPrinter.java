package dev.paratest.runner;

import com.fasterxml.jackson.databind.JsonNode;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.ReportFormat;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes everything the user sees of a run. Report output goes to standard output, problems to standard error.
 * Informational lines only appear in the console report, so that machine readable output stays clean.
 */
public final class ReportPrinter {
	public ReportPrinter(ReportFormat report, boolean color, boolean windows, String version, PrintStream out, PrintStream err) {
		this.report = report;
		this.color = color;
		this.windows = windows;
		this.version = version;
		this.out = out;
		this.err = err;
	}

	private static final String RED = "\u001B[31m";
	private static final String BLUE = "\u001B[34m";
	private static final String RESET = "\u001B[39m";

	private final ReportFormat report;
	private final boolean color;
	private final boolean windows;
	private final String version;
	private final PrintStream out;
	private final PrintStream err;


	public void printHeadline() {
		if(report.isMachineReadable()) {
			return;
		}

		var headline = "paratest " + version;
		out.println("\n" + headline + "\n" + "-".repeat(headline.length()) + "\n");
	}

	/**
	 * Prints a begin message, a test result or a summary message.
	 */
	public void printResult(JsonNode result) throws ProtocolException, IOException {
		switch(report) {
			case CONSOLE -> printConsoleResult(result);
			case JSON -> out.println(new String(MessageCodec.encode(result), StandardCharsets.UTF_8));
			case JUNIT -> {}
		}
	}

	public void printJUnit(JsonNode summary, List<JsonNode> results) throws IOException {
		out.println(JUnitReport.render(summary, results));
	}

	public void printError(String message) {
		err.println(message);
	}

	public void printRuntimeException() {
		err.println(colored(RED, "\n\nThere was an unexpected runtime exception while running tests\n\n"));
	}

	public void info(String message) {
		if(!report.isMachineReadable()) {
			out.println(message);
		}
	}

	public void infoHighlighted(String message) {
		info(colored(BLUE, message));
	}

	public void clearConsole() {
		if(!report.isMachineReadable()) {
			out.print(windows ? "\u001B[2J\u001B[0f" : "\u001B[2J\u001B[3J\u001B[H");
			out.flush();
		}
	}

	public void flush() {
		out.flush();
		err.flush();
	}

	private void printConsoleResult(JsonNode result) throws ProtocolException {
		var type = result.path("type").asText();
		switch(type) {
			case "begin" -> out.println(safe(result.path("output").asText()));

			case "complete" -> {
				var status = result.path("status").asText();
				switch(status) {
					case "pass" -> {
						var distributionReport = result.get("distributionReport");
						if(distributionReport != null) {
							out.println(safe(distributionReport.asText()));
						}
					}

					// Todos are listed in the summary.
					case "todo" -> {}

					case "fail" -> out.println(safe(result.path("failure").asText()));

					default -> throw new ProtocolException("Unexpected result status: " + status);
				}
			}

			case "summary" -> out.println(safe(result.path("summary").asText()));

			default -> throw new ProtocolException("Unexpected result type: " + type);
		}
	}

	private String safe(String text) {
		return ConsoleText.makeSafe(text, windows);
	}

	private String colored(String code, String text) {
		return color ? code + text + RESET : text;
	}
}
