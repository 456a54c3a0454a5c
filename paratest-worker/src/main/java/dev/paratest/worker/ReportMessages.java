package dev.paratest.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.paratest.protocol.MessageCodec;

import java.util.List;

/**
 * Builds the report payloads of a program for its report format.
 * The supervisor classifies results by these shapes, so the field names are fixed.
 */
final class ReportMessages {

	ReportMessages(ProgramFlags flags) {
		this.flags = flags;
	}

	private static final String RED = "\u001B[31m";
	private static final String GREEN = "\u001B[32m";
	private static final String YELLOW = "\u001B[33m";
	private static final String RESET = "\u001B[39m";

	private final ProgramFlags flags;


	public JsonNode begin(int testCount) {
		var node = MessageCodec.mapper().createObjectNode();
		switch(flags.reportFormat()) {
			case CONSOLE -> {
				node.put("type", "begin");
				node.put("output", "\nRunning " + testCount + " " + plural(testCount, "test") + ". To reproduce these results, run: paratest --fuzz " + flags.fuzz() + " --seed " + flags.seed() + pathSuffix() + "\n");
			}

			case JSON -> {
				node.put("event", "runStart");
				node.put("testCount", Integer.toString(testCount));
				node.put("fuzzRuns", Integer.toString(flags.fuzz()));
				var paths = node.putArray("paths");
				flags.paths().forEach(paths::add);
				node.put("initialSeed", Long.toString(flags.seed()));
			}

			case JUNIT -> {}
		}
		return node;
	}

	public JsonNode result(TestDefinition test, TestOutcome outcome, long durationMillis) {
		var node = MessageCodec.mapper().createObjectNode();
		var labels = test.labels();
		switch(flags.reportFormat()) {
			case CONSOLE -> {
				node.put("type", "complete");
				node.put("status", outcome.status().wireName());
				putLabels(node, labels);
				switch(outcome.status()) {
					case FAIL -> node.put("failure", consoleFailure(labels, outcome.message()));
					case TODO -> node.put("failure", outcome.message());
					case PASS -> {}
				}
			}

			case JSON -> {
				node.put("event", "testCompleted");
				node.put("status", outcome.status().wireName());
				putLabels(node, labels);
				var failures = node.putArray("failures");
				switch(outcome.status()) {
					case FAIL -> {
						var failure = failures.addObject();
						failure.putNull("given");
						failure.put("message", outcome.message());
					}
					case TODO -> failures.add(outcome.message());
					case PASS -> {}
				}
				node.put("duration", Long.toString(durationMillis));
			}

			case JUNIT -> {
				node.put("@classname", labels.get(0));
				node.put("@name", labels.size() > 1 ? String.join(" ", labels.subList(1, labels.size())) : labels.get(0));
				node.put("@time", durationMillis / 1000.0);
				switch(outcome.status()) {
					case FAIL -> node.put("failure", outcome.message());
					case TODO -> node.putObject("skipped").put("@message", outcome.message());
					case PASS -> {}
				}
			}
		}
		return node;
	}

	public JsonNode summary(int testCount, double duration, int failures, List<JsonNode> todos) {
		long durationMillis = Math.round(duration);
		int passed = testCount - failures - todos.size();

		var node = MessageCodec.mapper().createObjectNode();
		switch(flags.reportFormat()) {
			case CONSOLE -> {
				node.put("type", "summary");
				node.put("summary", consoleSummary(durationMillis, passed, failures, todos));
			}

			case JSON -> {
				node.put("event", "runComplete");
				node.put("passed", Integer.toString(passed));
				node.put("failed", Integer.toString(failures));
				node.put("duration", Long.toString(durationMillis));
				if(todos.isEmpty()) {
					node.putNull("autoFail");
				}
				else {
					node.put("autoFail", "Test.todo was used");
				}
			}

			case JUNIT -> {
				var suite = node.putObject("testsuite");
				suite.put("@name", "paratest");
				suite.put("@package", "paratest");
				suite.put("@tests", testCount);
				suite.put("@failures", failures);
				suite.put("@errors", 0);
				suite.put("@time", durationMillis / 1000.0);
				suite.putArray("testcase");
			}
		}
		return node;
	}

	public JsonNode noTests() {
		return TextNode.valueOf("No tests found. Make sure the test modules expose at least one test.");
	}

	private String consoleFailure(List<String> labels, String message) {
		var sb = new StringBuilder();
		sb.append('\n');
		for(int i = 0; i < labels.size() - 1; ++i) {
			sb.append("↓ ").append(labels.get(i)).append('\n');
		}
		sb.append(colored(RED, "✗ " + labels.get(labels.size() - 1))).append("\n\n");
		for(var line : String.valueOf(message).split("\n", -1)) {
			sb.append(line.isEmpty() ? "" : "    " + line).append('\n');
		}
		return sb.toString();
	}

	private String consoleSummary(long durationMillis, int passed, int failures, List<JsonNode> todos) {
		String headline;
		if(failures > 0) {
			headline = colored(RED, "TEST RUN FAILED");
		}
		else if(!todos.isEmpty()) {
			headline = colored(YELLOW, "TEST RUN INCOMPLETE") + " because there " + (todos.size() == 1 ? "is 1 TODO" : "are " + todos.size() + " TODOs") + " remaining";
		}
		else {
			headline = colored(GREEN, "TEST RUN PASSED");
		}

		var sb = new StringBuilder();
		sb.append('\n').append(headline).append("\n\n");
		sb.append("Duration: ").append(durationMillis).append(" ms\n");
		sb.append("Passed:   ").append(passed).append('\n');
		sb.append("Failed:   ").append(failures).append('\n');
		if(!todos.isEmpty()) {
			sb.append("Todo:     ").append(todos.size()).append('\n');
			for(var todo : todos) {
				sb.append('\n');
				var labels = todo.path("labels");
				for(int i = 0; i < labels.size(); ++i) {
					sb.append("↓ ").append(labels.get(i).asText()).append('\n');
				}
				var text = todo.has("todo") ? todo.get("todo") : todo.path("failure");
				sb.append("◦ TODO: ").append(text.asText()).append('\n');
			}
		}
		return sb.toString();
	}

	private String colored(String color, String text) {
		return flags.color() ? color + text + RESET : text;
	}

	private String pathSuffix() {
		return flags.paths().isEmpty() ? "" : " " + String.join(" ", flags.paths());
	}

	private static void putLabels(ObjectNode node, List<String> labels) {
		var array = node.putArray("labels");
		labels.forEach(array::add);
	}

	private static String plural(int n, String word) {
		return n == 1 ? word : word + "s";
	}
}
