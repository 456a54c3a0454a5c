package dev.paratest.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.ReportFormat;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class RunStateTests {

	private static ObjectNode consoleResult(String status, String name) {
		var node = MessageCodec.mapper().createObjectNode();
		node.put("type", "complete");
		node.put("status", status);
		node.putArray("labels").add(name);
		return node;
	}

	private static List<String> names(List<JsonNode> results) {
		return results.stream().map(r -> r.path("labels").get(0).asText()).toList();
	}

	@Test
	public void nothingIsPrintableBeforeBegin() throws Throwable {
		var state = new RunState(ReportFormat.CONSOLE, 1, 0);
		state.record(0, consoleResult("pass", "a"));

		Assertions.assertEquals(List.of(), state.takePrintable());
		Assertions.assertFalse(state.isStarted());
	}

	@Test
	public void resultsAreReleasedInOrderWithoutGaps() throws Throwable {
		var state = new RunState(ReportFormat.CONSOLE, 2, 0);
		Assertions.assertTrue(state.begin(4));
		Assertions.assertFalse(state.begin(4));

		state.record(1, consoleResult("pass", "b"));
		Assertions.assertEquals(List.of(), state.takePrintable());

		state.record(0, consoleResult("pass", "a"));
		state.record(3, consoleResult("pass", "d"));
		Assertions.assertEquals(List.of("a", "b"), names(state.takePrintable()));
		Assertions.assertEquals(2, state.nextResultToPrint());

		state.record(2, consoleResult("pass", "c"));
		Assertions.assertEquals(List.of("c", "d"), names(state.takePrintable()));
		Assertions.assertEquals(List.of(), state.takePrintable());
		Assertions.assertEquals(4, state.nextResultToPrint());
	}

	@Test
	public void firstResultForAnIndexWins() throws Throwable {
		var state = new RunState(ReportFormat.CONSOLE, 1, 0);
		state.begin(1);
		state.record(0, consoleResult("fail", "first"));
		state.record(0, consoleResult("fail", "second"));

		Assertions.assertEquals(1, state.failures());
		Assertions.assertEquals(List.of("first"), names(state.resultsInOrder()));
	}

	@Test
	public void consoleClassification() throws Throwable {
		var state = new RunState(ReportFormat.CONSOLE, 1, 0);
		state.record(0, consoleResult("pass", "a"));
		state.record(1, consoleResult("fail", "b"));
		state.record(2, consoleResult("todo", "c"));
		state.record(3, consoleResult("fail", "d"));

		Assertions.assertEquals(2, state.failures());
		Assertions.assertEquals(1, state.todos().size());
		Assertions.assertThrows(ProtocolException.class, () -> state.record(4, consoleResult("maybe", "e")));
	}

	@Test
	public void jsonTodosKeepLabelsAndFirstFailure() throws Throwable {
		var state = new RunState(ReportFormat.JSON, 1, 0);

		var todo = MessageCodec.mapper().createObjectNode();
		todo.put("event", "testCompleted");
		todo.put("status", "todo");
		todo.putArray("labels").add("Suite").add("later");
		todo.putArray("failures").add("write this test");
		state.record(0, todo);

		var failure = MessageCodec.mapper().createObjectNode();
		failure.put("status", "fail");
		state.record(1, failure);

		Assertions.assertEquals(1, state.failures());
		var recorded = state.todos().get(0);
		Assertions.assertEquals("write this test", recorded.get("todo").asText());
		Assertions.assertEquals("later", recorded.get("labels").get(1).asText());
	}

	@Test
	public void junitCountsResultsWithAFailure() throws Throwable {
		var state = new RunState(ReportFormat.JUNIT, 1, 0);

		var passing = MessageCodec.mapper().createObjectNode();
		passing.put("@name", "ok");
		var failing = MessageCodec.mapper().createObjectNode();
		failing.put("@name", "broken");
		failing.put("failure", "nope");

		state.record(0, passing);
		state.record(1, failing);

		Assertions.assertEquals(1, state.failures());
		Assertions.assertEquals(List.of(), state.todos());
	}

	@Test
	public void workerBookkeeping() {
		var state = new RunState(ReportFormat.CONSOLE, 2, 1000);

		state.workerFinished();
		Assertions.assertEquals(1, state.runningWorkers());

		Assertions.assertFalse(state.workerClosed());
		Assertions.assertTrue(state.workerClosed());
		Assertions.assertTrue(state.allWorkersClosed());
		Assertions.assertEquals(2, state.closedWorkers());

		Assertions.assertEquals(250.0, state.elapsedMillis(1250));
		Assertions.assertNull(state.summaryExitCode());
	}
}
