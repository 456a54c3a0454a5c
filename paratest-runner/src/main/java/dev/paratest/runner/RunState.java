package dev.paratest.runner;

import com.fasterxml.jackson.databind.JsonNode;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.ReportFormat;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * The state of one run, owned by the supervisor loop. A new one is created for every run.
 * <p>
 * Results are buffered by index and released strictly in index order, without gaps, once the test count is
 * known from the first {@code BEGIN}.
 */
final class RunState {
	RunState(ReportFormat report, int workers, long startingTime) {
		this.report = report;
		this.workers = workers;
		this.runningWorkers = workers;
		this.startingTime = startingTime;
	}

	private final ReportFormat report;
	private final int workers;
	private final long startingTime;

	private int nextResultToPrint = -1;
	private int testsToRun = -1;
	private int runningWorkers;
	private int closedWorkers = 0;
	private int failures = 0;
	private final List<JsonNode> todos = new ArrayList<>();
	private final Map<Integer, JsonNode> results = new TreeMap<>();
	private boolean pendingException = false;
	private @Nullable Integer summaryExitCode = null;


	/**
	 * Starts printing. Only the first call has an effect.
	 * @return true when this call started the run.
	 */
	public boolean begin(int testCount) {
		if(nextResultToPrint >= 0) {
			return false;
		}

		testsToRun = testCount;
		nextResultToPrint = 0;
		return true;
	}

	public boolean isStarted() {
		return nextResultToPrint >= 0;
	}

	/**
	 * Stores and classifies a result. A result for an index that already has one is ignored.
	 */
	public void record(int index, JsonNode result) throws ProtocolException {
		if(results.putIfAbsent(index, result) != null) {
			return;
		}

		switch(report) {
			case CONSOLE -> {
				var status = result.path("status").asText();
				switch(status) {
					case "pass" -> {}
					case "todo" -> todos.add(result);
					case "fail" -> ++failures;
					default -> throw new ProtocolException("Unexpected result status: " + status);
				}
			}

			case JSON -> {
				var status = result.path("status").asText();
				if(status.equals("fail")) {
					++failures;
				}
				else if(status.equals("todo")) {
					var todo = MessageCodec.mapper().createObjectNode();
					todo.set("labels", result.get("labels"));
					todo.set("todo", result.path("failures").get(0));
					todos.add(todo);
				}
			}

			case JUNIT -> {
				if(result.has("failure")) {
					++failures;
				}
			}
		}
	}

	/**
	 * @return The results that can be printed now, in order. They are not returned again.
	 */
	public List<JsonNode> takePrintable() {
		var printable = new ArrayList<JsonNode>();
		if(nextResultToPrint < 0) {
			return printable;
		}

		while(nextResultToPrint < testsToRun) {
			var result = results.get(nextResultToPrint);
			if(result == null) break;

			printable.add(result);
			++nextResultToPrint;
		}
		return printable;
	}

	public List<JsonNode> resultsInOrder() {
		return new ArrayList<>(results.values());
	}

	public void workerFinished() {
		--runningWorkers;
	}

	public int runningWorkers() {
		return runningWorkers;
	}

	/**
	 * @return true when every worker has closed.
	 */
	public boolean workerClosed() {
		++closedWorkers;
		return closedWorkers >= workers;
	}

	public int closedWorkers() {
		return closedWorkers;
	}

	public boolean allWorkersClosed() {
		return closedWorkers >= workers;
	}

	public int nextResultToPrint() {
		return nextResultToPrint;
	}

	public int failures() {
		return failures;
	}

	public List<JsonNode> todos() {
		return List.copyOf(todos);
	}

	public double elapsedMillis(long now) {
		return now - startingTime;
	}

	public boolean hasPendingException() {
		return pendingException;
	}

	public void setPendingException(boolean pendingException) {
		this.pendingException = pendingException;
	}

	public @Nullable Integer summaryExitCode() {
		return summaryExitCode;
	}

	public void setSummaryExitCode(int summaryExitCode) {
		this.summaryExitCode = summaryExitCode;
	}
}
