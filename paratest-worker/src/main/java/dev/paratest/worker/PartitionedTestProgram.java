package dev.paratest.worker;

import com.fasterxml.jackson.databind.JsonNode;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.SupervisorMessage;
import dev.paratest.protocol.WorkerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Base class for test programs that run in the worker JVM.
 * <p>
 * Every worker gets the same ordered list of tests. The worker at offset {@code k} of {@code P} runs the
 * tests at indices {@code k, k + P, k + 2P, ...}, so that together the workers run every test exactly once.
 */
public abstract class PartitionedTestProgram implements TestProgram {

	private static final Logger log = LoggerFactory.getLogger(PartitionedTestProgram.class);

	/**
	 * @return All tests of the program, in the same order on every call.
	 */
	protected abstract List<TestDefinition> tests(ProgramFlags flags) throws Exception;

	@Override
	public final ProgramSession start(ProgramFlags flags, ProgramOutput output) throws Exception {
		if(flags.processes() < 1) {
			throw new IllegalArgumentException("Invalid process count: " + flags.processes());
		}

		return new Session(flags, tests(flags), output);
	}

	private static final class Session implements ProgramSession {
		Session(ProgramFlags flags, List<TestDefinition> tests, ProgramOutput output) {
			this.flags = flags;
			this.tests = List.copyOf(tests);
			this.output = output;
			messages = new ReportMessages(flags);
		}

		private final ProgramFlags flags;
		private final List<TestDefinition> tests;
		private final ProgramOutput output;
		private final ReportMessages messages;


		@Override
		public void receive(JsonNode message) throws Exception {
			var decoded = MessageCodec.decodeSupervisorMessage(message);
			if(decoded instanceof SupervisorMessage.Test test) {
				runPartition(test.index());
			}
			else if(decoded instanceof SupervisorMessage.Summary summary) {
				sendSummary(summary);
			}
			else {
				throw new ProtocolException("Unexpected message for a running program: " + message);
			}
		}

		private void runPartition(int offset) throws IOException {
			output.send(new WorkerMessage.Begin(tests.size(), messages.begin(tests.size())));

			for(int i = offset; i < tests.size(); i += flags.processes()) {
				var test = tests.get(i);

				long start = System.nanoTime();
				var outcome = runTest(test);
				long durationMillis = (System.nanoTime() - start) / 1_000_000;

				output.send(new WorkerMessage.Results(Map.of(i, messages.result(test, outcome, durationMillis))));
			}

			output.send(new WorkerMessage.Finished(null));
		}

		private TestOutcome runTest(TestDefinition test) {
			try {
				return test.body().run(flags);
			}
			catch(Exception e) {
				log.debug("Test {} threw an exception", test.labels(), e);
				return TestOutcome.fail(e.getClass().getName() + ": " + e.getMessage());
			}
		}

		private void sendSummary(SupervisorMessage.Summary summary) throws IOException {
			if(tests.isEmpty()) {
				output.send(new WorkerMessage.Summary(messages.noTests(), 1));
				return;
			}

			var todos = summary.todos() == null ? List.<JsonNode>of() : summary.todos();
			int exitCode = summary.failures() > 0 ? 1 : 0;
			output.send(new WorkerMessage.Summary(messages.summary(tests.size(), summary.duration(), summary.failures(), todos), exitCode));
		}
	}
}
