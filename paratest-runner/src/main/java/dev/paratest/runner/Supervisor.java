package dev.paratest.runner;

import com.fasterxml.jackson.databind.JsonNode;
import dev.paratest.protocol.MessageChannel;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.ReportFormat;
import dev.paratest.protocol.SocketPaths;
import dev.paratest.protocol.SupervisorMessage;
import dev.paratest.protocol.WorkerMessage;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Runs one test run across a pool of workers.
 * <p>
 * The supervisor listens on a Unix domain socket, starts the workers, offers each connecting worker a partition
 * offset, and prints the results it receives strictly in test order. All run state is handled by the thread
 * calling {@link #run(Path)}; the accept thread and the reader threads only post events.
 */
public final class Supervisor {

	private static final Logger log = LoggerFactory.getLogger(Supervisor.class);

	public Supervisor(RunOptions options, CompiledProgram program, List<Path> testFiles, WorkerLauncher launcher, ReportPrinter printer) {
		this.options = options;
		this.program = program;
		this.testFiles = testFiles.stream().map(Path::toString).toList();
		this.launcher = launcher;
		this.printer = printer;
	}

	private final RunOptions options;
	private final CompiledProgram program;
	private final List<String> testFiles;
	private final WorkerLauncher launcher;
	private final ReportPrinter printer;

	private final BlockingQueue<SupervisorEvent> events = new LinkedBlockingQueue<>();
	private final List<WorkerProcess> workers = new ArrayList<>();
	private final Set<WorkerProcess> killedWorkers = new HashSet<>();
	private final List<WorkerConnection> connections = new ArrayList<>();
	private volatile boolean stopping = false;


	/**
	 * Runs the tests once.
	 *
	 * @param socketPath The socket to listen on. It must not exist yet.
	 * @return The exit code of the run.
	 */
	public int run(Path socketPath) throws IOException, ProtocolException, InterruptedException {
		var state = new RunState(options.report(), options.processes(), System.currentTimeMillis());

		try(var server = ServerSocketChannel.open(StandardProtocolFamily.UNIX)) {
			server.bind(UnixDomainSocketAddress.of(socketPath));
			log.debug("Listening on {}", socketPath);

			startDaemon("paratest-accept", () -> acceptLoop(server));

			for(int i = 0; i < options.processes(); ++i) {
				var worker = launcher.launch(socketPath);
				workers.add(worker);
				worker.onExit().whenComplete((exitCode, error) ->
					events.add(new SupervisorEvent.WorkerExited(worker, exitCode == null ? 1 : exitCode))
				);
			}

			return loop(state);
		}
		finally {
			stopping = true;
			killWorkers();
			for(var connection : connections) {
				connection.close();
			}
			if(!SocketPaths.isWindows()) {
				Files.deleteIfExists(socketPath);
			}
		}
	}

	private int loop(RunState state) throws IOException, ProtocolException, InterruptedException {
		while(true) {
			var event = events.take();
			Integer exitCode = null;

			if(event instanceof SupervisorEvent.Connected connected) {
				var connection = connected.connection();
				connections.add(connection);
				log.debug("Worker connection {} accepted", connection.id());
				connection.channel().send(loadMessage(connection.id()));
			}
			else if(event instanceof SupervisorEvent.Received received) {
				exitCode = handleMessage(state, received.connection(), received.message());
			}
			else if(event instanceof SupervisorEvent.Disconnected disconnected) {
				log.debug("Worker connection {} closed", disconnected.connection().id());
			}
			else if(event instanceof SupervisorEvent.ReadFailed failed) {
				if(failed.error() instanceof ProtocolException protocolException) {
					throw protocolException;
				}
				log.debug("Reading from worker connection {} failed", failed.connection().id(), failed.error());
			}
			else if(event instanceof SupervisorEvent.AcceptFailed failed) {
				throw new IOException("Failed to accept worker connections", failed.error());
			}
			else if(event instanceof SupervisorEvent.WorkerExited exited) {
				exitCode = handleExit(state, exited.worker(), exited.exitCode());
			}

			if(exitCode != null) {
				printer.flush();
				return exitCode;
			}
		}
	}

	private SupervisorMessage.Load loadMessage(int offset) {
		return new SupervisorMessage.Load(
			program.dest(),
			program.entry(),
			options.fuzz(),
			options.seed(),
			options.processes(),
			offset,
			options.report().wireName(options.color()),
			testFiles
		);
	}

	private @Nullable Integer handleMessage(RunState state, WorkerConnection connection, JsonNode node) throws IOException, ProtocolException {
		var message = MessageCodec.decodeWorkerMessage(node);

		if(message instanceof WorkerMessage.Begin begin) {
			if(state.begin(begin.testCount())) {
				printer.printHeadline();
				printer.printResult(begin.message());
			}
			flush(state);
		}
		else if(message instanceof WorkerMessage.Results results) {
			record(state, results.results());
			flush(state);
		}
		else if(message instanceof WorkerMessage.Finished finished) {
			record(state, finished.results());
			flush(state);

			if(!connection.markFinished()) {
				log.debug("Ignoring repeated FINISHED from worker connection {}", connection.id());
				return null;
			}

			state.workerFinished();
			if(state.runningWorkers() == 0) {
				var duration = state.elapsedMillis(System.currentTimeMillis());
				connection.channel().send(new SupervisorMessage.Summary(duration, state.failures(), state.todos()));
			}
		}
		else if(message instanceof WorkerMessage.Summary summary) {
			return handleSummary(state, summary);
		}
		else if(message instanceof WorkerMessage.Error error) {
			throw new ProtocolException(error.message());
		}

		return null;
	}

	private @Nullable Integer handleSummary(RunState state, WorkerMessage.Summary summary) throws IOException, ProtocolException {
		flush(state);

		var message = summary.message();
		if(summary.exitCode() == 1 && message != null && message.isTextual()) {
			// The tests could not run at all.
			printer.printError(message.asText());
		}
		else if(message != null) {
			printer.printResult(message);
			if(options.report() == ReportFormat.JUNIT) {
				printer.printJUnit(message, state.resultsInOrder());
			}
		}

		state.setSummaryExitCode(summary.exitCode());
		if(!options.watch()) {
			return summary.exitCode();
		}

		killWorkers();
		return state.allWorkersClosed() ? summary.exitCode() : null;
	}

	private @Nullable Integer handleExit(RunState state, WorkerProcess worker, int exitCode) {
		log.debug("Worker exited with code {}", exitCode);

		boolean crashed = exitCode != 0 && !killedWorkers.contains(worker);
		state.workerClosed();

		if(crashed) {
			if(options.watch() && !options.report().isMachineReadable()) {
				// Reported once all workers have closed.
				state.setPendingException(true);
				killWorkers();
			}
			else {
				printer.printRuntimeException();
				return 1;
			}
		}

		if(!state.allWorkersClosed()) {
			return null;
		}

		if(state.hasPendingException()) {
			printer.printRuntimeException();
			state.setPendingException(false);
			return 1;
		}

		var summaryExitCode = state.summaryExitCode();
		if(summaryExitCode == null) {
			printer.printError("All workers stopped before the test run completed.");
			return 1;
		}
		return summaryExitCode;
	}

	private void record(RunState state, @Nullable Map<Integer, JsonNode> results) throws ProtocolException {
		if(results == null) {
			return;
		}

		for(var entry : results.entrySet()) {
			state.record(entry.getKey(), entry.getValue());
		}
	}

	private void flush(RunState state) throws IOException, ProtocolException {
		for(var result : state.takePrintable()) {
			printer.printResult(result);
		}
	}

	private void killWorkers() {
		for(var worker : workers) {
			if(killedWorkers.add(worker)) {
				worker.kill();
			}
		}
	}

	private void acceptLoop(ServerSocketChannel server) {
		int nextId = 0;
		try {
			while(true) {
				var socket = server.accept();
				var connection = new WorkerConnection(nextId++, new MessageChannel(socket));
				events.add(new SupervisorEvent.Connected(connection));
				startDaemon("paratest-reader-" + connection.id(), () -> readLoop(connection));
			}
		}
		catch(ClosedChannelException e) {
			log.debug("Stopped accepting worker connections");
		}
		catch(IOException e) {
			if(!stopping) {
				events.add(new SupervisorEvent.AcceptFailed(e));
			}
		}
	}

	private void readLoop(WorkerConnection connection) {
		try {
			while(true) {
				var message = connection.channel().receive();
				if(message == null) {
					events.add(new SupervisorEvent.Disconnected(connection));
					return;
				}

				events.add(new SupervisorEvent.Received(connection, message));
			}
		}
		catch(IOException | ProtocolException e) {
			if(stopping || connection.isClosed()) {
				log.debug("Reader of worker connection {} stopped", connection.id(), e);
				return;
			}

			events.add(new SupervisorEvent.ReadFailed(connection, e));
		}
	}

	private static void startDaemon(String name, Runnable task) {
		var thread = new Thread(task, name);
		thread.setDaemon(true);
		thread.start();
	}
}
