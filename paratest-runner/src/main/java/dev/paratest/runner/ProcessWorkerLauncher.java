package dev.paratest.runner;

import dev.paratest.worker.WorkerMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Starts every worker as a separate JVM with the class path of the current one.
 * Workers share standard output and error with the supervisor.
 */
public final class ProcessWorkerLauncher implements WorkerLauncher {

	private static final Logger log = LoggerFactory.getLogger(ProcessWorkerLauncher.class);

	public ProcessWorkerLauncher(List<String> jvmArgs) {
		this.jvmArgs = List.copyOf(jvmArgs);
	}

	private final List<String> jvmArgs;


	@Override
	public WorkerProcess launch(Path socketPath) throws IOException {
		var java = Path.of(System.getProperty("java.home"), "bin", "java");

		List<String> cmd = new ArrayList<>();
		cmd.add(java.toString());
		cmd.addAll(jvmArgs);
		cmd.add("-cp");
		cmd.add(System.getProperty("java.class.path"));
		cmd.add(WorkerMain.class.getName());
		cmd.add(socketPath.toString());

		var pb = new ProcessBuilder();
		pb.command(cmd);

		pb.redirectInput(ProcessBuilder.Redirect.PIPE);
		pb.redirectOutput(ProcessBuilder.Redirect.INHERIT);
		pb.redirectError(ProcessBuilder.Redirect.INHERIT);

		var process = pb.start();
		process.getOutputStream().close();

		log.debug("Started worker process {}", process.pid());
		return new ChildWorker(process);
	}

	private record ChildWorker(Process process) implements WorkerProcess {
		@Override
		public CompletableFuture<Integer> onExit() {
			return process.onExit().thenApply(Process::exitValue);
		}

		@Override
		public void kill() {
			process.destroy();
		}
	}
}
