package dev.paratest.runner;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Workers that stop with the given exit code without ever connecting.
 */
final class ExitingWorkerLauncher implements WorkerLauncher {
	ExitingWorkerLauncher(int exitCode) {
		this.exitCode = exitCode;
	}

	private final int exitCode;

	@Override
	public WorkerProcess launch(Path socketPath) {
		return new WorkerProcess() {
			@Override
			public CompletableFuture<Integer> onExit() {
				return CompletableFuture.completedFuture(exitCode);
			}

			@Override
			public void kill() {}
		};
	}
}
