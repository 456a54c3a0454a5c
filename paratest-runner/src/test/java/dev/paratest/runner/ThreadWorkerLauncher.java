package dev.paratest.runner;

import dev.paratest.worker.Worker;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Runs workers on threads of the test JVM. Killing a worker interrupts its thread, which closes its channel.
 */
final class ThreadWorkerLauncher implements WorkerLauncher {

	private int launched = 0;

	@Override
	public WorkerProcess launch(Path socketPath) {
		var exitCode = new CompletableFuture<Integer>();
		var worker = new Worker(socketPath);
		var thread = new Thread(() -> exitCode.complete(worker.run()), "test-worker-" + launched++);
		thread.setDaemon(true);
		thread.start();

		return new WorkerProcess() {
			@Override
			public CompletableFuture<Integer> onExit() {
				return exitCode;
			}

			@Override
			public void kill() {
				thread.interrupt();
			}
		};
	}

	public int launched() {
		return launched;
	}
}
