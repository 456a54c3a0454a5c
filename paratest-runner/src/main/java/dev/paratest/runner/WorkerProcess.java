package dev.paratest.runner;

import java.util.concurrent.CompletableFuture;

/**
 * A running worker as seen by the supervisor.
 */
public interface WorkerProcess {
	/**
	 * @return Completes with the exit code of the worker once it has stopped.
	 */
	CompletableFuture<Integer> onExit();

	void kill();
}
