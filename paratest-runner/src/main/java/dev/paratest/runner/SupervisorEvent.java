package dev.paratest.runner;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Everything the supervisor loop reacts to. Events are posted by the accept thread, the per-connection
 * reader threads and the process exit callbacks.
 */
sealed interface SupervisorEvent {
	record Connected(WorkerConnection connection) implements SupervisorEvent {}
	record Received(WorkerConnection connection, JsonNode message) implements SupervisorEvent {}
	record Disconnected(WorkerConnection connection) implements SupervisorEvent {}
	record ReadFailed(WorkerConnection connection, Exception error) implements SupervisorEvent {}
	record AcceptFailed(Exception error) implements SupervisorEvent {}
	record WorkerExited(WorkerProcess worker, int exitCode) implements SupervisorEvent {}
}
