package dev.paratest.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Messages produced by a compiled test program and relayed by its worker to the supervisor.
 * Result payloads are kept as JSON trees; their shape depends on the report format.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
	@JsonSubTypes.Type(value = WorkerMessage.Begin.class, name = "BEGIN"),
	@JsonSubTypes.Type(value = WorkerMessage.Results.class, name = "RESULTS"),
	@JsonSubTypes.Type(value = WorkerMessage.Finished.class, name = "FINISHED"),
	@JsonSubTypes.Type(value = WorkerMessage.Summary.class, name = "SUMMARY"),
	@JsonSubTypes.Type(value = WorkerMessage.Error.class, name = "ERROR"),
})
public sealed interface WorkerMessage {
	record Begin(int testCount, JsonNode message) implements WorkerMessage {}

	record Results(Map<Integer, JsonNode> results) implements WorkerMessage {}

	// results is null when the last batch was already sent as RESULTS.
	record Finished(Map<Integer, JsonNode> results) implements WorkerMessage {}

	record Summary(JsonNode message, int exitCode) implements WorkerMessage {}

	record Error(String message) implements WorkerMessage {}
}
