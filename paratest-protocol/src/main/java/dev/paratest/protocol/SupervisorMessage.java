package dev.paratest.protocol;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Messages that travel towards a compiled test program.
 * {@code LOAD} and the {@code SUMMARY} request are sent by the supervisor; {@code TEST} is sent by the worker
 * once the program is loaded.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
	@JsonSubTypes.Type(value = SupervisorMessage.Load.class, name = "LOAD"),
	@JsonSubTypes.Type(value = SupervisorMessage.Test.class, name = "TEST"),
	@JsonSubTypes.Type(value = SupervisorMessage.Summary.class, name = "SUMMARY"),
})
public sealed interface SupervisorMessage {

	/**
	 * Asks a worker to load the compiled program and start its partition.
	 *
	 * @param dest Location of the compiled program (a jar or class directory), empty for the worker's own class path.
	 * @param entry Entry class of the program, or null to look it up as a service.
	 * @param index The partition offset of this worker.
	 * @param report Wire name of the report format.
	 */
	record Load(
		String dest,
		String entry,
		int fuzz,
		long seed,
		int processes,
		int index,
		String report,
		List<String> paths
	) implements SupervisorMessage {}

	record Test(int index) implements SupervisorMessage {}

	record Summary(double duration, int failures, List<JsonNode> todos) implements SupervisorMessage {}
}
