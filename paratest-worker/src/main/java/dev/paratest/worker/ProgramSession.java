package dev.paratest.worker;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A running test program. Receives every message the worker gets after {@code LOAD},
 * starting with {@code {"type":"TEST","index":<offset>}}.
 */
public interface ProgramSession {
	void receive(JsonNode message) throws Exception;
}
