package dev.paratest.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jetbrains.annotations.NotNull;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Converts between frame payloads and messages. Payloads are compact JSON objects.
 */
public final class MessageCodec {
	private MessageCodec() {}

	private static final ObjectMapper mapper = new ObjectMapper()
		.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
		.configure(SerializationFeature.INDENT_OUTPUT, false)
		.setSerializationInclusion(JsonInclude.Include.NON_NULL);

	public static ObjectMapper mapper() {
		return mapper;
	}

	public static byte[] encode(@NotNull SupervisorMessage message) throws JsonProcessingException {
		return mapper.writerFor(SupervisorMessage.class).writeValueAsBytes(message);
	}

	public static byte[] encode(@NotNull WorkerMessage message) throws JsonProcessingException {
		return mapper.writerFor(WorkerMessage.class).writeValueAsBytes(message);
	}

	public static byte[] encode(@NotNull JsonNode message) throws JsonProcessingException {
		return mapper.writeValueAsBytes(message);
	}

	public static @NotNull JsonNode toTree(@NotNull SupervisorMessage message) throws IOException {
		return mapper.readTree(encode(message));
	}

	public static @NotNull JsonNode toTree(@NotNull WorkerMessage message) throws IOException {
		return mapper.readTree(encode(message));
	}

	public static @NotNull JsonNode parse(byte[] frame) throws ProtocolException {
		JsonNode node;
		try {
			node = mapper.readTree(frame);
		}
		catch(IOException e) {
			throw new ProtocolException("Malformed message: " + new String(frame, StandardCharsets.UTF_8), e);
		}

		if(node == null || !node.isObject()) {
			throw new ProtocolException("Expected a JSON object: " + new String(frame, StandardCharsets.UTF_8));
		}

		return node;
	}

	public static @NotNull SupervisorMessage decodeSupervisorMessage(@NotNull JsonNode node) throws ProtocolException {
		return decode(node, SupervisorMessage.class);
	}

	public static @NotNull WorkerMessage decodeWorkerMessage(@NotNull JsonNode node) throws ProtocolException {
		return decode(node, WorkerMessage.class);
	}

	public static String typeOf(@NotNull JsonNode node) {
		return node.path("type").asText("");
	}

	private static <T> T decode(JsonNode node, Class<T> messageClass) throws ProtocolException {
		try {
			return mapper.treeToValue(node, messageClass);
		}
		catch(JsonProcessingException | IllegalArgumentException e) {
			throw new ProtocolException("Unexpected message of type \"" + typeOf(node) + "\": " + node, e);
		}
	}
}
