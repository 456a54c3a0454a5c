package dev.paratest.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import org.jetbrains.annotations.Nullable;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.ByteChannel;

/**
 * A framed JSON message channel over a byte channel such as a Unix domain socket.
 * One thread may receive while others send.
 */
public final class MessageChannel implements Closeable {
	public MessageChannel(ByteChannel channel) {
		this.channel = channel;
		reader = new FrameReader(channel);
		writer = new FrameWriter(channel);
	}

	private final ByteChannel channel;
	private final FrameReader reader;
	private final FrameWriter writer;


	/**
	 * @return The next message as a JSON object, or null when the other side has closed the channel.
	 */
	public @Nullable JsonNode receive() throws IOException, ProtocolException {
		var frame = reader.readFrame();
		if(frame == null) {
			return null;
		}

		return MessageCodec.parse(frame);
	}

	public void send(SupervisorMessage message) throws IOException {
		writer.writeFrame(MessageCodec.encode(message));
	}

	public void send(WorkerMessage message) throws IOException {
		writer.writeFrame(MessageCodec.encode(message));
	}

	public void send(JsonNode message) throws IOException {
		writer.writeFrame(MessageCodec.encode(message));
	}

	@Override
	public void close() throws IOException {
		channel.close();
	}
}
