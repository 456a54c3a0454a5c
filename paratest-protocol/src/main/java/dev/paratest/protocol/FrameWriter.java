package dev.paratest.protocol;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.WritableByteChannel;

/**
 * Writes LF-terminated frames. Safe to share between threads; frames are never interleaved.
 */
public final class FrameWriter {
	public FrameWriter(WritableByteChannel channel) {
		this.channel = channel;
	}

	private final WritableByteChannel channel;

	public synchronized void writeFrame(byte[] payload) throws IOException {
		for(byte b : payload) {
			if(b == '\n') {
				throw new IllegalArgumentException("Frame payload must not contain a line feed");
			}
		}

		var buffer = ByteBuffer.allocate(payload.length + 1);
		buffer.put(payload);
		buffer.put((byte)'\n');
		buffer.flip();

		while(buffer.hasRemaining()) {
			channel.write(buffer);
		}
	}
}
