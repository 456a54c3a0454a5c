package dev.paratest.protocol;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;

/**
 * Splits a byte stream into LF-terminated frames.
 * Frames may arrive split across reads or several to a read.
 */
public final class FrameReader {

	private static final Logger log = LoggerFactory.getLogger(FrameReader.class);

	public FrameReader(ReadableByteChannel channel) {
		this.channel = channel;
		buffer.flip();
	}

	private final ReadableByteChannel channel;
	private final ByteBuffer buffer = ByteBuffer.allocate(8192);
	private final ByteArrayOutputStream frame = new ByteArrayOutputStream();


	/**
	 * Reads the next non-empty frame, without its terminator.
	 * @return The frame, or null at end of stream. A trailing partial frame is discarded.
	 */
	public byte @Nullable [] readFrame() throws IOException {
		while(true) {
			while(buffer.hasRemaining()) {
				byte b = buffer.get();
				if(b == '\n') {
					if(frame.size() == 0) {
						continue;
					}

					var result = frame.toByteArray();
					frame.reset();
					return result;
				}

				frame.write(b);
			}

			buffer.clear();
			int n = channel.read(buffer);
			buffer.flip();

			if(n < 0) {
				if(frame.size() > 0) {
					log.debug("Discarding partial frame of {} bytes at end of stream", frame.size());
					frame.reset();
				}
				return null;
			}
		}
	}
}
