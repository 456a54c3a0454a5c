package dev.paratest.runner;

import dev.paratest.protocol.MessageChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * The supervisor's side of one worker connection.
 * The id is assigned in accept order and doubles as the partition offset offered to the worker.
 */
final class WorkerConnection {

	private static final Logger log = LoggerFactory.getLogger(WorkerConnection.class);

	WorkerConnection(int id, MessageChannel channel) {
		this.id = id;
		this.channel = channel;
	}

	private final int id;
	private final MessageChannel channel;
	private boolean finished = false;
	private volatile boolean closed = false;


	public int id() {
		return id;
	}

	public MessageChannel channel() {
		return channel;
	}

	/**
	 * @return true the first time only.
	 */
	public boolean markFinished() {
		if(finished) {
			return false;
		}

		finished = true;
		return true;
	}

	public boolean isClosed() {
		return closed;
	}

	public void close() {
		closed = true;
		try {
			channel.close();
		}
		catch(IOException e) {
			log.debug("Failed to close connection of worker {}", id, e);
		}
	}
}
