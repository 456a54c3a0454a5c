package dev.paratest.worker;

import com.fasterxml.jackson.databind.JsonNode;
import dev.paratest.protocol.MessageChannel;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.SupervisorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;

/**
 * Connects to the supervisor, loads the compiled program it is told to, and relays messages both ways.
 * A worker serves a single connection and never reconnects.
 */
public final class Worker {

	private static final Logger log = LoggerFactory.getLogger(Worker.class);

	public Worker(Path socketPath) {
		this.socketPath = socketPath;
	}

	private final Path socketPath;
	private volatile State state = State.CONNECTING;


	public State state() {
		return state;
	}

	/**
	 * Serves the connection until the supervisor closes it.
	 * @return The exit code of the worker: 0 after a clean close, 1 after any error.
	 */
	public int run() {
		try(var channel = new MessageChannel(SocketChannel.open(UnixDomainSocketAddress.of(socketPath)))) {
			state = State.AWAITING_LOAD;
			serve(channel);
			return 0;
		}
		catch(AsynchronousCloseException e) {
			// Killed by the supervisor.
			log.debug("Connection to supervisor at {} closed during a read", socketPath, e);
			return 1;
		}
		catch(IOException e) {
			log.error("Connection to supervisor at {} failed", socketPath, e);
			return 1;
		}
		catch(ProtocolException | ProgramLoadException e) {
			log.error(e.getMessage(), e);
			return 1;
		}
		catch(Exception e) {
			log.error("Test program failed", e);
			return 1;
		}
		finally {
			state = State.CLOSED;
		}
	}

	private void serve(MessageChannel channel) throws Exception {
		ProgramSession session = null;
		while(true) {
			JsonNode message = channel.receive();
			if(message == null) {
				log.debug("Supervisor closed the connection");
				return;
			}

			if(session != null) {
				session.receive(message);
				continue;
			}

			if(!(MessageCodec.decodeSupervisorMessage(message) instanceof SupervisorMessage.Load load)) {
				throw new ProtocolException("Worker received a message before LOAD: " + message);
			}

			var program = ProgramLoader.load(load.dest(), load.entry());
			var flags = new ProgramFlags(load.seed(), load.fuzz(), load.report(), load.processes(), load.index(), load.paths());
			session = program.start(flags, channel::send);
			state = State.RUNNING;

			session.receive(MessageCodec.toTree(new SupervisorMessage.Test(load.index())));
		}
	}

	public enum State {
		CONNECTING,
		AWAITING_LOAD,
		RUNNING,
		CLOSED,
	}
}
