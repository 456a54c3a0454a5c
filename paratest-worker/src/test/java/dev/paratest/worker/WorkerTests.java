package dev.paratest.worker;

import dev.paratest.protocol.MessageChannel;
import dev.paratest.protocol.MessageCodec;
import dev.paratest.protocol.SupervisorMessage;
import dev.paratest.protocol.WorkerMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ServerSocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

public class WorkerTests {

	private Path socketPath;
	private ServerSocketChannel server;

	@BeforeEach
	public void listen() throws Exception {
		socketPath = Files.createTempDirectory("paratest-worker").resolve("w.sock");
		server = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
		server.bind(UnixDomainSocketAddress.of(socketPath));
	}

	@AfterEach
	public void close() throws Exception {
		server.close();
		Files.deleteIfExists(socketPath);
		Files.deleteIfExists(socketPath.getParent());
	}

	private CompletableFuture<Integer> startWorker(Worker worker) {
		var exitCode = new CompletableFuture<Integer>();
		var thread = new Thread(() -> exitCode.complete(worker.run()), "worker");
		thread.setDaemon(true);
		thread.start();
		return exitCode;
	}

	@Test
	public void relaysBetweenSupervisorAndProgram() throws Throwable {
		var worker = new Worker(socketPath);
		var exitCode = startWorker(worker);

		try(var channel = new MessageChannel(server.accept())) {
			channel.send(new SupervisorMessage.Load("", SampleTestProgram.class.getName(), 100, 7L, 2, 1, "json", List.of()));

			var received = new ArrayList<WorkerMessage>();
			while(true) {
				var message = MessageCodec.decodeWorkerMessage(channel.receive());
				received.add(message);
				if(message instanceof WorkerMessage.Finished) break;
			}

			Assertions.assertInstanceOf(WorkerMessage.Begin.class, received.get(0));
			Assertions.assertEquals(4, received.size());
			Assertions.assertEquals(Worker.State.RUNNING, worker.state());

			var indices = new ArrayList<Integer>();
			for(var message : received.subList(1, 3)) {
				indices.addAll(((WorkerMessage.Results)message).results().keySet());
			}
			Assertions.assertEquals(List.of(1, 3), indices);

			channel.send(new SupervisorMessage.Summary(5.0, 1, List.of()));
			var summary = MessageCodec.decodeWorkerMessage(channel.receive());
			Assertions.assertEquals(1, Assertions.assertInstanceOf(WorkerMessage.Summary.class, summary).exitCode());
		}

		Assertions.assertEquals(0, exitCode.get(10, TimeUnit.SECONDS));
		Assertions.assertEquals(Worker.State.CLOSED, worker.state());
	}

	@Test
	public void messageBeforeLoadEndsTheWorker() throws Throwable {
		var exitCode = startWorker(new Worker(socketPath));

		try(var channel = new MessageChannel(server.accept())) {
			channel.send(new SupervisorMessage.Summary(5.0, 0, List.of()));
			Assertions.assertEquals(1, exitCode.get(10, TimeUnit.SECONDS));
		}
	}

	@Test
	public void unloadableProgramEndsTheWorker() throws Throwable {
		var exitCode = startWorker(new Worker(socketPath));

		try(var channel = new MessageChannel(server.accept())) {
			channel.send(new SupervisorMessage.Load("", "dev.paratest.worker.Missing", 100, 7L, 1, 0, "json", List.of()));
			Assertions.assertEquals(1, exitCode.get(10, TimeUnit.SECONDS));
		}
	}

	@Test
	public void interruptedWorkerStops() throws Throwable {
		var worker = new Worker(socketPath);
		var exitCode = new CompletableFuture<Integer>();
		var thread = new Thread(() -> exitCode.complete(worker.run()), "worker");
		thread.setDaemon(true);
		thread.start();

		try(var channel = new MessageChannel(server.accept())) {
			thread.interrupt();

			Assertions.assertEquals(1, exitCode.get(10, TimeUnit.SECONDS));
			Assertions.assertEquals(Worker.State.CLOSED, worker.state());
			Assertions.assertNull(channel.receive());
		}
	}

	@Test
	public void missingSupervisorEndsTheWorker() throws Throwable {
		var worker = new Worker(socketPath.resolveSibling("nobody.sock"));

		Assertions.assertEquals(1, worker.run());
	}
}
