package dev.paratest.worker;

import dev.paratest.protocol.WorkerMessage;

import java.io.IOException;

@FunctionalInterface
public interface ProgramOutput {
	void send(WorkerMessage message) throws IOException;
}
