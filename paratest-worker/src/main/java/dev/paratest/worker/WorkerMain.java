package dev.paratest.worker;

import java.nio.file.Path;

public final class WorkerMain {
	private WorkerMain() {}

	public static void main(String[] args) {
		if(args.length != 1) {
			System.err.println("Usage: WorkerMain <socket path>");
			System.exit(1);
		}

		System.exit(new Worker(Path.of(args[0])).run());
	}
}
