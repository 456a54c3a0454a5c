package dev.paratest.runner;

import java.io.IOException;
import java.nio.file.Path;

public interface WorkerLauncher {
	WorkerProcess launch(Path socketPath) throws IOException;
}
