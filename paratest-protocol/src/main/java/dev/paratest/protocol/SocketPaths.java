package dev.paratest.protocol;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Names the socket a supervisor listens on.
 * <p>
 * Unix domain socket files can be reused once deleted, so the name only depends on the process id.
 * On Windows a socket name may stay unusable for a while after a run, so every run gets its own.
 */
public final class SocketPaths {
	private SocketPaths() {}

	public static boolean isWindows() {
		return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
	}

	public static Path forRun(long pid, int run) throws IOException {
		return forRun(pid, run, isWindows(), Path.of(System.getProperty("java.io.tmpdir")));
	}

	static Path forRun(long pid, int run, boolean windows, Path tempDir) throws IOException {
		if(windows) {
			return tempDir.resolve("paratest-" + pid + "-" + run + ".sock");
		}

		var path = tempDir.resolve("paratest-" + pid + ".sock");
		Files.deleteIfExists(path);
		return path;
	}
}
