package dev.paratest.protocol;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;

public class ReportFormatTests {

	@Test
	public void wireNames() {
		Assertions.assertEquals("console-color", ReportFormat.CONSOLE.wireName(true));
		Assertions.assertEquals("console-monochrome", ReportFormat.CONSOLE.wireName(false));
		Assertions.assertEquals("json", ReportFormat.JSON.wireName(true));
		Assertions.assertEquals("junit", ReportFormat.JUNIT.wireName(false));

		for(var format : ReportFormat.values()) {
			Assertions.assertEquals(format, ReportFormat.fromWireName(format.wireName(false)));
		}
	}

	@Test
	public void machineReadableFormats() {
		Assertions.assertFalse(ReportFormat.CONSOLE.isMachineReadable());
		Assertions.assertTrue(ReportFormat.JSON.isMachineReadable());
		Assertions.assertTrue(ReportFormat.JUNIT.isMachineReadable());
	}

	@Test
	public void parseCommandLineNames() {
		Assertions.assertEquals(ReportFormat.JUNIT, ReportFormat.parse("JUnit"));
		Assertions.assertThrows(IllegalArgumentException.class, () -> ReportFormat.parse("tap"));
	}

	@Test
	public void socketPathsPerPlatform() throws Throwable {
		var tempDir = Files.createTempDirectory("paratest-sockets");
		try {
			var stale = tempDir.resolve("paratest-123.sock");
			Files.createFile(stale);

			Assertions.assertEquals(stale, SocketPaths.forRun(123, 5, false, tempDir));
			Assertions.assertFalse(Files.exists(stale));

			Assertions.assertEquals(tempDir.resolve("paratest-123-5.sock"), SocketPaths.forRun(123, 5, true, tempDir));
			Assertions.assertNotEquals(SocketPaths.forRun(123, 5, true, tempDir), SocketPaths.forRun(123, 6, true, tempDir));
		}
		finally {
			Files.deleteIfExists(tempDir);
		}
	}
}
