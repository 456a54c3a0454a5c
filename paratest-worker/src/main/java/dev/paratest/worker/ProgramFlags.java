package dev.paratest.worker;

import dev.paratest.protocol.ReportFormat;

import java.util.List;

/**
 * Execution parameters a program is started with.
 *
 * @param report Wire name of the report format, such as {@code console-color}.
 * @param firstTestToRun The partition offset of this worker.
 */
public record ProgramFlags(
	long seed,
	int fuzz,
	String report,
	int processes,
	int firstTestToRun,
	List<String> paths
) {
	public ReportFormat reportFormat() {
		return ReportFormat.fromWireName(report);
	}

	public boolean color() {
		return ReportFormat.isColorWireName(report);
	}
}
