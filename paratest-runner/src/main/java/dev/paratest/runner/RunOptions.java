package dev.paratest.runner;

import dev.paratest.protocol.ReportFormat;

/**
 * The settings of a run that workers and the report depend on.
 */
public record RunOptions(
	ReportFormat report,
	boolean color,
	int processes,
	long seed,
	int fuzz,
	boolean watch
) {
	public RunOptions {
		if(processes < 1) {
			throw new IllegalArgumentException("At least one process is required");
		}
	}
}
