package dev.paratest.runner;

import java.nio.file.Path;
import java.util.List;

/**
 * A module that may contain tests, with the exposed names that could be tests.
 */
public record TestModule(String moduleName, Path path, List<String> possiblyTests) {
	public TestModule {
		possiblyTests = List.copyOf(possiblyTests);
	}
}
