package dev.paratest.runner;

import java.io.IOException;
import java.util.List;

/**
 * Builds the single program that runs the tests of the given modules.
 */
public interface ProgramCompiler {
	CompiledProgram compile(List<TestModule> modules) throws IOException, CommandFailureException, InterruptedException;
}
