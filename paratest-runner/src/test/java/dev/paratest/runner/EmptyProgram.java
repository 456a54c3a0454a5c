package dev.paratest.runner;

import dev.paratest.worker.PartitionedTestProgram;
import dev.paratest.worker.ProgramFlags;
import dev.paratest.worker.TestDefinition;

import java.util.List;

public class EmptyProgram extends PartitionedTestProgram {
	@Override
	protected List<TestDefinition> tests(ProgramFlags flags) {
		return List.of();
	}
}
