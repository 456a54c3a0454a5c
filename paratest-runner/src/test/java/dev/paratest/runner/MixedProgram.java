package dev.paratest.runner;

import dev.paratest.worker.PartitionedTestProgram;
import dev.paratest.worker.ProgramFlags;
import dev.paratest.worker.TestDefinition;
import dev.paratest.worker.TestOutcome;

import java.util.List;

public class MixedProgram extends PartitionedTestProgram {
	@Override
	protected List<TestDefinition> tests(ProgramFlags flags) {
		return List.of(
			new TestDefinition(List.of("Lists", "append"), f -> TestOutcome.pass()),
			new TestDefinition(List.of("Lists", "reverse"), f -> TestOutcome.fail("Expected [3,2,1]")),
			new TestDefinition(List.of("Lists", "sort"), f -> TestOutcome.pass())
		);
	}
}
