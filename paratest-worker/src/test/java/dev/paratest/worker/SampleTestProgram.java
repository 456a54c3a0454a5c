package dev.paratest.worker;

import java.util.List;

public class SampleTestProgram extends PartitionedTestProgram {
	@Override
	protected List<TestDefinition> tests(ProgramFlags flags) {
		return List.of(
			new TestDefinition(List.of("Arithmetic", "addition"), f -> TestOutcome.pass()),
			new TestDefinition(List.of("Arithmetic", "subtraction"), f -> TestOutcome.pass()),
			new TestDefinition(List.of("Strings", "reverse"), f -> TestOutcome.fail("Expected \"cba\" but got \"abc\"")),
			new TestDefinition(List.of("Strings", "unicode"), f -> TestOutcome.todo("handle combining characters")),
			new TestDefinition(List.of("Throws"), f -> {
				throw new IllegalStateException("boom");
			})
		);
	}
}
