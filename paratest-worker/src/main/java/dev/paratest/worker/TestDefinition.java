package dev.paratest.worker;

import java.util.List;

/**
 * A test as known to a {@link PartitionedTestProgram}.
 *
 * @param labels The describe labels leading to the test, outermost first, ending with the test's own name.
 */
public record TestDefinition(List<String> labels, Body body) {
	public TestDefinition {
		labels = List.copyOf(labels);
		if(labels.isEmpty()) {
			throw new IllegalArgumentException("A test needs at least one label");
		}
	}

	@FunctionalInterface
	public interface Body {
		TestOutcome run(ProgramFlags flags) throws Exception;
	}
}
