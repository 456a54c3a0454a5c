package dev.paratest.worker;

/**
 * A compiled test program. Workers look it up through {@link ProgramLoader}, either by entry class name or as
 * the single {@code META-INF/services/dev.paratest.worker.TestProgram} provider of the program.
 */
public interface TestProgram {
	ProgramSession start(ProgramFlags flags, ProgramOutput output) throws Exception;
}
