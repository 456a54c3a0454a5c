package dev.paratest.runner;

import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * Uses a program that was compiled beforehand.
 */
public final class PrebuiltProgramCompiler implements ProgramCompiler {
	public PrebuiltProgramCompiler(@Nullable String dest, @Nullable String entry) {
		program = new CompiledProgram(dest == null ? "" : dest, entry);
	}

	private final CompiledProgram program;

	@Override
	public CompiledProgram compile(List<TestModule> modules) {
		return program;
	}
}
