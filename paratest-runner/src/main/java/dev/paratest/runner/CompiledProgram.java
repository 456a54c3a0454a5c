package dev.paratest.runner;

import org.jetbrains.annotations.Nullable;

/**
 * Where workers find the compiled test program.
 *
 * @param dest A jar file or class directory, or an empty string for the worker's own class path.
 * @param entry The program class, or null when the program registers itself as a service.
 */
public record CompiledProgram(String dest, @Nullable String entry) {
}
