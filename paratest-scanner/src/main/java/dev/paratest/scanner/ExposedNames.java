package dev.paratest.scanner;

import java.util.List;

/**
 * The names a module header exposes that may denote tests.
 * <p>
 * {@link All} stands for {@code exposing (..)}: every top-level lowercase binding of the
 * module is a candidate. {@link Listed} holds an explicit list, which may be empty.
 */
public sealed interface ExposedNames {
	ExposedNames ALL = new All();

	record All() implements ExposedNames {}

	record Listed(List<String> names) implements ExposedNames {
		public Listed {
			names = List.copyOf(names);
		}
	}

	static ExposedNames none() {
		return new Listed(List.of());
	}
}
