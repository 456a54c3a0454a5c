package dev.paratest.worker;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ProgramLoaderTests {

	@Test
	public void loadsTheEntryClass() throws Throwable {
		Assertions.assertInstanceOf(SampleTestProgram.class, ProgramLoader.load("", SampleTestProgram.class.getName()));
	}

	@Test
	public void findsTheSingleRegisteredProgram() throws Throwable {
		Assertions.assertInstanceOf(SampleTestProgram.class, ProgramLoader.load(null, null));
	}

	@Test
	public void missingEntryClass() {
		var e = Assertions.assertThrows(ProgramLoadException.class, () -> ProgramLoader.load("", "dev.paratest.worker.Missing"));

		Assertions.assertTrue(e.getMessage().contains("dev.paratest.worker.Missing"));
	}

	@Test
	public void entryClassMustBeATestProgram() {
		Assertions.assertThrows(ProgramLoadException.class, () -> ProgramLoader.load("", String.class.getName()));
	}

	@Test
	public void missingProgramLocation() {
		Assertions.assertThrows(ProgramLoadException.class, () -> ProgramLoader.load("does/not/exist.jar", null));
	}
}
