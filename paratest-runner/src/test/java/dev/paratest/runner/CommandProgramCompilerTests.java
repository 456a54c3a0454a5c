package dev.paratest.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

public class CommandProgramCompilerTests {

	@TempDir
	Path generated;

	@Test
	public void manifestListsEveryModule() throws Throwable {
		var manifest = generated.resolve(CommandProgramCompiler.MANIFEST_FILE);
		CommandProgramCompiler.writeManifest(manifest, List.of(
			new TestModule("Main", Path.of("/p/tests/Main.elm"), List.of("suite")),
			new TestModule("Http.Helpers", Path.of("/p/tests/Http/Helpers.elm"), List.of())
		));

		var tree = new ObjectMapper().readTree(manifest.toFile());
		var modules = tree.get("modules");
		Assertions.assertEquals(2, modules.size());
		Assertions.assertEquals("Main", modules.get(0).get("moduleName").asText());
		Assertions.assertEquals("/p/tests/Main.elm", modules.get(0).get("path").asText());
		Assertions.assertEquals("suite", modules.get(0).get("possiblyTests").get(0).asText());
		Assertions.assertEquals(0, modules.get(1).get("possiblyTests").size());
	}

	@Test
	public void failingCommand() {
		var compiler = new CommandProgramCompiler("false", generated);

		var e = Assertions.assertThrows(CommandFailureException.class, () -> compiler.compile(List.of()));
		Assertions.assertEquals("Compilation failed with exit code 1", e.getMessage());
		Assertions.assertEquals(List.of(
			"false",
			generated.resolve(CommandProgramCompiler.MANIFEST_FILE).toAbsolutePath().toString(),
			generated.resolve(CommandProgramCompiler.OUTPUT_FILE).toAbsolutePath().toString()
		), e.getCommand());
	}

	@Test
	public void commandWithoutOutput() {
		var compiler = new CommandProgramCompiler("true", generated);

		var e = Assertions.assertThrows(CommandFailureException.class, () -> compiler.compile(List.of()));
		Assertions.assertTrue(e.getMessage().startsWith("Compiler did not produce"), e.getMessage());
		Assertions.assertEquals("true", e.getCommand().get(0));
	}

	@Test
	public void failureShowsCommandAndOutput() {
		var e = new CommandFailureException("Compilation failed", List.of("elmc", "m.json", "out.jar"), "line 1: syntax error");
		var nl = System.lineSeparator();

		Assertions.assertEquals("line 1: syntax error", e.getCommandOutput());
		Assertions.assertEquals(
			CommandFailureException.class.getName() + ": Compilation failed" + nl + "Command: elmc m.json out.jar" + nl + "Output:" + nl + "line 1: syntax error",
			e.toString()
		);
	}
}
