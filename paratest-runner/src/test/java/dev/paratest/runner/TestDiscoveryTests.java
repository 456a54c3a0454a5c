package dev.paratest.runner;

import dev.paratest.scanner.ScanException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class TestDiscoveryTests {

	@TempDir
	Path project;

	private Path write(String relative, String content) throws Exception {
		var path = project.resolve(relative);
		Files.createDirectories(path.getParent());
		Files.writeString(path, content);
		return path;
	}

	@Test
	public void findsPossibleTestsInFileOrder() throws Throwable {
		var tests = project.resolve("tests");
		var files = new ArrayList<Path>();
		files.add(write("tests/Listed.elm", "module Listed exposing (suite, Model, helper)\n"));
		files.add(write("tests/Everything.elm", "module Everything exposing (..)\n\nimport Test\n\nsuite =\n    Test.todo \"x\"\n\nadd a b =\n    a + b\n"));
		for(int i = 0; i < 20; ++i) {
			files.add(write("tests/Many/M" + i + ".elm", "module Many.M" + i + " exposing (test" + i + ")\n"));
		}

		var discovery = new TestDiscovery(List.of(), tests);
		var modules = discovery.findTests(files);

		Assertions.assertEquals(22, modules.size());
		Assertions.assertEquals(new TestModule("Listed", files.get(0), List.of("suite", "helper")), modules.get(0));
		Assertions.assertEquals(List.of("suite"), modules.get(1).possiblyTests());
		for(int i = 0; i < 20; ++i) {
			Assertions.assertEquals("Many.M" + i, modules.get(i + 2).moduleName());
			Assertions.assertEquals(List.of("test" + i), modules.get(i + 2).possiblyTests());
		}
	}

	@Test
	public void testsDirectoryIsAlwaysARoot() {
		var discovery = new TestDiscovery(List.of(project.resolve("src")), project.resolve("tests"));

		Assertions.assertEquals(List.of(project.resolve("tests"), project.resolve("src")), discovery.sourceRoots());
	}

	@Test
	public void effectModulesStopDiscovery() throws Throwable {
		var file = write("tests/Effect.elm", "effect module Effect where { command = MyCmd } exposing (..)\n");
		var discovery = new TestDiscovery(List.of(), project.resolve("tests"));

		Assertions.assertThrows(ScanException.class, () -> discovery.findTests(List.of(file)));
	}

	@Test
	public void noFiles() throws Throwable {
		Assertions.assertEquals(List.of(), new TestDiscovery(List.of(), project.resolve("tests")).findTests(List.of()));
	}
}
