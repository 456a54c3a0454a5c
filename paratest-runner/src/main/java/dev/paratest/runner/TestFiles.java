package dev.paratest.runner;

import org.apache.commons.io.FilenameUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Resolves the test file arguments into the list of test files to run.
 */
public final class TestFiles {
	private TestFiles() {}

	static final Set<String> IGNORED_DIRECTORIES = Set.of("elm-stuff", "node_modules");

	/**
	 * Directories are searched recursively for {@code .elm} files, other existing paths are used as is and
	 * missing paths are skipped. Without arguments the tests directory is searched.
	 */
	public static List<Path> resolve(List<Path> args, Path testsDir) throws IOException {
		var inputs = args.isEmpty() ? List.of(testsDir) : args;

		var files = new LinkedHashSet<Path>();
		for(var input : inputs) {
			var path = input.toAbsolutePath().normalize();
			if(Files.isDirectory(path)) {
				findSourceFiles(path, files);
			}
			else if(Files.exists(path)) {
				files.add(path);
			}
		}
		return new ArrayList<>(files);
	}

	public static String noFilesFoundError(List<Path> args, Path testsDir) {
		if(!args.isEmpty()) {
			return """
				No files found matching:

				%s

				Are the above paths correct? Maybe try running paratest with no arguments?"""
				.formatted(args.stream().map(Path::toString).collect(Collectors.joining("\n")));
		}

		String problem;
		if(Files.isDirectory(testsDir)) {
			problem = "No .elm files found in the " + testsDir + " directory.";
		}
		else if(Files.exists(testsDir)) {
			problem = "Expected a directory but found something else at: " + testsDir.toAbsolutePath() + "\nCheck it out! Could you remove it?";
		}
		else {
			problem = "The " + testsDir + " directory does not exist.";
		}

		return problem + "\n\nIf your project has tests in a different directory, try calling paratest with --tests-dir or with the test files as arguments.";
	}

	private static void findSourceFiles(Path dir, Set<Path> files) throws IOException {
		var entries = new ArrayList<Path>();
		try(var dirStream = Files.list(dir)) {
			var it = dirStream.iterator();
			while(it.hasNext()) {
				entries.add(it.next());
			}
		}
		entries.sort(null);

		for(var p : entries) {
			var name = p.getFileName().toString();
			if(Files.isDirectory(p)) {
				if(!IGNORED_DIRECTORIES.contains(name)) {
					findSourceFiles(p, files);
				}
			}
			else if(FilenameUtils.isExtension(name, "elm")) {
				files.add(p);
			}
		}
	}
}
