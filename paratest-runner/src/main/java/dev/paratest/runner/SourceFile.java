package dev.paratest.runner;

import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * A test file together with the source root it belongs to and the module name that follows from its location.
 */
public record SourceFile(Path path, String moduleName, Path sourceRoot) {

	private static final Pattern UPPER_NAME = Pattern.compile("^\\p{Lu}[_\\d\\p{L}]*$");

	/**
	 * Finds the source root of a file and derives its module name from the path below that root.
	 * The module name is derived without reading the file, so that the compiler can report what is wrong with it.
	 *
	 * @param testsDir The tests directory, which counts as a source root even when not listed.
	 */
	public static SourceFile locate(Path path, List<Path> sourceRoots, Path testsDir) throws DiscoveryException {
		var file = path.toAbsolutePath().normalize();

		var matching = new ArrayList<Path>();
		for(var root : sourceRoots) {
			var normalizedRoot = root.toAbsolutePath().normalize();
			if(file.startsWith(normalizedRoot) && !file.equals(normalizedRoot) && !matching.contains(normalizedRoot)) {
				matching.add(normalizedRoot);
			}
		}

		if(matching.isEmpty()) {
			throw new DiscoveryException(missingSourceRootError(file));
		}

		if(matching.size() > 1) {
			throw new DiscoveryException(multipleSourceRootsError(file, matching, testsDir.toAbsolutePath().normalize()));
		}

		var sourceRoot = matching.get(0);
		var relative = sourceRoot.relativize(file);

		var parts = new ArrayList<String>();
		for(var part : relative) {
			parts.add(part.toString());
		}
		parts.set(parts.size() - 1, FilenameUtils.removeExtension(parts.get(parts.size() - 1)));

		var moduleName = String.join(".", parts);
		for(var part : parts) {
			if(!isUpperName(part)) {
				throw new DiscoveryException(badModuleNameError(file, sourceRoot, moduleName));
			}
		}

		return new SourceFile(file, moduleName, sourceRoot);
	}

	public static boolean isUpperName(String name) {
		return UPPER_NAME.matcher(name).matches();
	}

	private static String missingSourceRootError(Path file) {
		return """
			This file:

			%s

			…matches no source directory! Imports won't work then.

			Move it to the tests directory, or make sure it is covered by a --source-dir option."""
			.formatted(file);
	}

	private static String multipleSourceRootsError(Path file, List<Path> matching, Path testsDir) {
		var message = """
			This file:

			%s

			…matches more than one source directory:

			%s

			Change the --source-dir options so that no source directory contains another source directory!"""
			.formatted(file, matching.stream().map(Path::toString).collect(Collectors.joining("\n")));

		if(matching.contains(testsDir)) {
			message += "\n\nNote: The tests directory counts as a source directory too, even if it isn't passed as --source-dir!";
		}

		return message;
	}

	private static String badModuleNameError(Path file, Path sourceRoot, String moduleName) {
		return """
			This file:

			%s

			…located in this directory:

			%s

			…is problematic. Trying to construct a module name from the parts after the directory gives:

			%s

			…but module names need to look like for example:

			Main
			Http.Helpers

			Make sure that all parts start with an uppercase letter and don't contain any spaces or anything like that."""
			.formatted(file, sourceRoot, moduleName);
	}
}
