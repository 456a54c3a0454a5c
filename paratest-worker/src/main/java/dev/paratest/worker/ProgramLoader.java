package dev.paratest.worker;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

public final class ProgramLoader {
	private ProgramLoader() {}

	private static final Logger log = LoggerFactory.getLogger(ProgramLoader.class);

	/**
	 * Loads a compiled program.
	 *
	 * @param dest A jar file or class directory holding the program. Blank to use the worker's own class path.
	 * @param entry The program class. When null or blank, the program must register exactly one
	 *              {@link TestProgram} service.
	 */
	public static @NotNull TestProgram load(@Nullable String dest, @Nullable String entry) throws ProgramLoadException {
		var loader = classLoaderFor(dest);

		if(entry != null && !entry.isBlank()) {
			return instantiate(loader, entry);
		}

		var providers = ServiceLoader.load(TestProgram.class, loader).stream().toList();
		if(providers.isEmpty()) {
			throw new ProgramLoadException("No test program found in " + describe(dest));
		}

		if(providers.size() > 1) {
			var names = providers.stream().map(p -> p.type().getName()).toList();
			throw new ProgramLoadException("Multiple potential test programs found in " + describe(dest) + ": " + names + " - there must be exactly one");
		}

		var provider = providers.get(0);
		log.debug("Loading test program {}", provider.type().getName());
		try {
			return provider.get();
		}
		catch(ServiceConfigurationError e) {
			throw new ProgramLoadException("Could not create test program " + provider.type().getName(), e);
		}
	}

	private static ClassLoader classLoaderFor(@Nullable String dest) throws ProgramLoadException {
		var parent = Thread.currentThread().getContextClassLoader();
		if(parent == null) {
			parent = ProgramLoader.class.getClassLoader();
		}

		if(dest == null || dest.isBlank()) {
			return parent;
		}

		var path = Path.of(dest).toAbsolutePath();
		if(!Files.exists(path)) {
			throw new ProgramLoadException("Compiled program not found: " + path);
		}

		URL url;
		try {
			url = path.toUri().toURL();
		}
		catch(MalformedURLException e) {
			throw new ProgramLoadException("Invalid program location: " + path, e);
		}

		log.debug("Loading compiled program from {}", url);
		return new URLClassLoader(new URL[] { url }, parent);
	}

	private static TestProgram instantiate(ClassLoader loader, String entry) throws ProgramLoadException {
		Class<?> entryClass;
		try {
			entryClass = Class.forName(entry, true, loader);
		}
		catch(ClassNotFoundException e) {
			throw new ProgramLoadException("Test program class not found: " + entry, e);
		}

		if(!TestProgram.class.isAssignableFrom(entryClass)) {
			throw new ProgramLoadException("Class " + entry + " does not implement " + TestProgram.class.getName());
		}

		try {
			return (TestProgram)entryClass.getConstructor().newInstance();
		}
		catch(ReflectiveOperationException e) {
			throw new ProgramLoadException("Could not create test program " + entry, e);
		}
	}

	private static String describe(@Nullable String dest) {
		return dest == null || dest.isBlank() ? "the class path" : dest;
	}
}
