package dev.paratest.runner;

import dev.paratest.scanner.ExposedNames;
import dev.paratest.scanner.ModuleScanner;
import dev.paratest.scanner.ScanException;
import dev.paratest.scanner.TopLevelDeclarations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Turns test files into test modules. Files are scanned concurrently, results keep the order of the files.
 */
public final class TestDiscovery {

	private static final Logger log = LoggerFactory.getLogger(TestDiscovery.class);

	/**
	 * @param sourceRoots Source directories of the project. The tests directory is added when missing.
	 */
	public TestDiscovery(List<Path> sourceRoots, Path testsDir) {
		var roots = new LinkedHashSet<Path>();
		roots.add(testsDir.toAbsolutePath().normalize());
		for(var root : sourceRoots) {
			roots.add(root.toAbsolutePath().normalize());
		}

		this.sourceRoots = List.copyOf(roots);
		this.testsDir = testsDir;
	}

	private final List<Path> sourceRoots;
	private final Path testsDir;


	public List<Path> sourceRoots() {
		return sourceRoots;
	}

	public List<TestModule> findTests(List<Path> files) throws DiscoveryException, ScanException, IOException, InterruptedException {
		var sourceFiles = new ArrayList<SourceFile>();
		for(var file : files) {
			sourceFiles.add(SourceFile.locate(file, sourceRoots, testsDir));
		}

		if(sourceFiles.isEmpty()) {
			return List.of();
		}

		int threads = Math.min(sourceFiles.size(), Runtime.getRuntime().availableProcessors());
		var executor = Executors.newFixedThreadPool(threads, r -> {
			var thread = new Thread(r, "paratest-scanner");
			thread.setDaemon(true);
			return thread;
		});

		try {
			var futures = new ArrayList<Future<TestModule>>();
			for(var sourceFile : sourceFiles) {
				futures.add(executor.submit(() -> scan(sourceFile)));
			}

			var modules = new ArrayList<TestModule>();
			for(var future : futures) {
				modules.add(await(future));
			}
			return modules;
		}
		finally {
			executor.shutdownNow();
		}
	}

	private static TestModule scan(SourceFile sourceFile) throws IOException, ScanException {
		var exposed = ModuleScanner.scan(sourceFile.path());

		List<String> possiblyTests;
		if(exposed instanceof ExposedNames.Listed listed) {
			possiblyTests = listed.names();
		}
		else {
			possiblyTests = TopLevelDeclarations.read(sourceFile.path());
		}

		log.debug("{}: possibly tests {}", sourceFile.moduleName(), possiblyTests);
		return new TestModule(sourceFile.moduleName(), sourceFile.path(), possiblyTests);
	}

	private static TestModule await(Future<TestModule> future) throws ScanException, IOException, InterruptedException {
		try {
			return future.get();
		}
		catch(ExecutionException e) {
			var cause = e.getCause();
			if(cause instanceof ScanException scanException) {
				throw scanException;
			}
			if(cause instanceof IOException ioException) {
				throw ioException;
			}
			if(cause instanceof RuntimeException runtimeException) {
				throw runtimeException;
			}
			throw new IllegalStateException(cause);
		}
	}
}
