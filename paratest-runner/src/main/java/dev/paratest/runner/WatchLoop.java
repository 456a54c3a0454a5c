package dev.paratest.runner;

import io.methvin.watcher.DirectoryChangeEvent;
import io.methvin.watcher.DirectoryWatcher;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.function.IntSupplier;

/**
 * Runs the tests, then runs them again after every batch of file changes.
 * <p>
 * A run is never interrupted. Changes that happen during a run are queued and start the next run as soon as the
 * current one is over.
 */
final class WatchLoop implements Closeable {

	private static final Logger log = LoggerFactory.getLogger(WatchLoop.class);

	static final long BATCH_DELAY_MILLIS = 200;

	WatchLoop(List<Path> roots, List<Path> ignoredDirs, ReportPrinter printer, IntSupplier runTests) {
		this.roots = roots.stream().map(p -> p.toAbsolutePath().normalize()).toList();
		this.ignoredDirs = ignoredDirs.stream().map(p -> p.toAbsolutePath().normalize()).toList();
		this.printer = printer;
		this.runTests = runTests;
	}

	private final List<Path> roots;
	private final List<Path> ignoredDirs;
	private final ReportPrinter printer;
	private final IntSupplier runTests;
	private final BlockingQueue<FileEvent> queue = new LinkedBlockingQueue<>();
	private volatile DirectoryWatcher watcher;


	/**
	 * Watches until the thread is interrupted.
	 */
	public void run() throws IOException, InterruptedException {
		printer.clearConsole();
		printer.info("Running in watch mode");

		var watchedRoots = roots.stream().filter(Files::isDirectory).toList();
		if(watchedRoots.isEmpty()) {
			watchedRoots = List.of(Path.of("").toAbsolutePath());
		}

		log.debug("Watching {}", watchedRoots);
		watcher = DirectoryWatcher.builder()
			.paths(watchedRoots)
			.listener(this::onEvent)
			.build();
		watcher.watchAsync();

		runTests.getAsInt();

		while(true) {
			if(queue.isEmpty()) {
				printer.infoHighlighted("Watching for changes...");
			}

			var batch = new ArrayList<FileEvent>();
			batch.add(queue.take());

			// Let events that belong together arrive.
			Thread.sleep(BATCH_DELAY_MILLIS);
			queue.drainTo(batch);

			printer.clearConsole();
			printer.info(describe(batch));
			runTests.getAsInt();
		}
	}

	void onEvent(DirectoryChangeEvent event) {
		var path = event.path();
		if(path == null) {
			return;
		}

		var kind = kindOf(event.eventType(), event.isDirectory());
		if(kind != null) {
			enqueue(new FileEvent(kind, path));
		}
	}

	void enqueue(FileEvent event) {
		if(isIgnored(event.path())) {
			return;
		}

		log.debug("File event: {} on {}", event.kind(), event.path());
		queue.add(event);
	}

	/**
	 * @return null for changes that never require a run, such as the modification time of a directory.
	 */
	static FileEvent.@Nullable Kind kindOf(DirectoryChangeEvent.EventType eventType, boolean isDirectory) {
		return switch(eventType) {
			case CREATE -> FileEvent.Kind.ADDED;
			case DELETE -> FileEvent.Kind.REMOVED;
			case MODIFY -> isDirectory ? null : FileEvent.Kind.CHANGED;
			default -> FileEvent.Kind.CHANGED;
		};
	}

	boolean isIgnored(Path path) {
		var normalized = path.toAbsolutePath().normalize();
		for(var dir : ignoredDirs) {
			if(normalized.startsWith(dir)) {
				return true;
			}
		}

		for(var part : normalized) {
			if(TestFiles.IGNORED_DIRECTORIES.contains(part.toString())) {
				return true;
			}
		}
		return false;
	}

	static String describe(List<FileEvent> events) {
		final String suffix = ". Rebuilding!";

		var paths = new LinkedHashSet<Path>();
		var kinds = new TreeSet<String>();
		for(var event : events) {
			paths.add(event.path());
			kinds.add(event.kind().label());
		}

		if(paths.size() == 1) {
			var first = events.get(0);
			return first.path() + " " + first.kind().label() + suffix;
		}

		return paths.size() + " files " + String.join("/", kinds) + suffix;
	}

	@Override
	public void close() throws IOException {
		if(watcher != null) {
			watcher.close();
		}
	}

	record FileEvent(Kind kind, Path path) {
		enum Kind {
			ADDED("added"),
			CHANGED("changed"),
			REMOVED("removed"),
			;

			Kind(String label) {
				this.label = label;
			}

			private final String label;

			public String label() {
				return label;
			}
		}
	}
}
