package dev.paratest.runner;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import dev.paratest.protocol.ProtocolException;
import dev.paratest.protocol.SocketPaths;
import dev.paratest.scanner.ScanException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

public final class TestRunner {

	private static final Logger log = LoggerFactory.getLogger(TestRunner.class);

	public static void main(String[] args) throws IOException, InterruptedException {
		var testArgs = new TestRunnerArgs();
		var commander = JCommander.newBuilder()
			.programName("paratest")
			.addObject(testArgs)
			.build();

		try {
			commander.parse(args);
		}
		catch(ParameterException e) {
			System.err.println(e.getMessage());
			commander.usage();
			System.exit(1);
		}

		if(testArgs.help) {
			commander.usage();
			return;
		}

		var runner = new TestRunner(testArgs, new ProcessWorkerLauncher(List.of()), System.out, System.err);
		if(testArgs.watch) {
			runner.watch();
		}
		else {
			System.exit(runner.runOnce());
		}
	}

	TestRunner(TestRunnerArgs args, WorkerLauncher launcher, PrintStream out, PrintStream err) {
		this.args = args;
		this.launcher = launcher;

		long seed = args.seed != null ? args.seed : ThreadLocalRandom.current().nextLong(1000, 407_199_254_740_991L);
		var report = args.reportFormat();
		options = new RunOptions(report, !args.noColor, args.processes, seed, args.fuzz, args.watch);
		printer = new ReportPrinter(report, !args.noColor, SocketPaths.isWindows(), Versions.current(), out, err);
		discovery = new TestDiscovery(args.sourceDirs, args.testsDir);

		if(args.program != null || args.compiler == null) {
			compiler = new PrebuiltProgramCompiler(args.program, args.entry);
		}
		else {
			compiler = new CommandProgramCompiler(args.compiler, args.generatedDir);
		}
	}

	private final TestRunnerArgs args;
	private final WorkerLauncher launcher;
	private final RunOptions options;
	private final ReportPrinter printer;
	private final TestDiscovery discovery;
	private final ProgramCompiler compiler;
	private int runs = 0;


	/**
	 * Discovers, compiles and runs the tests once. Problems are reported to the user.
	 * @return The exit code of the run.
	 */
	public int runOnce() {
		++runs;
		try {
			var files = TestFiles.resolve(args.testFiles, args.testsDir);
			if(files.isEmpty()) {
				throw new DiscoveryException(TestFiles.noFilesFoundError(args.testFiles, args.testsDir));
			}

			var modules = discovery.findTests(files);
			var program = compiler.compile(modules);

			var supervisor = new Supervisor(options, program, files, launcher, printer);
			return supervisor.run(SocketPaths.forRun(ProcessHandle.current().pid(), runs));
		}
		catch(CommandFailureException e) {
			log.debug("Compilation failed", e);
			printer.printError(e.getMessage() + ": " + String.join(" ", e.getCommand()));
			printer.printError(e.getCommandOutput());
			return 1;
		}
		catch(DiscoveryException | ScanException | ProtocolException | IOException e) {
			log.debug("Test run failed", e);
			printer.printError(e.getMessage());
			return 1;
		}
		catch(InterruptedException e) {
			Thread.currentThread().interrupt();
			return 1;
		}
		finally {
			printer.flush();
		}
	}

	public void watch() throws IOException, InterruptedException {
		var roots = new ArrayList<Path>(discovery.sourceRoots());
		try(var loop = new WatchLoop(roots, List.of(args.generatedDir), printer, this::runOnce)) {
			loop.run();
		}
	}
}
