package dev.paratest.runner;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import dev.paratest.protocol.ReportFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

class TestRunnerArgs {

	@Parameter(names = { "-h", "--help" }, help = true, description = "Show this help")
	public boolean help = false;

	@Parameter(description = "Test files or directories to run (default: the tests directory)")
	public List<Path> testFiles = new ArrayList<>();

	@Parameter(names = { "--processes" }, validateWith = AtLeastOne.class, description = "Number of worker processes")
	public int processes = Math.max(1, Runtime.getRuntime().availableProcessors());

	@Parameter(names = { "--seed" }, description = "Initial random seed for fuzz tests (default: random)")
	public Long seed = null;

	@Parameter(names = { "--fuzz" }, validateWith = AtLeastOne.class, description = "Number of runs of each fuzz test")
	public int fuzz = 100;

	@Parameter(names = { "--report" }, validateWith = ReportValidator.class, description = "Report format: console, json or junit")
	public String report = "console";

	@Parameter(names = { "--watch" }, description = "Run tests again whenever source files change")
	public boolean watch = false;

	@Parameter(names = { "--no-color" }, description = "Disable colored console output")
	public boolean noColor = false;

	@Parameter(names = { "--source-dir" }, description = "Source directory of the project (repeatable)")
	public List<Path> sourceDirs = new ArrayList<>();

	@Parameter(names = { "--tests-dir" }, description = "Directory holding the tests; always a source directory")
	public Path testsDir = Path.of("tests");

	@Parameter(names = { "--program" }, description = "Jar or class directory of a compiled test program")
	public String program = null;

	@Parameter(names = { "--entry" }, description = "Class of the compiled test program (default: the registered service)")
	public String entry = null;

	@Parameter(names = { "--compiler" }, description = "Command that compiles the test modules into a test program")
	public String compiler = null;

	@Parameter(names = { "--generated" }, description = "Directory for generated files")
	public Path generatedDir = Path.of("elm-stuff", "generated-code", "paratest");

	public ReportFormat reportFormat() {
		return ReportFormat.parse(report);
	}

	public static final class AtLeastOne implements IParameterValidator {
		@Override
		public void validate(String name, String value) throws ParameterException {
			int n;
			try {
				n = Integer.parseInt(value);
			}
			catch(NumberFormatException e) {
				throw new ParameterException("Parameter " + name + " should be a number (found " + value + ")");
			}

			if(n < 1) {
				throw new ParameterException("Parameter " + name + " should be at least 1 (found " + value + ")");
			}
		}
	}

	public static final class ReportValidator implements IParameterValidator {
		@Override
		public void validate(String name, String value) throws ParameterException {
			try {
				ReportFormat.parse(value);
			}
			catch(IllegalArgumentException e) {
				throw new ParameterException(e.getMessage());
			}
		}
	}
}
