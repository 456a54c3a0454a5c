package dev.paratest.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiles the test program with an external command.
 * <p>
 * The command is invoked as {@code <command> <manifest> <output>}, where the manifest is a
 * {@code test-modules.json} file listing every test module with its possible tests and the output is the jar
 * the command must produce. The program in the jar is looked up as a service.
 */
public final class CommandProgramCompiler implements ProgramCompiler {

	private static final Logger log = LoggerFactory.getLogger(CommandProgramCompiler.class);

	public CommandProgramCompiler(String command, Path generatedDir) {
		this.command = List.of(command.trim().split("\\s+"));
		this.generatedDir = generatedDir;
	}

	static final String MANIFEST_FILE = "test-modules.json";
	static final String OUTPUT_FILE = "paratest-program.jar";

	private final List<String> command;
	private final Path generatedDir;


	@Override
	public CompiledProgram compile(List<TestModule> modules) throws IOException, CommandFailureException, InterruptedException {
		Files.createDirectories(generatedDir);

		var manifest = generatedDir.resolve(MANIFEST_FILE).toAbsolutePath();
		var output = generatedDir.resolve(OUTPUT_FILE).toAbsolutePath();
		writeManifest(manifest, modules);

		var cmd = new ArrayList<>(command);
		cmd.add(manifest.toString());
		cmd.add(output.toString());

		log.debug("Compiling test program: {}", cmd);

		var pb = new ProcessBuilder();
		pb.command(cmd);

		pb.redirectInput(ProcessBuilder.Redirect.PIPE);
		pb.redirectOutput(ProcessBuilder.Redirect.PIPE);
		pb.redirectErrorStream(true);

		var process = pb.start();

		process.getOutputStream().close();
		String commandOutput = IOUtils.toString(process.getInputStream(), StandardCharsets.UTF_8);
		var exitCode = process.waitFor();

		if(exitCode != 0) {
			throw new CommandFailureException("Compilation failed with exit code " + exitCode, cmd, commandOutput);
		}

		if(!Files.exists(output)) {
			throw new CommandFailureException("Compiler did not produce " + output, cmd, commandOutput);
		}

		return new CompiledProgram(output.toString(), null);
	}

	static void writeManifest(Path manifest, List<TestModule> modules) throws IOException {
		var entries = new ArrayList<Map<String, Object>>();
		for(var module : modules) {
			var entry = new LinkedHashMap<String, Object>();
			entry.put("moduleName", module.moduleName());
			entry.put("path", module.path().toString());
			entry.put("possiblyTests", module.possiblyTests());
			entries.add(entry);
		}

		var mapper = new ObjectMapper();
		mapper.writerWithDefaultPrettyPrinter().writeValue(manifest.toFile(), Map.of("modules", entries));
	}
}
