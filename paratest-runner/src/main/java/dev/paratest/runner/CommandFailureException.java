package dev.paratest.runner;

import java.util.List;

/**
 * The compiler command failed. Carries the command line and everything it printed.
 */
public class CommandFailureException extends Exception {
	public CommandFailureException(String message, List<String> command, String commandOutput) {
		super(message);
		this.command = List.copyOf(command);
		this.commandOutput = commandOutput;
	}

	private final List<String> command;
	private final String commandOutput;

	public List<String> getCommand() {
		return command;
	}

	public String getCommandOutput() {
		return commandOutput;
	}

	@Override
	public String toString() {
		var nl = System.lineSeparator();
		return super.toString() + nl + "Command: " + String.join(" ", command) + nl + "Output:" + nl + commandOutput;
	}
}
