package dev.paratest.worker;

public class ProgramLoadException extends Exception {
	public ProgramLoadException(String message) {
		super(message);
	}

	public ProgramLoadException(String message, Throwable cause) {
		super(message, cause);
	}
}
