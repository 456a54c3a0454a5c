package dev.paratest.runner;

/**
 * A test file that cannot be turned into a test module, or no test files at all.
 * The message is meant for the user as is.
 */
public class DiscoveryException extends Exception {
	public DiscoveryException(String message) {
		super(message);
	}
}
