package dev.paratest.protocol;

/**
 * A frame that could not be understood, or an error reported by the other side of the channel.
 */
public class ProtocolException extends Exception {
	public ProtocolException(String message) {
		super(message);
	}

	public ProtocolException(String message, Throwable cause) {
		super(message, cause);
	}
}
