package dev.paratest.worker;

import org.jetbrains.annotations.Nullable;

/**
 * The outcome of one test. Todo tests carry their description as the message.
 */
public record TestOutcome(Status status, @Nullable String message) {

	public static TestOutcome pass() {
		return new TestOutcome(Status.PASS, null);
	}

	public static TestOutcome fail(String message) {
		return new TestOutcome(Status.FAIL, message);
	}

	public static TestOutcome todo(String message) {
		return new TestOutcome(Status.TODO, message);
	}

	public enum Status {
		PASS("pass"),
		FAIL("fail"),
		TODO("todo"),
		;

		Status(String wireName) {
			this.wireName = wireName;
		}

		private final String wireName;

		public String wireName() {
			return wireName;
		}
	}
}
