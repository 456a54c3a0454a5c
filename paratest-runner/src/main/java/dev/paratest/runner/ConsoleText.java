package dev.paratest.runner;

import java.util.regex.Pattern;

/**
 * Replaces glyphs that Windows consoles commonly cannot show.
 */
public final class ConsoleText {
	private ConsoleText() {}

	private record Substitution(Pattern pattern, String replacement) {}

	private static final Substitution[] WINDOWS_SUBSTITUTIONS = {
		new Substitution(Pattern.compile("[↓✗►]"), ">"),
		new Substitution(Pattern.compile("[╵│╷╹┃╻]"), "|"),
		new Substitution(Pattern.compile("═"), "="),
		new Substitution(Pattern.compile("▔"), "-"),
		new Substitution(Pattern.compile("✔"), "√"),
	};

	public static String windowsify(String text) {
		var result = text;
		for(var substitution : WINDOWS_SUBSTITUTIONS) {
			result = substitution.pattern().matcher(result).replaceAll(substitution.replacement());
		}
		return result;
	}

	public static String makeSafe(String text, boolean windows) {
		return windows ? windowsify(text) : text;
	}
}
