package dev.paratest.runner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class ConsoleTextTests {

	@Test
	public void windowsGlyphs() {
		Assertions.assertEquals(
			"> Suite\n> test\n| a\n=== --- √",
			ConsoleText.windowsify("↓ Suite\n✗ test\n│ a\n═══ ▔▔▔ ✔")
		);
	}

	@Test
	public void onlyChangedOnWindows() {
		var text = "↓ Suite\n✗ test";

		Assertions.assertEquals(text, ConsoleText.makeSafe(text, false));
		Assertions.assertEquals("> Suite\n> test", ConsoleText.makeSafe(text, true));
	}
}
