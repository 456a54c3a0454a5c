package dev.paratest.runner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class XmlTextTests {

	@Test
	public void terminalEscapesAreSpelledOut() {
		Assertions.assertEquals("\\u{001b}[31mred\\u{001b}[39m", XmlText.replaceInvalidChars("\u001B[31mred\u001B[39m"));
	}

	@Test
	public void validTextIsUnchanged() {
		var text = "tab\there\nnewline\r åäö 🎉 <&>";
		Assertions.assertEquals(text, XmlText.replaceInvalidChars(text));
	}

	@Test
	public void otherInvalidCharacters() {
		Assertions.assertEquals("a\\u{0000}b\\u{fffe}", XmlText.replaceInvalidChars("a\u0000b\uFFFE"));
		Assertions.assertNull(XmlText.replaceInvalidChars(null));
	}

	@Test
	public void validity() {
		Assertions.assertTrue(XmlText.isValid(0x9));
		Assertions.assertTrue(XmlText.isValid(0x10FFFF));
		Assertions.assertFalse(XmlText.isValid(0x1F));
		Assertions.assertFalse(XmlText.isValid(0xD800));
	}
}
