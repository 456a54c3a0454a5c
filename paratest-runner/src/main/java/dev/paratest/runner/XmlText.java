package dev.paratest.runner;

/**
 * Makes arbitrary text safe for XML 1.0 documents.
 */
public final class XmlText {
	private XmlText() {}

	/**
	 * Replaces every character XML 1.0 does not allow with an escape of its code point, so that the start of a
	 * terminal escape sequence becomes {@code \\u{001b}}.
	 */
	public static String replaceInvalidChars(String text) {
		if(text == null) {
			return null;
		}

		var sb = new StringBuilder(text.length());
		text.codePoints().forEach(ch -> {
			if(isValid(ch)) {
				sb.appendCodePoint(ch);
			}
			else {
				var hex = Integer.toHexString(ch);
				sb.append("\\u{");
				sb.append("0".repeat(Math.max(0, 4 - hex.length())));
				sb.append(hex);
				sb.append('}');
			}
		});
		return sb.toString();
	}

	static boolean isValid(int ch) {
		return ch == 0x9 || ch == 0xA || ch == 0xD ||
			(ch >= 0x20 && ch <= 0xD7FF) ||
			(ch >= 0xE000 && ch <= 0xFFFD) ||
			(ch >= 0x10000 && ch <= 0x10FFFF);
	}
}
