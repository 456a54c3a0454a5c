package dev.paratest.scanner;

public record Token(TokenKind kind, String text) {
	public static Token word(String text) {
		return new Token(TokenKind.WORD, text);
	}

	public static Token punctuation(TokenKind kind) {
		return switch(kind) {
			case OPEN_PAREN -> new Token(kind, "(");
			case CLOSE_PAREN -> new Token(kind, ")");
			case COMMA -> new Token(kind, ",");
			case EQUALS -> new Token(kind, "=");
			case DOTS -> new Token(kind, "..");
			case WORD -> throw new IllegalArgumentException("Words carry their own text");
		};
	}
}
