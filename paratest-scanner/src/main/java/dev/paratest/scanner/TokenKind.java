package dev.paratest.scanner;

public enum TokenKind {
	WORD,
	OPEN_PAREN,
	CLOSE_PAREN,
	COMMA,
	EQUALS,
	DOTS,
	;
}
