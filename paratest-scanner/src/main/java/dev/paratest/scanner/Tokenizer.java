package dev.paratest.scanner;

/**
 * Turns a stream of code points into header tokens, one code point at a time.
 * <p>
 * Comments are dropped, block comments nest to any depth. String and char literals get no
 * special treatment.
 */
final class Tokenizer {

	Tokenizer(TokenSink sink) {
		this.sink = sink;
	}

	private final TokenSink sink;
	private final StringBuilder word = new StringBuilder();
	private State state = State.INITIAL;

	// Only meaningful in BLOCK_COMMENT.
	private int commentLevel = 0;
	private int previousChar = -1;


	public void accept(int ch) throws ScanException {
		switch(state) {
			case INITIAL -> initial(ch);

			case MAYBE_BLOCK_COMMENT_OPEN -> {
				if(ch == '-') {
					state = State.BLOCK_COMMENT;
					commentLevel = 1;
					previousChar = -1;
				}
				else {
					word.append('{');
					state = State.INITIAL;
					initial(ch);
				}
			}

			case BLOCK_COMMENT -> blockComment(ch);

			case MAYBE_LINE_COMMENT_OPEN -> {
				if(ch == '-') {
					state = State.LINE_COMMENT;
				}
				else {
					word.append('-');
					state = State.INITIAL;
					initial(ch);
				}
			}

			case LINE_COMMENT -> {
				if(ch == '\n') {
					state = State.INITIAL;
				}
			}

			case MAYBE_RANGE_DOTS -> {
				state = State.INITIAL;
				if(ch == '.') {
					flushWord();
					sink.accept(Token.punctuation(TokenKind.DOTS));
				}
				else {
					word.append('.');
					initial(ch);
				}
			}
		}
	}

	public void finish() throws ScanException {
		switch(state) {
			case MAYBE_BLOCK_COMMENT_OPEN -> word.append('{');
			case MAYBE_LINE_COMMENT_OPEN -> word.append('-');
			case MAYBE_RANGE_DOTS -> word.append('.');
			default -> {}
		}

		state = State.INITIAL;
		flushWord();
	}

	private void initial(int ch) throws ScanException {
		switch(ch) {
			case '(' -> punctuation(TokenKind.OPEN_PAREN);
			case ')' -> punctuation(TokenKind.CLOSE_PAREN);
			case ',' -> punctuation(TokenKind.COMMA);
			case '=' -> punctuation(TokenKind.EQUALS);

			case '{' -> {
				flushWord();
				state = State.MAYBE_BLOCK_COMMENT_OPEN;
			}

			case '-' -> {
				flushWord();
				state = State.MAYBE_LINE_COMMENT_OPEN;
			}

			// A lone dot stays inside the word: `Http.Helpers` is one word.
			case '.' -> state = State.MAYBE_RANGE_DOTS;

			default -> {
				if(Character.isWhitespace(ch)) {
					flushWord();
				}
				else {
					word.appendCodePoint(ch);
				}
			}
		}
	}

	private void blockComment(int ch) {
		if(previousChar == '{' && ch == '-') {
			++commentLevel;
			previousChar = -1;
		}
		else if(previousChar == '-' && ch == '}') {
			--commentLevel;
			previousChar = -1;
			if(commentLevel == 0) {
				state = State.INITIAL;
			}
		}
		else {
			previousChar = ch;
		}
	}

	private void punctuation(TokenKind kind) throws ScanException {
		flushWord();
		sink.accept(Token.punctuation(kind));
	}

	private void flushWord() throws ScanException {
		if(word.length() > 0) {
			var text = word.toString();
			word.setLength(0);
			sink.accept(Token.word(text));
		}
	}

	@FunctionalInterface
	interface TokenSink {
		void accept(Token token) throws ScanException;
	}

	private enum State {
		INITIAL,
		MAYBE_BLOCK_COMMENT_OPEN,
		BLOCK_COMMENT,
		MAYBE_LINE_COMMENT_OPEN,
		LINE_COMMENT,
		MAYBE_RANGE_DOTS,
	}
}
