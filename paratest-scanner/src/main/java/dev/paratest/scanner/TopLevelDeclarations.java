package dev.paratest.scanner;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Finds the top-level values of a module that take no arguments, such as {@code suite =}.
 * Used for modules exposing {@code (..)}, where every such value may be a test.
 * <p>
 * Unlike the header scanner this reader knows about string and char literals, since it has to
 * get through whole files.
 */
public final class TopLevelDeclarations {

	private TopLevelDeclarations() {
		names = new LinkedHashSet<>();
	}

	private static final Pattern LOWER_NAME = Pattern.compile("^\\p{Ll}[_\\d\\p{L}]*$");

	private static final Set<String> RESERVED_WORDS = Set.of(
		"if", "then", "else", "case", "of", "let", "in", "type",
		"module", "where", "import", "exposing", "as", "port"
	);

	private final Set<String> names;
	private final StringBuilder name = new StringBuilder();
	private State state = State.CODE;
	private Declaration declaration = Declaration.NONE;
	private boolean lineStart = true;
	private int commentLevel = 0;
	private int previousChar = -1;
	private int quoteRun = 0;


	public static List<String> read(Path path) throws IOException {
		try(var in = Files.newInputStream(path)) {
			return read(in);
		}
	}

	public static List<String> read(InputStream in) throws IOException {
		var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		var declarations = new TopLevelDeclarations();
		while(true) {
			int ch = ModuleScanner.readCodePoint(reader);
			if(ch < 0) break;

			if(ch != '\r') {
				declarations.accept(ch);
			}
		}
		return new ArrayList<>(declarations.names);
	}

	private void accept(int ch) {
		switch(state) {
			case CODE -> code(ch);

			case MAYBE_BLOCK_COMMENT -> {
				state = State.CODE;
				if(ch == '-') {
					state = State.BLOCK_COMMENT;
					commentLevel = 1;
					previousChar = -1;
				}
				else {
					declaration = Declaration.NONE;
					code(ch);
				}
			}

			case BLOCK_COMMENT -> {
				if(previousChar == '{' && ch == '-') {
					++commentLevel;
					previousChar = -1;
				}
				else if(previousChar == '-' && ch == '}') {
					--commentLevel;
					previousChar = -1;
					if(commentLevel == 0) {
						state = State.CODE;
					}
				}
				else {
					previousChar = ch;
				}
			}

			case MAYBE_LINE_COMMENT -> {
				state = State.CODE;
				if(ch == '-') {
					state = State.LINE_COMMENT;
				}
				else {
					declaration = Declaration.NONE;
					code(ch);
				}
			}

			case LINE_COMMENT -> {
				if(ch == '\n') {
					state = State.CODE;
					lineStart = true;
				}
			}

			case STRING_START -> {
				if(ch == '"') {
					state = State.EMPTY_STRING_OR_TRIPLE;
				}
				else if(ch == '\\') {
					state = State.STRING_ESCAPE;
				}
				else {
					state = State.STRING;
				}
			}

			case STRING -> {
				if(ch == '\\') {
					state = State.STRING_ESCAPE;
				}
				else if(ch == '"') {
					state = State.CODE;
				}
			}

			case STRING_ESCAPE -> state = State.STRING;

			case EMPTY_STRING_OR_TRIPLE -> {
				if(ch == '"') {
					state = State.TRIPLE_STRING;
					quoteRun = 0;
				}
				else {
					state = State.CODE;
					code(ch);
				}
			}

			case TRIPLE_STRING -> {
				if(ch == '\\') {
					state = State.TRIPLE_STRING_ESCAPE;
					quoteRun = 0;
				}
				else if(ch == '"') {
					++quoteRun;
					if(quoteRun == 3) {
						state = State.CODE;
					}
				}
				else {
					quoteRun = 0;
				}
			}

			case TRIPLE_STRING_ESCAPE -> state = State.TRIPLE_STRING;

			case CHAR -> {
				if(ch == '\\') {
					state = State.CHAR_ESCAPE;
				}
				else if(ch == '\'') {
					state = State.CODE;
				}
			}

			case CHAR_ESCAPE -> state = State.CHAR;
		}
	}

	private void code(int ch) {
		boolean atLineStart = lineStart;
		lineStart = false;

		if(atLineStart && Character.isLetter(ch)) {
			declaration = Declaration.NAME;
			name.setLength(0);
			name.appendCodePoint(ch);
			return;
		}

		if(declaration == Declaration.NAME) {
			if(ch == '_' || Character.isLetterOrDigit(ch)) {
				name.appendCodePoint(ch);
				return;
			}

			declaration = Declaration.AFTER_NAME;
		}

		switch(ch) {
			case '\n' -> lineStart = true;
			case '{' -> state = State.MAYBE_BLOCK_COMMENT;
			case '-' -> state = State.MAYBE_LINE_COMMENT;

			case '"' -> {
				declaration = Declaration.NONE;
				state = State.STRING_START;
			}

			case '\'' -> {
				declaration = Declaration.NONE;
				state = State.CHAR;
			}

			case '=' -> {
				if(declaration == Declaration.AFTER_NAME) {
					addCandidate(name.toString());
				}
				declaration = Declaration.NONE;
			}

			default -> {
				if(!Character.isWhitespace(ch)) {
					declaration = Declaration.NONE;
				}
			}
		}
	}

	private void addCandidate(String candidate) {
		if(LOWER_NAME.matcher(candidate).matches() && !RESERVED_WORDS.contains(candidate)) {
			names.add(candidate);
		}
	}

	private enum State {
		CODE,
		MAYBE_BLOCK_COMMENT,
		BLOCK_COMMENT,
		MAYBE_LINE_COMMENT,
		LINE_COMMENT,
		STRING_START,
		STRING,
		STRING_ESCAPE,
		EMPTY_STRING_OR_TRIPLE,
		TRIPLE_STRING,
		TRIPLE_STRING_ESCAPE,
		CHAR,
		CHAR_ESCAPE,
	}

	private enum Declaration {
		NONE,
		NAME,
		AFTER_NAME,
	}
}
