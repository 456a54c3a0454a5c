package dev.paratest.scanner;

import java.util.ArrayList;
import java.util.List;

/**
 * Consumes header tokens and collects the exposing list of the module declaration.
 * States only move forward. Malformed headers end the parse with whatever was collected.
 */
final class ExposingParser {

	static final String EFFECT_MODULE_PROBLEM =
		"It starts with `effect module`. Effect modules can only exist inside src/ in elm and elm-explorations packages. They cannot contain tests.";

	ExposingParser(String fileName) {
		this.fileName = fileName;
	}

	private final String fileName;
	private State state = State.AWAITING_MODULE_KEYWORD;
	private ModuleKind moduleKind = ModuleKind.PLAIN;
	private String previousWord = null;

	private int depth = 0;
	private int entryCount = 0;
	private boolean entryHasGroup = false;
	private final StringBuilder entry = new StringBuilder();
	private final List<String> entries = new ArrayList<>();


	public boolean isDone() {
		return state == State.DONE;
	}

	public ModuleKind moduleKind() {
		return moduleKind;
	}

	public void accept(Token token) throws ScanException {
		switch(state) {
			case AWAITING_MODULE_KEYWORD -> awaitModuleKeyword(token);

			case AWAITING_EXPOSING_KEYWORD -> {
				if(token.kind() == TokenKind.WORD) {
					switch(token.text()) {
						case "exposing" -> state = State.AWAITING_OPEN_PAREN;
						case "import" -> stopWithoutNames();
						default -> {}
					}
				}
			}

			case AWAITING_OPEN_PAREN -> {
				if(token.kind() == TokenKind.OPEN_PAREN) {
					depth = 1;
					state = State.COLLECTING_EXPOSED_NAMES;
				}
			}

			case COLLECTING_EXPOSED_NAMES -> collect(token);

			case DONE -> {}
		}
	}

	public ExposedNames result() {
		if(entryCount == 1 && entries.size() == 1 && entries.get(0).equals("..")) {
			return ExposedNames.ALL;
		}

		var names = new ArrayList<String>();
		for(var name : entries) {
			if(isPossiblyTest(name)) {
				names.add(name);
			}
		}
		return new ExposedNames.Listed(names);
	}

	static boolean isPossiblyTest(String name) {
		if(name.isEmpty()) {
			return false;
		}

		int first = name.codePointAt(0);
		return first == '_' || Character.getType(first) == Character.LOWERCASE_LETTER;
	}

	private void awaitModuleKeyword(Token token) throws ScanException {
		if(token.kind() != TokenKind.WORD) {
			previousWord = null;
			return;
		}

		switch(token.text()) {
			case "module" -> {
				moduleKind = ModuleKind.fromPrefix(previousWord);
				if(moduleKind == ModuleKind.EFFECT) {
					throw new ScanException(fileName, EFFECT_MODULE_PROBLEM);
				}

				state = State.AWAITING_EXPOSING_KEYWORD;
			}

			case "import" -> stopWithoutNames();

			default -> previousWord = token.text();
		}
	}

	private void collect(Token token) {
		switch(token.kind()) {
			case OPEN_PAREN -> {
				++depth;
				entryHasGroup = true;
				entry.append('(');
			}

			case CLOSE_PAREN -> {
				--depth;
				if(depth == 0) {
					finishEntry();
					state = State.DONE;
				}
				else {
					entry.append(')');
				}
			}

			case COMMA -> {
				if(depth == 1) {
					finishEntry();
				}
				else {
					entry.append(',');
				}
			}

			case WORD, DOTS, EQUALS -> {
				if(depth == 1 && entry.length() > 0) {
					entry.append(' ');
				}
				entry.append(token.text());
			}
		}
	}

	private void finishEntry() {
		var text = entry.toString().trim();
		entry.setLength(0);

		if(!text.isEmpty()) {
			++entryCount;

			// Type exports such as `Msg(..)` carry a nested group and are never tests.
			if(!entryHasGroup) {
				entries.add(text);
			}
		}

		entryHasGroup = false;
	}

	private void stopWithoutNames() {
		entries.clear();
		entryCount = 0;
		state = State.DONE;
	}

	private enum State {
		AWAITING_MODULE_KEYWORD,
		AWAITING_EXPOSING_KEYWORD,
		AWAITING_OPEN_PAREN,
		COLLECTING_EXPOSED_NAMES,
		DONE,
	}
}
