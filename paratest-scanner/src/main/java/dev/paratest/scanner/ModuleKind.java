package dev.paratest.scanner;

public enum ModuleKind {
	PLAIN,
	PORT,
	EFFECT,
	;

	static ModuleKind fromPrefix(String previousWord) {
		if(previousWord == null) {
			return PLAIN;
		}

		return switch(previousWord) {
			case "port" -> PORT;
			case "effect" -> EFFECT;
			default -> PLAIN;
		};
	}
}
