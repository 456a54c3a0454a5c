package dev.paratest.scanner;

public class ScanException extends Exception {
	public ScanException(String fileName, String problem) {
		super("This file is problematic:\n\n" + fileName + "\n\n" + problem);
		this.fileName = fileName;
	}

	private final String fileName;

	public String getFileName() {
		return fileName;
	}
}
