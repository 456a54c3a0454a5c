package dev.paratest.scanner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Extracts the exposed names of a module that could be tests, without a full parse.
 * <p>
 * Reading stops as soon as the exposing list closes. Files that are not valid modules yield
 * no names so that the compiler gets the chance to report the real problem. The only
 * failures are I/O errors and {@code effect module} headers.
 */
public final class ModuleScanner {
	private ModuleScanner() {}

	private static final Logger log = LoggerFactory.getLogger(ModuleScanner.class);

	public static ExposedNames scan(Path path) throws IOException, ScanException {
		try(var in = Files.newInputStream(path)) {
			return scan(in, path.toString());
		}
	}

	public static ExposedNames scan(InputStream in, String fileName) throws IOException, ScanException {
		var reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
		var parser = new ExposingParser(fileName);
		var tokenizer = new Tokenizer(parser::accept);

		while(!parser.isDone()) {
			int ch = readCodePoint(reader);
			if(ch < 0) {
				tokenizer.finish();
				break;
			}

			tokenizer.accept(ch);
		}

		if(!parser.isDone()) {
			log.debug("{}: no complete exposing list found", fileName);
		}

		var result = parser.result();
		log.debug("{}: {} module exposing {}", fileName, parser.moduleKind(), result);
		return result;
	}

	static int readCodePoint(Reader reader) throws IOException {
		int ch = reader.read();
		if(ch < 0 || !Character.isHighSurrogate((char)ch)) {
			return ch;
		}

		reader.mark(1);
		int low = reader.read();
		if(low >= 0 && Character.isLowSurrogate((char)low)) {
			return Character.toCodePoint((char)ch, (char)low);
		}

		reader.reset();
		return ch;
	}
}
