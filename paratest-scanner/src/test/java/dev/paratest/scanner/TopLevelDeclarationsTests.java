package dev.paratest.scanner;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

public class TopLevelDeclarationsTests {

	private static List<String> read(String source) throws IOException {
		return TopLevelDeclarations.read(new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8)));
	}

	@Test
	public void notFooledByStringsCharsAndComments() throws Throwable {
		var source = """

			module Main exposing ( ..)

			one="\\"{-"
			two=\"""-}
			notAThing = something
			\\\"""
			notAThing2 = something
			\"""
			three = '"' {- "
			notAThing3 = something
			-}
			four{--}=--{-
			    1
			five = something
			--}

			""";

		Assertions.assertEquals(List.of("one", "two", "three", "four", "five"), read(source));
	}

	@Test
	public void notFooledByImportsPortsTypesAndLetIn() throws Throwable {
		var source = """
			port module Main exposing (..)
			import Dict exposing (get)

			port sendMessage : String -> Cmd msg

			type alias Model =
			    { one : String
			    , two : Int }

			init flags =
			    let
			        notATest = 1
			    in
			    Model "" 0

			type User
			  = Regular String
			  | Visitor String

			user
			  = Regular "Joe"
			""";

		Assertions.assertEquals(List.of("user"), read(source));
	}

	@Test
	public void escapesInLiterals() throws Throwable {
		var source = """
			module Main exposing ( ..)

			string = "\\n\\r\\t\\"\\'\\\\\\u{00A0}"

			chars = [ '\\n', '\\r', '\\t', '\\"', '\\'', '\\\\', '\\u{00A0}' ]

			test = something
			--}
			""";

		Assertions.assertEquals(List.of("string", "chars", "test"), read(source));
	}

	@Test
	public void crlfLineEndings() throws Throwable {
		var source = "module Main exposing (..)\r\n\r\none =\r\n    test \"one\" something\r\n\r\ntwo : Test\r\ntwo =\r\n    test \"two\" somethingElse\r\n";

		Assertions.assertEquals(List.of("one", "two"), read(source));
	}

	@Test
	public void uppercaseDeclarationsAreSkipped() throws Throwable {
		Assertions.assertEquals(List.of(), read("module Main exposing (..)\n\nOne = 1\n"));
	}

	@Test
	public void functionsWithArgumentsAreSkipped() throws Throwable {
		Assertions.assertEquals(List.of("suite"), read("module Main exposing (..)\n\nhelper x = x\n\nsuite = describe \"s\" []\n"));
	}
}
