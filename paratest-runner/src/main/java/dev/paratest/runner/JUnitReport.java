package dev.paratest.runner;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import com.fasterxml.jackson.dataformat.xml.ser.ToXmlGenerator;

import java.util.List;

/**
 * Renders the JUnit report: the test suite from the summary message with every buffered result as a test case.
 * Text is passed through {@link XmlText#replaceInvalidChars(String)} so that the document is always well formed.
 */
final class JUnitReport {
	private JUnitReport() {}

	private static final XmlMapper mapper = createMapper();

	private static XmlMapper createMapper() {
		var mapper = new XmlMapper();
		mapper.configure(ToXmlGenerator.Feature.WRITE_XML_DECLARATION, true);
		mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
		return mapper;
	}

	public static String render(JsonNode summary, List<JsonNode> results) throws JsonProcessingException {
		var suiteNode = summary.path("testsuite");

		var suite = new JUnitTestSuite();
		suite.setName(XmlText.replaceInvalidChars(suiteNode.path("@name").asText("paratest")));
		suite.setPackageName(XmlText.replaceInvalidChars(suiteNode.path("@package").asText("paratest")));
		suite.setTests(suiteNode.path("@tests").asInt(results.size()));
		suite.setFailures(suiteNode.path("@failures").asInt());
		suite.setErrors(suiteNode.path("@errors").asInt());
		suite.setTime(suiteNode.path("@time").asDouble());

		for(var testCase : suiteNode.path("testcase")) {
			suite.getTestCases().add(toTestCase(testCase));
		}
		for(var result : results) {
			suite.getTestCases().add(toTestCase(result));
		}

		return mapper.writeValueAsString(suite);
	}

	private static JUnitTestCase toTestCase(JsonNode node) {
		var testCase = new JUnitTestCase();
		testCase.setClassName(XmlText.replaceInvalidChars(node.path("@classname").asText()));
		testCase.setName(XmlText.replaceInvalidChars(node.path("@name").asText()));
		testCase.setTime(node.path("@time").asDouble());

		var failure = node.get("failure");
		if(failure != null) {
			testCase.setFailure(XmlText.replaceInvalidChars(failure.isTextual() ? failure.asText() : failure.toString()));
		}

		var skipped = node.get("skipped");
		if(skipped != null) {
			var s = new JUnitTestCase.Skipped();
			s.setMessage(XmlText.replaceInvalidChars(skipped.path("@message").asText()));
			testCase.setSkipped(s);
		}

		return testCase;
	}
}
