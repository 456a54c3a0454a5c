package dev.paratest.runner;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.ArrayList;
import java.util.List;

@JacksonXmlRootElement(localName = "testsuite")
public class JUnitTestSuite {

	@JacksonXmlProperty(localName = "name", isAttribute = true)
	private String name;

	@JacksonXmlProperty(localName = "package", isAttribute = true)
	private String packageName;

	@JacksonXmlProperty(localName = "tests", isAttribute = true)
	private int tests;

	@JacksonXmlProperty(localName = "failures", isAttribute = true)
	private int failures;

	@JacksonXmlProperty(localName = "errors", isAttribute = true)
	private int errors;

	@JacksonXmlProperty(localName = "time", isAttribute = true)
	private double time;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "testcase")
	private List<JUnitTestCase> testCases = new ArrayList<>();

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getPackageName() {
		return packageName;
	}

	public void setPackageName(String packageName) {
		this.packageName = packageName;
	}

	public int getTests() {
		return tests;
	}

	public void setTests(int tests) {
		this.tests = tests;
	}

	public int getFailures() {
		return failures;
	}

	public void setFailures(int failures) {
		this.failures = failures;
	}

	public int getErrors() {
		return errors;
	}

	public void setErrors(int errors) {
		this.errors = errors;
	}

	public double getTime() {
		return time;
	}

	public void setTime(double time) {
		this.time = time;
	}

	public List<JUnitTestCase> getTestCases() {
		return testCases;
	}

	public void setTestCases(List<JUnitTestCase> testCases) {
		this.testCases = testCases;
	}
}
