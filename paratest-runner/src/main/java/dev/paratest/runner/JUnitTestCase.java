package dev.paratest.runner;

import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

public class JUnitTestCase {

	@JacksonXmlProperty(localName = "classname", isAttribute = true)
	private String className;

	@JacksonXmlProperty(localName = "name", isAttribute = true)
	private String name;

	@JacksonXmlProperty(localName = "time", isAttribute = true)
	private double time;

	@JacksonXmlProperty(localName = "failure")
	private String failure;

	@JacksonXmlProperty(localName = "skipped")
	private Skipped skipped;

	public String getClassName() {
		return className;
	}

	public void setClassName(String className) {
		this.className = className;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public double getTime() {
		return time;
	}

	public void setTime(double time) {
		this.time = time;
	}

	public String getFailure() {
		return failure;
	}

	public void setFailure(String failure) {
		this.failure = failure;
	}

	public Skipped getSkipped() {
		return skipped;
	}

	public void setSkipped(Skipped skipped) {
		this.skipped = skipped;
	}

	public static class Skipped {
		@JacksonXmlProperty(localName = "message", isAttribute = true)
		private String message;

		public String getMessage() {
			return message;
		}

		public void setMessage(String message) {
			this.message = message;
		}
	}
}
