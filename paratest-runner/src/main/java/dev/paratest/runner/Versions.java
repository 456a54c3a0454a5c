package dev.paratest.runner;

import java.io.IOException;
import java.util.Properties;

final class Versions {
	private Versions() {}

	static String current() {
		var properties = new Properties();
		try(var in = Versions.class.getResourceAsStream("version.properties")) {
			if(in != null) {
				properties.load(in);
			}
		}
		catch(IOException e) {
			return "unknown";
		}
		return properties.getProperty("version", "unknown");
	}
}
