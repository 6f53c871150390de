package dev.jbang.pypimirror.util;

/** Thrown at startup when a proxy environment variable does not hold a usable proxy URL */
public class InvalidProxyException extends IllegalArgumentException {

	private final String variable;

	public InvalidProxyException(String variable, String value, String reason) {
		super("Invalid proxy in " + variable + "='" + value + "': " + reason);
		this.variable = variable;
	}

	public String variable() {
		return variable;
	}
}
