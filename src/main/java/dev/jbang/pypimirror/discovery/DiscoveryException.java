package dev.jbang.pypimirror.discovery;

/** Thrown when the list of packages cannot be produced. Always fatal to the run. */
public class DiscoveryException extends Exception {

	public DiscoveryException(String message) {
		super(message);
	}

	public DiscoveryException(String message, Throwable cause) {
		super(message, cause);
	}
}
