package org.lexicon.indexing.partition;

/**
 * Thrown when a partition receives a command it has no handler for.
 */
public class UnsupportedCommandException extends RuntimeException {
	public UnsupportedCommandException(Object command) {
		super("Unsupported partition command: " + command);
	}
}
