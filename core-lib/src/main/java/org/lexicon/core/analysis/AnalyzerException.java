package org.lexicon.core.analysis;

/**
 * Thrown when the text analyzer cannot tokenize a field value.
 */
public class AnalyzerException extends AnalysisException {
	public AnalyzerException(String message) {
		super(message);
	}

	public AnalyzerException(String message, Throwable cause) {
		super(message, cause);
	}
}
