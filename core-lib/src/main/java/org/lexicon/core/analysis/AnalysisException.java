package org.lexicon.core.analysis;

/**
 * Base class for failures that abort the analysis of a document.
 */
public class AnalysisException extends Exception {
	public AnalysisException(String message) {
		super(message);
	}

	public AnalysisException(String message, Throwable cause) {
		super(message, cause);
	}
}
