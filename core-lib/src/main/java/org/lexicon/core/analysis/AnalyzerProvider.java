package org.lexicon.core.analysis;

@FunctionalInterface
public interface AnalyzerProvider {
	/**
	 * Acquire an analyzer session; callers must close it
	 */
	TextAnalyzer open() throws AnalyzerException;
}
