package org.lexicon.core.analysis;

import java.util.List;

/**
 * A tokenizer session acquired from an {@link AnalyzerProvider}.
 *
 * <p>Sessions are released with {@link #close()} once the caller is done with them.</p>
 */
public interface TextAnalyzer extends AutoCloseable {
	/**
	 * Split a value into tokens using the named analyzer factory
	 * @return tokens in text order, possibly empty
	 */
	List<String> analyze(String text, String factory, List<String> args) throws AnalyzerException;

	@Override
	void close();
}
