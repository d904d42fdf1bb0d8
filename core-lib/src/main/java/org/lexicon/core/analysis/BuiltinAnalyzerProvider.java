package org.lexicon.core.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Analyzer provider with a small set of built-in tokenizers.
 *
 * <ul>
 *   <li>{@code whitespace}: splits on whitespace, case preserved</li>
 *   <li>{@code standard}: lower-cases and splits on whitespace and punctuation; accepts
 *       {@code min_length=<n>}, {@code max_length=<n>} and {@code stop_words=a|b|c}</li>
 *   <li>{@code keyword}: the whole value is a single token</li>
 *   <li>{@code lowercase_keyword}: as {@code keyword}, lower-cased</li>
 * </ul>
 */
public class BuiltinAnalyzerProvider implements AnalyzerProvider {
	private static final Logger logger = LoggerFactory.getLogger(BuiltinAnalyzerProvider.class);

	public static final String WHITESPACE = "whitespace";
	public static final String STANDARD = "standard";
	public static final String KEYWORD = "keyword";
	public static final String LOWERCASE_KEYWORD = "lowercase_keyword";

	private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
	private static final Pattern STANDARD_PATTERN = Pattern.compile("[\\s\\p{Punct}]+");

	@Override
	public TextAnalyzer open() {
		return new Session();
	}

	private static final class Session implements TextAnalyzer {
		private boolean closed;

		@Override
		public List<String> analyze(String text, String factory, List<String> args) throws AnalyzerException {
			if (closed) {
				throw new AnalyzerException("Analyzer session already closed");
			}
			if (factory == null) {
				throw new AnalyzerException("No analyzer factory configured");
			}

			return switch (factory) {
				case WHITESPACE -> split(text, WHITESPACE_PATTERN);
				case STANDARD -> standard(text, StandardOptions.parse(args));
				case KEYWORD -> text.isEmpty() ? List.of() : List.of(text);
				case LOWERCASE_KEYWORD -> text.isEmpty() ? List.of() : List.of(text.toLowerCase(Locale.ROOT));
				default -> throw new AnalyzerException("Unknown analyzer factory: " + factory);
			};
		}

		@Override
		public void close() {
			closed = true;
		}
	}

	private static List<String> split(String text, Pattern separator) {
		List<String> tokens = new ArrayList<>();
		for (String token : separator.split(text)) {
			if (!token.isEmpty()) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	private static List<String> standard(String text, StandardOptions options) {
		List<String> tokens = new ArrayList<>();
		for (String token : split(text.toLowerCase(Locale.ROOT), STANDARD_PATTERN)) {
			if (options.accepts(token)) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	private record StandardOptions(int minLength, int maxLength, Set<String> stopWords) {

		boolean accepts(String token) {
			if (token.length() < minLength || token.length() > maxLength) {
				return false;
			}
			return !stopWords.contains(token);
		}

		static StandardOptions parse(List<String> args) throws AnalyzerException {
			int minLength = 1;
			int maxLength = Integer.MAX_VALUE;
			Set<String> stopWords = new HashSet<>();

			for (String arg : args) {
				int eq = arg.indexOf('=');
				if (eq < 0) {
					throw new AnalyzerException("Malformed analyzer argument: '" + arg + "'");
				}
				String key = arg.substring(0, eq).trim();
				String value = arg.substring(eq + 1).trim();
				switch (key) {
					case "min_length" -> minLength = parseLength(key, value);
					case "max_length" -> maxLength = parseLength(key, value);
					case "stop_words" -> Arrays.stream(value.split("\\|"))
							.map(w -> w.trim().toLowerCase(Locale.ROOT))
							.filter(w -> !w.isEmpty())
							.forEach(stopWords::add);
					default -> logger.warn("Ignoring unknown standard analyzer argument: {}", key);
				}
			}
			return new StandardOptions(minLength, maxLength, stopWords);
		}

		private static int parseLength(String key, String value) throws AnalyzerException {
			try {
				return Integer.parseInt(value);
			} catch (NumberFormatException e) {
				throw new AnalyzerException("Invalid integer for analyzer argument '" + key + "': '" + value + "'", e);
			}
		}
	}
}
