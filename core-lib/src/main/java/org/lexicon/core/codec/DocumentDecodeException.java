package org.lexicon.core.codec;

import java.io.IOException;

/**
 * Thrown when a wire document cannot be turned into a {@link org.lexicon.core.model.Document}.
 */
public class DocumentDecodeException extends IOException {

	public enum Reason {
		MISSING_IDENTITY,
		MALFORMED_WIRE_FORMAT
	}

	private final Reason reason;

	public DocumentDecodeException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public DocumentDecodeException(Reason reason, String message, Throwable cause) {
		super(message, cause);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}
}
