package org.lexicon.indexing.protocol;

/**
 * Destination of the replies a partition sends back to a caller.
 *
 * <p>A running stream checks {@link #isOpen()} between batches and stops once the sink is closed.</p>
 */
@FunctionalInterface
public interface ReplySink {
	void send(PartitionReply reply);

	default boolean isOpen() {
		return true;
	}
}
