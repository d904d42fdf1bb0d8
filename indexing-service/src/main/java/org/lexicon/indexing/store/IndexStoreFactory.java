package org.lexicon.indexing.store;

import org.lexicon.indexing.protocol.PartitionId;

@FunctionalInterface
public interface IndexStoreFactory {
	IndexStore open(PartitionId partition) throws StoreOpenException;
}
