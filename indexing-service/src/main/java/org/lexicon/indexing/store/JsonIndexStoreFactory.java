package org.lexicon.indexing.store;

import org.lexicon.indexing.protocol.PartitionId;

import java.nio.file.Path;

/**
 * Opens {@link JsonIndexStore}s under a root directory, one sub-directory per partition id.
 */
public class JsonIndexStoreFactory implements IndexStoreFactory {
	private final Path rootPath;
	private final int streamBatchSize;

	public JsonIndexStoreFactory(Path rootPath, int streamBatchSize) {
		this.rootPath = rootPath;
		this.streamBatchSize = streamBatchSize;
	}

	public Path partitionPath(PartitionId partition) {
		return rootPath.resolve(String.valueOf(partition.value()));
	}

	@Override
	public IndexStore open(PartitionId partition) throws StoreOpenException {
		return JsonIndexStore.open(partitionPath(partition), streamBatchSize);
	}
}
