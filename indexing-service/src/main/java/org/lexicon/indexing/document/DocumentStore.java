package org.lexicon.indexing.document;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.lexicon.core.codec.DocumentCodec;
import org.lexicon.core.codec.DocumentDecodeException;
import org.lexicon.core.model.Document;
import org.lexicon.core.model.FieldTerms;
import org.lexicon.core.model.FieldValue;
import org.lexicon.indexing.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Persists whole documents in the object store: bucket is the index name, key the document id.
 * The stored value holds the document's JSON wire form together with its field terms and facets,
 * so an analysed document comes back analysed.
 */
public class DocumentStore {
	private static final Logger logger = LoggerFactory.getLogger(DocumentStore.class);

	private static final Gson gson = new Gson();

	private final ObjectStore objectStore;

	public DocumentStore(ObjectStore objectStore) {
		this.objectStore = objectStore;
	}

	/**
	 * Create the document, or update the stored one in place (last writer wins)
	 */
	public void store(Document document) throws StoreException {
		String json = gson.toJson(new StoredDocument(DocumentCodec.encode(document), document.fieldTerms(), document.facets()));
		Optional<StoredObject> existing = objectStore.get(document.indexName(), document.id());

		StoredObject object;
		if (existing.isPresent()) {
			object = existing.get().update(json);
			logger.debug("Updating document {}/{} to revision {}", document.indexName(), document.id(), object.revision());
		} else {
			object = StoredObject.create(document.indexName(), document.id(), json);
			logger.debug("Creating document {}/{}", document.indexName(), document.id());
		}

		objectStore.put(object);
	}

	public Document fetch(String indexName, String id) throws StoreException {
		StoredObject object = fetchObject(indexName, id);
		try {
			StoredDocument stored = gson.fromJson(object.value(), StoredDocument.class);
			if (stored == null || stored.document() == null) {
				throw new StoreException("Stored document " + indexName + "/" + id + " has no wire form");
			}
			return DocumentCodec.decode(stored.document())
					.withAnalysis(orEmpty(stored.fieldTerms()), orEmpty(stored.facets()));
		} catch (JsonParseException | DocumentDecodeException e) {
			throw new StoreException("Stored document " + indexName + "/" + id + " is unreadable", e);
		}
	}

	private static <T> List<T> orEmpty(List<T> list) {
		return list == null ? List.of() : list;
	}

	/**
	 * The raw stored object of a document, including its revision
	 */
	public StoredObject fetchObject(String indexName, String id) throws StoreException {
		return objectStore.get(indexName, id)
				.orElseThrow(() -> new DocumentNotFoundException(indexName, id));
	}

	public void remove(String indexName, String id) throws StoreException {
		objectStore.delete(indexName, id);
		logger.debug("Removed document {}/{}", indexName, id);
	}

	private record StoredDocument(String document, List<FieldTerms> fieldTerms, List<FieldValue> facets) {}
}
