package org.lexicon.core.codec;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import org.lexicon.core.model.Document;
import org.lexicon.core.model.FieldValue;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * JSON wire form of a {@link Document}:
 * {@code {"id": "...", "index": "...", "fields": {name: value}, "props": {name: value}}}.
 *
 * <p>Fields are written sorted by name, props in document order. A name occurring more than once
 * is written as a repeated key and read back as separate entries, so streaming Gson readers and
 * writers are used instead of the tree model. Derived data (field terms, facets) is not part of
 * the wire form.</p>
 */
public final class DocumentCodec {
	static final String ID = "id";
	static final String INDEX = "index";
	static final String FIELDS = "fields";
	static final String PROPS = "props";

	private DocumentCodec() {}

	public static String encode(Document document) {
		List<FieldValue> sortedFields = new ArrayList<>(document.fields());
		sortedFields.sort(Comparator.comparing(FieldValue::name));

		StringWriter out = new StringWriter();
		try (JsonWriter writer = new JsonWriter(out)) {
			writer.beginObject();
			writer.name(ID).value(document.id());
			writer.name(INDEX).value(document.indexName());
			writePairs(writer, FIELDS, sortedFields);
			writePairs(writer, PROPS, document.props());
			writer.endObject();
		} catch (IOException e) {
			// StringWriter does not fail
			throw new IllegalStateException("Failed to encode document " + document.id(), e);
		}
		return out.toString();
	}

	public static Document decode(String json) throws DocumentDecodeException {
		if (json == null || json.isBlank()) {
			throw new DocumentDecodeException(DocumentDecodeException.Reason.MALFORMED_WIRE_FORMAT, "Empty document");
		}

		try (JsonReader reader = new JsonReader(new StringReader(json))) {
			if (reader.peek() != JsonToken.BEGIN_OBJECT) {
				throw malformed("Expected a JSON object but found " + reader.peek());
			}

			String id = null;
			String index = null;
			List<FieldValue> fields = List.of();
			List<FieldValue> props = List.of();

			reader.beginObject();
			while (reader.hasNext()) {
				String name = reader.nextName();
				switch (name) {
					case ID -> id = readScalar(reader);
					case INDEX -> index = readScalar(reader);
					case FIELDS -> fields = readPairs(reader);
					case PROPS -> props = readPairs(reader);
					default -> reader.skipValue();
				}
			}
			reader.endObject();

			if (reader.peek() != JsonToken.END_DOCUMENT) {
				throw malformed("Trailing content after document");
			}
			if (id == null || index == null) {
				throw new DocumentDecodeException(DocumentDecodeException.Reason.MISSING_IDENTITY,
						"Document is missing its id or index");
			}
			return Document.of(id, fields, props, index);
		} catch (DocumentDecodeException e) {
			throw e;
		} catch (IOException | IllegalStateException e) {
			throw new DocumentDecodeException(DocumentDecodeException.Reason.MALFORMED_WIRE_FORMAT,
					"Malformed document: " + e.getMessage(), e);
		}
	}

	private static void writePairs(JsonWriter writer, String name, List<FieldValue> pairs) throws IOException {
		writer.name(name).beginObject();
		for (FieldValue pair : pairs) {
			writer.name(pair.name()).value(pair.value());
		}
		writer.endObject();
	}

	/**
	 * Reads a string, number or boolean as a string; anything else is skipped and read as null.
	 */
	private static String readScalar(JsonReader reader) throws IOException {
		return switch (reader.peek()) {
			case STRING, NUMBER -> reader.nextString();
			case BOOLEAN -> String.valueOf(reader.nextBoolean());
			default -> {
				reader.skipValue();
				yield null;
			}
		};
	}

	private static List<FieldValue> readPairs(JsonReader reader) throws IOException {
		if (reader.peek() != JsonToken.BEGIN_OBJECT) {
			reader.skipValue();
			return List.of();
		}

		List<FieldValue> pairs = new ArrayList<>();
		reader.beginObject();
		while (reader.hasNext()) {
			String name = reader.nextName();
			String value = readScalar(reader);
			if (value != null) {
				pairs.add(new FieldValue(name, value));
			}
		}
		reader.endObject();
		return pairs;
	}

	private static DocumentDecodeException malformed(String message) {
		return new DocumentDecodeException(DocumentDecodeException.Reason.MALFORMED_WIRE_FORMAT, message);
	}
}
