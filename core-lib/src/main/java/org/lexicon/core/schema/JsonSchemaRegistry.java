package org.lexicon.core.schema;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Schema registry backed by JSON schema definitions.
 *
 * <p>Definitions look like:
 * <pre>
 * {"name": "books", "default_analyzer": "standard", "default_args": [],
 *  "fields": [{"name": "genre", "facet": true}, {"name": "title", "analyzer": "standard"}]}
 * </pre></p>
 */
public class JsonSchemaRegistry implements SchemaRegistry {
	private static final Logger logger = LoggerFactory.getLogger(JsonSchemaRegistry.class);
	private static final String DEFAULT_ANALYZER = "standard";

	private final Map<String, Schema> schemas = new ConcurrentHashMap<>();
	private final Gson gson = new GsonBuilder()
			.setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
			.create();

	@Override
	public Schema getSchema(String indexName) throws SchemaNotFoundException {
		Schema schema = schemas.get(indexName);
		if (schema == null) {
			throw new SchemaNotFoundException(indexName);
		}
		return schema;
	}

	public void register(Schema schema) {
		schemas.put(schema.name(), schema);
		logger.info("Registered schema {} with {} declared fields", schema.name(), schema.fields().size());
	}

	public int size() {
		return schemas.size();
	}

	/**
	 * Parse a schema definition and register it
	 */
	public Schema registerJson(String json) throws IOException {
		SchemaDefinition definition;
		try {
			definition = gson.fromJson(json, SchemaDefinition.class);
		} catch (JsonParseException e) {
			throw new IOException("Invalid schema definition: " + e.getMessage(), e);
		}

		if (definition == null || definition.name == null || definition.name.isBlank()) {
			throw new IOException("Schema definition has no name");
		}

		Schema schema = definition.toSchema();
		register(schema);
		return schema;
	}

	/**
	 * Load every *.json file in a directory
	 */
	public int loadDirectory(Path directory) throws IOException {
		if (!Files.isDirectory(directory)) {
			throw new IOException("Schema directory not found: " + directory);
		}

		int loaded = 0;
		try (Stream<Path> paths = Files.list(directory)) {
			for (Path path : paths.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList()) {
				registerJson(Files.readString(path));
				loaded++;
			}
		}

		logger.info("Loaded {} schemas from {}", loaded, directory);
		return loaded;
	}

	/**
	 * Load a schema definition from the classpath
	 */
	public Schema loadResource(String resourceName) throws IOException {
		try (InputStream in = JsonSchemaRegistry.class.getClassLoader().getResourceAsStream(resourceName)) {
			if (in == null) {
				throw new IOException("Schema resource not found: " + resourceName);
			}
			return registerJson(new String(in.readAllBytes(), StandardCharsets.UTF_8));
		}
	}

	private static class SchemaDefinition {
		String name;
		String defaultAnalyzer;
		List<String> defaultArgs;
		List<FieldDefinition> fields;

		Schema toSchema() {
			List<SchemaField> schemaFields = new ArrayList<>();
			if (fields != null) {
				for (FieldDefinition field : fields) {
					schemaFields.add(new SchemaField(field.name, field.facet, field.analyzer, field.args));
				}
			}
			String analyzer = defaultAnalyzer != null ? defaultAnalyzer : DEFAULT_ANALYZER;
			return new Schema(name, analyzer, defaultArgs, schemaFields);
		}
	}

	private static class FieldDefinition {
		String name;
		boolean facet;
		String analyzer;
		List<String> args;
	}
}
