package org.lexicon.indexing.config;

import org.lexicon.core.analysis.PositionOrder;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Typed configuration for the Indexing Service.
 *
 * <p>Loads {@code application.properties}, then overlays environment variables. Normalization applied:
 * <ul>
 *   <li>{@code node.name} falls back to {@code NODE_NAME}, then to {@code CURRENT_NODE_IP:hazelcast.port}.</li>
 *   <li>{@code store.root.path} defaults to {@code data/merge_index}; partition {@code n} lives in {@code <root>/n}.</li>
 *   <li>If {@code activemq.broker.url} is blank, it is derived from {@code BROKER_URL} or {@code MASTER_NODE_IP}.</li>
 * </ul>
 * Missing required keys fail fast with {@link IllegalStateException}.</p>
 */
public record IndexingConfig(
    int serverPort,
    Node node,
    Partitions partitions,
    Store store,
    Analysis analysis,
    Hazelcast hazelcast,
    ActiveMq activeMq
) {
    public static final Path DEFAULT_ROOT_PATH = Path.of("data", "merge_index");

    /** Identity this node uses in stream handshakes and info replies. */
    public record Node(String name) {}

    /** Partition ids hosted by this node. */
    public record Partitions(List<Integer> local) {}

    /** Local index store location and streaming settings. */
    public record Store(Path rootPath, int streamBatchSize, long replyTimeoutMillis) {}

    /** Document analysis settings; {@code schemaDirectory} is null when schemas come from the classpath. */
    public record Analysis(PositionOrder positionOrder, String schemaDirectory, String defaultSchemaResource) {}

    /** Hazelcast cluster settings for the document store. */
    public record Hazelcast(
        String clusterName,
        int port,
        List<Integer> memberPorts,
        int backupCount,
        int asyncBackupCount,
        String currentNodeIp,
        List<String> members,
        String documentMapPrefix
    ) {}

    /** ActiveMQ queue the service takes documents to index from. */
    public record ActiveMq(boolean enabled, String brokerUrl, String queueName) {}

    /**
     * Loads configuration from classpath properties plus environment variables.
     *
     * @return a fully-initialized {@link IndexingConfig}
     */
    public static IndexingConfig load() {
        Properties properties = loadProperties("application.properties");
        overlayEnvironment(properties);
        return from(properties);
    }

    static IndexingConfig from(Properties p) {
        Hazelcast hazelcast = readHazelcast(p);
        return new IndexingConfig(
            requireInt(p, "server.port"),
            readNode(p, hazelcast),
            new Partitions(splitCsvInts(requireString(p, "partitions.local"), "partitions.local")),
            readStore(p),
            readAnalysis(p),
            hazelcast,
            readActiveMq(p)
        );
    }

    private static Node readNode(Properties p, Hazelcast hazelcast) {
        String name = trimToNull(p.getProperty("node.name"));
        if (name == null) {
            name = trimToNull(p.getProperty("NODE_NAME"));
        }
        if (name == null) {
            name = hazelcast.currentNodeIp() + ":" + hazelcast.port();
        }
        return new Node(name);
    }

    private static Store readStore(Properties p) {
        String root = trimToNull(p.getProperty("store.root.path"));
        return new Store(
            root == null ? DEFAULT_ROOT_PATH : Path.of(root),
            optionalInt(p, "store.stream.batch.size", 100),
            optionalInt(p, "store.reply.timeout.ms", 30_000)
        );
    }

    private static Analysis readAnalysis(Properties p) {
        String order = trimToNull(p.getProperty("analysis.position.order"));
        PositionOrder positionOrder;
        try {
            positionOrder = order == null ? PositionOrder.ASCENDING : PositionOrder.parse(order);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid analysis.position.order: '" + order + "'", e);
        }
        String resource = trimToNull(p.getProperty("schema.default.resource"));
        return new Analysis(positionOrder, trimToNull(p.getProperty("schema.directory")),
            resource == null ? "schemas/default.json" : resource);
    }

    private static Hazelcast readHazelcast(Properties p) {
        return new Hazelcast(
            requireString(p, "hazelcast.cluster.name"),
            requireInt(p, "hazelcast.port"),
            splitCsvInts(p.getProperty("hazelcast.member.ports"), "hazelcast.member.ports"),
            requireInt(p, "hazelcast.backup.count"),
            requireInt(p, "hazelcast.async.backup.count"),
            requireString(p, "CURRENT_NODE_IP"),
            splitCsv(requireString(p, "CLUSTER_NODES_LIST")),
            requireString(p, "hazelcast.map.documents.prefix")
        );
    }

    private static ActiveMq readActiveMq(Properties p) {
        boolean enabled = Boolean.parseBoolean(trimToNull(p.getProperty("activemq.enabled")));
        if (!enabled) {
            return new ActiveMq(false, null, null);
        }
        return new ActiveMq(true, resolveBrokerUrl(p), requireString(p, "activemq.queue.name"));
    }

    private static String resolveBrokerUrl(Properties properties) {
        String brokerUrl = trimToNull(properties.getProperty("activemq.broker.url"));
        if (brokerUrl != null) {
            return brokerUrl;
        }

        String brokerEnv = trimToNull(properties.getProperty("BROKER_URL"));
        if (brokerEnv != null) {
            return brokerEnv;
        }

        return "tcp://" + requireString(properties, "MASTER_NODE_IP") + ":61616";
    }

    private static Properties loadProperties(String resourceName) {
        Properties properties = new Properties();
        try (InputStream in = IndexingConfig.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                properties.load(in);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resourceName, e);
        }
        return properties;
    }

    private static void overlayEnvironment(Properties properties) {
        properties.putAll(System.getenv());
    }

    private static List<String> splitCsv(String csv) {
        return Arrays.stream(csv.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .toList();
    }

    private static List<Integer> splitCsvInts(String csv, String key) {
        String trimmed = trimToNull(csv);
        if (trimmed == null) {
            return List.of();
        }
        return splitCsv(trimmed).stream()
            .map(value -> parseInt(key, value))
            .toList();
    }

    private static int optionalInt(Properties properties, String key, int defaultValue) {
        String value = trimToNull(properties.getProperty(key));
        return value == null ? defaultValue : parseInt(key, value);
    }

    private static String requireString(Properties properties, String key) {
        String value = trimToNull(properties.getProperty(key));
        if (value == null) {
            throw new IllegalStateException("Missing required configuration: " + key);
        }
        return value;
    }

    private static int requireInt(Properties properties, String key) {
        return parseInt(key, requireString(properties, key));
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Invalid integer for configuration '" + key + "': '" + value + "'", e);
        }
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
