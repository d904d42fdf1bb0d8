package org.lexicon.indexing.bootstrap;

import java.io.IOException;
import java.nio.file.Path;

import org.lexicon.core.analysis.BuiltinAnalyzerProvider;
import org.lexicon.core.analysis.DocumentAnalyzer;
import org.lexicon.core.schema.JsonSchemaRegistry;
import org.lexicon.indexing.config.IndexingConfig;
import org.lexicon.indexing.distributed.IngestionMessageListener;
import org.lexicon.indexing.document.DocumentStore;
import org.lexicon.indexing.document.HazelcastObjectStore;
import org.lexicon.indexing.hazelcast.HazelcastConfigFactory;
import org.lexicon.indexing.partition.PartitionRegistry;
import org.lexicon.indexing.protocol.NodeId;
import org.lexicon.indexing.protocol.PartitionId;
import org.lexicon.indexing.service.IndexingService;
import org.lexicon.indexing.store.JsonIndexStoreFactory;
import org.lexicon.indexing.store.StoreOpenException;
import org.lexicon.indexing.web.IndexingHttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hazelcast.core.Hazelcast;
import com.hazelcast.core.HazelcastInstance;

import io.javalin.Javalin;

/**
 * Application bootstrapper for the Indexing Service.
 *
 * <p>Loads configuration and schemas, starts Hazelcast and the local partitions, wires the optional
 * queue listener and the HTTP server, and registers a JVM shutdown hook for clean termination.</p>
 */
public final class IndexingBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(IndexingBootstrap.class);

    private IndexingBootstrap() {}

    /**
     * Starts the Indexing Service.
     *
     * <p>On startup failure, logs the error and exits with code {@code 1}.</p>
     */
    public static void run() {
        try {
            start();
        } catch (Exception e) {
            logger.error("Failed to start Indexing Service", e);
            System.exit(1);
        }
    }

    private static void start() throws IOException {
        IndexingConfig cfg = IndexingConfig.load();
        JsonSchemaRegistry schemas = loadSchemas(cfg.analysis());
        HazelcastInstance hz = Hazelcast.newHazelcastInstance(HazelcastConfigFactory.build(cfg.hazelcast()));
        PartitionRegistry partitions = startPartitions(cfg);
        IndexingService service = buildService(cfg, schemas, hz, partitions);
        IngestionMessageListener listener = startListener(cfg, service);
        Javalin app = IndexingHttpServer.start(cfg.serverPort(), service);
        addShutdownHook(hz, partitions, listener, app);
        logger.info("Indexing Service started on port {} as node {} with partitions {}",
            cfg.serverPort(), cfg.node().name(), partitions.partitions());
    }

    private static JsonSchemaRegistry loadSchemas(IndexingConfig.Analysis analysis) throws IOException {
        JsonSchemaRegistry registry = new JsonSchemaRegistry();
        registry.loadResource(analysis.defaultSchemaResource());
        if (analysis.schemaDirectory() != null) {
            registry.loadDirectory(Path.of(analysis.schemaDirectory()));
        }
        return registry;
    }

    private static PartitionRegistry startPartitions(IndexingConfig cfg) throws StoreOpenException {
        JsonIndexStoreFactory storeFactory = new JsonIndexStoreFactory(cfg.store().rootPath(), cfg.store().streamBatchSize());
        PartitionRegistry registry = new PartitionRegistry(NodeId.of(cfg.node().name()), storeFactory);
        for (int partition : cfg.partitions().local()) {
            registry.start(PartitionId.of(partition));
        }
        return registry;
    }

    private static IndexingService buildService(IndexingConfig cfg, JsonSchemaRegistry schemas,
                                                HazelcastInstance hz, PartitionRegistry partitions) {
        DocumentAnalyzer analyzer = new DocumentAnalyzer(schemas, new BuiltinAnalyzerProvider(), cfg.analysis().positionOrder());
        DocumentStore documentStore = new DocumentStore(new HazelcastObjectStore(hz, cfg.hazelcast().documentMapPrefix()));
        return new IndexingService(analyzer, documentStore, partitions, cfg.store().replyTimeoutMillis());
    }

    private static IngestionMessageListener startListener(IndexingConfig cfg, IndexingService service) {
        if (!cfg.activeMq().enabled()) {
            logger.info("ActiveMQ document listener disabled");
            return null;
        }
        IngestionMessageListener listener = new IngestionMessageListener(
            cfg.activeMq().brokerUrl(),
            cfg.activeMq().queueName(),
            service
        );
        listener.start();
        return listener;
    }

    private static void addShutdownHook(HazelcastInstance hz, PartitionRegistry partitions,
                                        IngestionMessageListener listener, Javalin app) {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down Indexing Service...");
            if (listener != null) {
                listener.stop();
            }
            app.stop();
            partitions.stopAll();
            hz.shutdown();
            logger.info("Indexing Service stopped.");
        }));
    }
}
