package org.lexicon.indexing.distributed;

import javax.jms.*;
import org.apache.activemq.ActiveMQConnectionFactory;
import org.lexicon.core.analysis.AnalysisException;
import org.lexicon.core.codec.DocumentDecodeException;
import org.lexicon.indexing.service.IndexingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Background consumer of an ActiveMQ queue carrying documents in their JSON wire form.
 * Each message is indexed through the {@link IndexingService}; a bad message is logged and dropped.
 */
public class IngestionMessageListener implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(IngestionMessageListener.class);
    private static final long RECEIVE_TIMEOUT_MS = 5000;
    private static final long RECONNECT_DELAY_MS = 10000;

    private final String brokerUrl;
    private final String queueName;
    private final IndexingService indexingService;

    private volatile boolean running = true;
    private volatile Connection connection;

    public IngestionMessageListener(String brokerUrl, String queueName, IndexingService indexingService) {
        this.brokerUrl = brokerUrl;
        this.queueName = queueName;
        this.indexingService = indexingService;
    }

    public void start() {
        Thread listenerThread = new Thread(this, "ActiveMQ-Document-Listener");
        listenerThread.setDaemon(true);
        listenerThread.start();
    }

    /**
     * Stops the loop; closing the connection unblocks a pending receive.
     */
    public void stop() {
        running = false;
        closeConnection();
    }

    @Override
    public void run() {
        ConnectionFactory connectionFactory = new ActiveMQConnectionFactory(brokerUrl);

        while (running) {
            try {
                connection = connectionFactory.createConnection();
                connection.start();
                Session session = connection.createSession(false, Session.AUTO_ACKNOWLEDGE);
                MessageConsumer consumer = session.createConsumer(session.createQueue(queueName));

                logger.info("Listening for documents on queue '{}' at {}", queueName, brokerUrl);

                while (running) {
                    Message message = consumer.receive(RECEIVE_TIMEOUT_MS);
                    if (message instanceof TextMessage textMessage) {
                        processMessage(textMessage.getText());
                    } else if (message != null) {
                        logger.warn("Ignoring non-text message {}", message.getJMSMessageID());
                    }
                }
            } catch (JMSException e) {
                if (running) {
                    logger.error("JMS connection failed: {}. Retrying in {} ms...", e.getMessage(), RECONNECT_DELAY_MS);
                    sleep(RECONNECT_DELAY_MS);
                }
            } finally {
                closeConnection();
            }
        }
        logger.info("Document listener has shut down.");
    }

    boolean processMessage(String json) {
        try {
            IndexingService.IndexResult result = indexingService.indexJson(json);
            logger.info("Indexed queued document {}/{} ({} postings)", result.index(), result.docId(), result.postings());
            return true;
        } catch (DocumentDecodeException e) {
            logger.error("Dropping undecodable message ({}): {}", e.getReason(), e.getMessage());
        } catch (AnalysisException | IOException e) {
            logger.error("Failed to index queued document", e);
        }
        return false;
    }

    private void closeConnection() {
        Connection current = connection;
        connection = null;
        if (current == null) {
            return;
        }
        try {
            current.close();
        } catch (JMSException e) {
            logger.warn("Exception while closing JMS connection", e);
        }
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        }
    }
}
