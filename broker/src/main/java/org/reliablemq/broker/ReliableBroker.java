package org.reliablemq.broker;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.reliablemq.broker.config.BrokerConfig;
import org.reliablemq.broker.config.BrokerConfigLoader;
import org.reliablemq.broker.connection.BrokerConnection;
import org.reliablemq.broker.consume.MessageConsumer;
import org.reliablemq.broker.consume.MessageHandler;
import org.reliablemq.broker.delivery.DeliveryPolicy;
import org.reliablemq.broker.delivery.DeliveryTracker;
import org.reliablemq.broker.model.PayloadCodec;
import org.reliablemq.broker.publish.BatchPublishResult;
import org.reliablemq.broker.publish.MessagePublisher;
import org.reliablemq.broker.status.BrokerStatus;
import org.reliablemq.broker.status.StatusReporter;
import org.reliablemq.broker.topology.QueueSpec;
import org.reliablemq.broker.topology.TopologyDefinition;
import org.reliablemq.broker.topology.TopologyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Main entry point: one RabbitMQ connection with topology, confirmed publishing
 * and retry-aware consumption wired together.
 *
 * <h3>Usage with YAML config:</h3>
 * <pre>
 * try (var broker = ReliableBroker.fromYaml(Path.of("broker.yml"))) {
 *     broker.connect();
 *     broker.publishToQueue(Payload.json(order), "orders", null);
 *     broker.consume(message -&gt; process(message));
 * }
 * </pre>
 *
 * <p>{@link #connect()} applies the configured topology and declares the
 * default consume, publish and reject queues. It is safe to call again after
 * a lost connection.</p>
 */
public class ReliableBroker implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ReliableBroker.class);

    private final BrokerConnection connection;
    private final DeliveryPolicy policy;
    private final TopologyDefinition topologyDefinition;
    private final PayloadCodec codec;
    private final TopologyManager topology;
    private final MessagePublisher publisher;
    private final MessageConsumer consumer;
    private final StatusReporter statusReporter;

    /** connection epoch whose topology has been applied */
    private long readyEpoch = -1;

    // ========== Factory methods ==========

    public static ReliableBroker fromYaml(Path path) {
        try {
            return new ReliableBroker(BrokerConfigLoader.fromYaml(path));
        } catch (Exception e) {
            throw new BrokerException("Failed to load config from " + path, e);
        }
    }

    public static ReliableBroker fromClasspath(String resource) {
        return new ReliableBroker(BrokerConfigLoader.fromClasspath(resource));
    }

    // ========== Constructor ==========

    public ReliableBroker(BrokerConfig config) {
        this(config, new ObjectMapper());
    }

    public ReliableBroker(BrokerConfig config, ObjectMapper objectMapper) {
        this(newConnection(config), config.toDeliveryPolicy(), config.toTopology(), new PayloadCodec(objectMapper));
    }

    public ReliableBroker(BrokerConnection connection, DeliveryPolicy policy,
                          TopologyDefinition topologyDefinition, PayloadCodec codec) {
        this.connection = connection;
        this.policy = policy;
        this.topologyDefinition = topologyDefinition == null ? TopologyDefinition.empty() : topologyDefinition;
        this.codec = codec;
        this.topology = new TopologyManager(connection);
        this.publisher = new MessagePublisher(connection, topology, policy, codec);
        this.consumer = new MessageConsumer(connection, topology, publisher, new DeliveryTracker(policy));
        this.statusReporter = new StatusReporter(connection, consumer);
    }

    private static BrokerConnection newConnection(BrokerConfig config) {
        DeliveryPolicy policy = config.toDeliveryPolicy();
        return new BrokerConnection(config.toSettings(), policy.maxConnectionRetries(), policy.retryDelay());
    }

    // ========== Lifecycle ==========

    /**
     * Connect (with bounded retry) and declare everything this process depends on.
     *
     * @throws org.reliablemq.broker.connection.ConnectionException      when the broker stays unreachable
     * @throws org.reliablemq.broker.topology.InvalidTopologyException when the broker rejects a declaration
     */
    public synchronized void connect() {
        connection.connect();
        long epoch = connection.getEpoch();
        if (epoch == readyEpoch) {
            return;
        }
        topology.setupTopology(topologyDefinition);
        for (String queue : defaultQueues()) {
            if (!topology.isDeclared(queue)) {
                topology.declareQueue(QueueSpec.durable(queue));
            }
        }
        readyEpoch = epoch;
        log.info("Broker ready on connection {}", connection.getConnectionName());
    }

    /**
     * Cancel every subscription, then close channel and connection.
     */
    @Override
    public synchronized void close() {
        consumer.cancelAll();
        connection.close();
        log.info("Broker connection {} closed", connection.getConnectionName());
    }

    private Set<String> defaultQueues() {
        Set<String> queues = new LinkedHashSet<>();
        queues.add(policy.defaultConsumeQueue());
        queues.add(policy.defaultPublishQueue());
        if (!policy.hasDeadLetterExchange()) {
            queues.add(policy.rejectQueue());
        }
        return queues;
    }

    // ========== Consume ==========

    /**
     * Block consuming the default consume queue.
     */
    public void consume(MessageHandler handler) {
        consumer.consume(handler);
    }

    public void consume(String queue, MessageHandler handler) {
        consumer.consume(queue, handler);
    }

    public boolean cancel(String queue) {
        return consumer.cancel(queue);
    }

    // ========== Publish ==========

    public void publishToQueue(Object content, String queue, Map<String, ?> headers) {
        publisher.publishToQueue(content, queue, headers);
    }

    public void publishToExchange(Object content, String exchange, Map<String, ?> headers, String routingKey) {
        publisher.publishToExchange(content, exchange, headers, routingKey);
    }

    public BatchPublishResult publishBatchToQueue(List<?> contents, String queue, Map<String, ?> headers) {
        return publisher.publishBatchToQueue(contents, queue, headers);
    }

    public BatchPublishResult publishBatchToExchange(List<?> contents, String exchange, Map<String, ?> headers) {
        return publisher.publishBatchToExchange(contents, exchange, headers);
    }

    // ========== Accessors ==========

    public BrokerStatus getStatus() {
        return statusReporter.status();
    }

    public DeliveryPolicy getPolicy() { return policy; }
    public PayloadCodec getCodec() { return codec; }
    public TopologyManager getTopology() { return topology; }
    public MessagePublisher getPublisher() { return publisher; }
    public MessageConsumer getConsumer() { return consumer; }
    public BrokerConnection getConnection() { return connection; }
}
