package org.reliablemq.broker.config;

import org.reliablemq.broker.connection.RabbitMQSettings;
import org.reliablemq.broker.delivery.DeliveryPolicy;
import org.reliablemq.broker.topology.BindingSpec;
import org.reliablemq.broker.topology.ExchangeKind;
import org.reliablemq.broker.topology.ExchangeSpec;
import org.reliablemq.broker.topology.QueueSpec;
import org.reliablemq.broker.topology.TopologyDefinition;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration for the reliable broker layer.
 *
 * <p>Can be loaded from YAML via {@link BrokerConfigLoader} or built programmatically.</p>
 *
 * <h3>YAML:</h3>
 * <pre>
 * reliablemq:
 *   broker:
 *     rabbitmq:
 *       host: 10.224.18.6
 *       port: 5672
 *       username: app
 *       password: secret
 *       vhost: /orders
 *     delivery:
 *       max-delivery-limit: 30
 *       max-connection-retries: 3
 *       retry-delay: 3s
 *       reject-queue: rejected
 *       consume-queue: inbound
 *       publish-queue: outbound
 *     topology:
 *       queues:
 *         - name: billing
 *       exchanges:
 *         - name: orders
 *           type: fanout
 *       bindings:
 *         orders: [billing]
 * </pre>
 */
public class BrokerConfig {

    private RabbitmqConfig rabbitmq = new RabbitmqConfig();

    private DeliveryConfig delivery = new DeliveryConfig();

    private TopologyConfig topology = new TopologyConfig();

    // --- Getters / Setters ---

    public RabbitmqConfig getRabbitmq() { return rabbitmq; }
    public void setRabbitmq(RabbitmqConfig rabbitmq) { this.rabbitmq = rabbitmq; }

    public DeliveryConfig getDelivery() { return delivery; }
    public void setDelivery(DeliveryConfig delivery) { this.delivery = delivery; }

    public TopologyConfig getTopology() { return topology; }
    public void setTopology(TopologyConfig topology) { this.topology = topology; }

    // ========== Conversions ==========

    public RabbitMQSettings toSettings() {
        return new RabbitMQSettings(rabbitmq.host, rabbitmq.port, rabbitmq.username, rabbitmq.password,
                rabbitmq.vhost, rabbitmq.ssl, rabbitmq.connectionTimeout, rabbitmq.heartbeat,
                rabbitmq.connectionName);
    }

    public DeliveryPolicy toDeliveryPolicy() {
        return DeliveryPolicy.builder()
                .maxDeliveryLimit(delivery.maxDeliveryLimit)
                .maxConnectionRetries(delivery.maxConnectionRetries)
                .retryDelay(delivery.retryDelay)
                .rejectQueue(delivery.rejectQueue)
                .deadLetterExchange(delivery.deadLetterExchange)
                .defaultPublishQueue(delivery.publishQueue)
                .defaultConsumeQueue(delivery.consumeQueue)
                .stripAttemptsOnQuarantine(delivery.stripAttemptsOnQuarantine)
                .confirmTimeout(delivery.confirmTimeout)
                .prefetchCount(delivery.prefetchCount)
                .workers(delivery.workers)
                .build();
    }

    public TopologyDefinition toTopology() {
        List<QueueSpec> queues = new ArrayList<>();
        for (QueueConfig q : topology.queues) {
            queues.add(new QueueSpec(q.name, q.durable, q.exclusive, q.autoDelete, q.arguments));
        }
        List<ExchangeSpec> exchanges = new ArrayList<>();
        for (ExchangeConfig x : topology.exchanges) {
            exchanges.add(new ExchangeSpec(x.name, ExchangeKind.fromString(x.type), x.durable, x.autoDelete,
                    x.arguments));
        }
        List<BindingSpec> bindings = new ArrayList<>();
        for (BindingConfig b : topology.bindings) {
            bindings.add(new BindingSpec(b.exchange, b.queue, b.routingKey, b.arguments));
        }
        return new TopologyDefinition(queues, exchanges, bindings);
    }

    // ========== Nested classes ==========

    public static class RabbitmqConfig {
        private String host = "localhost";
        private int port = 5672;
        private String username = "guest";
        private String password = "guest";
        private String vhost = "/";
        private boolean ssl = false;

        /**
         * Connection timeout in milliseconds.
         */
        private int connectionTimeout = 10_000;

        /**
         * Heartbeat interval in seconds.
         */
        private int heartbeat = 30;

        private String connectionName = "reliablemq";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        public String getVhost() { return vhost; }
        public void setVhost(String vhost) { this.vhost = vhost; }

        public boolean isSsl() { return ssl; }
        public void setSsl(boolean ssl) { this.ssl = ssl; }

        public int getConnectionTimeout() { return connectionTimeout; }
        public void setConnectionTimeout(int connectionTimeout) { this.connectionTimeout = connectionTimeout; }

        public int getHeartbeat() { return heartbeat; }
        public void setHeartbeat(int heartbeat) { this.heartbeat = heartbeat; }

        public String getConnectionName() { return connectionName; }
        public void setConnectionName(String connectionName) { this.connectionName = connectionName; }
    }

    public static class DeliveryConfig {

        /**
         * Handler attempts per message before it is quarantined.
         */
        private int maxDeliveryLimit = DeliveryPolicy.DEFAULT_MAX_DELIVERY_LIMIT;

        private int maxConnectionRetries = DeliveryPolicy.DEFAULT_MAX_CONNECTION_RETRIES;

        /**
         * Pause between connection attempts.
         */
        private Duration retryDelay = DeliveryPolicy.DEFAULT_RETRY_DELAY;

        private String rejectQueue = "rejected";

        /**
         * When set, quarantined messages go to this exchange instead of the reject queue.
         */
        private String deadLetterExchange;

        private String publishQueue = "outbound";
        private String consumeQueue = "inbound";
        private boolean stripAttemptsOnQuarantine = false;
        private Duration confirmTimeout = Duration.ofSeconds(30);
        private int prefetchCount = 10;
        private int workers = 1;

        public int getMaxDeliveryLimit() { return maxDeliveryLimit; }
        public void setMaxDeliveryLimit(int maxDeliveryLimit) { this.maxDeliveryLimit = maxDeliveryLimit; }

        public int getMaxConnectionRetries() { return maxConnectionRetries; }
        public void setMaxConnectionRetries(int maxConnectionRetries) { this.maxConnectionRetries = maxConnectionRetries; }

        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }

        public String getRejectQueue() { return rejectQueue; }
        public void setRejectQueue(String rejectQueue) { this.rejectQueue = rejectQueue; }

        public String getDeadLetterExchange() { return deadLetterExchange; }
        public void setDeadLetterExchange(String deadLetterExchange) { this.deadLetterExchange = deadLetterExchange; }

        public String getPublishQueue() { return publishQueue; }
        public void setPublishQueue(String publishQueue) { this.publishQueue = publishQueue; }

        public String getConsumeQueue() { return consumeQueue; }
        public void setConsumeQueue(String consumeQueue) { this.consumeQueue = consumeQueue; }

        public boolean isStripAttemptsOnQuarantine() { return stripAttemptsOnQuarantine; }
        public void setStripAttemptsOnQuarantine(boolean strip) { this.stripAttemptsOnQuarantine = strip; }

        public Duration getConfirmTimeout() { return confirmTimeout; }
        public void setConfirmTimeout(Duration confirmTimeout) { this.confirmTimeout = confirmTimeout; }

        public int getPrefetchCount() { return prefetchCount; }
        public void setPrefetchCount(int prefetchCount) { this.prefetchCount = prefetchCount; }

        public int getWorkers() { return workers; }
        public void setWorkers(int workers) { this.workers = workers; }
    }

    public static class TopologyConfig {
        private List<QueueConfig> queues = new ArrayList<>();
        private List<ExchangeConfig> exchanges = new ArrayList<>();
        private List<BindingConfig> bindings = new ArrayList<>();

        public List<QueueConfig> getQueues() { return queues; }
        public void setQueues(List<QueueConfig> queues) { this.queues = queues; }

        public List<ExchangeConfig> getExchanges() { return exchanges; }
        public void setExchanges(List<ExchangeConfig> exchanges) { this.exchanges = exchanges; }

        public List<BindingConfig> getBindings() { return bindings; }
        public void setBindings(List<BindingConfig> bindings) { this.bindings = bindings; }
    }

    public static class QueueConfig {
        private String name;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;
        private Map<String, Object> arguments = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public boolean isDurable() { return durable; }
        public void setDurable(boolean durable) { this.durable = durable; }

        public boolean isExclusive() { return exclusive; }
        public void setExclusive(boolean exclusive) { this.exclusive = exclusive; }

        public boolean isAutoDelete() { return autoDelete; }
        public void setAutoDelete(boolean autoDelete) { this.autoDelete = autoDelete; }

        public Map<String, Object> getArguments() { return arguments; }
        public void setArguments(Map<String, Object> arguments) { this.arguments = arguments; }
    }

    public static class ExchangeConfig {
        private String name;

        /**
         * direct, fanout, topic or headers.
         */
        private String type = "direct";

        private boolean durable = true;
        private boolean autoDelete = false;
        private Map<String, Object> arguments = new LinkedHashMap<>();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public boolean isDurable() { return durable; }
        public void setDurable(boolean durable) { this.durable = durable; }

        public boolean isAutoDelete() { return autoDelete; }
        public void setAutoDelete(boolean autoDelete) { this.autoDelete = autoDelete; }

        public Map<String, Object> getArguments() { return arguments; }
        public void setArguments(Map<String, Object> arguments) { this.arguments = arguments; }
    }

    public static class BindingConfig {
        private String exchange;
        private String queue;
        private String routingKey = "";
        private Map<String, Object> arguments = new LinkedHashMap<>();

        public BindingConfig() {
        }

        public BindingConfig(String exchange, String queue, String routingKey) {
            this.exchange = exchange;
            this.queue = queue;
            this.routingKey = routingKey;
        }

        public String getExchange() { return exchange; }
        public void setExchange(String exchange) { this.exchange = exchange; }

        public String getQueue() { return queue; }
        public void setQueue(String queue) { this.queue = queue; }

        public String getRoutingKey() { return routingKey; }
        public void setRoutingKey(String routingKey) { this.routingKey = routingKey; }

        public Map<String, Object> getArguments() { return arguments; }
        public void setArguments(Map<String, Object> arguments) { this.arguments = arguments; }
    }
}
