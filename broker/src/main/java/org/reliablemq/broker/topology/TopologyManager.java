package org.reliablemq.broker.topology;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import org.reliablemq.broker.BrokerException;
import org.reliablemq.broker.connection.BrokerConnection;
import org.reliablemq.broker.connection.ConnectionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Declares queues, exchanges and bindings on the broker.
 *
 * <p>All declarations are declare-if-absent: repeating one with identical
 * parameters is a no-op on the broker. Redeclaring with different parameters is
 * rejected by the broker ({@code PRECONDITION_FAILED}) and surfaces as
 * {@link InvalidTopologyException}.</p>
 *
 * <h3>Order in {@link #setupTopology(List, List, List)}:</h3>
 * <ol>
 *   <li>queues</li>
 *   <li>exchanges</li>
 *   <li>bindings (both ends must already exist)</li>
 * </ol>
 */
public class TopologyManager {

    private static final Logger log = LoggerFactory.getLogger(TopologyManager.class);

    private final BrokerConnection connection;

    /** queues declared in the current connection epoch, by any declare call */
    private final Set<String> ensuredQueues = new HashSet<>();
    private long ensuredEpoch = -1;

    public TopologyManager(BrokerConnection connection) {
        this.connection = connection;
    }

    // ========== Single declarations ==========

    public void declareQueue(String name, boolean durable, boolean exclusive, boolean autoDelete) {
        declareQueue(new QueueSpec(name, durable, exclusive, autoDelete));
    }

    public void declareQueue(QueueSpec spec) {
        requireName(spec.name(), "Queue");
        Channel channel = connection.ensureChannel();
        try {
            channel.queueDeclare(spec.name(), spec.durable(), spec.exclusive(), spec.autoDelete(), spec.arguments());
            remember(spec.name());
            log.debug("Declared queue {} (durable={}, exclusive={}, autoDelete={})",
                    spec.name(), spec.durable(), spec.exclusive(), spec.autoDelete());
        } catch (IOException | ShutdownSignalException e) {
            throw failure("declare queue", spec.name(), e);
        }
    }

    public void declareExchange(String name, ExchangeKind type, boolean durable, boolean autoDelete) {
        declareExchange(new ExchangeSpec(name, type, durable, autoDelete));
    }

    public void declareExchange(ExchangeSpec spec) {
        requireName(spec.name(), "Exchange");
        if (spec.type() == null) {
            throw new InvalidTopologyException("Exchange type is required for exchange " + spec.name());
        }
        Channel channel = connection.ensureChannel();
        try {
            channel.exchangeDeclare(spec.name(), spec.type().toBuiltin(), spec.durable(),
                    spec.autoDelete(), spec.arguments());
            log.debug("Declared {} exchange {} (durable={}, autoDelete={})",
                    spec.type(), spec.name(), spec.durable(), spec.autoDelete());
        } catch (IOException | ShutdownSignalException e) {
            throw failure("declare exchange", spec.name(), e);
        }
    }

    public void bindQueue(String exchange, String queue, String routingKey, Map<String, Object> arguments) {
        bindQueue(new BindingSpec(exchange, queue, routingKey, arguments));
    }

    public void bindQueue(BindingSpec binding) {
        requireName(binding.exchange(), "Binding exchange");
        requireName(binding.queue(), "Binding queue");
        String routingKey = binding.routingKey() == null ? "" : binding.routingKey();
        Channel channel = connection.ensureChannel();
        try {
            channel.queueBind(binding.queue(), binding.exchange(), routingKey, binding.arguments());
            log.debug("Bound queue {} to exchange {} with routing key '{}'",
                    binding.queue(), binding.exchange(), routingKey);
        } catch (IOException | ShutdownSignalException e) {
            throw failure("bind queue", binding.exchange() + " -> " + binding.queue(), e);
        }
    }

    // ========== Bulk ==========

    public void setupTopology(TopologyDefinition topology) {
        setupTopology(topology.queues(), topology.exchanges(), topology.bindings());
    }

    public void setupTopology(List<QueueSpec> queues, List<ExchangeSpec> exchanges, List<BindingSpec> bindings) {
        List<QueueSpec> q = queues == null ? List.of() : queues;
        List<ExchangeSpec> x = exchanges == null ? List.of() : exchanges;
        List<BindingSpec> b = bindings == null ? List.of() : bindings;

        q.forEach(this::declareQueue);
        x.forEach(this::declareExchange);
        b.forEach(this::bindQueue);

        log.info("Topology applied: {} queues, {} exchanges, {} bindings", q.size(), x.size(), b.size());
    }

    /**
     * Declare a durable queue unless a queue of that name was already declared
     * in the current connection epoch (by any declare call). Used for on-the-fly
     * publish and consume targets, so queues set up with their own arguments are
     * never redeclared with conflicting ones.
     */
    public void ensureQueue(String name) {
        if (isDeclared(name)) {
            return;
        }
        declareQueue(QueueSpec.durable(name));
    }

    public synchronized boolean isDeclared(String queue) {
        resetOnNewEpoch();
        return ensuredQueues.contains(queue);
    }

    private synchronized void remember(String queue) {
        resetOnNewEpoch();
        ensuredQueues.add(queue);
    }

    private void resetOnNewEpoch() {
        long epoch = connection.getEpoch();
        if (epoch != ensuredEpoch) {
            ensuredQueues.clear();
            ensuredEpoch = epoch;
        }
    }

    // ========== Internal ==========

    private static void requireName(String name, String what) {
        if (name == null || name.isBlank()) {
            throw new InvalidTopologyException(what + " name must not be blank");
        }
    }

    private BrokerException failure(String operation, String target, Exception e) {
        int replyCode = channelCloseCode(e);
        if (replyCode == AMQP.PRECONDITION_FAILED || replyCode == AMQP.NOT_FOUND) {
            log.error("Cannot {} {}: rejected by broker ({}): {}", operation, target, replyCode, e.getMessage());
            return new InvalidTopologyException("Broker rejected " + operation + " " + target, e);
        }
        log.error("Failed to {} {}: {}", operation, target, e.getMessage(), e);
        return new ConnectionException("Failed to " + operation + " " + target, e);
    }

    /**
     * Reply code of the channel.close that caused the failure, or -1.
     */
    private static int channelCloseCode(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof ShutdownSignalException sse
                    && sse.getReason() instanceof AMQP.Channel.Close close) {
                return close.getReplyCode();
            }
        }
        return -1;
    }
}
