package org.reliablemq.broker.consume;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.reliablemq.broker.BrokerException;
import org.reliablemq.broker.connection.BrokerConnection;
import org.reliablemq.broker.connection.ConnectionException;
import org.reliablemq.broker.delivery.DeliveryPolicy;
import org.reliablemq.broker.delivery.DeliveryTracker;
import org.reliablemq.broker.model.BrokerMessage;
import org.reliablemq.broker.publish.MessagePublisher;
import org.reliablemq.broker.publish.PublishTarget;
import org.reliablemq.broker.topology.TopologyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumes a queue with manual acknowledgements and turns handler outcomes into
 * ack / requeue / quarantine decisions.
 *
 * <h3>Per delivery:</h3>
 * <ol>
 *   <li>retry budget spent (or empty body) → publish to the quarantine target, ack</li>
 *   <li>handler returns {@code true} → ack</li>
 *   <li>handler returns {@code false} or throws → republish a copy with the attempt
 *       counter advanced to the consumed queue, ack</li>
 * </ol>
 *
 * <p>{@link #consume(String, MessageHandler)} blocks the calling thread, which
 * becomes the only thread acking and republishing for that subscription. The
 * client's delivery thread merely enqueues. With {@code workers > 1} handlers
 * run on a bounded pool and report back to the loop over the same queue.</p>
 *
 * <p>The loop returns after {@link #cancel(String)}, a broker-side cancel, or a
 * channel/connection shutdown. It is never restarted from here.</p>
 */
public class MessageConsumer {

    private static final Logger log = LoggerFactory.getLogger(MessageConsumer.class);

    private final BrokerConnection connection;
    private final TopologyManager topology;
    private final MessagePublisher publisher;
    private final DeliveryTracker tracker;
    private final DeliveryPolicy policy;

    /** queue → active subscription */
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();

    public MessageConsumer(BrokerConnection connection, TopologyManager topology,
                           MessagePublisher publisher, DeliveryTracker tracker) {
        this.connection = connection;
        this.topology = topology;
        this.publisher = publisher;
        this.tracker = tracker;
        this.policy = tracker.getPolicy();
    }

    // ========== Subscription lifecycle ==========

    public void consume(MessageHandler handler) {
        consume(policy.defaultConsumeQueue(), handler);
    }

    /**
     * Subscribe to {@code queue} and process deliveries until the subscription ends.
     *
     * @throws ConnectionException   if the subscription cannot be set up
     * @throws IllegalStateException if this consumer already consumes {@code queue}
     */
    public void consume(String queue, MessageHandler handler) {
        topology.ensureQueue(queue);
        Channel channel = connection.ensureChannel();

        Subscription subscription = new Subscription(queue, channel, handler);
        if (subscriptions.putIfAbsent(queue, subscription) != null) {
            subscription.shutdownWorkers();
            throw new IllegalStateException("Already consuming from queue " + queue);
        }

        try {
            channel.basicQos(policy.prefetchCount());
            subscription.consumerTag = channel.basicConsume(queue, false, subscription.consumer);
        } catch (IOException | ShutdownSignalException e) {
            subscriptions.remove(queue, subscription);
            subscription.shutdownWorkers();
            log.error("Cannot consume from queue {}: {}", queue, e.getMessage(), e);
            throw new ConnectionException("Cannot consume from queue " + queue, e);
        }

        log.info("Consumption started: queue={}, consumerTag={}, prefetch={}, workers={}",
                queue, subscription.consumerTag, policy.prefetchCount(), policy.workers());
        try {
            subscription.run();
        } finally {
            subscriptions.remove(queue, subscription);
            subscription.shutdownWorkers();
            log.info("Consumption stopped: queue={}", queue);
        }
    }

    /**
     * Ask the broker to stop delivering from {@code queue}. The consume loop
     * settles in-flight messages and returns. Callable from any thread.
     *
     * @return false if there was no subscription for the queue
     */
    public boolean cancel(String queue) {
        Subscription subscription = subscriptions.get(queue);
        if (subscription == null) {
            return false;
        }
        subscription.cancel();
        return true;
    }

    public void cancelAll() {
        subscriptions.values().forEach(Subscription::cancel);
    }

    public boolean isConsuming() {
        return subscriptions.values().stream().anyMatch(Subscription::isActive);
    }

    // ========== Delivery state machine ==========

    private DeliveryOutcome quarantine(Subscription subscription, BrokerMessage message) {
        PublishTarget target = policy.hasDeadLetterExchange()
                ? PublishTarget.exchange(policy.deadLetterExchange(), subscription.queue)
                : PublishTarget.queue(policy.rejectQueue());
        log.warn("Quarantining message {} from queue {} to {} after {} attempts",
                message.getDeliveryTag(), subscription.queue, target, tracker.getAttempts(message));
        publisher.publish(tracker.prepareForQuarantine(message), target);
        subscription.acknowledge(message);
        return DeliveryOutcome.QUARANTINED;
    }

    private void requeue(Subscription subscription, BrokerMessage message) {
        BrokerMessage retry = tracker.incrementAttempts(message);
        log.warn("Requeuing message {} on queue {} for retry, attempt {}/{}",
                message.getDeliveryTag(), subscription.queue,
                tracker.getAttempts(retry), policy.maxDeliveryLimit());
        publisher.publish(retry, PublishTarget.queue(subscription.queue));
        subscription.acknowledge(message);
    }

    private DeliveryOutcome settle(Subscription subscription, BrokerMessage message, boolean success) {
        if (success) {
            subscription.acknowledge(message);
            return DeliveryOutcome.ACKNOWLEDGED;
        }
        requeue(subscription, message);
        return DeliveryOutcome.REQUEUED;
    }

    // ========== Inner: one queue subscription ==========

    private interface Event {}

    private record Delivered(BrokerMessage message) implements Event {}

    private record Completed(BrokerMessage message, boolean success) implements Event {}

    /** cause is null for a cancel */
    private record Ended(ShutdownSignalException cause) implements Event {}

    private class Subscription {
        final String queue;
        final Channel channel;
        final MessageHandler handler;
        final BlockingQueue<Event> inbox = new LinkedBlockingQueue<>();
        final DefaultConsumer consumer;
        final ExecutorService workers;

        volatile String consumerTag;
        volatile boolean active = true;
        int inFlight;

        Subscription(String queue, Channel channel, MessageHandler handler) {
            this.queue = queue;
            this.channel = channel;
            this.handler = handler;
            this.workers = policy.workers() > 1 ? createWorkers(queue) : null;
            this.consumer = new DefaultConsumer(channel) {
                @Override
                public void handleDelivery(String ct, Envelope envelope,
                                           AMQP.BasicProperties properties, byte[] body) {
                    inbox.add(new Delivered(BrokerMessage.fromDelivery(envelope, properties, body)));
                }

                @Override
                public void handleCancelOk(String ct) {
                    inbox.add(new Ended(null));
                }

                @Override
                public void handleCancel(String ct) {
                    log.warn("Consumer {} on queue {} was cancelled by the broker", ct, queue);
                    inbox.add(new Ended(null));
                }

                @Override
                public void handleShutdownSignal(String ct, ShutdownSignalException sig) {
                    inbox.add(new Ended(sig));
                }
            };
        }

        void run() {
            boolean ending = false;
            while (!(ending && inFlight == 0)) {
                Event event;
                try {
                    event = inbox.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Consume loop for queue {} interrupted", queue);
                    cancel();
                    break;
                }

                if (event instanceof Ended ended) {
                    if (ended.cause() != null) {
                        logShutdown(ended.cause());
                        break;
                    }
                    ending = true;
                    continue;
                }

                BrokerMessage current = null;
                try {
                    if (event instanceof Delivered delivered) {
                        current = delivered.message();
                        dispatch(current);
                    } else if (event instanceof Completed completed) {
                        inFlight--;
                        current = completed.message();
                        settled(current, settle(this, current, completed.success()));
                    }
                } catch (BrokerException e) {
                    log.error("Consume loop for queue {} stopped, unacknowledged messages will be redelivered: {}",
                            queue, e.getMessage(), e);
                    cancel();
                    returnUnsettled(current);
                    break;
                }
            }
            active = false;
        }

        private void dispatch(BrokerMessage message) {
            if (tracker.isQuarantineCandidate(message)) {
                settled(message, quarantine(this, message));
                return;
            }
            if (workers == null) {
                settled(message, settle(this, message, invoke(message)));
                return;
            }
            inFlight++;
            workers.execute(() -> {
                boolean success = false;
                try {
                    success = invoke(message);
                } finally {
                    inbox.add(new Completed(message, success));
                }
            });
        }

        private void settled(BrokerMessage message, DeliveryOutcome outcome) {
            log.debug("Message {} on queue {} settled: {}", message.getDeliveryTag(), queue, outcome);
        }

        private boolean invoke(BrokerMessage message) {
            try {
                return handler.handle(message);
            } catch (Exception e) {
                log.error("Could not process message {} from queue {}: {}",
                        message.getDeliveryTag(), queue, e.getMessage(), e);
                return false;
            } catch (Error e) {
                log.error("Handler failed with {} on message {} from queue {}",
                        e.getClass().getName(), message.getDeliveryTag(), queue, e);
                return false;
            }
        }

        /**
         * Nack the failed message and every delivery still queued locally with
         * requeue, so the broker redelivers them while the channel stays open.
         */
        private void returnUnsettled(BrokerMessage failed) {
            shutdownWorkers();
            List<BrokerMessage> unsettled = new ArrayList<>();
            if (failed != null) {
                unsettled.add(failed);
            }
            Event event;
            while ((event = inbox.poll()) != null) {
                if (event instanceof Delivered delivered) {
                    unsettled.add(delivered.message());
                } else if (event instanceof Completed completed) {
                    unsettled.add(completed.message());
                }
            }
            for (BrokerMessage message : unsettled) {
                if (!channel.isOpen()) {
                    return;
                }
                try {
                    channel.basicNack(message.getDeliveryTag(), false, true);
                } catch (IOException | ShutdownSignalException e) {
                    log.warn("Could not return {} unsettled messages to queue {}: {}",
                            unsettled.size(), queue, e.getMessage());
                    return;
                }
            }
            log.info("Returned {} unsettled messages to queue {}", unsettled.size(), queue);
        }

        void acknowledge(BrokerMessage message) {
            try {
                channel.basicAck(message.getDeliveryTag(), false);
            } catch (IOException | ShutdownSignalException e) {
                throw new ConnectionException("Failed to acknowledge message "
                        + message.getDeliveryTag() + " on queue " + queue, e);
            }
        }

        void cancel() {
            String tag = consumerTag;
            try {
                if (tag != null && channel.isOpen()) {
                    channel.basicCancel(tag);
                    return;
                }
            } catch (IOException | ShutdownSignalException e) {
                log.debug("Error cancelling consumer {}: {}", tag, e.getMessage());
            }
            // no cancel-ok will arrive, end the loop directly
            inbox.add(new Ended(null));
        }

        boolean isActive() {
            return active && channel.isOpen();
        }

        void shutdownWorkers() {
            if (workers == null) return;
            workers.shutdown();
            try {
                if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                    workers.shutdownNow();
                }
            } catch (InterruptedException e) {
                workers.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        private void logShutdown(ShutdownSignalException cause) {
            if (cause.isInitiatedByApplication()) {
                log.info("Channel closed by application, consume loop for queue {} exits", queue);
            } else {
                log.error("connection to RabbitMQ lost while consuming queue {}: {}", queue, cause.getMessage());
            }
        }

        private ExecutorService createWorkers(String queue) {
            int size = policy.workers();
            int backlog = Math.max(size, policy.prefetchCount());
            AtomicInteger counter = new AtomicInteger();
            ThreadFactory threads = runnable -> {
                Thread thread = new Thread(runnable, "reliablemq-worker-" + queue + "-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            };
            // caller-runs once the backlog is full
            return new ThreadPoolExecutor(size, size, 0L, TimeUnit.MILLISECONDS,
                    new ArrayBlockingQueue<>(backlog), threads, new ThreadPoolExecutor.CallerRunsPolicy());
        }
    }
}
