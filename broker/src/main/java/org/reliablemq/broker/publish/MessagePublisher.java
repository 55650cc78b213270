package org.reliablemq.broker.publish;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ConfirmListener;
import com.rabbitmq.client.ReturnListener;
import com.rabbitmq.client.ShutdownSignalException;
import org.reliablemq.broker.connection.BrokerConnection;
import org.reliablemq.broker.connection.ConnectionException;
import org.reliablemq.broker.delivery.DeliveryPolicy;
import org.reliablemq.broker.model.BrokerMessage;
import org.reliablemq.broker.model.PayloadCodec;
import org.reliablemq.broker.topology.TopologyManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.TimeoutException;

/**
 * Publishes single messages and confirmed batches.
 *
 * <p>Content is anything {@link PayloadCodec#toMessage(Object, Map)} accepts.
 * Every message goes out persistent. A queue target other than the default
 * publish queue is declared on the fly (once per connection epoch).</p>
 *
 * <h3>Batch protocol:</h3>
 * <ol>
 *   <li>switch the channel to confirm mode</li>
 *   <li>send every message, mandatory, without waiting in between</li>
 *   <li>wait once for all confirmations</li>
 * </ol>
 * <p>Any nack or return fails the whole batch with {@link PublishConfirmException}.</p>
 */
public class MessagePublisher {

    private static final Logger log = LoggerFactory.getLogger(MessagePublisher.class);

    private final BrokerConnection connection;
    private final TopologyManager topology;
    private final DeliveryPolicy policy;
    private final PayloadCodec codec;

    public MessagePublisher(BrokerConnection connection, TopologyManager topology,
                            DeliveryPolicy policy, PayloadCodec codec) {
        this.connection = connection;
        this.topology = topology;
        this.policy = policy;
        this.codec = codec;
    }

    // ========== Single ==========

    public void publish(Object content, PublishTarget target) {
        publish(content, target, null);
    }

    /**
     * Publish one message.
     *
     * @param content message or application data
     * @param target  queue or exchange
     * @param headers merged over the content's own headers, may be null
     * @throws ConnectionException if there is no live connection or the send fails
     */
    public void publish(Object content, PublishTarget target, Map<String, ?> headers) {
        BrokerMessage message = codec.toMessage(content, headers);
        prepareTarget(target);
        Channel channel = connection.ensureChannel();
        try {
            channel.basicPublish(target.exchange(), target.routingKey(), message.toProperties(), message.getBody());
            log.debug("Published message to {} ({} bytes)", target, message.getBody().length);
        } catch (IOException | ShutdownSignalException e) {
            log.error("The publish to {} is not completed: {}", target, e.getMessage(), e);
            throw new ConnectionException("Failed to publish to " + target, e);
        }
    }

    public void publishToQueue(Object content, String queue, Map<String, ?> headers) {
        publish(content, PublishTarget.queue(queue == null ? policy.defaultPublishQueue() : queue), headers);
    }

    public void publishToExchange(Object content, String exchange, Map<String, ?> headers, String routingKey) {
        publish(content, PublishTarget.exchange(exchange, routingKey), headers);
    }

    // ========== Batch ==========

    public BatchPublishResult publishBatchToQueue(List<?> contents, String queue, Map<String, ?> headers) {
        return publishBatch(contents, PublishTarget.queue(queue == null ? policy.defaultPublishQueue() : queue), headers);
    }

    public BatchPublishResult publishBatchToExchange(List<?> contents, String exchange, Map<String, ?> headers) {
        return publishBatch(contents, PublishTarget.exchange(exchange), headers);
    }

    /**
     * Publish a batch and block until the broker confirmed all of it.
     *
     * @return a successful result
     * @throws PublishConfirmException if any entry was nacked or returned, or the wait timed out
     * @throws ConnectionException     if the channel failed while sending
     * @throws IllegalArgumentException if two entries carry the same message id
     */
    public BatchPublishResult publishBatch(List<?> contents, PublishTarget target, Map<String, ?> headers) {
        List<BrokerMessage> messages = new ArrayList<>(contents.size());
        Set<String> messageIds = new HashSet<>();
        for (Object content : contents) {
            BrokerMessage message = codec.toMessage(content, headers);
            if (message.getMessageId() == null) {
                // returns carry no sequence number, the message id identifies the entry
                message = message.toBuilder().messageId(UUID.randomUUID().toString()).build();
            }
            if (!messageIds.add(message.getMessageId())) {
                throw new IllegalArgumentException("Duplicate message id in batch: " + message.getMessageId());
            }
            messages.add(message);
        }
        if (messages.isEmpty()) {
            return BatchPublishResult.success(0);
        }

        prepareTarget(target);
        Channel channel = connection.ensureChannel();
        BatchTracker tracker = new BatchTracker();
        channel.addConfirmListener(tracker);
        channel.addReturnListener(tracker);
        try {
            channel.confirmSelect();
            for (int i = 0; i < messages.size(); i++) {
                BrokerMessage message = messages.get(i);
                tracker.track(channel.getNextPublishSeqNo(), message.getMessageId(), i);
                channel.basicPublish(target.exchange(), target.routingKey(), true,
                        message.toProperties(), message.getBody());
            }

            boolean allAcked = channel.waitForConfirms(policy.confirmTimeout().toMillis());
            BatchPublishResult result = tracker.result(messages.size(), allAcked);
            if (!result.isSuccess()) {
                log.warn("Batch publish to {} failed for {}/{} messages: {}",
                        target, result.failures().size(), result.total(), result.failedIndexes());
                throw new PublishConfirmException("Batch publish to " + target + " was not confirmed for entries "
                        + result.failedIndexes(), result);
            }
            log.debug("Batch of {} messages confirmed by {}", messages.size(), target);
            return result;

        } catch (TimeoutException e) {
            log.error("Timed out after {}ms waiting for confirms of {} messages to {}",
                    policy.confirmTimeout().toMillis(), messages.size(), target);
            throw new PublishConfirmException("Timed out waiting for publish confirms from " + target,
                    BatchPublishResult.allFailed(messages.size(), "confirm timeout"), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PublishConfirmException("Interrupted while waiting for publish confirms from " + target,
                    BatchPublishResult.allFailed(messages.size(), "interrupted"), e);
        } catch (IOException | ShutdownSignalException e) {
            log.error("The batch publish to {} is not completed: {}", target, e.getMessage(), e);
            throw new ConnectionException("Failed to publish batch to " + target, e);
        } finally {
            channel.removeConfirmListener(tracker);
            channel.removeReturnListener(tracker);
        }
    }

    // ========== Internal ==========

    private void prepareTarget(PublishTarget target) {
        if (target.isQueue() && !target.queue().equals(policy.defaultPublishQueue())) {
            topology.ensureQueue(target.queue());
        }
    }

    /**
     * Maps broker confirms and returns back to batch positions. Callbacks arrive
     * on the client's connection thread.
     */
    private static class BatchTracker implements ConfirmListener, ReturnListener {

        private final NavigableMap<Long, Integer> pending = new ConcurrentSkipListMap<>();
        private final Map<String, Integer> byMessageId = new ConcurrentHashMap<>();
        private final Map<Integer, String> failed = new ConcurrentSkipListMap<>();

        void track(long sequenceNumber, String messageId, int index) {
            pending.put(sequenceNumber, index);
            byMessageId.put(messageId, index);
        }

        @Override
        public void handleAck(long deliveryTag, boolean multiple) {
            settle(deliveryTag, multiple, null);
        }

        @Override
        public void handleNack(long deliveryTag, boolean multiple) {
            settle(deliveryTag, multiple, "nack");
        }

        @Override
        public void handleReturn(int replyCode, String replyText, String exchange, String routingKey,
                                 AMQP.BasicProperties properties, byte[] body) {
            String messageId = properties == null ? null : properties.getMessageId();
            Integer index = messageId == null ? null : byMessageId.get(messageId);
            if (index != null) {
                failed.put(index, "returned: " + replyCode + " " + replyText);
            }
        }

        private void settle(long deliveryTag, boolean multiple, String failure) {
            Map<Long, Integer> settled = multiple ? pending.headMap(deliveryTag, true) : subMap(deliveryTag);
            if (failure != null) {
                settled.values().forEach(index -> failed.putIfAbsent(index, failure));
            }
            settled.clear();
        }

        private Map<Long, Integer> subMap(long deliveryTag) {
            return pending.subMap(deliveryTag, true, deliveryTag, true);
        }

        BatchPublishResult result(int total, boolean allAcked) {
            if (failed.isEmpty() && !allAcked) {
                // broker reported a failure we cannot attribute to an entry
                return BatchPublishResult.allFailed(total, "nack");
            }
            List<BatchPublishResult.Failure> failures = new ArrayList<>();
            failed.forEach((index, reason) -> failures.add(new BatchPublishResult.Failure(index, reason)));
            return new BatchPublishResult(total, failures);
        }
    }
}
