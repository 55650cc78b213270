package org.reliablemq.broker.delivery;

import org.reliablemq.broker.model.BrokerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and advances the per-message attempt counter.
 *
 * <p>The counter lives in the {@value #ATTEMPTS_HEADER} header of the message
 * itself, so retry state survives process restarts and broker redelivery with
 * no storage of its own. Stateless apart from the policy.</p>
 *
 * <p>A lineage is handled at most {@code maxDeliveryLimit} times: attempts
 * 0 .. limit-1 are retryable, a message arriving with {@code attempts >= limit}
 * goes to quarantine. A requeued copy therefore never carries more than
 * {@code limit}.</p>
 */
public class DeliveryTracker {

    private static final Logger log = LoggerFactory.getLogger(DeliveryTracker.class);

    public static final String ATTEMPTS_HEADER = "x-delivery-attempts";

    private final DeliveryPolicy policy;

    public DeliveryTracker(DeliveryPolicy policy) {
        this.policy = policy;
    }

    /**
     * @return the attempt count carried by the message, 0 when absent or unreadable
     */
    public int getAttempts(BrokerMessage message) {
        Object value = message.getHeader(ATTEMPTS_HEADER);
        if (value == null) return 0;

        long attempts;
        if (value instanceof Number n) {
            attempts = n.longValue();
        } else {
            // LongString from the client, or a plain String from another producer
            try {
                attempts = Long.parseLong(value.toString().trim());
            } catch (NumberFormatException e) {
                log.warn("Ignoring unreadable {} header value '{}'", ATTEMPTS_HEADER, value);
                return 0;
            }
        }
        if (attempts < 0) return 0;
        return attempts > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) attempts;
    }

    /**
     * Copy of the message with the counter advanced by one. Body and all other
     * headers are preserved; delivery metadata is not carried over.
     */
    public BrokerMessage incrementAttempts(BrokerMessage message) {
        int next = getAttempts(message) + 1;
        return message.toBuilder()
                .header(ATTEMPTS_HEADER, next)
                .build();
    }

    public boolean isRetryable(BrokerMessage message) {
        return message != null
                && !message.isEmpty()
                && getAttempts(message) < policy.maxDeliveryLimit();
    }

    public boolean isQuarantineCandidate(BrokerMessage message) {
        return !isRetryable(message);
    }

    /**
     * The message as it should be written to the quarantine target.
     */
    public BrokerMessage prepareForQuarantine(BrokerMessage message) {
        if (!policy.stripAttemptsOnQuarantine()) {
            return message;
        }
        return message.toBuilder().removeHeader(ATTEMPTS_HEADER).build();
    }

    public DeliveryPolicy getPolicy() {
        return policy;
    }
}
