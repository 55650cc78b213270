package org.reliablemq.broker.delivery;

import java.time.Duration;

/**
 * Retry budgets and routing names shared by the connection, publisher and consumer.
 *
 * @param maxDeliveryLimit          handler attempts a message lineage gets before quarantine;
 *                                  0 quarantines every delivery without calling the handler
 * @param maxConnectionRetries      connection attempts made by {@code connect()}
 * @param retryDelay                fixed pause between connection attempts
 * @param rejectQueue               quarantine queue, used when no dead-letter exchange is set
 * @param deadLetterExchange        quarantine exchange (optional, wins over rejectQueue)
 * @param defaultPublishQueue       queue declared at startup, never redeclared per publish
 * @param defaultConsumeQueue       queue consumed by {@code consume(handler)}
 * @param stripAttemptsOnQuarantine remove {@code x-delivery-attempts} before quarantining
 * @param confirmTimeout            upper bound for the batch publish confirm wait
 * @param prefetchCount             unacknowledged deliveries the broker may push per consumer
 * @param workers                   handler threads per consumer; 1 runs handlers on the consume loop
 */
public record DeliveryPolicy(
        int maxDeliveryLimit,
        int maxConnectionRetries,
        Duration retryDelay,
        String rejectQueue,
        String deadLetterExchange,
        String defaultPublishQueue,
        String defaultConsumeQueue,
        boolean stripAttemptsOnQuarantine,
        Duration confirmTimeout,
        int prefetchCount,
        int workers
) {
    public static final int DEFAULT_MAX_DELIVERY_LIMIT = 30;
    public static final int DEFAULT_MAX_CONNECTION_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofMillis(3000);

    public DeliveryPolicy {
        if (maxDeliveryLimit < 0) throw new IllegalArgumentException("maxDeliveryLimit must be >= 0");
        if (maxConnectionRetries < 0) throw new IllegalArgumentException("maxConnectionRetries must be >= 0");
        if (prefetchCount < 0) throw new IllegalArgumentException("prefetchCount must be >= 0");
        if (workers < 1) throw new IllegalArgumentException("workers must be >= 1");
        if (retryDelay == null) retryDelay = DEFAULT_RETRY_DELAY;
        if (confirmTimeout == null) confirmTimeout = Duration.ofSeconds(30);
    }

    public static DeliveryPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasDeadLetterExchange() {
        return deadLetterExchange != null && !deadLetterExchange.isBlank();
    }

    public Builder toBuilder() {
        return builder()
                .maxDeliveryLimit(maxDeliveryLimit)
                .maxConnectionRetries(maxConnectionRetries)
                .retryDelay(retryDelay)
                .rejectQueue(rejectQueue)
                .deadLetterExchange(deadLetterExchange)
                .defaultPublishQueue(defaultPublishQueue)
                .defaultConsumeQueue(defaultConsumeQueue)
                .stripAttemptsOnQuarantine(stripAttemptsOnQuarantine)
                .confirmTimeout(confirmTimeout)
                .prefetchCount(prefetchCount)
                .workers(workers);
    }

    // ========== Builder ==========

    public static class Builder {
        private int maxDeliveryLimit = DEFAULT_MAX_DELIVERY_LIMIT;
        private int maxConnectionRetries = DEFAULT_MAX_CONNECTION_RETRIES;
        private Duration retryDelay = DEFAULT_RETRY_DELAY;
        private String rejectQueue = "rejected";
        private String deadLetterExchange;
        private String defaultPublishQueue = "outbound";
        private String defaultConsumeQueue = "inbound";
        private boolean stripAttemptsOnQuarantine;
        private Duration confirmTimeout = Duration.ofSeconds(30);
        private int prefetchCount = 10;
        private int workers = 1;

        public Builder maxDeliveryLimit(int v) { this.maxDeliveryLimit = v; return this; }
        public Builder maxConnectionRetries(int v) { this.maxConnectionRetries = v; return this; }
        public Builder retryDelay(Duration v) { this.retryDelay = v; return this; }
        public Builder rejectQueue(String v) { this.rejectQueue = v; return this; }
        public Builder deadLetterExchange(String v) { this.deadLetterExchange = v; return this; }
        public Builder defaultPublishQueue(String v) { this.defaultPublishQueue = v; return this; }
        public Builder defaultConsumeQueue(String v) { this.defaultConsumeQueue = v; return this; }
        public Builder stripAttemptsOnQuarantine(boolean v) { this.stripAttemptsOnQuarantine = v; return this; }
        public Builder confirmTimeout(Duration v) { this.confirmTimeout = v; return this; }
        public Builder prefetchCount(int v) { this.prefetchCount = v; return this; }
        public Builder workers(int v) { this.workers = v; return this; }

        public DeliveryPolicy build() {
            return new DeliveryPolicy(maxDeliveryLimit, maxConnectionRetries, retryDelay, rejectQueue,
                    deadLetterExchange, defaultPublishQueue, defaultConsumeQueue, stripAttemptsOnQuarantine,
                    confirmTimeout, prefetchCount, workers);
        }
    }
}
