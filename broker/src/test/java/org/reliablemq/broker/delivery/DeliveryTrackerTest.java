package org.reliablemq.broker.delivery;

import com.rabbitmq.client.LongString;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.Test;
import org.reliablemq.broker.model.BrokerMessage;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class DeliveryTrackerTest {

    private final DeliveryTracker tracker = new DeliveryTracker(DeliveryPolicy.defaults());

    private static BrokerMessage message(Object attempts) {
        BrokerMessage.Builder builder = BrokerMessage.builder()
                .body("payload".getBytes(StandardCharsets.UTF_8))
                .header("trace-id", "abc");
        if (attempts != null) builder.header(DeliveryTracker.ATTEMPTS_HEADER, attempts);
        return builder.build();
    }

    @Test
    void missingHeaderCountsAsZero() {
        assertThat(tracker.getAttempts(message(null))).isZero();
    }

    @Test
    void readsNumbersAndNumericStrings() {
        LongString fromClient = LongStringHelper.asLongString("7");

        assertThat(tracker.getAttempts(message(5))).isEqualTo(5);
        assertThat(tracker.getAttempts(message(12L))).isEqualTo(12);
        assertThat(tracker.getAttempts(message("3"))).isEqualTo(3);
        assertThat(tracker.getAttempts(message(fromClient))).isEqualTo(7);
    }

    @Test
    void unreadableOrNegativeCountsAsZero() {
        assertThat(tracker.getAttempts(message("many"))).isZero();
        assertThat(tracker.getAttempts(message(-4))).isZero();
    }

    @Test
    void incrementKeepsBodyAndOtherHeaders() {
        BrokerMessage original = message(2);

        BrokerMessage next = tracker.incrementAttempts(original);

        assertThat(tracker.getAttempts(next)).isEqualTo(3);
        assertThat(next.getBody()).isEqualTo(original.getBody());
        assertThat(next.getHeader("trace-id")).isEqualTo("abc");
        assertThat(tracker.getAttempts(original)).isEqualTo(2);
    }

    @Test
    void incrementStartsFromZeroWithoutHeader() {
        assertThat(tracker.getAttempts(tracker.incrementAttempts(message(null)))).isEqualTo(1);
    }

    @Test
    void retryableBelowTheLimitOnly() {
        DeliveryTracker limited = new DeliveryTracker(DeliveryPolicy.builder().maxDeliveryLimit(3).build());

        assertThat(limited.isRetryable(message(0))).isTrue();
        assertThat(limited.isRetryable(message(2))).isTrue();
        assertThat(limited.isRetryable(message(3))).isFalse();
        assertThat(limited.isQuarantineCandidate(message(3))).isTrue();
        assertThat(limited.isQuarantineCandidate(message(40))).isTrue();
    }

    @Test
    void emptyOrMissingMessageIsNeverRetryable() {
        BrokerMessage empty = BrokerMessage.builder().build();

        assertThat(tracker.isRetryable(empty)).isFalse();
        assertThat(tracker.isRetryable(null)).isFalse();
        assertThat(tracker.isQuarantineCandidate(null)).isTrue();
    }

    @Test
    void zeroLimitQuarantinesEverything() {
        DeliveryTracker none = new DeliveryTracker(DeliveryPolicy.builder().maxDeliveryLimit(0).build());

        assertThat(none.isQuarantineCandidate(message(null))).isTrue();
    }

    @Test
    void quarantineKeepsCounterUnlessConfiguredToStrip() {
        DeliveryTracker stripping = new DeliveryTracker(
                DeliveryPolicy.builder().stripAttemptsOnQuarantine(true).build());

        assertThat(tracker.prepareForQuarantine(message(30)).getHeader(DeliveryTracker.ATTEMPTS_HEADER))
                .isEqualTo(30);
        BrokerMessage stripped = stripping.prepareForQuarantine(message(30));
        assertThat(stripped.getHeaders()).doesNotContainKey(DeliveryTracker.ATTEMPTS_HEADER);
        assertThat(stripped.getHeader("trace-id")).isEqualTo("abc");
    }
}
