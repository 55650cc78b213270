package org.reliablemq.broker.consume;

/**
 * Terminal state of one delivery. Each one ends with exactly one ack of the
 * original delivery tag.
 */
public enum DeliveryOutcome {

    /** handler succeeded, original acked */
    ACKNOWLEDGED,

    /** handler failed, incremented copy republished, original acked */
    REQUEUED,

    /** retry budget spent, body published to the quarantine target, original acked */
    QUARANTINED
}
