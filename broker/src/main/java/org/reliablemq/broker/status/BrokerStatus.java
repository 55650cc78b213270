package org.reliablemq.broker.status;

/**
 * Point-in-time health snapshot.
 *
 * @param brokerName broker product name, always "RabbitMQ"
 * @param connected  a live connection exists
 * @param consuming  at least one subscription is active on an open channel
 */
public record BrokerStatus(String brokerName, boolean connected, boolean consuming) {

    public boolean isHealthy() {
        return connected;
    }
}
