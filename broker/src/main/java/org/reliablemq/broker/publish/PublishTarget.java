package org.reliablemq.broker.publish;

/**
 * Where a publish goes: a queue through the default exchange, or a named exchange.
 *
 * @param exchange   exchange name, "" for the default exchange
 * @param routingKey routing key, the queue name for queue targets
 * @param queue      queue name for queue targets, null for exchange targets
 */
public record PublishTarget(String exchange, String routingKey, String queue) {

    public static PublishTarget queue(String queue) {
        return new PublishTarget("", queue, queue);
    }

    public static PublishTarget exchange(String exchange) {
        return new PublishTarget(exchange, "", null);
    }

    public static PublishTarget exchange(String exchange, String routingKey) {
        return new PublishTarget(exchange, routingKey == null ? "" : routingKey, null);
    }

    public boolean isQueue() {
        return queue != null;
    }

    @Override
    public String toString() {
        return isQueue() ? "queue '" + queue + "'" : "exchange '" + exchange + "' (routing key '" + routingKey + "')";
    }
}
