package org.reliablemq.broker.topology;

import java.util.Map;

/**
 * Declarative queue definition.
 *
 * @param arguments optional x-arguments (x-dead-letter-exchange, x-message-ttl, ...), may be null
 */
public record QueueSpec(
        String name,
        boolean durable,
        boolean exclusive,
        boolean autoDelete,
        Map<String, Object> arguments
) {
    public QueueSpec(String name, boolean durable, boolean exclusive, boolean autoDelete) {
        this(name, durable, exclusive, autoDelete, null);
    }

    /**
     * Durable, shared, kept after the last consumer leaves.
     */
    public static QueueSpec durable(String name) {
        return new QueueSpec(name, true, false, false, null);
    }
}
