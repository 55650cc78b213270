package org.reliablemq.broker.topology;

import java.util.Map;

/**
 * Declarative exchange definition.
 */
public record ExchangeSpec(
        String name,
        ExchangeKind type,
        boolean durable,
        boolean autoDelete,
        Map<String, Object> arguments
) {
    public ExchangeSpec(String name, ExchangeKind type, boolean durable, boolean autoDelete) {
        this(name, type, durable, autoDelete, null);
    }

    public static ExchangeSpec durable(String name, ExchangeKind type) {
        return new ExchangeSpec(name, type, true, false, null);
    }
}
