package org.reliablemq.broker.topology;

import com.rabbitmq.client.BuiltinExchangeType;

/**
 * AMQP 0-9-1 exchange types.
 */
public enum ExchangeKind {

    DIRECT(BuiltinExchangeType.DIRECT),
    FANOUT(BuiltinExchangeType.FANOUT),
    TOPIC(BuiltinExchangeType.TOPIC),
    HEADERS(BuiltinExchangeType.HEADERS);

    private final BuiltinExchangeType builtin;

    ExchangeKind(BuiltinExchangeType builtin) {
        this.builtin = builtin;
    }

    public BuiltinExchangeType toBuiltin() {
        return builtin;
    }

    /**
     * Parse "direct", "Fanout", "TOPIC"...
     *
     * @throws InvalidTopologyException for unknown or blank names
     */
    public static ExchangeKind fromString(String type) {
        if (type == null || type.isBlank()) {
            throw new InvalidTopologyException("Exchange type is required");
        }
        for (ExchangeKind kind : values()) {
            if (kind.name().equalsIgnoreCase(type.trim())) {
                return kind;
            }
        }
        throw new InvalidTopologyException("Unknown exchange type: " + type);
    }
}
