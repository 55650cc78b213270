package org.reliablemq.broker.topology;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Routes messages from an exchange to a queue.
 */
public record BindingSpec(
        String exchange,
        String queue,
        String routingKey,
        Map<String, Object> arguments
) {
    public static BindingSpec of(String exchange, String queue) {
        return new BindingSpec(exchange, queue, "", null);
    }

    public static BindingSpec of(String exchange, String queue, String routingKey) {
        return new BindingSpec(exchange, queue, routingKey, null);
    }

    /**
     * Expand the compact "exchange → queues" form, binding with an empty routing key.
     * <pre>
     * BindingSpec.fromMap(Map.of("orders", List.of("billing", "shipping")))
     * </pre>
     */
    public static List<BindingSpec> fromMap(Map<String, ? extends List<String>> exchangeToQueues) {
        List<BindingSpec> bindings = new ArrayList<>();
        if (exchangeToQueues == null) return bindings;
        for (Map.Entry<String, ? extends List<String>> entry : exchangeToQueues.entrySet()) {
            if (entry.getValue() == null) continue;
            for (String queue : entry.getValue()) {
                bindings.add(of(entry.getKey(), queue));
            }
        }
        return bindings;
    }
}
