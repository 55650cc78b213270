package org.reliablemq.broker.topology;

import java.util.List;

/**
 * The full set of queues, exchanges and bindings a process depends on.
 */
public record TopologyDefinition(
        List<QueueSpec> queues,
        List<ExchangeSpec> exchanges,
        List<BindingSpec> bindings
) {
    public TopologyDefinition {
        queues = queues == null ? List.of() : List.copyOf(queues);
        exchanges = exchanges == null ? List.of() : List.copyOf(exchanges);
        bindings = bindings == null ? List.of() : List.copyOf(bindings);
    }

    public static TopologyDefinition empty() {
        return new TopologyDefinition(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return queues.isEmpty() && exchanges.isEmpty() && bindings.isEmpty();
    }
}
