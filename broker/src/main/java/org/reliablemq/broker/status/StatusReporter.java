package org.reliablemq.broker.status;

import org.reliablemq.broker.connection.BrokerConnection;
import org.reliablemq.broker.consume.MessageConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BooleanSupplier;

/**
 * Reports connection and consumption flags. Never throws.
 */
public class StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(StatusReporter.class);

    public static final String BROKER_NAME = "RabbitMQ";

    private final BrokerConnection connection;
    private final MessageConsumer consumer;

    /**
     * @param consumer may be null, in which case consuming is always false
     */
    public StatusReporter(BrokerConnection connection, MessageConsumer consumer) {
        this.connection = connection;
        this.consumer = consumer;
    }

    public BrokerStatus status() {
        boolean connected = probe("connected", connection::isConnected);
        boolean consuming = consumer != null && probe("consuming", consumer::isConsuming);
        return new BrokerStatus(BROKER_NAME, connected, consuming);
    }

    private static boolean probe(String name, BooleanSupplier check) {
        try {
            return check.getAsBoolean();
        } catch (Exception e) {
            log.debug("Status probe '{}' failed, reporting false: {}", name, e.getMessage());
            return false;
        }
    }
}
