package org.reliablemq.broker;

/**
 * Base class for failures raised by the broker layer.
 *
 * <p>Unchecked: callers decide where to catch. Subclasses identify the failing
 * concern (connection, topology, publish confirmation).</p>
 */
public class BrokerException extends RuntimeException {

    public BrokerException(String message) {
        super(message);
    }

    public BrokerException(String message, Throwable cause) {
        super(message, cause);
    }
}
