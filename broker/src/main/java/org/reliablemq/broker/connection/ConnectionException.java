package org.reliablemq.broker.connection;

import org.reliablemq.broker.BrokerException;

/**
 * Broker unreachable, or the connection/channel is gone.
 *
 * <p>Retried only inside {@link BrokerConnection#connect()}; everywhere else it is
 * fatal for the operation that raised it.</p>
 */
public class ConnectionException extends BrokerException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
