package org.reliablemq.broker.topology;

import org.reliablemq.broker.BrokerException;

/**
 * Malformed or conflicting queue/exchange/binding declaration. Never retried.
 */
public class InvalidTopologyException extends BrokerException {

    public InvalidTopologyException(String message) {
        super(message);
    }

    public InvalidTopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
