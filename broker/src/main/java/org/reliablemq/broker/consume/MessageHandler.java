package org.reliablemq.broker.consume;

import org.reliablemq.broker.model.BrokerMessage;

/**
 * Application callback for consumed messages.
 *
 * <p>Return {@code true} when the message was processed. Returning {@code false}
 * or throwing sends the message back to its queue with the attempt counter
 * advanced; once the counter reaches the delivery limit the message is
 * quarantined instead of being handed to the handler again.</p>
 *
 * <p>Handlers must not acknowledge messages themselves.</p>
 */
@FunctionalInterface
public interface MessageHandler {

    boolean handle(BrokerMessage message) throws Exception;
}
