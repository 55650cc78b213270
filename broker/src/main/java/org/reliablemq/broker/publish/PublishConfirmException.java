package org.reliablemq.broker.publish;

import org.reliablemq.broker.BrokerException;

/**
 * A batch publish was not fully confirmed by the broker.
 *
 * <p>{@link #getResult()} tells which entries failed. The batch as a whole must
 * be treated as not delivered; retrying it is up to the caller.</p>
 */
public class PublishConfirmException extends BrokerException {

    private final transient BatchPublishResult result;

    public PublishConfirmException(String message, BatchPublishResult result) {
        super(message);
        this.result = result;
    }

    public PublishConfirmException(String message, BatchPublishResult result, Throwable cause) {
        super(message, cause);
        this.result = result;
    }

    public BatchPublishResult getResult() {
        return result;
    }
}
