package org.reliablemq.broker.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.reliablemq.broker.BrokerException;

import java.util.Map;

/**
 * The single boundary where application data becomes message bytes.
 *
 * <p>Accepted content:</p>
 * <ul>
 *   <li>{@link BrokerMessage}: used as is (headers may still be merged)</li>
 *   <li>{@link Payload.RawBytes} or {@code byte[]}: body taken verbatim</li>
 *   <li>{@link Payload.StructuredValue} or any other object: JSON via Jackson</li>
 * </ul>
 */
public class PayloadCodec {

    public static final String JSON_CONTENT_TYPE = "application/json";

    private final ObjectMapper objectMapper;

    public PayloadCodec() {
        this(new ObjectMapper());
    }

    public PayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Build the message to publish from arbitrary content.
     *
     * @param content application content, see class docs
     * @param headers headers merged over the content's own headers (may be null)
     */
    public BrokerMessage toMessage(Object content, Map<String, ?> headers) {
        BrokerMessage.Builder builder;
        if (content instanceof BrokerMessage message) {
            builder = message.toBuilder();
        } else if (content instanceof Payload.RawBytes raw) {
            builder = BrokerMessage.builder().body(raw.bytes());
        } else if (content instanceof byte[] bytes) {
            builder = BrokerMessage.builder().body(bytes);
        } else if (content instanceof Payload.StructuredValue structured) {
            builder = json(structured.value());
        } else {
            builder = json(content);
        }
        return builder.headers(headers).build();
    }

    /**
     * Decode a JSON body into the requested type.
     */
    public <T> T decode(BrokerMessage message, Class<T> type) {
        try {
            return objectMapper.readValue(message.getBody(), type);
        } catch (Exception e) {
            throw new PayloadCodecException("Failed to decode message body as " + type.getSimpleName(), e);
        }
    }

    public JsonNode readTree(BrokerMessage message) {
        try {
            return objectMapper.readTree(message.getBody());
        } catch (Exception e) {
            throw new PayloadCodecException("Failed to parse message body as JSON", e);
        }
    }

    private BrokerMessage.Builder json(Object value) {
        try {
            return BrokerMessage.builder()
                    .body(objectMapper.writeValueAsBytes(value))
                    .contentType(JSON_CONTENT_TYPE);
        } catch (Exception e) {
            throw new PayloadCodecException("Failed to encode payload of type "
                    + (value == null ? "null" : value.getClass().getName()), e);
        }
    }

    public static class PayloadCodecException extends BrokerException {
        public PayloadCodecException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
