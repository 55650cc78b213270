package org.reliablemq.broker.model;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A message as seen by this layer: opaque body plus application headers.
 *
 * <p>Messages received from the broker also carry their delivery metadata
 * (delivery tag, exchange, routing key). Identity is the broker-assigned
 * delivery tag, never the content.</p>
 */
public class BrokerMessage {

    /** Persistent delivery mode, see AMQP 0-9-1 basic.properties */
    public static final int PERSISTENT = 2;

    private final byte[] body;

    /** Application headers, never null */
    private final Map<String, Object> headers;

    private final String contentType;
    private final String messageId;

    /** Broker-assigned tag, 0 when the message was not delivered by a broker */
    private final long deliveryTag;

    private final String exchange;
    private final String routingKey;
    private final boolean redelivered;

    private BrokerMessage(Builder builder) {
        this.body = builder.body;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
        this.contentType = builder.contentType;
        this.messageId = builder.messageId;
        this.deliveryTag = builder.deliveryTag;
        this.exchange = builder.exchange;
        this.routingKey = builder.routingKey;
        this.redelivered = builder.redelivered;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Wrap a delivery handed over by the RabbitMQ client.
     */
    public static BrokerMessage fromDelivery(Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
        Builder builder = builder().body(body);
        if (envelope != null) {
            builder.deliveryTag(envelope.getDeliveryTag())
                    .exchange(envelope.getExchange())
                    .routingKey(envelope.getRoutingKey())
                    .redelivered(envelope.isRedeliver());
        }
        if (properties != null) {
            if (properties.getHeaders() != null) builder.headers(properties.getHeaders());
            builder.contentType(properties.getContentType())
                    .messageId(properties.getMessageId());
        }
        return builder.build();
    }

    /**
     * Copy of the content (body, headers, content type, message id) without the
     * delivery metadata. Used to build the republished copy of a delivery.
     */
    public Builder toBuilder() {
        return builder()
                .body(body)
                .headers(headers)
                .contentType(contentType)
                .messageId(messageId);
    }

    /**
     * Properties for publishing this message: persistent, with its headers.
     */
    public AMQP.BasicProperties toProperties() {
        return new AMQP.BasicProperties.Builder()
                .deliveryMode(PERSISTENT)
                .contentType(contentType)
                .messageId(messageId)
                .headers(headers.isEmpty() ? null : new LinkedHashMap<>(headers))
                .build();
    }

    // --- Getters ---

    public byte[] getBody() { return body; }
    public Map<String, Object> getHeaders() { return headers; }
    public Object getHeader(String name) { return headers.get(name); }
    public String getContentType() { return contentType; }
    public String getMessageId() { return messageId; }
    public long getDeliveryTag() { return deliveryTag; }
    public String getExchange() { return exchange; }
    public String getRoutingKey() { return routingKey; }
    public boolean isRedelivered() { return redelivered; }

    public boolean isEmpty() {
        return body.length == 0;
    }

    public boolean hasDeliveryTag() {
        return deliveryTag > 0;
    }

    @Override
    public String toString() {
        return "BrokerMessage{" +
                "deliveryTag=" + deliveryTag +
                ", exchange='" + exchange + '\'' +
                ", routingKey='" + routingKey + '\'' +
                ", messageId='" + messageId + '\'' +
                ", headers=" + headers +
                ", bodyLength=" + body.length +
                '}';
    }

    // ========== Builder ==========

    public static class Builder {
        private byte[] body = new byte[0];
        private final Map<String, Object> headers = new LinkedHashMap<>();
        private String contentType;
        private String messageId;
        private long deliveryTag;
        private String exchange;
        private String routingKey;
        private boolean redelivered;

        public Builder body(byte[] body) { this.body = body == null ? new byte[0] : body; return this; }
        public Builder header(String name, Object value) { this.headers.put(name, value); return this; }
        public Builder removeHeader(String name) { this.headers.remove(name); return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder messageId(String messageId) { this.messageId = messageId; return this; }
        public Builder deliveryTag(long deliveryTag) { this.deliveryTag = deliveryTag; return this; }
        public Builder exchange(String exchange) { this.exchange = exchange; return this; }
        public Builder routingKey(String routingKey) { this.routingKey = routingKey; return this; }
        public Builder redelivered(boolean redelivered) { this.redelivered = redelivered; return this; }

        /** Adds all given headers, replacing existing keys */
        public Builder headers(Map<String, ?> headers) {
            if (headers != null) this.headers.putAll(headers);
            return this;
        }

        public BrokerMessage build() {
            Objects.requireNonNull(body, "body is required");
            return new BrokerMessage(this);
        }
    }
}
