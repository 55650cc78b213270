package org.reliablemq.broker.model;

/**
 * Application data handed to the publisher.
 *
 * <p>Either bytes that go on the wire as they are, or a value that
 * {@link PayloadCodec} serializes to JSON first. Pre-built
 * {@link BrokerMessage}s bypass this type entirely.</p>
 */
public interface Payload {

    static Payload raw(byte[] bytes) {
        return new RawBytes(bytes);
    }

    static Payload json(Object value) {
        return new StructuredValue(value);
    }

    record RawBytes(byte[] bytes) implements Payload {}

    record StructuredValue(Object value) implements Payload {}
}
