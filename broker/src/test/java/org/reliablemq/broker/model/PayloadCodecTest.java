package org.reliablemq.broker.model;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PayloadCodecTest {

    private final PayloadCodec codec = new PayloadCodec();

    public record Order(String id, int quantity) {}

    @Test
    void rawBytesGoOutVerbatim() {
        byte[] bytes = {0x01, 0x02, (byte) 0xff};

        BrokerMessage message = codec.toMessage(Payload.raw(bytes), null);

        assertThat(message.getBody()).containsExactly(0x01, 0x02, 0xff);
        assertThat(message.getContentType()).isNull();
    }

    @Test
    void structuredValuesBecomeJson() {
        BrokerMessage message = codec.toMessage(Payload.json(new Order("o-1", 3)), Map.of("tenant", "acme"));

        assertThat(message.getContentType()).isEqualTo(PayloadCodec.JSON_CONTENT_TYPE);
        assertThat(message.getHeader("tenant")).isEqualTo("acme");
        assertThat(codec.decode(message, Order.class)).isEqualTo(new Order("o-1", 3));
    }

    @Test
    void plainObjectsAreTreatedAsStructured() {
        JsonNode json = codec.readTree(codec.toMessage(Map.of("k", 1), null));

        assertThat(json.get("k").asInt()).isEqualTo(1);
    }

    @Test
    void prebuiltMessagesKeepContentButDropDeliveryMetadata() {
        BrokerMessage delivered = BrokerMessage.builder()
                .body("x".getBytes(StandardCharsets.UTF_8))
                .messageId("m-1")
                .deliveryTag(17)
                .header("a", 1)
                .build();

        BrokerMessage message = codec.toMessage(delivered, Map.of("b", 2));

        assertThat(message.getMessageId()).isEqualTo("m-1");
        assertThat(message.hasDeliveryTag()).isFalse();
        assertThat(message.getHeaders()).containsEntry("a", 1).containsEntry("b", 2);
    }

    @Test
    void undecodableBodyFails() {
        BrokerMessage garbage = BrokerMessage.builder().body("not json".getBytes(StandardCharsets.UTF_8)).build();

        assertThatThrownBy(() -> codec.decode(garbage, Order.class))
                .isInstanceOf(PayloadCodec.PayloadCodecException.class)
                .hasMessageContaining("Order");
    }
}
