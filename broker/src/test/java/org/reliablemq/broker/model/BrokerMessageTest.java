package org.reliablemq.broker.model;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BrokerMessageTest {

    @Test
    void wrapsBrokerDelivery() {
        AMQP.BasicProperties props = new AMQP.BasicProperties.Builder()
                .headers(Map.of("x-delivery-attempts", 2))
                .contentType("text/plain")
                .messageId("m-9")
                .build();

        BrokerMessage message = BrokerMessage.fromDelivery(
                new Envelope(42L, true, "orders", "order.created"), props, new byte[]{1});

        assertThat(message.getDeliveryTag()).isEqualTo(42L);
        assertThat(message.isRedelivered()).isTrue();
        assertThat(message.getExchange()).isEqualTo("orders");
        assertThat(message.getRoutingKey()).isEqualTo("order.created");
        assertThat(message.getHeader("x-delivery-attempts")).isEqualTo(2);
        assertThat(message.getMessageId()).isEqualTo("m-9");
    }

    @Test
    void publishPropertiesArePersistent() {
        AMQP.BasicProperties props = BrokerMessage.builder().body(new byte[]{1}).build().toProperties();

        assertThat(props.getDeliveryMode()).isEqualTo(BrokerMessage.PERSISTENT);
        assertThat(props.getHeaders()).isNull();
    }

    @Test
    void headersAreImmutable() {
        BrokerMessage message = BrokerMessage.builder().header("a", 1).build();

        assertThatThrownBy(() -> message.getHeaders().put("b", 2))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(message.isEmpty()).isTrue();
    }
}
