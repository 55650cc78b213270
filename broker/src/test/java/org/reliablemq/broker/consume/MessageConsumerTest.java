package org.reliablemq.broker.consume;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.reliablemq.broker.connection.BrokerConnection;
import org.reliablemq.broker.connection.ConnectionException;
import org.reliablemq.broker.delivery.DeliveryPolicy;
import org.reliablemq.broker.delivery.DeliveryTracker;
import org.reliablemq.broker.model.BrokerMessage;
import org.reliablemq.broker.publish.MessagePublisher;
import org.reliablemq.broker.publish.PublishTarget;
import org.reliablemq.broker.topology.TopologyManager;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class MessageConsumerTest {

    private static final String QUEUE = "inbound";

    private BrokerConnection connection;
    private TopologyManager topology;
    private MessagePublisher publisher;
    private Channel channel;

    /** deliveries the mocked broker pushes as soon as the consumer subscribes */
    private final List<Delivery> deliveries = new ArrayList<>();

    private record Delivery(long tag, Integer attempts, String body) {}

    @BeforeEach
    void setUp() throws Exception {
        connection = mock(BrokerConnection.class);
        topology = mock(TopologyManager.class);
        publisher = mock(MessagePublisher.class);
        channel = mock(Channel.class);
        when(connection.ensureChannel()).thenReturn(channel);
        when(channel.isOpen()).thenReturn(true);

        when(channel.basicConsume(eq(QUEUE), eq(false), any(Consumer.class))).thenAnswer(inv -> {
            Consumer consumer = inv.getArgument(2);
            for (Delivery d : deliveries) {
                AMQP.BasicProperties.Builder props = new AMQP.BasicProperties.Builder();
                if (d.attempts() != null) {
                    props.headers(Map.of(DeliveryTracker.ATTEMPTS_HEADER, d.attempts()));
                }
                consumer.handleDelivery("ctag-1", new Envelope(d.tag(), false, "", QUEUE), props.build(),
                        d.body().getBytes(StandardCharsets.UTF_8));
            }
            consumer.handleCancelOk("ctag-1");
            return "ctag-1";
        });
    }

    private MessageConsumer consumer(DeliveryPolicy policy) {
        return new MessageConsumer(connection, topology, publisher, new DeliveryTracker(policy));
    }

    private MessageConsumer consumer() {
        return consumer(DeliveryPolicy.builder().defaultConsumeQueue(QUEUE).build());
    }

    private void deliver(long tag, Integer attempts, String body) {
        deliveries.add(new Delivery(tag, attempts, body));
    }

    // ========== Outcomes ==========

    @Test
    void successfulHandlerAcksExactlyOnce() throws Exception {
        deliver(1, null, "order-1");
        List<String> seen = new ArrayList<>();

        consumer().consume(message -> seen.add(new String(message.getBody(), StandardCharsets.UTF_8)));

        assertThat(seen).containsExactly("order-1");
        verify(channel, times(1)).basicAck(1L, false);
        verifyNoInteractions(publisher);
        verify(topology).ensureQueue(QUEUE);
        verify(channel).basicQos(10);
    }

    @Test
    void failedHandlerRequeuesCopyThenAcksOriginal() throws Exception {
        deliver(1, 4, "order-1");
        ArgumentCaptor<BrokerMessage> requeued = ArgumentCaptor.forClass(BrokerMessage.class);

        consumer().consume(message -> false);

        InOrder order = inOrder(publisher, channel);
        order.verify(publisher).publish(requeued.capture(), eq(PublishTarget.queue(QUEUE)));
        order.verify(channel).basicAck(1L, false);
        verify(channel, times(1)).basicAck(anyLong(), anyBoolean());
        assertThat(requeued.getValue().getHeader(DeliveryTracker.ATTEMPTS_HEADER)).isEqualTo(5);
        assertThat(new String(requeued.getValue().getBody(), StandardCharsets.UTF_8)).isEqualTo("order-1");
    }

    @Test
    void throwingHandlerIsTreatedAsFailure() throws Exception {
        deliver(1, null, "order-1");
        ArgumentCaptor<BrokerMessage> requeued = ArgumentCaptor.forClass(BrokerMessage.class);

        consumer().consume(message -> {
            throw new IllegalStateException("database down");
        });

        verify(publisher).publish(requeued.capture(), eq(PublishTarget.queue(QUEUE)));
        assertThat(requeued.getValue().getHeader(DeliveryTracker.ATTEMPTS_HEADER)).isEqualTo(1);
        verify(channel, times(1)).basicAck(1L, false);
    }

    @Test
    void handlerErrorIsTreatedAsFailure() throws Exception {
        deliver(1, null, "order-1");
        deliver(2, null, "order-2");
        ArgumentCaptor<BrokerMessage> requeued = ArgumentCaptor.forClass(BrokerMessage.class);
        MessageConsumer consumer = consumer();

        consumer.consume(message -> {
            if (message.getDeliveryTag() == 1) {
                throw new AssertionError("bug in handler");
            }
            return true;
        });

        verify(publisher).publish(requeued.capture(), eq(PublishTarget.queue(QUEUE)));
        assertThat(requeued.getValue().getHeader(DeliveryTracker.ATTEMPTS_HEADER)).isEqualTo(1);
        verify(channel, times(1)).basicAck(1L, false);
        verify(channel, times(1)).basicAck(2L, false);
        assertThat(consumer.isConsuming()).isFalse();
    }

    @Test
    void exhaustedMessageIsQuarantinedWithoutCallingHandler() throws Exception {
        deliver(1, 30, "poison");
        AtomicInteger calls = new AtomicInteger();
        ArgumentCaptor<BrokerMessage> quarantined = ArgumentCaptor.forClass(BrokerMessage.class);

        consumer().consume(message -> calls.incrementAndGet() > 0);

        assertThat(calls).hasValue(0);
        InOrder order = inOrder(publisher, channel);
        order.verify(publisher).publish(quarantined.capture(), eq(PublishTarget.queue("rejected")));
        order.verify(channel).basicAck(1L, false);
        assertThat(quarantined.getValue().getHeader(DeliveryTracker.ATTEMPTS_HEADER)).isEqualTo(30);
    }

    @Test
    void quarantineGoesToDeadLetterExchangeWhenConfigured() throws Exception {
        deliver(1, 3, "poison");
        DeliveryPolicy policy = DeliveryPolicy.builder()
                .defaultConsumeQueue(QUEUE)
                .maxDeliveryLimit(3)
                .deadLetterExchange("dlx")
                .build();

        consumer(policy).consume(message -> true);

        verify(publisher).publish(any(BrokerMessage.class), eq(PublishTarget.exchange("dlx", QUEUE)));
        verify(channel, times(1)).basicAck(1L, false);
    }

    @Test
    void emptyBodyIsQuarantined() throws Exception {
        deliver(1, null, "");

        consumer().consume(message -> true);

        verify(publisher).publish(any(BrokerMessage.class), eq(PublishTarget.queue("rejected")));
        verify(channel, times(1)).basicAck(1L, false);
    }

    @Test
    void lineageIsHandledLimitTimesThenQuarantined() throws Exception {
        DeliveryPolicy policy = DeliveryPolicy.builder().defaultConsumeQueue(QUEUE).maxDeliveryLimit(3).build();
        DeliveryTracker tracker = new DeliveryTracker(policy);
        AtomicInteger handled = new AtomicInteger();
        ArgumentCaptor<BrokerMessage> published = ArgumentCaptor.forClass(BrokerMessage.class);
        ArgumentCaptor<PublishTarget> targets = ArgumentCaptor.forClass(PublishTarget.class);

        // each round the broker hands back the copy published in the previous one
        Integer attempts = null;
        for (int round = 1; round <= 10; round++) {
            deliveries.clear();
            deliver(round, attempts, "flaky");
            consumer(policy).consume(message -> {
                handled.incrementAndGet();
                return false;
            });
            verify(publisher, times(round)).publish(published.capture(), targets.capture());
            if (!targets.getValue().equals(PublishTarget.queue(QUEUE))) {
                break;
            }
            attempts = tracker.getAttempts(published.getValue());
            assertThat(attempts).isLessThanOrEqualTo(policy.maxDeliveryLimit());
        }

        assertThat(handled).hasValue(3);
        assertThat(targets.getValue()).isEqualTo(PublishTarget.queue("rejected"));
        assertThat(tracker.getAttempts(published.getValue())).isEqualTo(3);
    }

    // ========== Failure paths ==========

    @Test
    void failedRequeueLeavesOriginalUnacked() throws Exception {
        deliver(1, null, "order-1");
        deliver(2, null, "order-2");
        doThrow(new ConnectionException("Failed to publish to queue 'inbound'"))
                .when(publisher).publish(any(), any(PublishTarget.class));

        consumer().consume(message -> false);

        verify(channel, never()).basicAck(anyLong(), anyBoolean());
        verify(channel).basicCancel("ctag-1");
        verify(channel).basicNack(1L, false, true);
        verify(channel).basicNack(2L, false, true);
        verify(publisher, times(1)).publish(any(), any(PublishTarget.class));
    }

    @Test
    void shutdownSignalEndsTheLoop() throws Exception {
        reset(channel);
        when(channel.isOpen()).thenReturn(false);
        when(channel.basicConsume(eq(QUEUE), eq(false), any(Consumer.class))).thenAnswer(inv -> {
            Consumer consumer = inv.getArgument(2);
            consumer.handleShutdownSignal("ctag-1", new ShutdownSignalException(true, false, null, channel));
            return "ctag-1";
        });
        MessageConsumer consumer = consumer();

        consumer.consume(message -> true);

        assertThat(consumer.isConsuming()).isFalse();
        verify(channel, never()).basicAck(anyLong(), anyBoolean());
    }

    @Test
    void subscribeFailureIsConnectionError() throws Exception {
        reset(channel);
        when(channel.basicConsume(eq(QUEUE), eq(false), any(Consumer.class)))
                .thenThrow(new IOException("access refused"));
        MessageConsumer consumer = consumer();

        assertThatThrownBy(() -> consumer.consume(message -> true))
                .isInstanceOf(ConnectionException.class)
                .hasMessageContaining(QUEUE);
        assertThat(consumer.isConsuming()).isFalse();
    }

    // ========== Subscription lifecycle ==========

    @Test
    void secondSubscriptionOnSameQueueIsRejected() {
        deliver(1, null, "order-1");
        MessageConsumer consumer = consumer();
        AtomicReference<Throwable> error = new AtomicReference<>();

        consumer.consume(message -> {
            try {
                consumer.consume(QUEUE, m -> true);
            } catch (IllegalStateException e) {
                error.set(e);
            }
            return true;
        });

        assertThat(error.get()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void consumingFlagFollowsTheSubscription() throws Exception {
        deliver(1, null, "order-1");
        MessageConsumer consumer = consumer();
        AtomicReference<Boolean> during = new AtomicReference<>();

        consumer.consume(message -> {
            during.set(consumer.isConsuming());
            return true;
        });

        assertThat(during.get()).isTrue();
        assertThat(consumer.isConsuming()).isFalse();
    }

    @Test
    void cancelAsksTheBrokerToStop() throws Exception {
        deliver(1, null, "order-1");
        MessageConsumer consumer = consumer();

        consumer.consume(message -> consumer.cancel(QUEUE));

        verify(channel).basicCancel("ctag-1");
        assertThat(consumer.cancel(QUEUE)).isFalse();
    }

    // ========== Worker pool ==========

    @Test
    void workerPoolRunsHandlersOffTheLoopButAcksOnIt() throws Exception {
        for (int tag = 1; tag <= 6; tag++) {
            deliver(tag, null, "order-" + tag);
        }
        Thread loopThread = Thread.currentThread();
        Queue<Thread> ackThreads = new ConcurrentLinkedQueue<>();
        Queue<String> handlerThreads = new ConcurrentLinkedQueue<>();
        doAnswer(inv -> {
            ackThreads.add(Thread.currentThread());
            return null;
        }).when(channel).basicAck(anyLong(), anyBoolean());
        DeliveryPolicy policy = DeliveryPolicy.builder().defaultConsumeQueue(QUEUE).workers(3).build();

        consumer(policy).consume(message -> {
            handlerThreads.add(Thread.currentThread().getName());
            return message.getDeliveryTag() % 2 == 0;
        });

        assertThat(handlerThreads).hasSize(6).allMatch(name -> name.startsWith("reliablemq-worker-" + QUEUE));
        assertThat(ackThreads).hasSize(6).allMatch(thread -> thread == loopThread);
        for (long tag = 1; tag <= 6; tag++) {
            verify(channel, times(1)).basicAck(tag, false);
        }
        verify(publisher, times(3)).publish(any(), eq(PublishTarget.queue(QUEUE)));
    }

    @Test
    void workerErrorStillSettlesTheDelivery() throws Exception {
        deliver(1, null, "order-1");
        deliver(2, null, "order-2");
        DeliveryPolicy policy = DeliveryPolicy.builder().defaultConsumeQueue(QUEUE).workers(2).build();

        assertTimeoutPreemptively(Duration.ofSeconds(10), () -> consumer(policy).consume(message -> {
            if (message.getDeliveryTag() == 1) {
                throw new StackOverflowError();
            }
            return true;
        }));

        verify(publisher, times(1)).publish(any(), eq(PublishTarget.queue(QUEUE)));
        verify(channel, times(1)).basicAck(1L, false);
        verify(channel, times(1)).basicAck(2L, false);
    }
}
