package demo;

import org.reliablemq.broker.ReliableBroker;
import org.reliablemq.broker.delivery.DeliveryTracker;
import org.reliablemq.broker.model.BrokerMessage;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 展示重试和隔离：处理失败的消息带着递增的 x-delivery-attempts 重新入队，
 * 超过 max-delivery-limit 后被转到 reject 队列。
 *
 * 运行: java -cp "lib/*" demo.RetryExample
 */
public class RetryExample {

    public static void main(String[] args) {
        var broker = ReliableBroker.fromClasspath("broker.yml");
        broker.connect();

        // 先放一条测试消息进去
        broker.publishToQueue("flaky job".getBytes(StandardCharsets.UTF_8),
                broker.getPolicy().defaultConsumeQueue(), null);

        Runtime.getRuntime().addShutdownHook(new Thread(broker::close));

        var tracker = new DeliveryTracker(broker.getPolicy());
        broker.consume(message -> handle(tracker, message));
    }

    private static boolean handle(DeliveryTracker tracker, BrokerMessage message) {
        int attempts = tracker.getAttempts(message);
        System.out.printf("delivery %d, attempt %d/%d%n",
                message.getDeliveryTag(), attempts + 1, tracker.getPolicy().maxDeliveryLimit());

        // 模拟不稳定的下游服务
        if (ThreadLocalRandom.current().nextInt(4) != 0) {
            throw new IllegalStateException("downstream unavailable");
        }
        return true;
    }
}
