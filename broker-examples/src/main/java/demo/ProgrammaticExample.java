package demo;

import org.reliablemq.broker.ReliableBroker;
import org.reliablemq.broker.config.BrokerConfig;
import org.reliablemq.broker.config.BrokerConfig.*;
import org.reliablemq.broker.model.Payload;
import org.reliablemq.broker.publish.BatchPublishResult;
import org.reliablemq.broker.publish.PublishConfirmException;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * 纯代码配置，不需要 YAML 文件。
 * 展示拓扑声明、单条发布和批量确认发布。
 */
public class ProgrammaticExample {

    public record Order(String id, String product, int quantity) {}

    public static void main(String[] args) {

        // ========== 1. 纯代码构建配置 ==========

        var config = new BrokerConfig();
        config.getRabbitmq().setHost("10.224.18.6");
        config.getRabbitmq().setUsername("orders");
        config.getRabbitmq().setPassword("password");
        config.getRabbitmq().setVhost("/orders");

        config.getDelivery().setMaxDeliveryLimit(5);
        config.getDelivery().setRetryDelay(Duration.ofSeconds(1));

        // fanout 交换机 orders → billing / shipping
        var exchange = new ExchangeConfig();
        exchange.setName("orders");
        exchange.setType("fanout");
        config.getTopology().getExchanges().add(exchange);

        for (String name : List.of("billing", "shipping")) {
            var queue = new QueueConfig();
            queue.setName(name);
            config.getTopology().getQueues().add(queue);
            config.getTopology().getBindings().add(new BindingConfig("orders", name, ""));
        }

        // ========== 2. 连接并发布 ==========

        try (var broker = new ReliableBroker(config)) {
            broker.connect();

            // 单条发布：对象会被序列化为 JSON
            broker.publishToExchange(Payload.json(new Order("o-1", "book", 1)), "orders",
                    Map.of("source", "demo"), "");

            // 批量发布：一次等待所有确认，任何一条失败整批报错
            var batch = List.of(
                    Payload.json(new Order("o-2", "pen", 10)),
                    Payload.json(new Order("o-3", "lamp", 2)),
                    Payload.json(new Order("o-4", "desk", 1)));
            try {
                BatchPublishResult result = broker.publishBatchToExchange(batch, "orders", null);
                System.out.println("Batch confirmed: " + result.total() + " messages");
            } catch (PublishConfirmException e) {
                System.err.println("Batch failed for entries " + e.getResult().failedIndexes());
            }

            System.out.println(broker.getStatus());
        }
    }
}
