package demo;

import org.reliablemq.broker.ReliableBroker;
import org.reliablemq.broker.model.BrokerMessage;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * 最简单的用法：YAML 配置 + main 方法。
 *
 * 运行: java -cp "lib/*" demo.BasicExample broker.yml
 */
public class BasicExample {

    public static void main(String[] args) {
        // 1. 从 YAML 加载配置（没有参数时使用 classpath 中的 broker.yml）
        var broker = args.length > 0
                ? ReliableBroker.fromYaml(Path.of(args[0]))
                : ReliableBroker.fromClasspath("broker.yml");

        // 2. 连接（按配置重试）并声明队列/交换机
        broker.connect();
        System.out.println(broker.getStatus());

        // 3. Ctrl+C 时取消订阅并关闭连接
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("Shutting down...");
            broker.close();
        }));

        // 4. 阻塞消费默认队列；返回 false 或抛异常的消息会被重新入队
        System.out.println("Consuming " + broker.getPolicy().defaultConsumeQueue() + "... (Ctrl+C to stop)");
        broker.consume(BasicExample::onMessage);
    }

    private static boolean onMessage(BrokerMessage message) {
        System.out.printf("[%d] %s  attempts=%s%n",
                message.getDeliveryTag(),
                new String(message.getBody(), StandardCharsets.UTF_8),
                message.getHeader("x-delivery-attempts"));
        return true;
    }
}
