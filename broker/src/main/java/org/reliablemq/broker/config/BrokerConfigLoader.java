package org.reliablemq.broker.config;

import org.reliablemq.broker.BrokerException;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads {@link BrokerConfig} from a YAML file.
 *
 * <p>The legacy keys {@code max-rmq-delivery-limit}, {@code max-rmq-connection-retries}
 * and {@code max-rmq-connection-retry-delay} (milliseconds) are accepted in the
 * {@code delivery} section. Bindings may be a list of entries or the compact
 * "exchange: [queue, ...]" map.</p>
 */
public class BrokerConfigLoader {

    /**
     * Load config from a YAML file path.
     */
    public static BrokerConfig fromYaml(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return fromYaml(is);
        }
    }

    /**
     * Load config from a classpath resource.
     */
    public static BrokerConfig fromClasspath(String resource) {
        try (InputStream is = BrokerConfigLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalArgumentException("Resource not found: " + resource);
            }
            return fromYaml(is);
        } catch (IOException e) {
            throw new BrokerException("Failed to load config from classpath: " + resource, e);
        }
    }

    /**
     * Load config from an InputStream.
     */
    public static BrokerConfig fromYaml(InputStream is) {
        Yaml yaml = new Yaml();
        Map<String, Object> root = yaml.load(is);
        if (root == null) {
            throw new IllegalArgumentException("Empty broker configuration");
        }

        // Navigate to reliablemq.broker
        Map<String, Object> reliablemq = getMap(root, "reliablemq");
        Map<String, Object> broker = getMap(reliablemq, "broker");

        BrokerConfig config = new BrokerConfig();
        parseRabbitmq(getMapOrEmpty(broker, "rabbitmq"), config.getRabbitmq());
        parseDelivery(getMapOrEmpty(broker, "delivery"), config.getDelivery());
        parseTopology(getMapOrEmpty(broker, "topology"), config.getTopology());
        return config;
    }

    private static void parseRabbitmq(Map<String, Object> map, BrokerConfig.RabbitmqConfig rmq) {
        if (map.containsKey("host")) rmq.setHost(String.valueOf(map.get("host")));
        if (map.containsKey("port")) rmq.setPort(toInt(map.get("port"), 5672));
        if (map.containsKey("username")) rmq.setUsername(String.valueOf(map.get("username")));
        if (map.containsKey("password")) rmq.setPassword(String.valueOf(map.get("password")));
        if (map.containsKey("vhost")) rmq.setVhost(String.valueOf(map.get("vhost")));
        if (map.containsKey("ssl")) rmq.setSsl(Boolean.parseBoolean(String.valueOf(map.get("ssl"))));
        if (map.containsKey("connection-timeout"))
            rmq.setConnectionTimeout(toInt(map.get("connection-timeout"), 10_000));
        if (map.containsKey("heartbeat"))
            rmq.setHeartbeat(toInt(map.get("heartbeat"), 30));
        if (map.containsKey("connection-name"))
            rmq.setConnectionName(String.valueOf(map.get("connection-name")));
    }

    private static void parseDelivery(Map<String, Object> map, BrokerConfig.DeliveryConfig d) {
        // legacy names first, so the current names win when both are present
        if (map.containsKey("max-rmq-delivery-limit"))
            d.setMaxDeliveryLimit(toInt(map.get("max-rmq-delivery-limit"), d.getMaxDeliveryLimit()));
        if (map.containsKey("max-rmq-connection-retries"))
            d.setMaxConnectionRetries(toInt(map.get("max-rmq-connection-retries"), d.getMaxConnectionRetries()));
        if (map.containsKey("max-rmq-connection-retry-delay"))
            d.setRetryDelay(Duration.ofMillis(toLong(map.get("max-rmq-connection-retry-delay"),
                    d.getRetryDelay().toMillis())));

        if (map.containsKey("max-delivery-limit"))
            d.setMaxDeliveryLimit(toInt(map.get("max-delivery-limit"), d.getMaxDeliveryLimit()));
        if (map.containsKey("max-connection-retries"))
            d.setMaxConnectionRetries(toInt(map.get("max-connection-retries"), d.getMaxConnectionRetries()));
        if (map.containsKey("retry-delay"))
            d.setRetryDelay(parseDuration(String.valueOf(map.get("retry-delay"))));
        if (map.containsKey("reject-queue")) d.setRejectQueue(String.valueOf(map.get("reject-queue")));
        if (map.containsKey("dead-letter-exchange"))
            d.setDeadLetterExchange(String.valueOf(map.get("dead-letter-exchange")));
        if (map.containsKey("publish-queue")) d.setPublishQueue(String.valueOf(map.get("publish-queue")));
        if (map.containsKey("consume-queue")) d.setConsumeQueue(String.valueOf(map.get("consume-queue")));
        if (map.containsKey("strip-attempts-on-quarantine"))
            d.setStripAttemptsOnQuarantine(Boolean.parseBoolean(String.valueOf(map.get("strip-attempts-on-quarantine"))));
        if (map.containsKey("confirm-timeout"))
            d.setConfirmTimeout(parseDuration(String.valueOf(map.get("confirm-timeout"))));
        if (map.containsKey("prefetch-count")) d.setPrefetchCount(toInt(map.get("prefetch-count"), 10));
        if (map.containsKey("workers")) d.setWorkers(toInt(map.get("workers"), 1));
    }

    @SuppressWarnings("unchecked")
    private static void parseTopology(Map<String, Object> map, BrokerConfig.TopologyConfig topology) {
        for (Map<String, Object> q : getListOfMaps(map, "queues")) {
            BrokerConfig.QueueConfig queue = new BrokerConfig.QueueConfig();
            queue.setName(requireString(q, "name", "queue"));
            if (q.containsKey("durable")) queue.setDurable(Boolean.parseBoolean(String.valueOf(q.get("durable"))));
            if (q.containsKey("exclusive")) queue.setExclusive(Boolean.parseBoolean(String.valueOf(q.get("exclusive"))));
            if (q.containsKey("auto-delete")) queue.setAutoDelete(Boolean.parseBoolean(String.valueOf(q.get("auto-delete"))));
            queue.setArguments(getMapOrEmpty(q, "arguments"));
            topology.getQueues().add(queue);
        }

        for (Map<String, Object> x : getListOfMaps(map, "exchanges")) {
            BrokerConfig.ExchangeConfig exchange = new BrokerConfig.ExchangeConfig();
            exchange.setName(requireString(x, "name", "exchange"));
            if (x.containsKey("type")) exchange.setType(String.valueOf(x.get("type")));
            if (x.containsKey("durable")) exchange.setDurable(Boolean.parseBoolean(String.valueOf(x.get("durable"))));
            if (x.containsKey("auto-delete")) exchange.setAutoDelete(Boolean.parseBoolean(String.valueOf(x.get("auto-delete"))));
            exchange.setArguments(getMapOrEmpty(x, "arguments"));
            topology.getExchanges().add(exchange);
        }

        Object bindings = map.get("bindings");
        if (bindings instanceof Map<?, ?> compact) {
            // exchange: [queue, queue]
            for (Map.Entry<?, ?> entry : compact.entrySet()) {
                String exchange = String.valueOf(entry.getKey());
                Object queues = entry.getValue();
                List<Object> names = queues instanceof List<?> list ? (List<Object>) list : List.of(queues);
                for (Object queue : names) {
                    topology.getBindings().add(new BrokerConfig.BindingConfig(exchange, String.valueOf(queue), ""));
                }
            }
        } else {
            for (Map<String, Object> b : getListOfMaps(map, "bindings")) {
                BrokerConfig.BindingConfig binding = new BrokerConfig.BindingConfig(
                        requireString(b, "exchange", "binding"),
                        requireString(b, "queue", "binding"),
                        b.containsKey("routing-key") ? String.valueOf(b.get("routing-key")) : "");
                binding.setArguments(getMapOrEmpty(b, "arguments"));
                topology.getBindings().add(binding);
            }
        }
    }

    // ========== Utility ==========

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        throw new IllegalArgumentException("Missing or invalid key: " + key);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMapOrEmpty(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        if (val instanceof Map) return (Map<String, Object>) val;
        return new LinkedHashMap<>();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> getListOfMaps(Map<String, Object> parent, String key) {
        Object val = parent.get(key);
        List<Map<String, Object>> result = new ArrayList<>();
        if (val == null) return result;
        if (!(val instanceof List<?> list)) {
            throw new IllegalArgumentException("Key " + key + " must be a list");
        }
        for (Object item : list) {
            if (!(item instanceof Map)) {
                throw new IllegalArgumentException("Entries of " + key + " must be mappings");
            }
            result.add((Map<String, Object>) item);
        }
        return result;
    }

    private static String requireString(Map<String, Object> map, String key, String what) {
        Object val = map.get(key);
        if (val == null || String.valueOf(val).isBlank()) {
            throw new IllegalArgumentException("Missing '" + key + "' in " + what + " entry");
        }
        return String.valueOf(val);
    }

    private static int toInt(Object val, int defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.intValue();
        try {
            return Integer.parseInt(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    private static long toLong(Object val, long defaultVal) {
        if (val == null) return defaultVal;
        if (val instanceof Number n) return n.longValue();
        try {
            return Long.parseLong(String.valueOf(val).trim());
        } catch (NumberFormatException e) {
            return defaultVal;
        }
    }

    /**
     * Parse simple duration strings: "500ms", "3s", "1m", "1h".
     * Falls back to milliseconds if no unit specified.
     */
    static Duration parseDuration(String str) {
        if (str == null || str.isBlank()) return Duration.ofMillis(3000);
        str = str.trim().toLowerCase();
        if (str.endsWith("ms")) return Duration.ofMillis(Long.parseLong(str.substring(0, str.length() - 2).trim()));
        if (str.endsWith("s")) return Duration.ofSeconds(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        if (str.endsWith("m")) return Duration.ofMinutes(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        if (str.endsWith("h")) return Duration.ofHours(Long.parseLong(str.substring(0, str.length() - 1).trim()));
        return Duration.ofMillis(Long.parseLong(str));
    }
}
