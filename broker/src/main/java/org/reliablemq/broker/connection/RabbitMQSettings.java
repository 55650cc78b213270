package org.reliablemq.broker.connection;

/**
 * Endpoint and credentials for a RabbitMQ broker.
 *
 * @param host              RabbitMQ host
 * @param port              RabbitMQ port (default 5672)
 * @param username          user name
 * @param password          password
 * @param virtualHost       virtual host (default "/")
 * @param ssl               enable SSL/TLS
 * @param connectionTimeout connection timeout in milliseconds
 * @param heartbeat         AMQP heartbeat interval in seconds
 * @param connectionName    client-provided connection name shown in the management UI
 */
public record RabbitMQSettings(
        String host,
        int port,
        String username,
        String password,
        String virtualHost,
        boolean ssl,
        int connectionTimeout,
        int heartbeat,
        String connectionName
) {
    public RabbitMQSettings(String host, int port, String username, String password) {
        this(host, port, username, password, "/", false, 10_000, 30, "reliablemq");
    }

    @Override
    public String toString() {
        // without the password
        return "RabbitMQSettings[" + username + "@" + host + ":" + port + virtualHostPath() + ", ssl=" + ssl + "]";
    }

    private String virtualHostPath() {
        if (virtualHost == null || virtualHost.isEmpty()) return "/";
        return virtualHost.startsWith("/") ? virtualHost : "/" + virtualHost;
    }
}
