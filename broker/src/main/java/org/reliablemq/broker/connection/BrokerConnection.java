package org.reliablemq.broker.connection;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the process-wide RabbitMQ {@link Connection} and its {@link Channel}.
 *
 * <p>State is either disconnected or a (connection, channel) pair; the pair is
 * replaced as a whole, so no reader ever sees a connection without a channel.
 * This is the only class that mutates it. Every other component obtains the
 * channel through {@link #ensureChannel()} right before using it.</p>
 *
 * <p>Reconnection is explicit: {@link #connect()} retries a fixed number of times
 * with a fixed delay and then gives up. The client's automatic recovery is
 * switched off and nothing schedules a restart.</p>
 */
public class BrokerConnection implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnection.class);

    private final ConnectionFactory factory;
    private final String connectionName;
    private final int maxConnectionRetries;
    private final Duration retryDelay;

    /** null while disconnected */
    private volatile Session session;

    /** incremented on every successful connect */
    private final AtomicLong epoch = new AtomicLong();

    public BrokerConnection(RabbitMQSettings settings, int maxConnectionRetries, Duration retryDelay) {
        this(createConnectionFactory(settings), settings.connectionName(), maxConnectionRetries, retryDelay);
    }

    public BrokerConnection(ConnectionFactory factory, String connectionName,
                            int maxConnectionRetries, Duration retryDelay) {
        if (maxConnectionRetries < 0) {
            throw new IllegalArgumentException("maxConnectionRetries must be >= 0: " + maxConnectionRetries);
        }
        this.factory = factory;
        this.connectionName = connectionName;
        this.maxConnectionRetries = maxConnectionRetries;
        this.retryDelay = retryDelay == null ? Duration.ZERO : retryDelay;
    }

    // ========== Lifecycle ==========

    /**
     * Open the connection and its channel, blocking until success or until the
     * retry budget is spent. At least one attempt is always made.
     *
     * @throws ConnectionException when every attempt failed; state is then disconnected
     */
    public synchronized void connect() {
        if (isConnected()) {
            ensureChannel();
            log.debug("Already connected to RabbitMQ, connect() ignored");
            return;
        }
        closeSession(session);
        session = null;

        int attempts = Math.max(1, maxConnectionRetries);
        log.info("Connecting to RabbitMQ {}:{} (attempts={}, retryDelay={}ms)",
                factory.getHost(), factory.getPort(), attempts, retryDelay.toMillis());

        Exception lastError = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            Connection connection = null;
            try {
                connection = factory.newConnection(connectionName);
                Channel channel = connection.createChannel();
                if (channel == null) {
                    throw new IOException("No free channel number on connection");
                }
                session = new Session(connection, channel);
                long current = epoch.incrementAndGet();
                log.info("Succeeded in establishing connection with RabbitMQ (attempt {}/{}, epoch {})",
                        attempt, attempts, current);
                return;
            } catch (IOException | TimeoutException | RuntimeException e) {
                lastError = e;
                closeQuietly(connection);
                log.warn("Connection attempt {}/{} to RabbitMQ failed: {}", attempt, attempts, e.getMessage());
            }

            if (attempt < attempts) {
                pause();
            }
        }

        log.error("Failed to establish connection with RabbitMQ after {} attempts", attempts);
        throw new ConnectionException(
                "Failed to connect to RabbitMQ " + factory.getHost() + ":" + factory.getPort()
                        + " after " + attempts + " attempts", lastError);
    }

    /**
     * Return the live channel, reopening it if the broker closed it while the
     * connection stayed up. Must be called before every channel operation.
     *
     * @throws ConnectionException if there is no live connection
     */
    public synchronized Channel ensureChannel() {
        Session current = session;
        if (current == null || !current.connection().isOpen()) {
            throw new ConnectionException("Not connected to RabbitMQ broker");
        }
        if (current.channel().isOpen()) {
            return current.channel();
        }

        try {
            Channel channel = current.connection().createChannel();
            if (channel == null) {
                throw new ConnectionException("No free channel number on connection");
            }
            session = new Session(current.connection(), channel);
            log.info("Channel was closed by the broker, reopened as channel {}", channel.getChannelNumber());
            return channel;
        } catch (IOException e) {
            log.error("Failed to reopen channel: {}", e.getMessage(), e);
            throw new ConnectionException("Failed to reopen channel", e);
        }
    }

    /**
     * Release channel then connection. Safe to call repeatedly or while disconnected.
     */
    @Override
    public synchronized void close() {
        Session current = session;
        session = null;
        if (current != null) {
            closeSession(current);
            log.info("RabbitMQ connection closed");
        }
    }

    // ========== Probes ==========

    public boolean isConnected() {
        Session current = session;
        try {
            return current != null && current.connection().isOpen();
        } catch (RuntimeException e) {
            return false;
        }
    }

    public boolean isChannelOpen() {
        Session current = session;
        try {
            return current != null && current.channel().isOpen();
        } catch (RuntimeException e) {
            return false;
        }
    }

    public long getEpoch() {
        return epoch.get();
    }

    public String getConnectionName() {
        return connectionName;
    }

    // ========== Internal ==========

    private void pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConnectionException("Interrupted while waiting to reconnect to RabbitMQ", e);
        }
    }

    private static void closeSession(Session current) {
        if (current == null) return;
        try { if (current.channel().isOpen()) current.channel().close(); }
        catch (Exception e) { log.debug("Error closing channel: {}", e.getMessage()); }
        closeQuietly(current.connection());
    }

    private static void closeQuietly(Connection connection) {
        try { if (connection != null && connection.isOpen()) connection.close(); }
        catch (Exception e) { log.debug("Error closing connection: {}", e.getMessage()); }
    }

    static ConnectionFactory createConnectionFactory(RabbitMQSettings settings) {
        ConnectionFactory factory = new ConnectionFactory();
        factory.setHost(settings.host());
        factory.setPort(settings.port());
        if (settings.username() != null) factory.setUsername(settings.username());
        if (settings.password() != null) factory.setPassword(settings.password());
        if (settings.virtualHost() != null) factory.setVirtualHost(settings.virtualHost());
        factory.setConnectionTimeout(settings.connectionTimeout());
        factory.setRequestedHeartbeat(settings.heartbeat());

        // reconnect policy lives in connect()
        factory.setAutomaticRecoveryEnabled(false);
        factory.setTopologyRecoveryEnabled(false);

        if (settings.ssl()) {
            try {
                factory.useSslProtocol();
            } catch (Exception e) {
                throw new ConnectionException("Failed to configure SSL", e);
            }
        }
        return factory;
    }

    private record Session(Connection connection, Channel channel) {}
}
