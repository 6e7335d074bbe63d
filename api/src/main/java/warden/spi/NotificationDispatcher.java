package warden.spi;

import warden.core.model.threat.AlertSeverity;

/**
 * SPI for delivering security notifications to people.
 *
 * <p>Platform teams implement this interface to connect alerting to their
 * mail, paging or chat systems. Implementations are discovered via
 * {@link java.util.ServiceLoader} and invoked off the request path.
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.NotificationDispatcher}
 */
public interface NotificationDispatcher extends AutoCloseable {

    /**
     * Returns the unique name of this dispatcher.
     */
    String name();

    /**
     * Higher priority dispatchers are invoked first. The built-in logging
     * dispatcher uses 0.
     */
    default int priority() {
        return 0;
    }

    /**
     * Whether this dispatcher can be used, for example because its credentials
     * are configured.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Deliver a notification. Dispatchers that do not support a channel ignore it.
     *
     * @param channel  the delivery channel
     * @param severity severity of the underlying alert
     * @param message  human-readable message
     */
    void notify(NotificationChannel channel, AlertSeverity severity, String message);

    @Override
    default void close() {}
}
