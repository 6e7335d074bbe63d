package warden.spi;

/**
 * SPI for persisting audit records.
 *
 * <p>Sinks are discovered via {@link java.util.ServiceLoader} and receive entries
 * asynchronously; a failing sink never affects the request that produced the entry.
 *
 * <p>Register implementations in:
 * {@code META-INF/services/warden.spi.AuditSink}
 */
public interface AuditSink extends AutoCloseable {

    String name();

    default int priority() {
        return 0;
    }

    default boolean isAvailable() {
        return true;
    }

    void append(AuditEntry entry);

    @Override
    default void close() {}
}
