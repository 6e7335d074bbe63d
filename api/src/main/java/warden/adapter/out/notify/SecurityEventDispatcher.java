package warden.adapter.out.notify;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;

import warden.core.model.threat.AlertSeverity;
import warden.core.port.out.SecurityNotifications;
import warden.spi.AuditEntry;
import warden.spi.AuditSink;
import warden.spi.NotificationChannel;
import warden.spi.NotificationDispatcher;

/**
 * Dispatches notifications and audit entries to registered handlers.
 *
 * <p>Dispatchers and sinks are discovered via {@link ServiceLoader} and invoked
 * in priority order (highest priority first) on a single background thread, so
 * request processing never waits for delivery.
 */
@ApplicationScoped
public class SecurityEventDispatcher implements SecurityNotifications {

    private static final Logger LOG = Logger.getLogger(SecurityEventDispatcher.class);

    private List<NotificationDispatcher> dispatchers = List.of();
    private List<AuditSink> sinks = List.of();
    private ExecutorService executor;

    public SecurityEventDispatcher() {}

    /**
     * Creates a dispatcher with explicit handlers (for testing).
     */
    SecurityEventDispatcher(List<NotificationDispatcher> dispatchers, List<AuditSink> sinks) {
        this.dispatchers = sortDispatchers(dispatchers);
        this.sinks = sortSinks(sinks);
        this.executor = newExecutor();
    }

    @PostConstruct
    void init() {
        dispatchers = sortDispatchers(ServiceLoader.load(NotificationDispatcher.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList());
        sinks = sortSinks(ServiceLoader.load(AuditSink.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList());

        if (dispatchers.isEmpty()) {
            LOG.warn("No notification dispatchers found - notifications will be dropped");
        } else {
            LOG.infof(
                    "Loaded %d notification dispatcher(s): %s",
                    dispatchers.size(),
                    dispatchers.stream()
                            .map(d -> d.name() + "(priority=" + d.priority() + ")")
                            .toList());
        }
        if (sinks.isEmpty()) {
            LOG.warn("No audit sinks found - audit entries will be dropped");
        } else {
            LOG.infof(
                    "Loaded %d audit sink(s): %s",
                    sinks.size(), sinks.stream().map(AuditSink::name).toList());
        }

        executor = newExecutor();
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        dispatchers.forEach(dispatcher -> {
            try {
                dispatcher.close();
            } catch (Exception e) {
                LOG.warnf("Error closing dispatcher %s: %s", dispatcher.name(), e.getMessage());
            }
        });
        sinks.forEach(sink -> {
            try {
                sink.close();
            } catch (Exception e) {
                LOG.warnf("Error closing audit sink %s: %s", sink.name(), e.getMessage());
            }
        });
    }

    @Override
    public void notify(NotificationChannel channel, AlertSeverity severity, String message) {
        if (dispatchers.isEmpty()) {
            return;
        }
        submit(() -> {
            for (var dispatcher : dispatchers) {
                try {
                    dispatcher.notify(channel, severity, message);
                } catch (Exception e) {
                    LOG.warnf("Dispatcher %s failed to deliver %s notification: %s",
                            dispatcher.name(), channel, e.getMessage());
                }
            }
        });
    }

    @Override
    public void audit(AuditEntry entry) {
        if (sinks.isEmpty()) {
            return;
        }
        submit(() -> {
            for (var sink : sinks) {
                try {
                    sink.append(entry);
                } catch (Exception e) {
                    LOG.warnf("Audit sink %s failed to append %s: %s", sink.name(), entry.action(), e.getMessage());
                }
            }
        });
    }

    private void submit(Runnable task) {
        try {
            executor.submit(task);
        } catch (RejectedExecutionException e) {
            LOG.debugf("Dispatcher shut down, dropping event: %s", e.getMessage());
        }
    }

    private static List<NotificationDispatcher> sortDispatchers(List<NotificationDispatcher> loaded) {
        return loaded.stream()
                .filter(NotificationDispatcher::isAvailable)
                .sorted(Comparator.comparingInt(NotificationDispatcher::priority).reversed())
                .toList();
    }

    private static List<AuditSink> sortSinks(List<AuditSink> loaded) {
        return loaded.stream()
                .filter(AuditSink::isAvailable)
                .sorted(Comparator.comparingInt(AuditSink::priority).reversed())
                .toList();
    }

    private static ExecutorService newExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            var thread = new Thread(r, "security-event-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }
}
