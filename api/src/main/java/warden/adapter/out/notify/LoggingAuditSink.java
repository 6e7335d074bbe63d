package warden.adapter.out.notify;

import java.util.Map;
import java.util.stream.Collectors;

import org.jboss.logging.Logger;

import warden.spi.AuditEntry;
import warden.spi.AuditSink;

/**
 * Audit sink that writes one log line per entry to the {@code warden.audit}
 * category. Route that category to a dedicated handler to keep an audit trail.
 */
public class LoggingAuditSink implements AuditSink {

    private static final Logger LOG = Logger.getLogger("warden.audit");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public void append(AuditEntry entry) {
        LOG.infof(
                "AUDIT: action=%s outcome=%s actor=%s resource=%s/%s at=%s %s",
                entry.action(),
                entry.outcome(),
                entry.actorId() != null ? entry.actorId() : "-",
                entry.resourceType(),
                entry.resourceId() != null ? entry.resourceId() : "-",
                entry.timestamp(),
                format(entry));
    }

    private static String format(AuditEntry entry) {
        return entry.metadata().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(" "));
    }
}
