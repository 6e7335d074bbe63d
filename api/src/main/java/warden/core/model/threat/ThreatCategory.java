package warden.core.model.threat;

/**
 * Kinds of threat recognised by the monitor, with the severity and risk score
 * an alert of that kind starts with.
 */
public enum ThreatCategory {
    SQL_INJECTION("sql_injection", AlertSeverity.HIGH, 8.0, true),
    SCRIPT_INJECTION("script_injection", AlertSeverity.HIGH, 7.5, true),
    PATH_TRAVERSAL("path_traversal", AlertSeverity.MEDIUM, 6.5, false),
    CODE_INJECTION("code_injection", AlertSeverity.CRITICAL, 9.0, false),
    DENIAL_OF_SERVICE("denial_of_service", AlertSeverity.HIGH, 7.0, true),
    BRUTE_FORCE("brute_force", AlertSeverity.MEDIUM, 6.0, false);

    private final String wireName;
    private final AlertSeverity severity;
    private final double riskScore;
    private final boolean blocksImmediately;

    ThreatCategory(String wireName, AlertSeverity severity, double riskScore, boolean blocksImmediately) {
        this.wireName = wireName;
        this.severity = severity;
        this.riskScore = riskScore;
        this.blocksImmediately = blocksImmediately;
    }

    public String wireName() {
        return wireName;
    }

    public AlertSeverity severity() {
        return severity;
    }

    public double riskScore() {
        return riskScore;
    }

    /** Whether a detection of this kind blocks the source without waiting for the threat score. */
    public boolean blocksImmediately() {
        return blocksImmediately;
    }

    public static ThreatCategory fromWireName(String value) {
        for (var category : values()) {
            if (category.wireName.equals(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown threat category: " + value);
    }
}
