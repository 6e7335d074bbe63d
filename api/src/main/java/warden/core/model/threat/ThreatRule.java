package warden.core.model.threat;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One entry of the request inspection table.
 */
public record ThreatRule(Pattern pattern, ThreatCategory category) {

    /**
     * Fixed inspection table, evaluated in order.
     */
    public static final List<ThreatRule> DEFAULT_RULES = List.of(
            new ThreatRule(
                    Pattern.compile("(?i)\\b(select|union|insert|delete|drop|create|alter)\\b"),
                    ThreatCategory.SQL_INJECTION),
            new ThreatRule(
                    Pattern.compile("(?i)(<script|javascript:|vbscript:|onload=|onerror=)"),
                    ThreatCategory.SCRIPT_INJECTION),
            new ThreatRule(Pattern.compile("(\\.\\./|\\.\\.\\\\)"), ThreatCategory.PATH_TRAVERSAL),
            new ThreatRule(Pattern.compile("(?i)(eval\\(|exec\\(|system\\()"), ThreatCategory.CODE_INJECTION));

    public boolean matches(String input) {
        return input != null && pattern.matcher(input).find();
    }

    /**
     * First rule in {@code rules} matching any of the inputs.
     */
    public static Optional<ThreatRule> firstMatch(List<ThreatRule> rules, List<String> inputs) {
        for (var rule : rules) {
            for (var input : inputs) {
                if (rule.matches(input)) {
                    return Optional.of(rule);
                }
            }
        }
        return Optional.empty();
    }
}
