package com.alert.triage.domain;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Alert severity, ordered from most to least urgent. Monitoring sources still send
 * legacy spellings (Sev1, severity-2, P3 ...), so parsing accepts those aliases too.
 */
public enum Severity {
    CRITICAL(List.of("critical", "crit", "sev1", "sev-1", "severity-1", "severity1", "p1")),
    MAJOR(List.of("major", "high", "error", "sev2", "sev-2", "severity-2", "severity2", "p2")),
    WARNING(List.of("warning", "warn", "medium", "sev3", "sev-3", "severity-3", "severity3", "p3")),
    INFO(List.of("info", "informational", "low", "sev4", "sev-4", "severity-4", "severity4", "p4"));

    private static final Map<String, Severity> BY_ALIAS = new HashMap<>();

    static {
        for (Severity severity : values()) {
            for (String alias : severity.aliases) {
                BY_ALIAS.put(alias, severity);
            }
        }
    }

    private final List<String> aliases;

    Severity(List<String> aliases) {
        this.aliases = aliases;
    }

    /**
     * Resolve a raw severity string (case-insensitive, surrounding whitespace ignored).
     * @return empty for null, blank or unknown values
     */
    public static Optional<Severity> parse(String raw) {
        if (raw == null || raw.isBlank()) return Optional.empty();
        return Optional.ofNullable(BY_ALIAS.get(raw.trim().toLowerCase(Locale.ROOT)));
    }

    public boolean isCritical() {
        return this == CRITICAL;
    }
}
