package com.alert.triage.core.rules;

import com.alert.triage.domain.Alert;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * History slicing shared by the pattern rules.
 */
final class AlertHistoryFilters {

    private AlertHistoryFilters() {
    }

    /** Same host and title as {@code alert} (case-insensitive), raised in [from, alert time], oldest first. */
    static List<Alert> sameSourceSince(Alert alert, List<Alert> history, Instant from) {
        Instant to = alert.getTimestamp();
        return history.stream()
                .filter(a -> a.getHost().equalsIgnoreCase(alert.getHost()))
                .filter(a -> a.getTitle().equalsIgnoreCase(alert.getTitle()))
                .filter(a -> !a.getTimestamp().isBefore(from) && !a.getTimestamp().isAfter(to))
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .collect(Collectors.toList());
    }
}
