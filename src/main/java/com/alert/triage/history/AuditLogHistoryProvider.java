package com.alert.triage.history;

import com.alert.triage.audit.AuditLog;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * History taken from our own audit trail: alerts previously decided for the same host and title
 * over the lookback period. Replays of the same alert id keep their latest snapshot.
 */
@RequiredArgsConstructor
public class AuditLogHistoryProvider implements AlertHistoryProvider {

    private final AuditLog auditLog;
    private final Duration lookback;

    @Override
    public List<Alert> fetchHistory(Alert alert, int limit) {
        if (limit <= 0) return List.of();
        AuditQuery query = AuditQuery.builder()
                .host(alert.getHost())
                .from(alert.getTimestamp().minus(lookback))
                .build();
        Map<String, Alert> byId = new LinkedHashMap<>();
        for (AuditEntry entry : auditLog.query(query)) {
            Alert past = entry.getAlert();
            if (past.getId().equals(alert.getId())) continue;
            if (!past.getTitle().equalsIgnoreCase(alert.getTitle())) continue;
            byId.put(past.getId(), past);
        }
        List<Alert> sorted = byId.values().stream()
                .sorted(Comparator.comparing(Alert::getTimestamp))
                .collect(Collectors.toList());
        return sorted.size() > limit ? sorted.subList(sorted.size() - limit, sorted.size()) : sorted;
    }
}
