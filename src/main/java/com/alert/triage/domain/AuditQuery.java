package com.alert.triage.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Filter for audit log reads. Null fields do not constrain the result; time bounds are
 * inclusive and apply to the decision time.
 */
@Value
@Builder
public class AuditQuery {

    String alertId;
    String host;
    Instant from;
    Instant to;
    /** Max entries to return (oldest first); null or non-positive means no limit. */
    Integer limit;

    public static AuditQuery all() {
        return AuditQuery.builder().build();
    }

    public boolean matches(AuditEntry entry) {
        if (alertId != null && !alertId.equals(entry.getAlertId())) return false;
        if (host != null && (entry.getAlert() == null || !host.equalsIgnoreCase(entry.getAlert().getHost()))) return false;
        Instant decidedAt = entry.getDecision() != null ? entry.getDecision().getDecidedAt() : null;
        if (from != null && (decidedAt == null || decidedAt.isBefore(from))) return false;
        if (to != null && (decidedAt == null || decidedAt.isAfter(to))) return false;
        return true;
    }

    public boolean hasLimit() {
        return limit != null && limit > 0;
    }
}
