package com.alert.triage.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Immutable audit record: the alert as it was decided on, and the decision made.
 */
@Value
@Builder
public class AuditEntry {

    /** Monotonically increasing, assigned by the audit log on append. */
    long sequence;
    String alertId;
    Alert alert;
    Decision decision;
    Instant recordedAt;
}
