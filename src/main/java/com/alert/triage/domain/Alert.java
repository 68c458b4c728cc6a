package com.alert.triage.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Validated, canonical alert. Immutable once produced by the normalizer.
 */
@Value
@Builder
public class Alert {

    String id;
    String host;
    String title;
    Severity severity;
    String description;
    String category;
    String source;
    /** Optional source-side state; empty string when the source did not send one. */
    String status;
    /** UTC instant the alert was raised. */
    Instant timestamp;
    /** When the source reported the alert as resolved, if it has been. */
    Instant resolvedAt;
}
