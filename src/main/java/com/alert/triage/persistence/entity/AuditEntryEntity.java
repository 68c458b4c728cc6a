package com.alert.triage.persistence.entity;

import com.alert.triage.domain.DecisionReason;
import com.alert.triage.domain.Severity;
import com.alert.triage.domain.Verdict;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persistent audit entry: alert snapshot and decision, flattened into one row.
 * Rows are inserted once and never updated.
 */
@Entity
@Table(name = "alert_audit_log", indexes = {
    @Index(name = "idx_audit_alert_id", columnList = "alert_id"),
    @Index(name = "idx_audit_host", columnList = "host_normalized"),
    @Index(name = "idx_audit_decided_at", columnList = "decided_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "audit_seq", nullable = false, updatable = false)
    private Long sequence;

    @Column(name = "alert_id", nullable = false, updatable = false)
    private String alertId;

    @Column(name = "host", nullable = false, updatable = false)
    private String host;

    /** Lower-cased host, for case-insensitive lookups. */
    @Column(name = "host_normalized", nullable = false, updatable = false)
    private String hostNormalized;

    @Column(name = "title", length = 1000, updatable = false)
    private String title;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false, updatable = false)
    private Severity severity;

    @Column(name = "description", columnDefinition = "TEXT", updatable = false)
    private String description;

    @Column(name = "category", updatable = false)
    private String category;

    @Column(name = "source", updatable = false)
    private String source;

    @Column(name = "status", updatable = false)
    private String status;

    @Column(name = "alert_timestamp", nullable = false, updatable = false)
    private Instant alertTimestamp;

    @Column(name = "resolved_at", updatable = false)
    private Instant resolvedAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "verdict", nullable = false, updatable = false)
    private Verdict verdict;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, updatable = false)
    private DecisionReason reason;

    @Column(name = "rule_name", updatable = false)
    private String ruleName;

    @Column(name = "detail", length = 1000, updatable = false)
    private String detail;

    @Column(name = "score_probability", updatable = false)
    private Double scoreProbability;

    @Column(name = "score_confidence", updatable = false)
    private Double scoreConfidence;

    @Column(name = "score_explanation", columnDefinition = "TEXT", updatable = false)
    private String scoreExplanation;

    @Column(name = "decided_at", nullable = false, updatable = false)
    private Instant decidedAt;

    @Column(name = "recorded_at", nullable = false, updatable = false)
    private Instant recordedAt;

    @PrePersist
    protected void onCreate() {
        if (recordedAt == null) {
            recordedAt = Instant.now();
        }
    }
}
