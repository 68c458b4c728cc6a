package com.alert.triage.api;

import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.Decision;
import com.alert.triage.domain.DecisionReason;
import com.alert.triage.domain.SuppressionScore;
import com.alert.triage.domain.Verdict;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * REST API response for a processed alert, also used for audit listings.
 */
@Value
@Builder(toBuilder = true)
public class DecisionResponseDto {

    String alertId;
    Verdict verdict;
    DecisionReason reason;
    /** Suppression probability, when a score was considered. */
    Double probability;
    Double confidence;
    String explanation;
    String ruleName;
    String detail;
    Instant decidedAt;
    /** Audit log position; null when the response is not backed by a stored entry. */
    Long auditSequence;

    public static DecisionResponseDto from(Decision decision) {
        if (decision == null) {
            throw new IllegalArgumentException("Decision cannot be null");
        }
        SuppressionScore score = decision.getScore();
        return DecisionResponseDto.builder()
                .alertId(decision.getAlertId())
                .verdict(decision.getVerdict())
                .reason(decision.getReason())
                .probability(score != null ? score.getProbability() : null)
                .confidence(score != null ? score.getConfidence() : null)
                .explanation(score != null ? score.getExplanation() : null)
                .ruleName(decision.getRuleName())
                .detail(decision.getDetail())
                .decidedAt(decision.getDecidedAt())
                .build();
    }

    public static DecisionResponseDto from(AuditEntry entry) {
        return from(entry.getDecision()).toBuilder().auditSequence(entry.getSequence()).build();
    }
}
