package com.alert.triage.domain;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Final verdict for one alert together with the reasoning behind it.
 */
@Value
@Builder
public class Decision {

    String alertId;
    Verdict verdict;
    DecisionReason reason;
    /** Score that was considered, or null when scoring was skipped or unavailable. */
    SuppressionScore score;
    /** Name of the business rule for {@link DecisionReason#RULE_FORCED}; null otherwise. */
    String ruleName;
    /** Human-readable explanation, safe to show to operators as-is. */
    String detail;
    Instant decidedAt;

    public boolean isSuppressed() {
        return verdict == Verdict.SUPPRESS;
    }
}
