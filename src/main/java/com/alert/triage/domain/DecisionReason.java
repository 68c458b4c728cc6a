package com.alert.triage.domain;

/**
 * Which rule produced a verdict. Stored with every audit entry.
 */
public enum DecisionReason {
    /** Same host/title/severity seen inside the duplicate window. */
    DUPLICATE_SUPPRESSED,
    /** Predictor was confident enough that the alert is noise. */
    ML_SUPPRESSED,
    /** Critical alerts are always kept. */
    CRITICAL_FORCED,
    /** A deterministic business rule (flapping, self-resolving, ...) decided. */
    RULE_FORCED,
    /** No confident suppression signal, including when no score was available. */
    KEPT_LOW_CONFIDENCE
}
