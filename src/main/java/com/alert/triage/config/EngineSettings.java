package com.alert.triage.config;

import com.alert.triage.api.InvalidEngineConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Immutable engine configuration. Injected at construction so several engines with different
 * settings can run side by side; request-level overrides are merged with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class EngineSettings {

    /** Minimum predicted probability needed to suppress a non-duplicate, non-critical alert. */
    @Builder.Default
    double suppressionThreshold = 0.8;
    /** Minimum predictor confidence for its probability to count. */
    @Builder.Default
    double minScoreConfidence = 0.5;
    @Builder.Default
    int duplicateWindowMinutes = 5;
    /** Must stay true; false is rejected by {@link #validate()}. */
    @Builder.Default
    boolean criticalAlwaysForward = true;
    /** Upper bound on a single scorer call. */
    @Builder.Default
    Duration scorerTimeout = Duration.ofSeconds(2);
    /** Max past alerts handed to the scorer and pattern rules. */
    @Builder.Default
    int historyLimit = 50;

    @Builder.Default
    boolean patternRulesEnabled = true;
    @Builder.Default
    int flappingWindowMinutes = 30;
    /** Status changes inside the flapping window that mark an alert as flapping. */
    @Builder.Default
    int flappingThreshold = 3;
    /** An alert resolved within this many minutes counts as a quick resolution. */
    @Builder.Default
    int selfResolveThresholdMinutes = 15;
    @Builder.Default
    int minResolutionCount = 3;
    /** Share of quick resolutions needed to call an alert self-resolving. */
    @Builder.Default
    double selfResolveRatio = 0.7;
    @Builder.Default
    int selfResolveLookbackDays = 7;

    public static EngineSettings defaults() {
        return EngineSettings.builder().build();
    }

    public Duration getDuplicateWindow() {
        return Duration.ofMinutes(duplicateWindowMinutes);
    }

    /**
     * @return this instance, for chaining
     * @throws InvalidEngineConfigurationException on the first invalid value
     */
    public EngineSettings validate() {
        requireUnitInterval("suppression_threshold", suppressionThreshold);
        requireUnitInterval("min_score_confidence", minScoreConfidence);
        requireUnitInterval("self_resolve_ratio", selfResolveRatio);
        if (duplicateWindowMinutes <= 0) {
            throw new InvalidEngineConfigurationException("duplicate_window_minutes must be > 0, was " + duplicateWindowMinutes);
        }
        if (!criticalAlwaysForward) {
            throw new InvalidEngineConfigurationException("critical_always_forward must be true: critical alerts are never suppressed");
        }
        if (scorerTimeout == null || scorerTimeout.isNegative() || scorerTimeout.isZero()) {
            throw new InvalidEngineConfigurationException("scorer timeout must be positive, was " + scorerTimeout);
        }
        if (historyLimit < 0) {
            throw new InvalidEngineConfigurationException("history limit must be >= 0, was " + historyLimit);
        }
        if (flappingWindowMinutes <= 0 || flappingThreshold <= 0) {
            throw new InvalidEngineConfigurationException("flapping window and threshold must be > 0");
        }
        if (selfResolveThresholdMinutes <= 0 || minResolutionCount <= 0 || selfResolveLookbackDays <= 0) {
            throw new InvalidEngineConfigurationException("self-resolve threshold, min count and lookback must be > 0");
        }
        return this;
    }

    private static void requireUnitInterval(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new InvalidEngineConfigurationException(name + " must be within [0, 1], was " + value);
        }
    }
}
