package com.alert.triage.api;

import com.alert.triage.config.EngineSettings;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * Optional per-request engine overrides. Absent fields keep the service defaults.
 * {@code critical_always_forward=false} passes binding and is rejected by {@link EngineSettings#validate()}.
 */
@Data
public class EngineConfigurationDto {

    @JsonProperty("suppression_threshold")
    @DecimalMin(value = "0.0", message = "suppression_threshold must be >= 0")
    @DecimalMax(value = "1.0", message = "suppression_threshold must be <= 1")
    private Double suppressionThreshold;

    @JsonProperty("duplicate_window_minutes")
    @Positive(message = "duplicate_window_minutes must be > 0")
    private Integer duplicateWindowMinutes;

    @JsonProperty("critical_always_forward")
    private Boolean criticalAlwaysForward;

    @JsonProperty("min_score_confidence")
    @DecimalMin(value = "0.0", message = "min_score_confidence must be >= 0")
    @DecimalMax(value = "1.0", message = "min_score_confidence must be <= 1")
    private Double minScoreConfidence;

    public EngineSettings applyTo(EngineSettings defaults) {
        EngineSettings.EngineSettingsBuilder builder = defaults.toBuilder();
        if (suppressionThreshold != null) builder.suppressionThreshold(suppressionThreshold);
        if (duplicateWindowMinutes != null) builder.duplicateWindowMinutes(duplicateWindowMinutes);
        if (criticalAlwaysForward != null) builder.criticalAlwaysForward(criticalAlwaysForward);
        if (minScoreConfidence != null) builder.minScoreConfidence(minScoreConfidence);
        return builder.build();
    }
}
