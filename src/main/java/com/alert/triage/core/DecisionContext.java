package com.alert.triage.core;

import com.alert.triage.config.EngineSettings;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.DuplicateResult;
import com.alert.triage.domain.SuppressionScore;
import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Everything the rule engine looks at for one alert.
 */
@Value
@Builder
public class DecisionContext {

    Alert alert;
    DuplicateResult duplicateResult;
    /** Related past alerts, newest last; empty when not fetched. */
    @Builder.Default
    List<Alert> history = List.of();
    /** Null when scoring was skipped or unavailable. */
    @With
    SuppressionScore score;
    @With
    EngineSettings settings;
}
