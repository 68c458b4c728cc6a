package com.alert.triage.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Output of the external suppression predictor for one alert.
 */
@Value
@Builder
public class SuppressionScore {

    /** 0.0–1.0; likelihood that the alert is noise. */
    double probability;
    /** 0.0–1.0; how much the predictor trusts its own answer. */
    double confidence;
    String explanation;
}
