package com.alert.triage.scoring;

import com.alert.triage.domain.Alert;
import com.alert.triage.domain.SuppressionScore;

import java.util.List;

/**
 * Typed boundary to the external suppression predictor. Implementations make one remote call and
 * keep no state.
 */
public interface SuppressionScorer {

    /**
     * @param history related past alerts supplied by the caller, newest last
     * @throws ScoringUnavailableException on transport errors, timeouts or unusable responses
     */
    SuppressionScore score(Alert alert, List<Alert> history);
}
