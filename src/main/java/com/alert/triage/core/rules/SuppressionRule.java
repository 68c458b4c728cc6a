package com.alert.triage.core.rules;

import com.alert.triage.core.DecisionContext;

import java.util.Optional;

/**
 * Deterministic business rule evaluated after the critical and duplicate checks and before the
 * predictor score. Implementations are Spring beans; {@code @Order} sets their position and the
 * first rule returning an outcome wins.
 */
public interface SuppressionRule {

    /** Short name stored with the decision, e.g. "flapping". */
    String getRuleName();

    Optional<RuleOutcome> evaluate(DecisionContext context);
}
