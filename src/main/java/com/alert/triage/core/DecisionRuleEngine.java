package com.alert.triage.core;

import com.alert.triage.config.EngineSettings;
import com.alert.triage.core.rules.RuleOutcome;
import com.alert.triage.core.rules.SuppressionRule;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.Decision;
import com.alert.triage.domain.DecisionReason;
import com.alert.triage.domain.DuplicateResult;
import com.alert.triage.domain.SuppressionScore;
import com.alert.triage.domain.Verdict;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Turns duplicate status, business rules and the predictor score into a verdict.
 * Rules run in a fixed order and the first match wins:
 * <ol>
 *   <li>critical severity: keep (nothing below can override it)</li>
 *   <li>duplicate inside the window: suppress</li>
 *   <li>business rules ({@link SuppressionRule} beans, e.g. flapping, self-resolving)</li>
 *   <li>confident predictor score at or above the threshold: suppress</li>
 *   <li>otherwise keep; a missing score never leads to a silent drop</li>
 * </ol>
 */
@Slf4j
@Service
public class DecisionRuleEngine {

    private final EngineSettings defaultSettings;
    private final List<SuppressionRule> rules;
    private final Clock clock;

    public DecisionRuleEngine(EngineSettings defaultSettings, List<SuppressionRule> rules, Clock clock) {
        this.defaultSettings = defaultSettings;
        this.rules = List.copyOf(rules);
        this.clock = clock;
    }

    /**
     * Decide with the engine's default settings and no history.
     * @param score null when no score is available
     */
    public Decision decide(Alert alert, DuplicateResult duplicateResult, SuppressionScore score) {
        return decide(DecisionContext.builder()
                .alert(alert)
                .duplicateResult(duplicateResult)
                .score(score)
                .settings(defaultSettings)
                .build());
    }

    public Decision decide(DecisionContext context) {
        DecisionContext resolved = withSettings(context);
        return decideWithoutScore(resolved).orElseGet(() -> decideOnScore(resolved));
    }

    /**
     * Rules that do not need a score (1–3). When this returns a decision the scorer call can be skipped.
     */
    public Optional<Decision> decideWithoutScore(DecisionContext context) {
        context = withSettings(context);
        Alert alert = context.getAlert();
        EngineSettings settings = context.getSettings();

        if (alert.getSeverity().isCritical()) {
            return Optional.of(build(context, Verdict.KEEP, DecisionReason.CRITICAL_FORCED, null,
                    "Critical alert: always forwarded"));
        }

        DuplicateResult dup = context.getDuplicateResult();
        if (dup != null && dup.isDuplicate()) {
            return Optional.of(build(context, Verdict.SUPPRESS, DecisionReason.DUPLICATE_SUPPRESSED, null,
                    String.format("Duplicate: %d earlier alert(s) for the same host/title/severity since %s (window %d min)",
                            dup.getPriorCount(), dup.getMatchedAt(), settings.getDuplicateWindowMinutes())));
        }

        for (SuppressionRule rule : rules) {
            Optional<RuleOutcome> outcome = rule.evaluate(context);
            if (outcome.isPresent()) {
                log.debug("Rule {} decided alertId={} verdict={}", rule.getRuleName(), alert.getId(), outcome.get().getVerdict());
                return Optional.of(build(context, outcome.get().getVerdict(), DecisionReason.RULE_FORCED,
                        rule.getRuleName(), outcome.get().getDetail()));
            }
        }
        return Optional.empty();
    }

    private Decision decideOnScore(DecisionContext context) {
        EngineSettings settings = context.getSettings();
        SuppressionScore score = context.getScore();
        if (score == null) {
            return build(context, Verdict.KEEP, DecisionReason.KEPT_LOW_CONFIDENCE, null,
                    "No suppression score available: forwarded by default");
        }
        if (score.getProbability() >= settings.getSuppressionThreshold()
                && score.getConfidence() >= settings.getMinScoreConfidence()) {
            return build(context, Verdict.SUPPRESS, DecisionReason.ML_SUPPRESSED, null,
                    String.format("Predicted noise: probability %.2f >= %.2f (confidence %.2f)",
                            score.getProbability(), settings.getSuppressionThreshold(), score.getConfidence()));
        }
        return build(context, Verdict.KEEP, DecisionReason.KEPT_LOW_CONFIDENCE, null,
                String.format("No confident suppression: probability %.2f (threshold %.2f), confidence %.2f (floor %.2f)",
                        score.getProbability(), settings.getSuppressionThreshold(),
                        score.getConfidence(), settings.getMinScoreConfidence()));
    }

    private Decision build(DecisionContext context, Verdict verdict, DecisionReason reason, String ruleName, String detail) {
        Alert alert = context.getAlert();
        if (verdict == Verdict.SUPPRESS && alert.getSeverity().isCritical()) {
            throw new IllegalStateException("Refusing to suppress critical alert " + alert.getId());
        }
        return Decision.builder()
                .alertId(alert.getId())
                .verdict(verdict)
                .reason(reason)
                .score(context.getScore())
                .ruleName(ruleName)
                .detail(detail)
                .decidedAt(Instant.now(clock))
                .build();
    }

    private DecisionContext withSettings(DecisionContext context) {
        return context.getSettings() != null ? context : context.withSettings(defaultSettings);
    }
}
