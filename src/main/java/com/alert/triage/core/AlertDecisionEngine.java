package com.alert.triage.core;

import com.alert.triage.api.AuditWriteFailureException;
import com.alert.triage.audit.AuditLog;
import com.alert.triage.config.EngineSettings;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.Decision;
import com.alert.triage.domain.DuplicateResult;
import com.alert.triage.domain.RawAlert;
import com.alert.triage.domain.SuppressionScore;
import com.alert.triage.history.AlertHistoryProvider;
import com.alert.triage.scoring.ResilientSuppressionScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Runs one alert through the pipeline: normalize, duplicate check, business rules, score (only
 * when still undecided), decide, audit. A decision is returned only once its audit entry exists.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlertDecisionEngine {

    private final AlertNormalizer normalizer;
    private final DuplicateDetector duplicateDetector;
    private final AlertHistoryProvider historyProvider;
    private final ResilientSuppressionScorer scorer;
    private final DecisionRuleEngine ruleEngine;
    private final AuditLog auditLog;
    private final EngineSettings settings;

    public Decision process(RawAlert raw) {
        return processAndAudit(raw, settings).getDecision();
    }

    /**
     * Process with request-level settings instead of the engine defaults.
     */
    public Decision process(RawAlert raw, EngineSettings overrides) {
        return processAndAudit(raw, overrides).getDecision();
    }

    /**
     * @throws com.alert.triage.api.InvalidEngineConfigurationException if {@code effective} is invalid
     * @throws com.alert.triage.api.AlertValidationException before any state change if the alert is malformed
     * @throws AuditWriteFailureException if the decision could not be recorded
     */
    public AuditEntry processAndAudit(RawAlert raw, EngineSettings effective) {
        effective.validate();
        Alert alert = normalizer.normalize(raw);

        DuplicateResult duplicate = duplicateDetector.check(alert, effective.getDuplicateWindow());
        List<Alert> history = needsHistory(alert, duplicate) ? fetchHistory(alert, effective) : List.of();
        DecisionContext context = DecisionContext.builder()
                .alert(alert)
                .duplicateResult(duplicate)
                .history(history)
                .settings(effective)
                .build();

        Decision decision = ruleEngine.decideWithoutScore(context).orElseGet(() -> {
            Optional<SuppressionScore> score = scorer.tryScore(alert, history, effective.getScorerTimeout());
            return ruleEngine.decide(context.withScore(score.orElse(null)));
        });

        AuditEntry entry;
        try {
            entry = auditLog.append(alert, decision);
        } catch (AuditWriteFailureException e) {
            duplicateDetector.forget(alert);
            throw e;
        } catch (RuntimeException e) {
            duplicateDetector.forget(alert);
            log.error("Audit append failed: alertId={} verdict={}", alert.getId(), decision.getVerdict(), e);
            throw new AuditWriteFailureException("Could not record decision for alert " + alert.getId(), e);
        }
        log.info("Alert decided: alertId={} host={} severity={} verdict={} reason={} sequence={}",
                alert.getId(), alert.getHost(), alert.getSeverity(), decision.getVerdict(), decision.getReason(), entry.getSequence());
        return entry;
    }

    /** Critical and duplicate alerts are settled before anything that reads history. */
    private static boolean needsHistory(Alert alert, DuplicateResult duplicate) {
        return !alert.getSeverity().isCritical() && !duplicate.isDuplicate();
    }

    private List<Alert> fetchHistory(Alert alert, EngineSettings effective) {
        try {
            return historyProvider.fetchHistory(alert, effective.getHistoryLimit());
        } catch (RuntimeException e) {
            log.warn("History lookup failed for alertId={}; deciding without history: {}", alert.getId(), e.getMessage());
            return List.of();
        }
    }
}
