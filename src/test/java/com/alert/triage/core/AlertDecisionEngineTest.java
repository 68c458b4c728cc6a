package com.alert.triage.core;

import com.alert.triage.api.AlertValidationException;
import com.alert.triage.api.AuditWriteFailureException;
import com.alert.triage.api.InvalidEngineConfigurationException;
import com.alert.triage.audit.AuditLog;
import com.alert.triage.audit.InMemoryAuditLog;
import com.alert.triage.config.EngineSettings;
import com.alert.triage.core.rules.FlappingAlertRule;
import com.alert.triage.core.rules.SelfResolvingAlertRule;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import com.alert.triage.domain.Decision;
import com.alert.triage.domain.DecisionReason;
import com.alert.triage.domain.RawAlert;
import com.alert.triage.domain.Severity;
import com.alert.triage.domain.SuppressionScore;
import com.alert.triage.domain.Verdict;
import com.alert.triage.history.AlertHistoryProvider;
import com.alert.triage.history.AuditLogHistoryProvider;
import com.alert.triage.scoring.ResilientSuppressionScorer;
import com.alert.triage.scoring.SuppressionScorer;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Pipeline tests for AlertDecisionEngine with real components and a mocked scorer.
 */
@ExtendWith(MockitoExtension.class)
class AlertDecisionEngineTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");
    private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    private static final EngineSettings SETTINGS = EngineSettings.builder()
            .scorerTimeout(Duration.ofMillis(200))
            .build();

    @Mock
    private SuppressionScorer suppressionScorer;

    private ExecutorService executor;
    private InMemoryAuditLog auditLog;
    private AlertDecisionEngine engine;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(2);
        auditLog = new InMemoryAuditLog(CLOCK);
        engine = engine(auditLog, new AuditLogHistoryProvider(auditLog, Duration.ofDays(7)));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private AlertDecisionEngine engine(AuditLog log, AlertHistoryProvider history) {
        DecisionRuleEngine ruleEngine = new DecisionRuleEngine(SETTINGS,
                List.of(new FlappingAlertRule(), new SelfResolvingAlertRule()), CLOCK);
        ResilientSuppressionScorer scorer = new ResilientSuppressionScorer(
                suppressionScorer, CircuitBreakerRegistry.ofDefaults(), executor);
        return new AlertDecisionEngine(new AlertNormalizer(), new DuplicateDetector(), history, scorer,
                ruleEngine, log, SETTINGS);
    }

    private static RawAlert raw(String id, String severity, Instant ts) {
        return RawAlert.builder()
                .id(id)
                .host("H")
                .title("T")
                .severity(severity)
                .source("prometheus")
                .timestamp(ts.toString())
                .build();
    }

    private void scoreWith(double probability, double confidence) {
        when(suppressionScorer.score(any(Alert.class), anyList())).thenReturn(SuppressionScore.builder()
                .probability(probability).confidence(confidence).explanation("model").build());
    }

    @Test
    void confidentNoisePredictionSuppressesWarning() {
        scoreWith(0.9, 0.95);

        Decision d = engine.process(raw("a1", "warning", NOW));

        assertThat(d.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(d.getReason()).isEqualTo(DecisionReason.ML_SUPPRESSED);
        assertThat(auditLog.size()).isEqualTo(1);
    }

    @Test
    void criticalIsKeptWithoutConsultingScorer() {
        Decision d = engine.process(raw("a1", "critical", NOW));

        assertThat(d.getVerdict()).isEqualTo(Verdict.KEEP);
        assertThat(d.getReason()).isEqualTo(DecisionReason.CRITICAL_FORCED);
        verifyNoInteractions(suppressionScorer);
    }

    @Test
    void repeatWithinWindowIsSuppressedWithoutScoring() {
        scoreWith(0.1, 0.9);
        Decision first = engine.process(raw("a1", "warning", NOW));

        Decision second = engine.process(raw("a2", "warning", NOW.plusSeconds(240)));

        assertThat(first.getVerdict()).isEqualTo(Verdict.KEEP);
        assertThat(second.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(second.getReason()).isEqualTo(DecisionReason.DUPLICATE_SUPPRESSED);
        verify(suppressionScorer, times(1)).score(any(Alert.class), anyList());
    }

    @Test
    void scorerTimeoutKeepsAlert() {
        when(suppressionScorer.score(any(Alert.class), anyList())).thenAnswer(inv -> {
            Thread.sleep(2_000);
            return SuppressionScore.builder().probability(1.0).confidence(1.0).build();
        });

        Decision d = engine.process(raw("a1", "warning", NOW));

        assertThat(d.getVerdict()).isEqualTo(Verdict.KEEP);
        assertThat(d.getReason()).isEqualTo(DecisionReason.KEPT_LOW_CONFIDENCE);
        assertThat(d.getScore()).isNull();
    }

    @Test
    void missingTimestampIsRejectedWithoutAuditEntry() {
        RawAlert noTimestamp = RawAlert.builder().id("a1").host("H").title("T").severity("warning").build();

        assertThatThrownBy(() -> engine.process(noTimestamp))
                .isInstanceOf(AlertValidationException.class)
                .hasMessageContaining("timestamp");
        assertThat(auditLog.size()).isZero();
        verifyNoInteractions(suppressionScorer);
    }

    @Test
    void rejectedAlertDoesNotCountForDuplicates() {
        scoreWith(0.1, 0.9);
        RawAlert badSeverity = raw("a0", "urgent", NOW);
        assertThatThrownBy(() -> engine.process(badSeverity)).isInstanceOf(AlertValidationException.class);

        assertThat(engine.process(raw("a1", "warning", NOW)).getReason()).isEqualTo(DecisionReason.KEPT_LOW_CONFIDENCE);
    }

    @Test
    void everyDecisionIsAuditedBeforeReturn() {
        scoreWith(0.2, 0.9);

        AuditEntry entry = engine.processAndAudit(raw("a1", "major", NOW), SETTINGS);

        assertThat(entry.getSequence()).isPositive();
        assertThat(auditLog.query(AuditQuery.builder().alertId("a1").build()))
                .singleElement()
                .extracting(AuditEntry::getDecision)
                .isEqualTo(entry.getDecision());
    }

    @Test
    void overridesApplyToSingleCall() {
        scoreWith(0.6, 0.9);
        EngineSettings lenient = SETTINGS.toBuilder().suppressionThreshold(0.5).build();

        Decision overridden = engine.process(raw("a1", "warning", NOW), lenient);
        Decision defaults = engine.process(raw("b1", "warning", NOW).toBuilder().title("Other").build());

        assertThat(overridden.getReason()).isEqualTo(DecisionReason.ML_SUPPRESSED);
        assertThat(defaults.getReason()).isEqualTo(DecisionReason.KEPT_LOW_CONFIDENCE);
    }

    @Test
    void invalidOverridesAreRejected() {
        EngineSettings unsafe = SETTINGS.toBuilder().criticalAlwaysForward(false).build();

        assertThatThrownBy(() -> engine.process(raw("a1", "warning", NOW), unsafe))
                .isInstanceOf(InvalidEngineConfigurationException.class);
        assertThat(auditLog.size()).isZero();
    }

    @Test
    void auditFailureIsSurfaced() {
        AuditLog broken = new AuditLog() {
            @Override
            public AuditEntry append(Alert alert, Decision decision) {
                throw new IllegalStateException("disk full");
            }

            @Override
            public List<AuditEntry> query(AuditQuery query) {
                return List.of();
            }
        };
        AlertDecisionEngine failing = engine(broken, (alert, limit) -> List.of());

        assertThatThrownBy(() -> failing.process(raw("a1", "critical", NOW)))
                .isInstanceOf(AuditWriteFailureException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void retryAfterFailedAuditIsNotTreatedAsDuplicate() {
        scoreWith(0.1, 0.9);
        AtomicBoolean failNext = new AtomicBoolean(true);
        AuditLog flaky = new AuditLog() {
            @Override
            public AuditEntry append(Alert alert, Decision decision) {
                if (failNext.getAndSet(false)) {
                    throw new IllegalStateException("connection reset");
                }
                return auditLog.append(alert, decision);
            }

            @Override
            public List<AuditEntry> query(AuditQuery query) {
                return auditLog.query(query);
            }
        };
        AlertDecisionEngine retrying = engine(flaky, (alert, limit) -> List.of());
        RawAlert alert = raw("a1", "warning", NOW);

        assertThatThrownBy(() -> retrying.process(alert)).isInstanceOf(AuditWriteFailureException.class);
        Decision retried = retrying.process(alert);

        assertThat(retried.getVerdict()).isEqualTo(Verdict.KEEP);
        assertThat(retried.getReason()).isEqualTo(DecisionReason.KEPT_LOW_CONFIDENCE);
        assertThat(auditLog.size()).isEqualTo(1);
    }

    @Test
    void historyFailureFallsBackToEmptyHistory() {
        scoreWith(0.1, 0.9);
        AlertDecisionEngine noHistory = engine(auditLog, (alert, limit) -> {
            throw new IllegalStateException("history store down");
        });

        assertThat(noHistory.process(raw("a1", "warning", NOW)).getVerdict()).isEqualTo(Verdict.KEEP);
        assertThat(auditLog.size()).isEqualTo(1);
    }

    @Test
    void flappingHistoryIsSuppressedByRule() {
        String[] statuses = {"triggered", "resolved", "triggered"};
        for (int i = 0; i < statuses.length; i++) {
            Instant ts = NOW.minusSeconds((20 - i * 7L) * 60);
            Alert past = Alert.builder().id("p" + i).host("H").title("T")
                    .severity(Severity.WARNING).status(statuses[i]).timestamp(ts).build();
            auditLog.append(past, Decision.builder().alertId(past.getId()).verdict(Verdict.KEEP)
                    .reason(DecisionReason.KEPT_LOW_CONFIDENCE).decidedAt(ts).build());
        }

        Decision d = engine.process(raw("a1", "warning", NOW).toBuilder().status("resolved").build());

        assertThat(d.getVerdict()).isEqualTo(Verdict.SUPPRESS);
        assertThat(d.getReason()).isEqualTo(DecisionReason.RULE_FORCED);
        assertThat(d.getRuleName()).isEqualTo("flapping");
        verifyNoInteractions(suppressionScorer);
    }
}
