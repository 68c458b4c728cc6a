package com.alert.triage.config;

import com.alert.triage.audit.AuditLog;
import com.alert.triage.audit.InMemoryAuditLog;
import com.alert.triage.history.AlertHistoryProvider;
import com.alert.triage.history.AuditLogHistoryProvider;
import com.alert.triage.persistence.repository.AuditEntryRepository;
import com.alert.triage.persistence.service.JpaAuditLog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Wires the decision engine: settings from {@code alerting.engine.*}, audit store selection,
 * history source and the executor that runs scorer calls.
 */
@Slf4j
@Configuration
public class EngineConfig {

    @Value("${alerting.engine.suppression-threshold:0.8}")
    private double suppressionThreshold;
    @Value("${alerting.engine.min-score-confidence:0.5}")
    private double minScoreConfidence;
    @Value("${alerting.engine.duplicate-window-minutes:5}")
    private int duplicateWindowMinutes;
    @Value("${alerting.engine.critical-always-forward:true}")
    private boolean criticalAlwaysForward;
    @Value("${alerting.engine.scorer-timeout-ms:2000}")
    private long scorerTimeoutMs;
    @Value("${alerting.engine.history-limit:50}")
    private int historyLimit;
    @Value("${alerting.engine.pattern-rules.enabled:true}")
    private boolean patternRulesEnabled;
    @Value("${alerting.engine.pattern-rules.flapping-window-minutes:30}")
    private int flappingWindowMinutes;
    @Value("${alerting.engine.pattern-rules.flapping-threshold:3}")
    private int flappingThreshold;
    @Value("${alerting.engine.pattern-rules.self-resolve-threshold-minutes:15}")
    private int selfResolveThresholdMinutes;
    @Value("${alerting.engine.pattern-rules.min-resolution-count:3}")
    private int minResolutionCount;
    @Value("${alerting.engine.pattern-rules.self-resolve-ratio:0.7}")
    private double selfResolveRatio;
    @Value("${alerting.engine.pattern-rules.self-resolve-lookback-days:7}")
    private int selfResolveLookbackDays;

    @Value("${alerting.ml.executor-threads:8}")
    private int scoringThreads;

    /** Fails startup on invalid values, including critical-always-forward=false. */
    @Bean
    public EngineSettings engineSettings() {
        EngineSettings settings = EngineSettings.builder()
                .suppressionThreshold(suppressionThreshold)
                .minScoreConfidence(minScoreConfidence)
                .duplicateWindowMinutes(duplicateWindowMinutes)
                .criticalAlwaysForward(criticalAlwaysForward)
                .scorerTimeout(Duration.ofMillis(scorerTimeoutMs))
                .historyLimit(historyLimit)
                .patternRulesEnabled(patternRulesEnabled)
                .flappingWindowMinutes(flappingWindowMinutes)
                .flappingThreshold(flappingThreshold)
                .selfResolveThresholdMinutes(selfResolveThresholdMinutes)
                .minResolutionCount(minResolutionCount)
                .selfResolveRatio(selfResolveRatio)
                .selfResolveLookbackDays(selfResolveLookbackDays)
                .build()
                .validate();
        log.info("Engine settings: {}", settings);
        return settings;
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = "alerting.audit.store", havingValue = "jpa")
    public AuditLog jpaAuditLog(AuditEntryRepository repository) {
        log.info("Audit log: JPA store");
        return new JpaAuditLog(repository);
    }

    @Bean
    @ConditionalOnProperty(name = "alerting.audit.store", havingValue = "memory", matchIfMissing = true)
    public AuditLog inMemoryAuditLog(Clock clock) {
        log.info("Audit log: in-memory store (not durable)");
        return new InMemoryAuditLog(clock);
    }

    /** Default history source; replace with your own bean to read from a warehouse instead. */
    @Bean
    @ConditionalOnMissingBean(AlertHistoryProvider.class)
    public AlertHistoryProvider alertHistoryProvider(AuditLog auditLog) {
        return new AuditLogHistoryProvider(auditLog, Duration.ofDays(selfResolveLookbackDays));
    }

    @Bean(name = "scoringExecutor", destroyMethod = "shutdownNow")
    public ExecutorService scoringExecutor() {
        return Executors.newFixedThreadPool(scoringThreads);
    }
}
