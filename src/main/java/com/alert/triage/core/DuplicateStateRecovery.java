package com.alert.triage.core;

import com.alert.triage.audit.AuditLog;
import com.alert.triage.config.EngineSettings;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps duplicate-window state usable across restarts and bounded over time: on start it replays
 * audit entries decided within the trailing window into the detector, then periodically drops
 * buckets for keys that went quiet.
 */
@Slf4j
@Component
public class DuplicateStateRecovery {

    private final DuplicateDetector duplicateDetector;
    private final AuditLog auditLog;
    private final EngineSettings settings;
    private final Clock clock;
    private final long purgeIntervalSeconds;
    private final ScheduledExecutorService scheduler;

    public DuplicateStateRecovery(DuplicateDetector duplicateDetector,
                                  AuditLog auditLog,
                                  EngineSettings settings,
                                  Clock clock,
                                  @Value("${alerting.engine.duplicate-purge-interval-seconds:60}") long purgeIntervalSeconds) {
        this.duplicateDetector = duplicateDetector;
        this.auditLog = auditLog;
        this.settings = settings;
        this.clock = clock;
        this.purgeIntervalSeconds = purgeIntervalSeconds;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        int restored = restore();
        log.info("Duplicate detector restored {} recent alert(s) from the audit log, tracking {} key(s)",
                restored, duplicateDetector.trackedKeys());
        if (purgeIntervalSeconds > 0) {
            scheduler.scheduleAtFixedRate(this::purgeIdle, purgeIntervalSeconds, purgeIntervalSeconds, TimeUnit.SECONDS);
        }
    }

    /**
     * @return number of audit entries replayed
     */
    public int restore() {
        Duration window = settings.getDuplicateWindow();
        List<AuditEntry> recent;
        try {
            recent = auditLog.query(AuditQuery.builder().from(Instant.now(clock).minus(window)).build());
        } catch (RuntimeException e) {
            log.warn("Could not read the audit log to restore duplicate state; starting empty: {}", e.getMessage());
            return 0;
        }
        for (AuditEntry entry : recent) {
            duplicateDetector.seed(entry.getAlert(), window);
        }
        return recent.size();
    }

    public int purgeIdle() {
        int removed = duplicateDetector.purgeIdle(Instant.now(clock), settings.getDuplicateWindow());
        if (removed > 0) {
            log.debug("Purged {} idle duplicate-window key(s), {} remaining", removed, duplicateDetector.trackedKeys());
        }
        return removed;
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }
}
