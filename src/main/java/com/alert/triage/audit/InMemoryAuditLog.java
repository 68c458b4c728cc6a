package com.alert.triage.audit;

import com.alert.triage.api.AuditWriteFailureException;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import com.alert.triage.domain.Decision;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Process-local audit log. Entries live until the process exits; use the JPA store when the
 * trail has to survive restarts.
 */
@Slf4j
public class InMemoryAuditLog implements AuditLog {

    private static final Comparator<AuditEntry> BY_DECISION_TIME = Comparator
            .comparing((AuditEntry e) -> e.getDecision().getDecidedAt())
            .thenComparingLong(AuditEntry::getSequence);

    private final ConcurrentSkipListMap<Long, AuditEntry> entries = new ConcurrentSkipListMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Clock clock;

    public InMemoryAuditLog(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AuditEntry append(Alert alert, Decision decision) {
        if (alert == null || decision == null || decision.getDecidedAt() == null) {
            throw new AuditWriteFailureException("Audit entry needs an alert and a timestamped decision");
        }
        AuditEntry entry = AuditEntry.builder()
                .sequence(sequence.incrementAndGet())
                .alertId(alert.getId())
                .alert(alert)
                .decision(decision)
                .recordedAt(Instant.now(clock))
                .build();
        entries.put(entry.getSequence(), entry);
        log.debug("Audit entry appended: sequence={} alertId={}", entry.getSequence(), entry.getAlertId());
        return entry;
    }

    @Override
    public List<AuditEntry> query(AuditQuery query) {
        Stream<AuditEntry> matching = entries.values().stream()
                .filter(query::matches)
                .sorted(BY_DECISION_TIME);
        if (query.hasLimit()) {
            matching = matching.limit(query.getLimit());
        }
        return matching.collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
