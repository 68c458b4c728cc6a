package com.alert.triage.persistence.service;

import com.alert.triage.api.AuditWriteFailureException;
import com.alert.triage.audit.AuditLog;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import com.alert.triage.domain.Decision;
import com.alert.triage.domain.SuppressionScore;
import com.alert.triage.persistence.entity.AuditEntryEntity;
import com.alert.triage.persistence.repository.AuditEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Audit log stored through Spring Data JPA, so it survives restarts and can seed the duplicate
 * detector on start. Works with whatever database the datasource points at.
 */
@Slf4j
@RequiredArgsConstructor
public class JpaAuditLog implements AuditLog {

    private static final Sort BY_DECISION_TIME = Sort.by("decidedAt", "sequence");

    private final AuditEntryRepository repository;

    @Override
    @Transactional
    public AuditEntry append(Alert alert, Decision decision) {
        AuditEntryEntity saved;
        try {
            saved = repository.saveAndFlush(toEntity(alert, decision));
        } catch (DataAccessException e) {
            log.error("Failed to persist audit entry: alertId={} verdict={}", alert.getId(), decision.getVerdict(), e);
            throw new AuditWriteFailureException("Could not persist audit entry for alert " + alert.getId(), e);
        }
        log.debug("Persisted audit entry: sequence={} alertId={}", saved.getSequence(), saved.getAlertId());
        return toAuditEntry(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEntry> query(AuditQuery query) {
        Specification<AuditEntryEntity> spec = toSpecification(query);
        List<AuditEntryEntity> rows = query.hasLimit()
                ? repository.findAll(spec, PageRequest.of(0, query.getLimit(), BY_DECISION_TIME)).getContent()
                : repository.findAll(spec, BY_DECISION_TIME);
        return rows.stream().map(JpaAuditLog::toAuditEntry).collect(Collectors.toList());
    }

    static Specification<AuditEntryEntity> toSpecification(AuditQuery query) {
        Specification<AuditEntryEntity> spec = Specification.where(null);
        if (query.getAlertId() != null) {
            spec = spec.and((root, q, cb) -> cb.equal(root.get("alertId"), query.getAlertId()));
        }
        if (query.getHost() != null) {
            String host = query.getHost().toLowerCase(Locale.ROOT);
            spec = spec.and((root, q, cb) -> cb.equal(root.get("hostNormalized"), host));
        }
        if (query.getFrom() != null) {
            spec = spec.and((root, q, cb) -> cb.greaterThanOrEqualTo(root.get("decidedAt"), query.getFrom()));
        }
        if (query.getTo() != null) {
            spec = spec.and((root, q, cb) -> cb.lessThanOrEqualTo(root.get("decidedAt"), query.getTo()));
        }
        return spec;
    }

    static AuditEntryEntity toEntity(Alert alert, Decision decision) {
        SuppressionScore score = decision.getScore();
        return AuditEntryEntity.builder()
                .alertId(alert.getId())
                .host(alert.getHost())
                .hostNormalized(alert.getHost().toLowerCase(Locale.ROOT))
                .title(alert.getTitle())
                .severity(alert.getSeverity())
                .description(alert.getDescription())
                .category(alert.getCategory())
                .source(alert.getSource())
                .status(alert.getStatus())
                .alertTimestamp(alert.getTimestamp())
                .resolvedAt(alert.getResolvedAt())
                .verdict(decision.getVerdict())
                .reason(decision.getReason())
                .ruleName(decision.getRuleName())
                .detail(decision.getDetail())
                .scoreProbability(score != null ? score.getProbability() : null)
                .scoreConfidence(score != null ? score.getConfidence() : null)
                .scoreExplanation(score != null ? score.getExplanation() : null)
                .decidedAt(decision.getDecidedAt())
                .build();
    }

    static AuditEntry toAuditEntry(AuditEntryEntity entity) {
        Alert alert = Alert.builder()
                .id(entity.getAlertId())
                .host(entity.getHost())
                .title(entity.getTitle())
                .severity(entity.getSeverity())
                .description(entity.getDescription())
                .category(entity.getCategory())
                .source(entity.getSource())
                .status(entity.getStatus())
                .timestamp(entity.getAlertTimestamp())
                .resolvedAt(entity.getResolvedAt())
                .build();
        SuppressionScore score = entity.getScoreProbability() == null ? null : SuppressionScore.builder()
                .probability(entity.getScoreProbability())
                .confidence(entity.getScoreConfidence() != null ? entity.getScoreConfidence() : 0.0)
                .explanation(entity.getScoreExplanation())
                .build();
        Decision decision = Decision.builder()
                .alertId(entity.getAlertId())
                .verdict(entity.getVerdict())
                .reason(entity.getReason())
                .score(score)
                .ruleName(entity.getRuleName())
                .detail(entity.getDetail())
                .decidedAt(entity.getDecidedAt())
                .build();
        return AuditEntry.builder()
                .sequence(entity.getSequence())
                .alertId(entity.getAlertId())
                .alert(alert)
                .decision(decision)
                .recordedAt(entity.getRecordedAt())
                .build();
    }
}
