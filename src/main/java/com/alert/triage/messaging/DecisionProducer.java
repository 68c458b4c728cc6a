package com.alert.triage.messaging;

import com.alert.triage.domain.AuditEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes each audited decision for downstream consumers (notification routing, dashboards).
 * Keyed by alert id so all decisions for one alert land on the same partition, in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alerting.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class DecisionProducer {

    private final KafkaTemplate<String, AuditEntry> decisionKafkaTemplate;

    @Value("${alerting.kafka.topic.decisions:alert-decisions}")
    private String topic;

    public void send(AuditEntry entry) {
        CompletableFuture<SendResult<String, AuditEntry>> future = decisionKafkaTemplate.send(topic, entry.getAlertId(), entry);
        future.whenComplete((result, ex) -> {
            if (ex != null) log.error("Failed to publish decision for alertId={} sequence={}", entry.getAlertId(), entry.getSequence(), ex);
            else log.debug("Published decision alertId={} partition={}", entry.getAlertId(),
                    result != null ? result.getRecordMetadata().partition() : null);
        });
    }
}
