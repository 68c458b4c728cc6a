package com.alert.triage.messaging;

import com.alert.triage.api.AlertValidationException;
import com.alert.triage.config.EngineSettings;
import com.alert.triage.core.AlertDecisionEngine;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.RawAlert;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Consumes raw alerts from monitoring sources and runs each through the decision engine.
 * Malformed alerts are logged and skipped; audit failures propagate so the container's error
 * handler retries the record.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "alerting.kafka.enabled", havingValue = "true", matchIfMissing = true)
public class RawAlertConsumer {

    private final AlertDecisionEngine engine;
    private final DecisionProducer decisionProducer;
    private final EngineSettings settings;

    @KafkaListener(
            topics = "${alerting.kafka.topic.raw-alerts:alerts-raw}",
            groupId = "${alerting.kafka.consumer-group:alert-triage-engine}",
            containerFactory = "rawAlertListenerContainerFactory"
    )
    public void onRawAlert(
            @Payload(required = false) RawAlert raw,
            @Header(value = KafkaHeaders.RECEIVED_KEY, required = false) String key,
            @Header(value = KafkaHeaders.RECEIVED_PARTITION, required = false) Integer partition,
            @Header(value = KafkaHeaders.OFFSET, required = false) Long offset) {
        if (raw == null) {
            log.warn("Received null alert (deserialization failed). key={} partition={} offset={}", key, partition, offset);
            return;
        }
        AuditEntry entry;
        try {
            entry = engine.processAndAudit(raw, settings);
        } catch (AlertValidationException e) {
            log.warn("Skipping invalid alert key={} partition={} offset={}: {}", key, partition, offset, e.getFieldErrors());
            return;
        }
        decisionProducer.send(entry);
    }
}
