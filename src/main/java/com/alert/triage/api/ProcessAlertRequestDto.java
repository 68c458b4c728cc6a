package com.alert.triage.api;

import com.alert.triage.domain.RawAlert;
import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import lombok.Data;

/**
 * REST request body: the raw alert fields as the source sent them, plus optional engine overrides.
 * Field-level checks (required id, parsable timestamp, known severity) are left to the normalizer
 * so HTTP and Kafka callers get the same validation.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProcessAlertRequestDto {

    @JsonAlias({"alert_id", "alertId"})
    private String id;
    private String host;
    private String title;
    private String severity;
    private String description;
    private String category;
    private String source;
    private String status;
    @JsonAlias({"created_at", "createdAt"})
    private String timestamp;
    @JsonAlias({"resolved_at"})
    private String resolvedAt;

    @Valid
    private EngineConfigurationDto configuration;

    public RawAlert toRawAlert() {
        return RawAlert.builder()
                .id(id)
                .host(host)
                .title(title)
                .severity(severity)
                .description(description)
                .category(category)
                .source(source)
                .status(status)
                .timestamp(timestamp)
                .resolvedAt(resolvedAt)
                .build();
    }
}
