package com.alert.triage.domain;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Alert record exactly as a monitoring source delivers it: loosely typed, possibly incomplete.
 * The normalizer turns it into an {@link Alert} or rejects it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RawAlert {

    @JsonAlias({"alert_id", "alertId"})
    private String id;
    private String host;
    private String title;
    private String severity;
    private String description;
    private String category;
    private String source;
    /** Source-side state, e.g. triggered / acknowledged / resolved. */
    private String status;
    /** ISO-8601, "yyyy-MM-dd HH:mm:ss" (UTC) or epoch seconds/millis. */
    @JsonAlias({"created_at", "createdAt"})
    private String timestamp;
    @JsonAlias({"resolved_at"})
    private String resolvedAt;
}
