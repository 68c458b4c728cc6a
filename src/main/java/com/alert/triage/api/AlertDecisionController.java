package com.alert.triage.api;

import com.alert.triage.audit.AuditLog;
import com.alert.triage.config.EngineSettings;
import com.alert.triage.core.AlertDecisionEngine;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for alert triage: submit one alert for a keep/suppress decision, and read the audit trail.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
@Tag(name = "Alerts", description = "Decide whether alerts reach on-call and inspect past decisions")
public class AlertDecisionController {

    private static final int DEFAULT_AUDIT_LIMIT = 100;

    private final AlertDecisionEngine engine;
    private final AuditLog auditLog;
    private final EngineSettings settings;

    @PostMapping("/process")
    @Operation(
            summary = "Process alert",
            description = "Normalizes the alert, checks it against recent duplicates and business rules, consults the "
                    + "suppression model when still undecided, and records the decision in the audit log before returning it. "
                    + "Critical alerts are always kept. Optional body.configuration overrides the service defaults for this call only.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Decision recorded. body.verdict is KEEP or SUPPRESS; body.reason and body.detail explain why.",
                    content = @Content(mediaType = "application/json", schema = @Schema(implementation = DecisionResponseDto.class))),
            @ApiResponse(responseCode = "400", description = "Alert failed validation or configuration was rejected. Body: { \"error\": \"VALIDATION_FAILED\"|\"INVALID_CONFIGURATION\", \"details\"|\"message\": ... }"),
            @ApiResponse(responseCode = "503", description = "Decision could not be recorded. Body: { \"error\": \"AUDIT_WRITE_FAILED\", \"message\": \"...\" }. Safe to retry."),
            @ApiResponse(responseCode = "500", description = "Internal error. Body: { \"error\": \"INTERNAL_ERROR\", \"message\": \"...\" }")
    })
    public ResponseEntity<DecisionResponseDto> process(@Valid @RequestBody ProcessAlertRequestDto dto) {
        EngineSettings effective = dto.getConfiguration() != null
                ? dto.getConfiguration().applyTo(settings)
                : settings;
        AuditEntry entry = engine.processAndAudit(dto.toRawAlert(), effective);
        return ResponseEntity.ok(DecisionResponseDto.from(entry));
    }

    @GetMapping("/audit")
    @Operation(summary = "List audit entries",
            description = "Returns recorded decisions oldest first. All filters are optional; from/to are inclusive ISO-8601 instants on the decision time.")
    public ResponseEntity<List<DecisionResponseDto>> audit(
            @RequestParam(required = false) String alertId,
            @RequestParam(required = false) String host,
            @RequestParam(required = false) Instant from,
            @RequestParam(required = false) Instant to,
            @RequestParam(required = false) Integer limit) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new IllegalArgumentException("from must not be after to");
        }
        AuditQuery query = AuditQuery.builder()
                .alertId(alertId)
                .host(host)
                .from(from)
                .to(to)
                .limit(limit != null && limit > 0 ? limit : DEFAULT_AUDIT_LIMIT)
                .build();
        List<DecisionResponseDto> body = auditLog.query(query).stream()
                .map(DecisionResponseDto::from)
                .collect(Collectors.toList());
        log.debug("Audit query alertId={} host={} returned {} entries", alertId, host, body.size());
        return ResponseEntity.ok(body);
    }
}
