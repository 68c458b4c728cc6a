package com.alert.triage.core.rules;

import com.alert.triage.config.EngineSettings;
import com.alert.triage.core.DecisionContext;
import com.alert.triage.domain.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Suppresses alerts that keep toggling state: within the flapping window the same host/title
 * changed status at least {@code flappingThreshold} times.
 */
@Slf4j
@Component
@Order(10)
public class FlappingAlertRule implements SuppressionRule {

    static final String NAME = "flapping";

    @Override
    public String getRuleName() {
        return NAME;
    }

    @Override
    public Optional<RuleOutcome> evaluate(DecisionContext context) {
        EngineSettings settings = context.getSettings();
        if (!settings.isPatternRulesEnabled()) return Optional.empty();

        Alert alert = context.getAlert();
        Duration window = Duration.ofMinutes(settings.getFlappingWindowMinutes());
        List<Alert> series = new ArrayList<>(AlertHistoryFilters.sameSourceSince(
                alert, context.getHistory(), alert.getTimestamp().minus(window)));
        series.add(alert);
        if (series.size() < 2) return Optional.empty();

        int stateChanges = 0;
        String previous = null;
        for (Alert a : series) {
            String status = a.getStatus();
            if (status == null || status.isEmpty()) continue;
            if (previous != null && !previous.equalsIgnoreCase(status)) stateChanges++;
            previous = status;
        }
        log.debug("Flapping check: alertId={} alerts={} stateChanges={} threshold={}",
                alert.getId(), series.size(), stateChanges, settings.getFlappingThreshold());
        if (stateChanges < settings.getFlappingThreshold()) return Optional.empty();

        return Optional.of(RuleOutcome.suppress(String.format(
                "Flapping: %d state changes across %d alerts in the last %d min",
                stateChanges, series.size(), settings.getFlappingWindowMinutes())));
    }
}
