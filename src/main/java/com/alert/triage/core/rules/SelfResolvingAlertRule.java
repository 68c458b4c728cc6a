package com.alert.triage.core.rules;

import com.alert.triage.config.EngineSettings;
import com.alert.triage.core.DecisionContext;
import com.alert.triage.domain.Alert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Suppresses alerts that historically clear on their own: enough past occurrences were resolved,
 * and most of them within a few minutes.
 */
@Slf4j
@Component
@Order(20)
public class SelfResolvingAlertRule implements SuppressionRule {

    static final String NAME = "self-resolving";

    @Override
    public String getRuleName() {
        return NAME;
    }

    @Override
    public Optional<RuleOutcome> evaluate(DecisionContext context) {
        EngineSettings settings = context.getSettings();
        if (!settings.isPatternRulesEnabled()) return Optional.empty();

        Alert alert = context.getAlert();
        List<Alert> resolved = AlertHistoryFilters.sameSourceSince(
                        alert, context.getHistory(), alert.getTimestamp().minus(Duration.ofDays(settings.getSelfResolveLookbackDays())))
                .stream()
                .filter(a -> a.getResolvedAt() != null && !a.getResolvedAt().isBefore(a.getTimestamp()))
                .collect(Collectors.toList());
        if (resolved.size() < settings.getMinResolutionCount()) return Optional.empty();

        Duration quick = Duration.ofMinutes(settings.getSelfResolveThresholdMinutes());
        long quickResolutions = resolved.stream()
                .filter(a -> Duration.between(a.getTimestamp(), a.getResolvedAt()).compareTo(quick) <= 0)
                .count();
        log.debug("Self-resolving check: alertId={} resolved={} quick={}", alert.getId(), resolved.size(), quickResolutions);
        if (quickResolutions < settings.getSelfResolveRatio() * resolved.size()) return Optional.empty();

        return Optional.of(RuleOutcome.suppress(String.format(
                "Self-resolving: %d of %d past occurrences resolved within %d min",
                quickResolutions, resolved.size(), settings.getSelfResolveThresholdMinutes())));
    }
}
