package com.alert.triage.scoring;

import com.alert.triage.domain.Alert;
import com.alert.triage.domain.Severity;
import com.alert.triage.domain.SuppressionScore;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ResilientSuppressionScorer: every scorer failure becomes "no score".
 */
class ResilientSuppressionScorerTest {

    private static final Duration TIMEOUT = Duration.ofMillis(200);

    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Alert alert() {
        return Alert.builder().id("a1").host("web-01").title("Disk usage high").severity(Severity.WARNING)
                .timestamp(Instant.parse("2024-03-01T10:00:00Z")).build();
    }

    private ResilientSuppressionScorer scorer(SuppressionScorer delegate, CircuitBreakerRegistry registry) {
        return new ResilientSuppressionScorer(delegate, registry, executor);
    }

    private ResilientSuppressionScorer scorer(SuppressionScorer delegate) {
        return scorer(delegate, CircuitBreakerRegistry.ofDefaults());
    }

    @Test
    void returnsScoreFromDelegate() {
        SuppressionScore expected = SuppressionScore.builder().probability(0.9).confidence(0.95).explanation("noise").build();

        Optional<SuppressionScore> score = scorer((alert, history) -> expected).tryScore(alert(), List.of(), TIMEOUT);

        assertThat(score).contains(expected);
    }

    @Test
    void noDelegateMeansNoScore() {
        assertThat(scorer(null).tryScore(alert(), List.of(), TIMEOUT)).isEmpty();
    }

    @Test
    void slowDelegateTimesOut() {
        SuppressionScorer slow = (alert, history) -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return SuppressionScore.builder().probability(1.0).confidence(1.0).build();
        };

        long start = System.nanoTime();
        Optional<SuppressionScore> score = scorer(slow).tryScore(alert(), List.of(), TIMEOUT);

        assertThat(score).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
    }

    @Test
    void delegateFailureMeansNoScore() {
        SuppressionScorer failing = (alert, history) -> {
            throw new ScoringUnavailableException("ML service down");
        };

        assertThat(scorer(failing).tryScore(alert(), List.of(), TIMEOUT)).isEmpty();
    }

    @Test
    void unexpectedDelegateErrorMeansNoScore() {
        SuppressionScorer broken = (alert, history) -> {
            throw new IllegalStateException("bug");
        };

        assertThat(scorer(broken).tryScore(alert(), List.of(), TIMEOUT)).isEmpty();
    }

    @Test
    void openCircuitSkipsDelegate() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(CircuitBreakerConfig.custom()
                .slidingWindowSize(2)
                .minimumNumberOfCalls(2)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofMinutes(1))
                .build());
        AtomicInteger calls = new AtomicInteger();
        SuppressionScorer failing = (alert, history) -> {
            calls.incrementAndGet();
            throw new ScoringUnavailableException("ML service down");
        };
        ResilientSuppressionScorer resilient = scorer(failing, registry);

        resilient.tryScore(alert(), List.of(), TIMEOUT);
        resilient.tryScore(alert(), List.of(), TIMEOUT);
        Optional<SuppressionScore> third = resilient.tryScore(alert(), List.of(), TIMEOUT);

        assertThat(third).isEmpty();
        assertThat(calls.get()).isEqualTo(2);
        assertThat(registry.circuitBreaker(ResilientSuppressionScorer.CIRCUIT_BREAKER).getState())
                .isEqualTo(io.github.resilience4j.circuitbreaker.CircuitBreaker.State.OPEN);
    }
}
