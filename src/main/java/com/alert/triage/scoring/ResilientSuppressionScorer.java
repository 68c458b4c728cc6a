package com.alert.triage.scoring;

import com.alert.triage.domain.Alert;
import com.alert.triage.domain.SuppressionScore;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;

/**
 * Calls the {@link SuppressionScorer} with a hard time limit and behind a circuit breaker.
 * Never throws: any failure (no scorer configured, timeout, open circuit, scorer error) comes back
 * as an empty result, which the rule engine treats as "no score".
 */
@Slf4j
@Component
public class ResilientSuppressionScorer {

    static final String CIRCUIT_BREAKER = "suppressionScorer";

    private final SuppressionScorer delegate;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ExecutorService executor;

    public ResilientSuppressionScorer(@Autowired(required = false) SuppressionScorer delegate,
                                      CircuitBreakerRegistry circuitBreakerRegistry,
                                      @Qualifier("scoringExecutor") ExecutorService executor) {
        this.delegate = delegate;
        this.circuitBreakerRegistry = circuitBreakerRegistry;
        this.executor = executor;
    }

    public Optional<SuppressionScore> tryScore(Alert alert, List<Alert> history, Duration timeout) {
        if (delegate == null) {
            log.debug("No suppression scorer configured; deciding alertId={} without a score", alert.getId());
            return Optional.empty();
        }
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER);
        TimeLimiter timeLimiter = TimeLimiter.of(timeout);
        Callable<SuppressionScore> timed = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(() -> delegate.score(alert, history), executor));
        Callable<SuppressionScore> guarded = CircuitBreaker.decorateCallable(cb, timed);
        try {
            return Optional.ofNullable(guarded.call());
        } catch (TimeoutException e) {
            log.warn("Suppression scorer timed out after {} for alertId={}", timeout, alert.getId());
        } catch (CallNotPermittedException e) {
            log.warn("Suppression scorer circuit open; skipping score for alertId={}", alert.getId());
        } catch (ScoringUnavailableException e) {
            log.warn("Suppression scorer unavailable for alertId={}: {}", alert.getId(), e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while scoring alertId={}", alert.getId());
        } catch (Exception e) {
            log.error("Unexpected error from suppression scorer for alertId={}", alert.getId(), e);
        }
        return Optional.empty();
    }
}
