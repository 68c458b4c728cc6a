package com.alert.triage.core;

import com.alert.triage.domain.Alert;
import com.alert.triage.domain.DuplicateResult;
import com.alert.triage.domain.Severity;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for DuplicateDetector: inclusive window, keying and concurrent checks.
 */
class DuplicateDetectorTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final Duration WINDOW = Duration.ofMinutes(5);

    private final DuplicateDetector detector = new DuplicateDetector();

    private static Alert alert(String id, String host, String title, Severity severity, Instant ts) {
        return Alert.builder().id(id).host(host).title(title).severity(severity).timestamp(ts).build();
    }

    private static Alert alert(String id, Instant ts) {
        return alert(id, "web-01", "Disk usage high", Severity.WARNING, ts);
    }

    @Test
    void firstOccurrenceIsNotDuplicate() {
        DuplicateResult result = detector.check(alert("a1", T0), WINDOW);
        assertThat(result.isDuplicate()).isFalse();
        assertThat(result.getPriorCount()).isZero();
        assertThat(result.getMatchedAt()).isNull();
    }

    @Test
    void repeatInsideWindowIsDuplicate() {
        detector.check(alert("a1", T0), WINDOW);
        DuplicateResult result = detector.check(alert("a2", T0.plusSeconds(120)), WINDOW);

        assertThat(result.isDuplicate()).isTrue();
        assertThat(result.getMatchedAt()).isEqualTo(T0);
        assertThat(result.getPriorCount()).isEqualTo(1);
    }

    @Test
    void exactWindowBoundaryIsDuplicate() {
        detector.check(alert("a1", T0), WINDOW);
        assertThat(detector.check(alert("a2", T0.plus(WINDOW)), WINDOW).isDuplicate()).isTrue();
    }

    @Test
    void justBeyondWindowIsNotDuplicate() {
        detector.check(alert("a1", T0), WINDOW);
        assertThat(detector.check(alert("a2", T0.plus(WINDOW).plusMillis(1)), WINDOW).isDuplicate()).isFalse();
    }

    @Test
    void burstCountsAllPriorsInWindow() {
        detector.check(alert("a1", T0), WINDOW);
        detector.check(alert("a2", T0.plusSeconds(60)), WINDOW);
        DuplicateResult third = detector.check(alert("a3", T0.plusSeconds(120)), WINDOW);

        assertThat(third.getPriorCount()).isEqualTo(2);
        assertThat(third.getMatchedAt()).isEqualTo(T0);
    }

    @Test
    void lateArrivalMatchesByAbsoluteDistance() {
        detector.check(alert("a1", T0.plusSeconds(120)), WINDOW);
        assertThat(detector.check(alert("a2", T0), WINDOW).isDuplicate()).isTrue();
    }

    @Test
    void hostAndTitleCompareCaseInsensitively() {
        detector.check(alert("a1", "WEB-01", "Disk  usage HIGH", Severity.WARNING, T0), WINDOW);
        assertThat(detector.check(alert("a2", "web-01", "disk usage high", Severity.WARNING, T0.plusSeconds(10)), WINDOW)
                .isDuplicate()).isTrue();
    }

    @Test
    void differentSeverityHostOrTitleIsNotDuplicate() {
        detector.check(alert("a1", T0), WINDOW);
        assertThat(detector.check(alert("a2", "web-01", "Disk usage high", Severity.MAJOR, T0), WINDOW).isDuplicate()).isFalse();
        assertThat(detector.check(alert("a3", "web-02", "Disk usage high", Severity.WARNING, T0), WINDOW).isDuplicate()).isFalse();
        assertThat(detector.check(alert("a4", "web-01", "CPU high", Severity.WARNING, T0), WINDOW).isDuplicate()).isFalse();
        assertThat(detector.trackedKeys()).isEqualTo(4);
    }

    @Test
    void minuteOverloadUsesSameWindow() {
        detector.check(alert("a1", T0), 5);
        assertThat(detector.check(alert("a2", T0.plusSeconds(300)), 5).isDuplicate()).isTrue();
    }

    @Test
    void seededOccurrencesCountAsPriors() {
        detector.seed(alert("a1", T0), WINDOW);
        assertThat(detector.check(alert("a2", T0.plusSeconds(30)), WINDOW).isDuplicate()).isTrue();
    }

    @Test
    void purgeIdleDropsQuietKeysOnly() {
        detector.check(alert("a1", "web-01", "Disk usage high", Severity.WARNING, T0), WINDOW);
        detector.check(alert("a2", "web-02", "Disk usage high", Severity.WARNING, T0.plusSeconds(400)), WINDOW);

        int removed = detector.purgeIdle(T0.plusSeconds(420), WINDOW);

        assertThat(removed).isEqualTo(1);
        assertThat(detector.trackedKeys()).isEqualTo(1);
    }

    @Test
    void purgeIdleKeepsKeysStillInsideWiderRequestWindow() {
        detector.check(alert("a1", T0), Duration.ofMinutes(30));

        int removed = detector.purgeIdle(T0.plus(Duration.ofMinutes(10)), WINDOW);

        assertThat(removed).isZero();
        assertThat(detector.check(alert("a2", T0.plus(Duration.ofMinutes(20))), Duration.ofMinutes(30)).isDuplicate())
                .isTrue();
    }

    @Test
    void forgottenOccurrenceNoLongerMatches() {
        Alert original = alert("a1", T0);
        detector.check(original, WINDOW);

        detector.forget(original);

        assertThat(detector.trackedKeys()).isZero();
        assertThat(detector.check(alert("a1", T0), WINDOW).isDuplicate()).isFalse();
    }

    @Test
    void forgetRemovesOnlyOneOccurrence() {
        detector.check(alert("a1", T0), WINDOW);
        detector.check(alert("a2", T0.plusSeconds(60)), WINDOW);

        detector.forget(alert("a2", T0.plusSeconds(60)));

        DuplicateResult result = detector.check(alert("a3", T0.plusSeconds(90)), WINDOW);
        assertThat(result.getPriorCount()).isEqualTo(1);
        assertThat(result.getMatchedAt()).isEqualTo(T0);
    }

    @Test
    void concurrentIdenticalAlertsYieldExactlyOneOriginal() throws Exception {
        int threads = 16;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<DuplicateResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Alert a = alert("a" + i, T0);
                Callable<DuplicateResult> task = () -> {
                    start.await();
                    return detector.check(a, WINDOW);
                };
                futures.add(pool.submit(task));
            }
            start.countDown();
            int originals = 0;
            for (Future<DuplicateResult> f : futures) {
                if (!f.get(5, TimeUnit.SECONDS).isDuplicate()) originals++;
            }
            assertThat(originals).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }
}
