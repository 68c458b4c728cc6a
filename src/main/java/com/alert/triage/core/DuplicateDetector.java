package com.alert.triage.core;

import com.alert.triage.domain.Alert;
import com.alert.triage.domain.DuplicateResult;
import com.alert.triage.domain.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Remembers recent alert timestamps per (host, title, severity) and flags repeats inside the
 * duplicate window. Buckets only hold timestamps still inside the window, so memory follows the
 * number of active host/title pairs rather than alert volume.
 * <p>
 * Every bucket is read, evaluated and updated inside {@link ConcurrentHashMap#compute}, which
 * serializes callers on the same key while other keys proceed in parallel.
 */
@Slf4j
@Component
public class DuplicateDetector {

    private final Map<WindowKey, List<Instant>> buckets = new ConcurrentHashMap<>();
    /** Widest window any check has used; purging never drops entries a wider per-request window still needs. */
    private final AtomicLong widestWindowMillis = new AtomicLong();

    public DuplicateResult check(Alert alert, int windowMinutes) {
        return check(alert, Duration.ofMinutes(windowMinutes));
    }

    /**
     * Is there a prior alert with the same key no further than {@code window} away (inclusive)?
     * The alert's own timestamp is recorded whatever the answer, so a burst is matched against
     * every earlier member still in the window, not only the latest one.
     */
    public DuplicateResult check(Alert alert, Duration window) {
        WindowKey key = WindowKey.of(alert);
        Instant ts = alert.getTimestamp();
        widestWindowMillis.accumulateAndGet(window.toMillis(), Math::max);
        DuplicateResult[] result = new DuplicateResult[1];
        buckets.compute(key, (k, bucket) -> {
            if (bucket == null) bucket = new ArrayList<>();
            Instant earliestMatch = null;
            int matches = 0;
            for (Instant prior : bucket) {
                if (Duration.between(prior, ts).abs().compareTo(window) <= 0) {
                    matches++;
                    if (earliestMatch == null || prior.isBefore(earliestMatch)) earliestMatch = prior;
                }
            }
            insertSorted(bucket, ts);
            evict(bucket, window);
            result[0] = matches > 0
                    ? DuplicateResult.builder().duplicate(true).matchedAt(earliestMatch).priorCount(matches).build()
                    : DuplicateResult.notDuplicate();
            return bucket;
        });
        log.debug("Duplicate check: alertId={} key={} duplicate={} priorCount={}",
                alert.getId(), key, result[0].isDuplicate(), result[0].getPriorCount());
        return result[0];
    }

    /**
     * Record an occurrence without checking it. Used to rebuild state from the audit log on start.
     */
    public void seed(Alert alert, Duration window) {
        buckets.compute(WindowKey.of(alert), (k, bucket) -> {
            if (bucket == null) bucket = new ArrayList<>();
            insertSorted(bucket, alert.getTimestamp());
            evict(bucket, window);
            return bucket;
        });
    }

    /**
     * Undo the occurrence recorded by {@link #check} for an alert whose decision could not be
     * audited, so a retry of the same alert is not matched against itself.
     */
    public void forget(Alert alert) {
        Instant ts = alert.getTimestamp();
        buckets.computeIfPresent(WindowKey.of(alert), (k, bucket) -> {
            bucket.remove(ts);
            return bucket.isEmpty() ? null : bucket;
        });
        log.debug("Forgot occurrence: alertId={} timestamp={}", alert.getId(), ts);
    }

    /**
     * Drop buckets whose newest entry fell out of the window relative to {@code now}. Lazy eviction
     * in {@link #check} never revisits keys that went quiet; this does. The cutoff uses the wider
     * of {@code window} and the widest window seen by {@link #check}.
     * @return number of buckets removed
     */
    public int purgeIdle(Instant now, Duration window) {
        Duration effective = Duration.ofMillis(Math.max(window.toMillis(), widestWindowMillis.get()));
        Instant cutoff = now.minus(effective);
        int[] removed = new int[1];
        for (WindowKey key : buckets.keySet()) {
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (bucket.isEmpty() || bucket.get(bucket.size() - 1).isBefore(cutoff)) {
                    removed[0]++;
                    return null;
                }
                return bucket;
            });
        }
        return removed[0];
    }

    public int trackedKeys() {
        return buckets.size();
    }

    private static void insertSorted(List<Instant> bucket, Instant ts) {
        int i = bucket.size();
        while (i > 0 && bucket.get(i - 1).isAfter(ts)) i--;
        bucket.add(i, ts);
    }

    /** Keeps entries within {@code window} of the newest one. */
    private static void evict(List<Instant> bucket, Duration window) {
        Instant cutoff = bucket.get(bucket.size() - 1).minus(window);
        bucket.removeIf(t -> t.isBefore(cutoff));
    }

    /** Host and title compare case-insensitively; runs of whitespace in titles collapse to one space. */
    record WindowKey(String host, String title, Severity severity) {

        static WindowKey of(Alert alert) {
            return new WindowKey(
                    normalize(alert.getHost()),
                    normalize(alert.getTitle()).replaceAll("\\s+", " "),
                    alert.getSeverity());
        }

        private static String normalize(String value) {
            return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        }
    }
}
