package com.alert.triage.history;

import com.alert.triage.domain.Alert;

import java.util.List;

/**
 * Read-only source of past alerts related to a new one. Backs the pattern rules and the
 * scorer's context; the engine makes no assumption about where the history is stored.
 */
public interface AlertHistoryProvider {

    /**
     * @param limit max alerts to return; the most recent ones are kept
     * @return related past alerts, oldest first
     */
    List<Alert> fetchHistory(Alert alert, int limit);
}
