package com.alert.triage.audit;

import com.alert.triage.api.AuditWriteFailureException;
import com.alert.triage.domain.Alert;
import com.alert.triage.domain.AuditEntry;
import com.alert.triage.domain.AuditQuery;
import com.alert.triage.domain.Decision;

import java.util.List;

/**
 * Append-only record of every decision and the alert it was made on. The only source of truth
 * for why an alert was or was not surfaced.
 */
public interface AuditLog {

    /**
     * Record one decision. Never deduplicates: appending the same decision twice yields two entries.
     * @throws AuditWriteFailureException if the entry could not be stored
     */
    AuditEntry append(Alert alert, Decision decision);

    /**
     * Entries matching the query, ordered by decision time then sequence. Includes every entry
     * whose append completed before the call.
     */
    List<AuditEntry> query(AuditQuery query);
}
