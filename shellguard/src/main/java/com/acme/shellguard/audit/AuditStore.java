package com.acme.shellguard.audit;

/**
 * Durable, append-only store of {@link AuditRecord}s.
 *
 * <p>Implementations must be thread-safe. Records are never modified or removed once appended.</p>
 */
public interface AuditStore {

    /**
     * Persists one record. Returns only after the record is durably written; on failure nothing was
     * recorded and the cause is reported.
     */
    void append(AuditRecord record) throws AuditStoreException;

    /**
     * Returns the records matching {@code query} as a lazy sequence that re-reads the store on every
     * iteration.
     *
     * @throws AuditStoreException if the store does not exist or cannot be opened
     */
    AuditRecordSequence query(AuditQuery query) throws AuditStoreException;

    /** Aggregates over the records matching {@code query}. */
    AuditStatistics statistics(AuditQuery query) throws AuditStoreException;

    default AuditStatistics statistics() throws AuditStoreException {
        return statistics(AuditQuery.all());
    }
}
