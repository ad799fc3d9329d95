package com.churnguard.intervention.ledger;

import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.model.InterventionSource;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * Durable store of intervention records.
 *
 * <p>Writers never overlap on a row: the Sentinel and the HTTP layer only insert,
 * and the Optimizer only touches the attribution fields of rows it selected.
 */
public interface InterventionLedger {

    /** @return the stored record, with its id assigned */
    Mono<InterventionRecord> insert(InterventionRecord record);

    /**
     * @param since        inclusive lower bound on {@code createdAt}
     * @param sourceFilter restricts to one source; {@code null} for all sources
     */
    Flux<InterventionRecord> queryByUser(String userId, Instant since, InterventionSource sourceFilter);

    /** Pending, unattributed records with {@code createdAt} in {@code [start, end]}, oldest first. */
    Flux<InterventionRecord> queryPendingInWindow(Instant start, Instant end, int limit);

    /**
     * Atomically writes the attribution fields of one row, only while it is still pending.
     *
     * @return {@code true} if the row was updated, {@code false} if it was no longer pending
     */
    Mono<Boolean> updateOutcome(Long id, OutcomeAttribution attribution);

    /** Most recent records of any source, newest first. */
    Flux<InterventionRecord> recent(int limit);

    Flux<InterventionRecord> recentBySource(InterventionSource source, int limit);

    /** Every record with a terminal outcome. */
    Flux<InterventionRecord> attributed();
}
