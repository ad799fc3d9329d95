package com.churnguard.intervention.sentinel;

/**
 * Terminal state of one user within one Sentinel cycle.
 */
public enum UserDecision {

    ACTED,
    SKIPPED_BELOW_THRESHOLD,
    SKIPPED_COOLDOWN,
    SKIPPED_HUMAN_PRIORITY,
    SKIPPED_RATE_LIMIT,
    /** A gate query failed; the user is treated as gated. */
    SKIPPED_GATE_CHECK_FAILED,
    /** Classified and cleared the gates, but the ledger write failed. */
    PERSIST_FAILED
}
