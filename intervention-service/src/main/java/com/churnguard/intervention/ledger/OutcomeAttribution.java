package com.churnguard.intervention.ledger;

import com.churnguard.common.model.InterventionOutcome;

import java.time.Instant;

/**
 * The four attribution fields, written together or not at all.
 */
public record OutcomeAttribution(
    InterventionOutcome outcome,
    double              riskDelta,
    double              currentRisk,
    Instant             attributedAt
) {

    public OutcomeAttribution {
        if (outcome == null || !outcome.isTerminal()) {
            throw new IllegalArgumentException("attribution requires a terminal outcome, was " + outcome);
        }
        if (attributedAt == null) {
            throw new IllegalArgumentException("attributedAt is required");
        }
    }
}
