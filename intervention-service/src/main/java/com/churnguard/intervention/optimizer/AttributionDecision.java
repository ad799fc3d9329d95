package com.churnguard.intervention.optimizer;

/** What one attribution cycle did with one pending record. */
public enum AttributionDecision {

    SUCCESS,
    FAILURE,
    /** Not enough movement yet; row left untouched for a later run. */
    STILL_PENDING,
    /** No current risk available (unknown user or fetch error). */
    SKIPPED_NO_RISK_DATA,
    /** Another run attributed the row first. */
    ALREADY_ATTRIBUTED,
    WRITE_FAILED
}
