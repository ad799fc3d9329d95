package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Attribution verdict for a past intervention.
 *
 * <p>{@link #PENDING} is the only non-terminal value: a record moves
 * {@code PENDING -> SUCCESS | FAILURE} exactly once and never back.
 */
public enum InterventionOutcome {

    PENDING,
    SUCCESS,
    FAILURE;

    public boolean isTerminal() {
        return this != PENDING;
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterventionOutcome fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
