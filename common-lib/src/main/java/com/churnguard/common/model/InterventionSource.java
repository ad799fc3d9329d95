package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who initiated an intervention. Only {@link #MANUAL} records trigger the
 * Sentinel's human-priority deference.
 */
public enum InterventionSource {

    MANUAL,
    SENTINEL,
    API;

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterventionSource fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("source is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                "Invalid source '" + value + "'. Must be one of: manual, sentinel, api", e);
        }
    }
}
