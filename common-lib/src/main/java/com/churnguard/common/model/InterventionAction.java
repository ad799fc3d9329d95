package com.churnguard.common.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Escalating intervention tiers, ordered by severity: {@code NUDGE < SUPPORT < OFFER}.
 *
 * <p>Two spellings exist for every tier:
 * <ul>
 *   <li>{@link #autoLabel()} – the classification label used by the Sentinel
 *       ({@code AUTO_NUDGE}, {@code AUTO_SUPPORT}, {@code AUTO_OFFER}) and carried
 *       on per-action events.</li>
 *   <li>{@link #dbValue()} – the lower-case tier name persisted in
 *       {@code interventions.action_type} and used on the REST surface.</li>
 * </ul>
 */
public enum InterventionAction {

    NUDGE,
    SUPPORT,
    OFFER;

    private static final String AUTO_PREFIX = "AUTO_";

    public String autoLabel() {
        return AUTO_PREFIX + name();
    }

    @JsonValue
    public String dbValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts either spelling ({@code "support"} or {@code "AUTO_SUPPORT"}).
     *
     * @throws IllegalArgumentException for anything else, including {@code null}
     */
    @JsonCreator
    public static InterventionAction fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("actionType is required");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith(AUTO_PREFIX)) {
            normalized = normalized.substring(AUTO_PREFIX.length());
        }
        for (InterventionAction action : values()) {
            if (action.name().equals(normalized)) {
                return action;
            }
        }
        throw new IllegalArgumentException(
            "Invalid actionType '" + value + "'. Must be one of: nudge, support, offer");
    }
}
