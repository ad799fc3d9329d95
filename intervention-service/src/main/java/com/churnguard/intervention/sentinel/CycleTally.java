package com.churnguard.intervention.sentinel;

import java.util.EnumMap;
import java.util.Map;

/** Per-cycle decision counters. */
class CycleTally {

    private final EnumMap<UserDecision, Integer> counts = new EnumMap<>(UserDecision.class);
    private int candidates;
    private boolean rateLimitLogged;

    synchronized UserDecision record(UserDecision decision) {
        candidates++;
        counts.merge(decision, 1, Integer::sum);
        return decision;
    }

    synchronized int count(UserDecision decision) {
        return counts.getOrDefault(decision, 0);
    }

    synchronized int actions() {
        return count(UserDecision.ACTED);
    }

    synchronized int candidates() {
        return candidates;
    }

    /** @return true the first time only */
    synchronized boolean markRateLimitReached() {
        if (rateLimitLogged) {
            return false;
        }
        rateLimitLogged = true;
        return true;
    }

    synchronized Map<UserDecision, Integer> snapshot() {
        return Map.copyOf(counts);
    }
}
