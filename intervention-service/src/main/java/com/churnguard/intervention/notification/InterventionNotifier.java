package com.churnguard.intervention.notification;

import com.churnguard.common.model.InterventionRecord;

/**
 * Delivers a persisted intervention to the user. Fire-and-forget: implementations
 * must return promptly and must not throw; delivery failures are theirs to log.
 */
public interface InterventionNotifier {

    void notify(InterventionRecord intervention);
}
