package com.churnguard.common.event;

/**
 * Outbound event sink handed to both loops at construction.
 *
 * <p>Delivery is fire-and-forget and at-most-once: implementations must not block,
 * must not throw back into the caller, and give no guarantee that any particular
 * subscriber sees a given event. The loops depend only on this interface, never on
 * the transport behind it.
 */
public interface InterventionEventPublisher {

    /**
     * @param event the event to broadcast
     */
    void publish(EngineEvent event);
}
