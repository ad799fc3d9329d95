package com.churnguard.common.event;

/**
 * Anything the engine broadcasts to dashboards. {@link #type()} is the event name
 * subscribers switch on; it is not part of the serialized payload.
 */
public interface EngineEvent {

    String type();
}
