package com.churnguard.intervention.publisher;

import com.churnguard.common.event.EngineEvent;
import com.churnguard.common.event.InterventionEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-process fan-out of engine events to every connected dashboard stream.
 *
 * <p>Best effort: a slow subscriber misses events instead of holding back the loops,
 * and events published while nobody listens are dropped.
 */
@Component
public class BroadcastEventPublisher implements InterventionEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(BroadcastEventPublisher.class);

    private final Sinks.Many<EngineEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public void publish(EngineEvent event) {
        Sinks.EmitResult result;
        // Both loops and the HTTP layer publish; the sink requires serialized emission.
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isSuccess()) {
            log.debug("Event published. type={}", event.type());
        } else if (result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("Event not delivered. type={} result={}", event.type(), result);
        }
    }

    public Flux<EngineEvent> stream() {
        return sink.asFlux();
    }
}
