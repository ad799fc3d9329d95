package com.churnguard.intervention.controller;

import com.churnguard.common.event.EngineEvent;
import com.churnguard.intervention.publisher.BroadcastEventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

/**
 * Live engine events for dashboards. The SSE {@code event:} field carries the event
 * type ({@code SENTINEL_ACTION}, {@code OPTIMIZER_UPDATE}, ...), {@code data:} the payload.
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventStreamController {

    private static final Logger log = LoggerFactory.getLogger(EventStreamController.class);

    private final BroadcastEventPublisher publisher;

    public EventStreamController(BroadcastEventPublisher publisher) {
        this.publisher = publisher;
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<EngineEvent>> stream() {
        log.info("Event stream subscriber connected");
        return publisher.stream()
            .map(event -> ServerSentEvent.<EngineEvent>builder()
                .event(event.type())
                .data(event)
                .build())
            .doFinally(signal -> log.info("Event stream subscriber disconnected. signal={}", signal));
    }
}
