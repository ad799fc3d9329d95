package com.churnguard.intervention.controller;

import com.churnguard.common.model.InterventionRecord;
import com.churnguard.intervention.dto.ManualInterventionRequest;
import com.churnguard.intervention.service.InterventionQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/interventions")
public class InterventionController {

    private static final Logger log = LoggerFactory.getLogger(InterventionController.class);

    private final InterventionQueryService queryService;

    public InterventionController(InterventionQueryService queryService) {
        this.queryService = queryService;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<InterventionRecord> record(@RequestBody ManualInterventionRequest request) {
        log.info("Intervention received. userId={} actionType={} source={}",
                 request.userId(), request.actionType(), request.source());
        return queryService.recordIntervention(request);
    }

    @GetMapping
    public Flux<InterventionRecord> recent(@RequestParam(defaultValue = "100") int limit) {
        return queryService.recent(limit);
    }
}
