package com.churnguard.intervention.controller;

import com.churnguard.common.event.ConfigurationChangedEvent;
import com.churnguard.common.event.InterventionEventPublisher;
import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.model.SentinelConfiguration;
import com.churnguard.intervention.config.SentinelConfigurationStore;
import com.churnguard.intervention.dto.SentinelConfigUpdate;
import com.churnguard.intervention.sentinel.SentinelCycleReport;
import com.churnguard.intervention.sentinel.SentinelLoop;
import com.churnguard.intervention.service.InterventionQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/sentinel")
public class SentinelController {

    private static final Logger log = LoggerFactory.getLogger(SentinelController.class);

    private final SentinelConfigurationStore configStore;
    private final SentinelLoop sentinelLoop;
    private final InterventionQueryService queryService;
    private final InterventionEventPublisher eventPublisher;

    public SentinelController(SentinelConfigurationStore configStore,
                              SentinelLoop sentinelLoop,
                              InterventionQueryService queryService,
                              InterventionEventPublisher eventPublisher) {
        this.configStore    = configStore;
        this.sentinelLoop   = sentinelLoop;
        this.queryService   = queryService;
        this.eventPublisher = eventPublisher;
    }

    @GetMapping("/status")
    public Mono<SentinelConfiguration> status() {
        return Mono.fromSupplier(configStore::get);
    }

    /**
     * Partial update. Invalid thresholds or intervals are rejected with 400 and
     * leave the configuration unchanged.
     */
    @PostMapping("/config")
    public Mono<SentinelConfiguration> updateConfig(@RequestBody SentinelConfigUpdate update) {
        log.info("Sentinel config update received. enabled={} dryRun={} intervalMinutes={} thresholds={}",
                 update.enabled(), update.dryRun(), update.intervalMinutes(), update.thresholds());
        return Mono.fromCallable(() -> configStore.update(update))
            .doOnNext(updated -> eventPublisher.publish(new ConfigurationChangedEvent(updated)));
    }

    /** Runs one cycle now; 409 when a cycle is already in flight. */
    @PostMapping("/run")
    public Mono<SentinelCycleReport> run() {
        log.info("Manual Sentinel run requested");
        return sentinelLoop.runSentinelCycle();
    }

    @GetMapping("/history")
    public Flux<InterventionRecord> history(@RequestParam(defaultValue = "20") int limit) {
        return queryService.sentinelHistory(limit);
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<String>> health() {
        return Mono.just(ResponseEntity.ok("OK"));
    }
}
