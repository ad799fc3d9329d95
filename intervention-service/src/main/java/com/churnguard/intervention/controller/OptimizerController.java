package com.churnguard.intervention.controller;

import com.churnguard.intervention.dto.EfficacyDTO;
import com.churnguard.intervention.optimizer.AttributionCycleReport;
import com.churnguard.intervention.optimizer.OptimizerLoop;
import com.churnguard.intervention.service.InterventionQueryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/optimizer")
public class OptimizerController {

    private static final Logger log = LoggerFactory.getLogger(OptimizerController.class);

    private final OptimizerLoop optimizerLoop;
    private final InterventionQueryService queryService;

    public OptimizerController(OptimizerLoop optimizerLoop, InterventionQueryService queryService) {
        this.optimizerLoop = optimizerLoop;
        this.queryService  = queryService;
    }

    @PostMapping("/run")
    public Mono<AttributionCycleReport> run() {
        log.info("Manual Optimizer run requested");
        return optimizerLoop.runAttributionCycle();
    }

    @GetMapping("/efficacy")
    public Mono<List<EfficacyDTO>> efficacy() {
        return queryService.efficacy()
            .doOnError(e -> log.error("Efficacy endpoint error", e));
    }
}
