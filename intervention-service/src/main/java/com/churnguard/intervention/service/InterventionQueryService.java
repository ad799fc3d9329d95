package com.churnguard.intervention.service;

import com.churnguard.common.event.InterventionEventPublisher;
import com.churnguard.common.event.InterventionRecordedEvent;
import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.InterventionOutcome;
import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.model.InterventionSource;
import com.churnguard.intervention.dto.EfficacyDTO;
import com.churnguard.intervention.dto.ManualInterventionRequest;
import com.churnguard.intervention.ledger.InterventionLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger access for the HTTP layer: manual recording, history and efficacy.
 */
@Service
public class InterventionQueryService {

    private static final Logger log = LoggerFactory.getLogger(InterventionQueryService.class);

    private final InterventionLedger ledger;
    private final InterventionEventPublisher eventPublisher;
    private final Clock clock;

    public InterventionQueryService(InterventionLedger ledger,
                                    InterventionEventPublisher eventPublisher,
                                    Clock clock) {
        this.ledger         = ledger;
        this.eventPublisher = eventPublisher;
        this.clock          = clock;
    }

    /**
     * Validates and records a manual or API intervention, then broadcasts it.
     * A {@code manual} record holds the Sentinel off the user for {@code humanPriorityHours}.
     */
    public Mono<InterventionRecord> recordIntervention(ManualInterventionRequest request) {
        return Mono.fromCallable(() -> {
                InterventionAction action = request.action();
                InterventionSource source = request.resolvedSource();
                return InterventionRecord.completed(request.userId(), action, source, clock.instant(),
                    request.validatedRisk(), request.metadata());
            })
            .flatMap(ledger::insert)
            .doOnSuccess(saved -> {
                log.info("Intervention recorded. id={} userId={} action={} source={}",
                         saved.id(), saved.userId(), saved.actionType().dbValue(), saved.source().dbValue());
                eventPublisher.publish(new InterventionRecordedEvent(saved.userId(),
                    saved.actionType().dbValue(), saved.source().dbValue(), saved.id(), saved.createdAt()));
            });
    }

    public Flux<InterventionRecord> recent(int limit) {
        return Flux.defer(() -> ledger.recent(clampLimit(limit)));
    }

    public Flux<InterventionRecord> sentinelHistory(int limit) {
        return Flux.defer(() -> ledger.recentBySource(InterventionSource.SENTINEL, clampLimit(limit)));
    }

    /** Success rates per action type over every attributed record, in tier order. */
    public Mono<List<EfficacyDTO>> efficacy() {
        return ledger.attributed()
            .collectList()
            .map(InterventionQueryService::aggregate);
    }

    static List<EfficacyDTO> aggregate(List<InterventionRecord> attributed) {
        Map<InterventionAction, int[]> stats = new EnumMap<>(InterventionAction.class);
        for (InterventionRecord record : attributed) {
            // [total, successes, failures]
            int[] s = stats.computeIfAbsent(record.actionType(), a -> new int[3]);
            s[0]++;
            if (record.outcome() == InterventionOutcome.SUCCESS) s[1]++;
            if (record.outcome() == InterventionOutcome.FAILURE) s[2]++;
        }

        List<EfficacyDTO> result = new ArrayList<>();
        stats.forEach((action, s) -> result.add(new EfficacyDTO(
            action.dbValue(), s[0], s[1], s[2],
            s[0] > 0 ? (int) Math.round(s[1] * 100.0 / s[0]) : 0)));
        return result;
    }

    private static int clampLimit(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be > 0, was " + limit);
        }
        return Math.min(limit, 500);
    }
}
