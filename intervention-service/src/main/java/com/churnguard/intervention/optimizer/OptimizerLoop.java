package com.churnguard.intervention.optimizer;

import com.churnguard.common.attribution.AttributionResult;
import com.churnguard.common.attribution.OutcomeClassifier;
import com.churnguard.common.event.AttributionCycleEvent;
import com.churnguard.common.event.InterventionEventPublisher;
import com.churnguard.common.model.InterventionOutcome;
import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.trace.TraceContextUtil;
import com.churnguard.intervention.client.RiskSourceClient;
import com.churnguard.intervention.config.OptimizerProperties;
import com.churnguard.intervention.ledger.InterventionLedger;
import com.churnguard.intervention.ledger.OutcomeAttribution;
import com.churnguard.intervention.schedule.CycleGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The Optimizer: closes the loop by attributing an outcome to each intervention
 * roughly two days after it was taken.
 *
 * <p>One cycle selects pending rows created in {@code [now - windowStart, now - windowEnd]},
 * re-scores each user and applies {@link OutcomeClassifier}. Terminal outcomes are
 * written with a conditional single-row update, so re-running the cycle over the same
 * window never changes an already attributed row. Non-terminal results are not
 * written at all and the row stays eligible until it ages out of the window.
 *
 * <p>Only a failed window query aborts the cycle; per-record failures leave that row
 * pending and the cycle continues.
 */
@Service
public class OptimizerLoop {

    private static final Logger log = LoggerFactory.getLogger(OptimizerLoop.class);

    private final InterventionLedger ledger;
    private final RiskSourceClient riskSource;
    private final InterventionEventPublisher eventPublisher;
    private final OptimizerProperties properties;
    private final Clock clock;
    private final CycleGuard guard = new CycleGuard("optimizer");

    public OptimizerLoop(InterventionLedger ledger,
                         RiskSourceClient riskSource,
                         InterventionEventPublisher eventPublisher,
                         OptimizerProperties properties,
                         Clock clock) {
        this.ledger         = ledger;
        this.riskSource     = riskSource;
        this.eventPublisher = eventPublisher;
        this.properties     = properties.validate();
        this.clock          = clock;
    }

    /**
     * Runs one attribution cycle. Used by both the scheduler and the manual trigger.
     *
     * @return the cycle report; errors with {@code CycleInProgressException} when a
     *         cycle is already running
     */
    public Mono<AttributionCycleReport> runAttributionCycle() {
        return guard.runExclusive(this::executeCycle);
    }

    public boolean isCycleRunning() {
        return guard.isRunning();
    }

    private Mono<AttributionCycleReport> executeCycle() {
        String cycleId = TraceContextUtil.newTraceId();
        Instant now = clock.instant();
        Instant windowStart = now.minus(properties.windowStart());
        Instant windowEnd   = now.minus(properties.windowEnd());

        TraceContextUtil.withMdc(cycleId, () ->
            log.info("Optimizer cycle started. cycleId={} windowStart={} windowEnd={} batchSize={}",
                     cycleId, windowStart, windowEnd, properties.getBatchSize()));

        return ledger.queryPendingInWindow(windowStart, windowEnd, properties.getBatchSize())
            .collectList()
            .map(Optional::of)
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(cycleId, () ->
                    log.error("Optimizer window query failed, aborting cycle. cycleId={} error={}",
                              cycleId, e.getMessage()));
                return Mono.just(Optional.<List<InterventionRecord>>empty());
            })
            .flatMap(pending -> pending.isPresent()
                ? attributeAll(pending.get(), cycleId, windowStart, windowEnd)
                : Mono.just(new AttributionCycleReport(cycleId, true, 0, 0, 0, 0, 0, 0, 0,
                    windowStart, windowEnd, clock.instant())));
    }

    private Mono<AttributionCycleReport> attributeAll(List<InterventionRecord> pending,
                                                      String cycleId,
                                                      Instant windowStart,
                                                      Instant windowEnd) {
        log.info("Optimizer evaluating pending interventions. cycleId={} count={}", cycleId, pending.size());
        Map<AttributionDecision, Integer> counts = new EnumMap<>(AttributionDecision.class);

        return Flux.fromIterable(pending)
            .concatMap(record -> attribute(record, cycleId))
            .doOnNext(decision -> counts.merge(decision, 1, Integer::sum))
            .then(Mono.fromCallable(() -> finish(cycleId, pending.size(), counts, windowStart, windowEnd)));
    }

    private Mono<AttributionDecision> attribute(InterventionRecord record, String cycleId) {
        if (record.isAttributed()) {
            return Mono.just(AttributionDecision.ALREADY_ATTRIBUTED);
        }
        return riskSource.fetchRisk(record.userId())
            .onErrorResume(e -> {
                log.warn("Optimizer risk lookup failed, record stays pending. id={} userId={} error={}",
                         record.id(), record.userId(), e.getMessage());
                return Mono.empty();
            })
            .flatMap(current -> {
                AttributionResult result = OutcomeClassifier.evaluate(record.riskAtIntervention(), current);
                if (!result.isTerminal()) {
                    log.debug("Optimizer outcome still pending. id={} userId={} riskDelta={}",
                              record.id(), record.userId(), result.riskDelta());
                    return Mono.just(AttributionDecision.STILL_PENDING);
                }
                return write(record, result, cycleId);
            })
            .switchIfEmpty(Mono.fromCallable(() -> {
                log.info("Optimizer skip, no risk data. id={} userId={} cycleId={}",
                         record.id(), record.userId(), cycleId);
                return AttributionDecision.SKIPPED_NO_RISK_DATA;
            }));
    }

    private Mono<AttributionDecision> write(InterventionRecord record, AttributionResult result, String cycleId) {
        OutcomeAttribution attribution = new OutcomeAttribution(
            result.outcome(), result.riskDelta(), result.currentRisk(), clock.instant());

        return ledger.updateOutcome(record.id(), attribution)
            .map(updated -> {
                if (!updated) {
                    return AttributionDecision.ALREADY_ATTRIBUTED;
                }
                log.info("Optimizer outcome attributed. id={} userId={} action={} outcome={} riskDelta={} cycleId={}",
                         record.id(), record.userId(), record.actionType().dbValue(),
                         result.outcome().dbValue(), formatDelta(result.riskDelta()), cycleId);
                return result.outcome() == InterventionOutcome.SUCCESS
                    ? AttributionDecision.SUCCESS
                    : AttributionDecision.FAILURE;
            })
            .defaultIfEmpty(AttributionDecision.WRITE_FAILED)
            .onErrorResume(e -> {
                log.warn("Optimizer outcome write failed, record stays pending. id={} cycleId={} error={}",
                         record.id(), cycleId, e.getMessage());
                return Mono.just(AttributionDecision.WRITE_FAILED);
            });
    }

    private AttributionCycleReport finish(String cycleId,
                                          int selected,
                                          Map<AttributionDecision, Integer> counts,
                                          Instant windowStart,
                                          Instant windowEnd) {
        int successes     = counts.getOrDefault(AttributionDecision.SUCCESS, 0);
        int failures      = counts.getOrDefault(AttributionDecision.FAILURE, 0);
        int stillPending  = counts.getOrDefault(AttributionDecision.STILL_PENDING, 0);
        int skipped       = counts.getOrDefault(AttributionDecision.SKIPPED_NO_RISK_DATA, 0)
                          + counts.getOrDefault(AttributionDecision.ALREADY_ATTRIBUTED, 0);
        int writeFailures = counts.getOrDefault(AttributionDecision.WRITE_FAILED, 0);
        int processed     = successes + failures + stillPending;
        Instant finishedAt = clock.instant();

        eventPublisher.publish(new AttributionCycleEvent(processed, successes, failures, finishedAt));

        TraceContextUtil.withMdc(cycleId, () ->
            log.info("Optimizer cycle complete. cycleId={} selected={} processed={} successes={} failures={} " +
                     "stillPending={} skipped={} writeFailures={}",
                     cycleId, selected, processed, successes, failures, stillPending, skipped, writeFailures));

        return new AttributionCycleReport(cycleId, false, selected, processed, successes, failures,
            stillPending, skipped, writeFailures, windowStart, windowEnd, finishedAt);
    }

    private static String formatDelta(double delta) {
        return String.format("%+.1f%%", delta * 100);
    }
}
