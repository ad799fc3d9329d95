package com.churnguard.intervention.sentinel;

import com.churnguard.common.decision.TierClassifier;
import com.churnguard.common.event.InterventionEventPublisher;
import com.churnguard.common.event.SentinelActionEvent;
import com.churnguard.common.event.SentinelStatusEvent;
import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.model.InterventionSource;
import com.churnguard.common.model.SentinelConfiguration;
import com.churnguard.common.model.UserRiskSnapshot;
import com.churnguard.common.trace.TraceContextUtil;
import com.churnguard.intervention.client.RiskSourceClient;
import com.churnguard.intervention.config.SentinelConfigurationStore;
import com.churnguard.intervention.ledger.InterventionLedger;
import com.churnguard.intervention.notification.InterventionNotifier;
import com.churnguard.intervention.schedule.CycleGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The Sentinel: scans the riskiest users and intervenes, within safety limits.
 *
 * <p>One cycle:
 * <pre>
 *   read config ─ disabled? ─► no-op
 *        │
 *   fetch chunkSize users ─ failed? ─► summary with fetchFailed
 *        │
 *   sort by risk desc, then for each user, strictly in order:
 *     budget spent?            → SKIPPED_RATE_LIMIT
 *     below nudge threshold?   → SKIPPED_BELOW_THRESHOLD
 *     any record in cooldown?  → SKIPPED_COOLDOWN
 *     manual record recently?  → SKIPPED_HUMAN_PRIORITY
 *     else                     → ACTED (persist + notify, or log only in dry-run)
 *        │
 *   record lastRun/nextRun, publish SENTINEL_STATUS
 * </pre>
 *
 * <p>Users are processed with {@code concatMap}, so every gate query sees the rows
 * written earlier in the same cycle. Nothing survives between cycles except the
 * ledger itself.
 *
 * <p>Failures are isolated per user. A failed gate query closes the gate for that
 * user, a failed insert is counted and the cycle moves on.
 */
@Service
public class SentinelLoop {

    private static final Logger log = LoggerFactory.getLogger(SentinelLoop.class);

    private final SentinelConfigurationStore configStore;
    private final RiskSourceClient riskSource;
    private final InterventionLedger ledger;
    private final InterventionEventPublisher eventPublisher;
    private final InterventionNotifier notifier;
    private final Clock clock;
    private final CycleGuard guard = new CycleGuard("sentinel");

    public SentinelLoop(SentinelConfigurationStore configStore,
                        RiskSourceClient riskSource,
                        InterventionLedger ledger,
                        InterventionEventPublisher eventPublisher,
                        InterventionNotifier notifier,
                        Clock clock) {
        this.configStore    = configStore;
        this.riskSource     = riskSource;
        this.ledger         = ledger;
        this.eventPublisher = eventPublisher;
        this.notifier       = notifier;
        this.clock          = clock;
    }

    /**
     * Runs one cycle. Used by both the scheduler and the manual trigger.
     *
     * @return the cycle report; errors with {@code CycleInProgressException} when a
     *         cycle is already running
     */
    public Mono<SentinelCycleReport> runSentinelCycle() {
        return guard.runExclusive(this::executeCycle);
    }

    public boolean isCycleRunning() {
        return guard.isRunning();
    }

    private Mono<SentinelCycleReport> executeCycle() {
        SentinelConfiguration config = configStore.get();
        String cycleId = TraceContextUtil.newTraceId();
        Instant startedAt = clock.instant();

        if (!config.enabled()) {
            log.debug("Sentinel disabled, skipping cycle. cycleId={}", cycleId);
            return Mono.just(SentinelCycleReport.disabled(cycleId, config.dryRun(), startedAt));
        }

        TraceContextUtil.withMdc(cycleId, () ->
            log.info("Sentinel cycle started. cycleId={} dryRun={} chunkSize={} maxActionsPerRun={}",
                     cycleId, config.dryRun(), config.chunkSize(), config.maxActionsPerRun()));

        CycleTally tally = new CycleTally();
        AtomicBoolean fetchFailed = new AtomicBoolean(false);

        return riskSource.fetchRiskBatch(config.chunkSize())
            .defaultIfEmpty(List.of())
            .onErrorResume(e -> {
                fetchFailed.set(true);
                TraceContextUtil.withMdc(cycleId, () ->
                    log.error("Sentinel risk fetch failed, aborting cycle. cycleId={} error={}",
                              cycleId, e.getMessage()));
                return Mono.just(List.of());
            })
            .flatMapMany(users -> Flux.fromIterable(prioritize(users)))
            .concatMap(user -> evaluate(user, config, cycleId, tally))
            .then(Mono.fromCallable(() -> finish(config, cycleId, tally, fetchFailed.get(), startedAt)));
    }

    /**
     * Highest risk first, so that the budget goes to the users most likely to churn.
     * The sort is stable: equal risks keep the order the risk source returned.
     */
    static List<UserRiskSnapshot> prioritize(List<UserRiskSnapshot> users) {
        List<UserRiskSnapshot> sorted = new ArrayList<>(users);
        sorted.sort(Comparator.comparingDouble(UserRiskSnapshot::churnProbability).reversed());
        return sorted;
    }

    private Mono<UserDecision> evaluate(UserRiskSnapshot user,
                                        SentinelConfiguration config,
                                        String cycleId,
                                        CycleTally tally) {
        if (tally.actions() >= config.maxActionsPerRun()) {
            if (tally.markRateLimitReached()) {
                log.info("Sentinel rate limit reached, remaining users skipped. cycleId={} maxActionsPerRun={}",
                         cycleId, config.maxActionsPerRun());
            }
            return Mono.just(tally.record(UserDecision.SKIPPED_RATE_LIMIT));
        }

        Optional<InterventionAction> tier = TierClassifier.classify(user.churnProbability(), config.thresholds());
        if (tier.isEmpty()) {
            return Mono.just(tally.record(UserDecision.SKIPPED_BELOW_THRESHOLD));
        }

        InterventionAction action = tier.get();
        Instant now = clock.instant();
        return checkGates(user.userId(), config, now, cycleId)
            .switchIfEmpty(Mono.defer(() -> act(user, action, config, cycleId, now)))
            .map(tally::record);
    }

    /**
     * Cooldown first, then human priority. Emits the blocking decision, or completes
     * empty when the user may be acted upon.
     */
    private Mono<UserDecision> checkGates(String userId, SentinelConfiguration config,
                                          Instant now, String cycleId) {
        return hasRecordSince(userId, config.cooldownHours(), null, now)
            .flatMap(inCooldown -> {
                if (inCooldown) {
                    log.debug("Sentinel skip, cooldown active. userId={} cooldownHours={} cycleId={}",
                              userId, config.cooldownHours(), cycleId);
                    return Mono.just(UserDecision.SKIPPED_COOLDOWN);
                }
                return hasRecordSince(userId, config.humanPriorityHours(), InterventionSource.MANUAL, now)
                    .flatMap(manual -> {
                        if (manual) {
                            log.debug("Sentinel skip, human priority. userId={} humanPriorityHours={} cycleId={}",
                                      userId, config.humanPriorityHours(), cycleId);
                            return Mono.just(UserDecision.SKIPPED_HUMAN_PRIORITY);
                        }
                        return Mono.<UserDecision>empty();
                    });
            })
            .onErrorResume(e -> {
                log.warn("Sentinel gate check failed, user skipped. userId={} cycleId={} error={}",
                         userId, cycleId, e.getMessage());
                return Mono.just(UserDecision.SKIPPED_GATE_CHECK_FAILED);
            });
    }

    /** A zero-hour window contains nothing, so no query is issued. */
    private Mono<Boolean> hasRecordSince(String userId, int hours, InterventionSource source, Instant now) {
        if (hours <= 0) {
            return Mono.just(false);
        }
        return ledger.queryByUser(userId, now.minus(Duration.ofHours(hours)), source).hasElements();
    }

    private Mono<UserDecision> act(UserRiskSnapshot user,
                                   InterventionAction action,
                                   SentinelConfiguration config,
                                   String cycleId,
                                   Instant now) {
        if (config.dryRun()) {
            log.info("DRY RUN: would execute. action={} userId={} riskPercent={} cycleId={}",
                     action.autoLabel(), user.userId(), user.riskPercent(), cycleId);
            eventPublisher.publish(new SentinelActionEvent(
                user.userId(), action.autoLabel(), user.riskPercent(), true, now));
            return Mono.just(UserDecision.ACTED);
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("triggeredBy", InterventionSource.SENTINEL.dbValue());
        metadata.put("tier", action.autoLabel());
        metadata.put("cycleId", cycleId);
        metadata.put("timestamp", now.toString());

        InterventionRecord record = InterventionRecord.completed(
            user.userId(), action, InterventionSource.SENTINEL, now, user.churnProbability(), metadata);

        return ledger.insert(record)
            .map(saved -> {
                configStore.incrementActionsToday();
                log.info("Sentinel action executed. action={} userId={} riskPercent={} interventionId={} cycleId={}",
                         action.autoLabel(), user.userId(), user.riskPercent(), saved.id(), cycleId);
                announce(saved, user, action, cycleId, now);
                return UserDecision.ACTED;
            })
            .defaultIfEmpty(UserDecision.PERSIST_FAILED)
            .onErrorResume(e -> {
                log.warn("Sentinel persist failed, continuing. userId={} action={} cycleId={} error={}",
                         user.userId(), action.autoLabel(), cycleId, e.getMessage());
                return Mono.just(UserDecision.PERSIST_FAILED);
            });
    }

    /** Runs after the row is written; a failure here never turns the action into a persist failure. */
    private void announce(InterventionRecord saved,
                          UserRiskSnapshot user,
                          InterventionAction action,
                          String cycleId,
                          Instant now) {
        try {
            notifier.notify(saved);
        } catch (RuntimeException e) {
            log.warn("Sentinel notification failed, action kept. userId={} interventionId={} cycleId={} error={}",
                     user.userId(), saved.id(), cycleId, e.getMessage());
        }
        try {
            eventPublisher.publish(new SentinelActionEvent(
                user.userId(), action.autoLabel(), user.riskPercent(), false, now));
        } catch (RuntimeException e) {
            log.warn("Sentinel action event not published. userId={} interventionId={} cycleId={} error={}",
                     user.userId(), saved.id(), cycleId, e.getMessage());
        }
    }

    private SentinelCycleReport finish(SentinelConfiguration config,
                                       String cycleId,
                                       CycleTally tally,
                                       boolean fetchFailed,
                                       Instant startedAt) {
        Instant finishedAt = clock.instant();
        // Interval is re-read so that an update made during the cycle applies to the next tick.
        int intervalMinutes = configStore.get().intervalMinutes();
        Instant nextRun = finishedAt.plus(Duration.ofMinutes(intervalMinutes));
        configStore.recordStats(finishedAt, nextRun);

        int persistFailures = tally.count(UserDecision.PERSIST_FAILED);
        int gateFailures    = tally.count(UserDecision.SKIPPED_GATE_CHECK_FAILED);

        eventPublisher.publish(new SentinelStatusEvent(
            finishedAt, tally.actions(), config.dryRun(), fetchFailed, persistFailures, gateFailures));

        SentinelCycleReport report = new SentinelCycleReport(cycleId, true, config.dryRun(), fetchFailed,
            tally.candidates(), tally.actions(), tally.snapshot(), startedAt, finishedAt, nextRun);

        TraceContextUtil.withMdc(cycleId, () ->
            log.info("Sentinel cycle complete. cycleId={} candidates={} actions={} dryRun={} fetchFailed={} " +
                     "persistFailures={} gateFailures={} durationMs={} nextRun={}",
                     cycleId, report.candidates(), report.actions(), report.dryRun(), fetchFailed,
                     persistFailures, gateFailures,
                     Duration.between(startedAt, finishedAt).toMillis(), nextRun));
        return report;
    }
}
