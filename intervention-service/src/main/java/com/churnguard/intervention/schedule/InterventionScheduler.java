package com.churnguard.intervention.schedule;

import com.churnguard.common.exception.CycleInProgressException;
import com.churnguard.intervention.config.OptimizerProperties;
import com.churnguard.intervention.config.SentinelConfigurationStore;
import com.churnguard.intervention.optimizer.OptimizerLoop;
import com.churnguard.intervention.sentinel.SentinelLoop;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;

/**
 * Drives both loops on their own timers.
 *
 * <pre>
 *   Sentinel:  delay(intervalMinutes) → cycle → read live interval → repeat
 *   Optimizer: delay(until next runAt) → cycle → repeat
 * </pre>
 *
 * <p>Each tick is a fresh {@link Mono} whose terminal {@code subscribe()} schedules the
 * next one, on success and on error alike, so a failing cycle never stops its loop.
 * A tick that finds its loop still busy (e.g. a long manual run) is skipped, not queued.
 *
 * <p>Changing {@code intervalMinutes} re-arms a pending Sentinel delay from now. A cycle
 * already in flight is left alone and picks up the new interval when it finishes.
 *
 * <p>Disabled with {@code scheduler.enabled=false}; manual triggers keep working.
 */
@Component
@ConditionalOnProperty(name = "scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class InterventionScheduler {

    private static final Logger log = LoggerFactory.getLogger(InterventionScheduler.class);

    private final SentinelLoop sentinelLoop;
    private final OptimizerLoop optimizerLoop;
    private final SentinelConfigurationStore configStore;
    private final OptimizerProperties optimizerProperties;
    private final Clock clock;

    private volatile boolean stopped;
    private volatile Disposable optimizerTick;

    // guarded by this
    private Disposable sentinelDelay;
    private Disposable sentinelCycle;
    private long sentinelGeneration;

    public InterventionScheduler(SentinelLoop sentinelLoop,
                                 OptimizerLoop optimizerLoop,
                                 SentinelConfigurationStore configStore,
                                 OptimizerProperties optimizerProperties,
                                 Clock clock) {
        this.sentinelLoop        = sentinelLoop;
        this.optimizerLoop       = optimizerLoop;
        this.configStore         = configStore;
        this.optimizerProperties = optimizerProperties;
        this.clock               = clock;
    }

    @PostConstruct
    public void start() {
        Duration sentinelDelay = sentinelInterval();
        Duration optimizerDelay = untilNextOptimizerRun();
        log.info("Intervention scheduler started. sentinelIntervalMinutes={} optimizerRunAt={} {} optimizerFirstRunInMinutes={}",
                 sentinelDelay.toMinutes(), optimizerProperties.getRunAt(), optimizerProperties.getZone(),
                 optimizerDelay.toMinutes());
        configStore.onIntervalChange(this::rearmSentinel);
        scheduleSentinel(sentinelDelay);
        scheduleOptimizer(optimizerDelay);
    }

    @PreDestroy
    public void stop() {
        stopped = true;
        synchronized (this) {
            dispose(sentinelDelay);
            dispose(sentinelCycle);
        }
        dispose(optimizerTick);
        log.info("Intervention scheduler stopped");
    }

    // ── sentinel loop ─────────────────────────────────────────────────────────

    private synchronized void scheduleSentinel(Duration delay) {
        if (stopped) {
            return;
        }
        long generation = ++sentinelGeneration;
        configStore.recordStats(null, clock.instant().plus(delay));
        sentinelDelay = Mono.delay(delay).subscribe(tick -> fireSentinel(generation));
    }

    private void fireSentinel(long generation) {
        synchronized (this) {
            if (stopped || generation != sentinelGeneration) {
                return;
            }
            sentinelDelay = null;
            sentinelCycle = sentinelLoop.runSentinelCycle()
                .subscribe(
                    report -> scheduleSentinel(sentinelInterval()),
                    err -> {
                        logTickFailure("sentinel", err);
                        scheduleSentinel(sentinelInterval());
                    }
                );
        }
    }

    private synchronized void rearmSentinel(int intervalMinutes) {
        if (stopped || sentinelDelay == null) {
            return;
        }
        dispose(sentinelDelay);
        log.info("Sentinel interval changed, rescheduling. intervalMinutes={}", intervalMinutes);
        scheduleSentinel(Duration.ofMinutes(intervalMinutes));
    }

    private Duration sentinelInterval() {
        return Duration.ofMinutes(configStore.get().intervalMinutes());
    }

    // ── optimizer loop ────────────────────────────────────────────────────────

    private void scheduleOptimizer(Duration delay) {
        if (stopped) {
            return;
        }
        optimizerTick = Mono.delay(delay)
            .then(optimizerLoop.runAttributionCycle())
            .subscribe(
                report -> scheduleOptimizer(untilNextOptimizerRun()),
                err -> {
                    logTickFailure("optimizer", err);
                    scheduleOptimizer(untilNextOptimizerRun());
                }
            );
    }

    private Duration untilNextOptimizerRun() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(optimizerProperties.zoneId()));
        return DailySchedule.untilNext(now, optimizerProperties.runAtTime());
    }

    private static void logTickFailure(String loop, Throwable err) {
        if (err instanceof CycleInProgressException) {
            log.warn("Scheduled tick skipped, previous cycle still running. loop={}", loop);
        } else {
            log.error("Scheduled cycle failed, rescheduling. loop={}", loop, err);
        }
    }

    private static void dispose(Disposable tick) {
        if (tick != null && !tick.isDisposed()) {
            tick.dispose();
        }
    }
}
