package com.churnguard.intervention.config;

import com.churnguard.common.exception.InvalidConfigurationException;
import com.churnguard.common.model.RiskThresholds;
import com.churnguard.common.model.SentinelConfiguration;
import com.churnguard.common.model.SentinelStats;
import com.churnguard.intervention.dto.SentinelConfigUpdate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.IntConsumer;

/**
 * Owner of the live Sentinel configuration.
 *
 * <p>Shared by the Sentinel loop, the scheduler and the HTTP layer. Every read and write of the state is
 * {@code synchronized} and hands out immutable {@link SentinelConfiguration} snapshots,
 * so callers never observe a half-applied update.
 *
 * <p>Reads perform the daily rollover: the first read on a new calendar day (in the
 * clock's zone) resets {@code actionsToday} to zero.
 *
 * <p>Interval listeners are called outside the lock, after the new interval is visible.
 */
@Component
public class SentinelConfigurationStore {

    private static final Logger log = LoggerFactory.getLogger(SentinelConfigurationStore.class);

    private final Clock clock;
    private final List<IntConsumer> intervalListeners = new CopyOnWriteArrayList<>();
    private SentinelConfiguration current;

    @Autowired
    public SentinelConfigurationStore(SentinelProperties properties, Clock clock) {
        this(properties.toConfiguration(LocalDate.now(clock)), clock);
    }

    public SentinelConfigurationStore(SentinelConfiguration initial, Clock clock) {
        this.current = initial;
        this.clock   = clock;
        log.info("Sentinel configuration loaded. enabled={} dryRun={} thresholds={} intervalMinutes={}",
                 initial.enabled(), initial.dryRun(), initial.thresholds(), initial.intervalMinutes());
    }

    public synchronized SentinelConfiguration get() {
        rollOverIfNewDay();
        return current;
    }

    /**
     * Applies a partial update atomically.
     *
     * @return the new snapshot
     * @throws InvalidConfigurationException when the merged result is invalid; nothing is changed
     */
    public SentinelConfiguration update(SentinelConfigUpdate update) {
        int previousInterval;
        SentinelConfiguration updated;
        synchronized (this) {
            previousInterval = current.intervalMinutes();
            updated = applyUpdate(update);
        }
        if (updated.intervalMinutes() != previousInterval) {
            intervalListeners.forEach(listener -> listener.accept(updated.intervalMinutes()));
            return get();
        }
        return updated;
    }

    /** Called with the new value whenever an update changes {@code intervalMinutes}. */
    public void onIntervalChange(IntConsumer listener) {
        intervalListeners.add(listener);
    }

    private SentinelConfiguration applyUpdate(SentinelConfigUpdate update) {
        rollOverIfNewDay();
        SentinelConfiguration candidate = current;

        if (update.enabled() != null) {
            candidate = candidate.withEnabled(update.enabled());
        }
        if (update.dryRun() != null) {
            candidate = candidate.withDryRun(update.dryRun());
        }
        if (update.intervalMinutes() != null) {
            if (update.intervalMinutes() <= 0) {
                throw new InvalidConfigurationException(
                    "intervalMinutes must be > 0, was " + update.intervalMinutes());
            }
            candidate = candidate.withIntervalMinutes(update.intervalMinutes());
        }
        if (update.thresholds() != null) {
            RiskThresholds merged = candidate.thresholds().merge(update.thresholds()).validate();
            candidate = candidate.withThresholds(merged);
        }

        current = candidate;
        log.info("Sentinel configuration updated. enabled={} dryRun={} thresholds={} intervalMinutes={}",
                 current.enabled(), current.dryRun(), current.thresholds(), current.intervalMinutes());
        return current;
    }

    /**
     * Records run timestamps. A {@code null} argument leaves that field unchanged.
     */
    public synchronized SentinelConfiguration recordStats(Instant lastRun, Instant nextRun) {
        rollOverIfNewDay();
        SentinelStats stats = current.stats();
        current = current.withStats(new SentinelStats(
            lastRun != null ? lastRun : stats.lastRun(),
            nextRun != null ? nextRun : stats.nextRun(),
            stats.actionsToday(),
            stats.lastResetDate()));
        return current;
    }

    /** Counts one real (non-dry-run) action against today's total. */
    public synchronized int incrementActionsToday() {
        rollOverIfNewDay();
        SentinelStats stats = current.stats();
        int next = stats.actionsToday() + 1;
        current = current.withStats(
            new SentinelStats(stats.lastRun(), stats.nextRun(), next, stats.lastResetDate()));
        return next;
    }

    private void rollOverIfNewDay() {
        LocalDate today = LocalDate.now(clock);
        SentinelStats stats = current.stats();
        if (!today.equals(stats.lastResetDate())) {
            log.info("Daily reset of actionsToday. previous={} lastResetDate={} today={}",
                     stats.actionsToday(), stats.lastResetDate(), today);
            current = current.withStats(new SentinelStats(stats.lastRun(), stats.nextRun(), 0, today));
        }
    }
}
