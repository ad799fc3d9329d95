package com.churnguard.intervention.config;

import com.churnguard.common.exception.InvalidConfigurationException;
import com.churnguard.common.model.RiskThresholds;
import com.churnguard.common.model.SentinelConfiguration;
import com.churnguard.common.model.SentinelStats;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.LocalDate;

/**
 * Start-up values for the Sentinel, bound from {@code sentinel.*}.
 * Runtime changes go through {@link SentinelConfigurationStore}, never back here.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "sentinel")
public class SentinelProperties {

    private boolean enabled = false;

    /** Log and broadcast decisions without writing rows or notifying anyone. */
    private boolean dryRun = true;

    private Thresholds thresholds = new Thresholds();

    private int intervalMinutes = 60;

    /** Users fetched from the risk source per cycle. */
    private int chunkSize = 100;

    private int maxActionsPerRun = 10;

    private int cooldownHours = 24;

    /** How long a manual intervention keeps the Sentinel away from that user. */
    private int humanPriorityHours = 12;

    @Getter
    @Setter
    public static class Thresholds {
        private double nudge   = RiskThresholds.DEFAULTS.nudge();
        private double support = RiskThresholds.DEFAULTS.support();
        private double offer   = RiskThresholds.DEFAULTS.offer();
    }

    /**
     * @throws InvalidConfigurationException when a bound value is out of range
     */
    public SentinelConfiguration toConfiguration(LocalDate today) {
        RiskThresholds riskThresholds =
            new RiskThresholds(thresholds.getNudge(), thresholds.getSupport(), thresholds.getOffer())
                .validate();
        requirePositive("intervalMinutes", intervalMinutes);
        requirePositive("chunkSize", chunkSize);
        requireNonNegative("maxActionsPerRun", maxActionsPerRun);
        requireNonNegative("cooldownHours", cooldownHours);
        requireNonNegative("humanPriorityHours", humanPriorityHours);

        return new SentinelConfiguration(enabled, dryRun, riskThresholds, intervalMinutes, chunkSize,
            maxActionsPerRun, cooldownHours, humanPriorityHours, SentinelStats.fresh(today));
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new InvalidConfigurationException(name + " must be > 0, was " + value);
        }
    }

    private static void requireNonNegative(String name, int value) {
        if (value < 0) {
            throw new InvalidConfigurationException(name + " must be >= 0, was " + value);
        }
    }
}
