package com.churnguard.intervention.config;

import com.churnguard.common.exception.InvalidConfigurationException;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Attribution window and daily run time, bound from {@code optimizer.*}.
 *
 * <p>The window selects interventions created between {@code windowStartHours} and
 * {@code windowEndHours} ago, i.e. {@code [now - 50h, now - 46h]} by default: old
 * enough for the risk score to have moved, with a few hours of overlap so a late
 * run does not miss anything.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "optimizer")
public class OptimizerProperties {

    /** Local time of day, {@code HH:mm}. */
    private String runAt = "00:00";

    private String zone = "UTC";

    private int windowStartHours = 50;

    private int windowEndHours = 46;

    private int batchSize = 100;

    public LocalTime runAtTime() {
        return LocalTime.parse(runAt);
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public Duration windowStart() {
        return Duration.ofHours(windowStartHours);
    }

    public Duration windowEnd() {
        return Duration.ofHours(windowEndHours);
    }

    /**
     * @throws InvalidConfigurationException when the window is empty or inverted
     */
    public OptimizerProperties validate() {
        if (windowEndHours < 0 || windowStartHours <= windowEndHours) {
            throw new InvalidConfigurationException(String.format(
                "optimizer window must satisfy windowStartHours > windowEndHours >= 0, was %d/%d",
                windowStartHours, windowEndHours));
        }
        if (batchSize <= 0) {
            throw new InvalidConfigurationException("optimizer batchSize must be > 0, was " + batchSize);
        }
        return this;
    }
}
