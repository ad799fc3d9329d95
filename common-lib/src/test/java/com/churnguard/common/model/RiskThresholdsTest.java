package com.churnguard.common.model;

import com.churnguard.common.exception.InvalidConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RiskThresholdsTest {

    @Nested
    @DisplayName("merge()")
    class Merge {

        @Test
        @DisplayName("updates only the keys present")
        void mergesPerKey() {
            RiskThresholds merged = RiskThresholds.DEFAULTS.merge(Map.of("support", 0.92));

            assertEquals(new RiskThresholds(0.85, 0.92, 0.95), merged);
        }

        @Test
        @DisplayName("ignores unknown keys and null values")
        void ignoresUnknownAndNull() {
            Map<String, Double> partial = new HashMap<>();
            partial.put("escalate", 0.5);
            partial.put("offer", null);

            assertEquals(RiskThresholds.DEFAULTS, RiskThresholds.DEFAULTS.merge(partial));
        }

        @Test
        @DisplayName("null or empty partial returns the same thresholds")
        void emptyPartial() {
            assertSame(RiskThresholds.DEFAULTS, RiskThresholds.DEFAULTS.merge(null));
            assertSame(RiskThresholds.DEFAULTS, RiskThresholds.DEFAULTS.merge(Map.of()));
        }
    }

    @Nested
    @DisplayName("validate()")
    class Validate {

        @Test
        void defaultsAreValid() {
            assertSame(RiskThresholds.DEFAULTS, RiskThresholds.DEFAULTS.validate());
        }

        @Test
        @DisplayName("out-of-order tiers are rejected")
        void outOfOrder() {
            RiskThresholds swapped = new RiskThresholds(0.90, 0.85, 0.95);

            InvalidConfigurationException e =
                assertThrows(InvalidConfigurationException.class, swapped::validate);
            assertTrue(e.getMessage().contains("nudge < support < offer"));
            assertEquals("config", e.getComponent());
        }

        @Test
        @DisplayName("equal tiers are rejected")
        void equalTiers() {
            assertThrows(InvalidConfigurationException.class,
                () -> new RiskThresholds(0.9, 0.9, 0.95).validate());
        }

        @Test
        @DisplayName("values outside (0, 1] are rejected")
        void outOfRange() {
            assertThrows(InvalidConfigurationException.class,
                () -> new RiskThresholds(0.0, 0.5, 0.9).validate());
            assertThrows(InvalidConfigurationException.class,
                () -> new RiskThresholds(0.5, 0.9, 1.01).validate());
        }
    }

    @Test
    @DisplayName("InterventionAction accepts both spellings")
    void actionSpellings() {
        assertEquals(InterventionAction.SUPPORT, InterventionAction.fromValue("support"));
        assertEquals(InterventionAction.SUPPORT, InterventionAction.fromValue("AUTO_SUPPORT"));
        assertEquals("AUTO_OFFER", InterventionAction.OFFER.autoLabel());
        assertEquals("nudge", InterventionAction.NUDGE.dbValue());
        assertThrows(IllegalArgumentException.class, () -> InterventionAction.fromValue("escalate"));
    }
}
