package com.churnguard.intervention.controller;

import com.churnguard.common.event.ConfigurationChangedEvent;
import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.InterventionOutcome;
import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.model.InterventionSource;
import com.churnguard.common.model.InterventionStatus;
import com.churnguard.common.model.RiskThresholds;
import com.churnguard.common.model.SentinelConfiguration;
import com.churnguard.common.model.SentinelStats;
import com.churnguard.common.model.UserRiskSnapshot;
import com.churnguard.intervention.client.RiskSourceClient;
import com.churnguard.intervention.config.OptimizerProperties;
import com.churnguard.intervention.config.SentinelConfigurationStore;
import com.churnguard.intervention.dto.SentinelConfigUpdate;
import com.churnguard.intervention.optimizer.OptimizerLoop;
import com.churnguard.intervention.sentinel.SentinelLoop;
import com.churnguard.intervention.service.InterventionQueryService;
import com.churnguard.intervention.support.InMemoryInterventionLedger;
import com.churnguard.intervention.support.MutableClock;
import com.churnguard.intervention.support.RecordingEventPublisher;
import com.churnguard.intervention.support.RecordingNotifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InterventionApiTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private InMemoryInterventionLedger ledger;
    private RecordingEventPublisher events;
    private SentinelConfigurationStore store;
    private Sinks.One<List<UserRiskSnapshot>> pendingFetch;
    private SentinelLoop sentinelLoop;
    private WebTestClient client;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(NOW);
        ledger       = new InMemoryInterventionLedger();
        events       = new RecordingEventPublisher();
        pendingFetch = Sinks.one();

        RiskSourceClient riskSource = new RiskSourceClient() {
            @Override
            public Mono<List<UserRiskSnapshot>> fetchRiskBatch(int limit) {
                return pendingFetch.asMono();
            }

            @Override
            public Mono<UserRiskSnapshot> fetchRisk(String userId) {
                return Mono.empty();
            }
        };

        store = new SentinelConfigurationStore(new SentinelConfiguration(false, true, RiskThresholds.DEFAULTS,
            60, 100, 10, 24, 12, SentinelStats.fresh(LocalDate.of(2026, 3, 10))), clock);
        sentinelLoop = new SentinelLoop(store, riskSource, ledger, events, new RecordingNotifier(), clock);
        OptimizerLoop optimizerLoop = new OptimizerLoop(ledger, riskSource, events, new OptimizerProperties(), clock);
        InterventionQueryService queryService = new InterventionQueryService(ledger, events, clock);

        client = WebTestClient
            .bindToController(
                new SentinelController(store, sentinelLoop, queryService, events),
                new OptimizerController(optimizerLoop, queryService),
                new InterventionController(queryService))
            .controllerAdvice(new ApiExceptionHandler())
            .build();
    }

    @Nested
    @DisplayName("/api/v1/sentinel")
    class Sentinel {

        @Test
        @DisplayName("status returns the configuration snapshot with stats")
        void status() {
            client.get().uri("/api/v1/sentinel/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.enabled").isEqualTo(false)
                .jsonPath("$.dryRun").isEqualTo(true)
                .jsonPath("$.thresholds.support").isEqualTo(0.90)
                .jsonPath("$.stats.actionsToday").isEqualTo(0);
        }

        @Test
        @DisplayName("config update merges thresholds, ignores unknown keys and broadcasts")
        void updateConfig() {
            client.post().uri("/api/v1/sentinel/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"enabled\": true, \"thresholds\": {\"offer\": 0.97}, \"colour\": \"blue\"}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.enabled").isEqualTo(true)
                .jsonPath("$.thresholds.nudge").isEqualTo(0.85)
                .jsonPath("$.thresholds.offer").isEqualTo(0.97);

            assertTrue(store.get().enabled());
            assertEquals(1, events.ofType(ConfigurationChangedEvent.class).size());
        }

        @Test
        @DisplayName("invalid thresholds answer 400 and leave the configuration untouched")
        void invalidConfig() {
            client.post().uri("/api/v1/sentinel/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"enabled\": true, \"thresholds\": {\"nudge\": 0.99}}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("invalid_configuration");

            assertFalse(store.get().enabled());
            assertTrue(events.events().isEmpty());
        }

        @Test
        @DisplayName("manual run of a disabled Sentinel returns a no-op report")
        void runDisabled() {
            client.post().uri("/api/v1/sentinel/run")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.executed").isEqualTo(false);
        }

        @Test
        @DisplayName("manual run while a cycle is in flight answers 409")
        void runWhileBusy() {
            store.update(new SentinelConfigUpdate(true, null, null, null));
            Disposable inFlight = sentinelLoop.runSentinelCycle().subscribe();
            try {
                client.post().uri("/api/v1/sentinel/run")
                    .exchange()
                    .expectStatus().isEqualTo(409)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("cycle_in_progress");
            } finally {
                pendingFetch.tryEmitValue(List.of());
                inFlight.dispose();
            }
            assertFalse(sentinelLoop.isCycleRunning());
        }

        @Test
        @DisplayName("history lists sentinel records only")
        void history() {
            ledger.seed(InterventionRecord.completed("u-1", InterventionAction.OFFER, InterventionSource.SENTINEL,
                NOW, 0.96, null));
            ledger.seed(InterventionRecord.completed("u-2", InterventionAction.NUDGE, InterventionSource.MANUAL,
                NOW, null, null));

            client.get().uri("/api/v1/sentinel/history?limit=20")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].userId").isEqualTo("u-1")
                .jsonPath("$[1]").doesNotExist()
                .jsonPath("$[0].actionType").isEqualTo("offer")
                .jsonPath("$[0].source").isEqualTo("sentinel");
        }

        @Test
        void health() {
            client.get().uri("/api/v1/sentinel/health")
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class).isEqualTo("OK");
        }
    }

    @Nested
    @DisplayName("/api/v1/interventions")
    class Interventions {

        @Test
        @DisplayName("a manual intervention is recorded with 201")
        void record() {
            client.post().uri("/api/v1/interventions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\": \"u-7\", \"actionType\": \"nudge\", \"metadata\": {\"channel\": \"phone\"}}")
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isNotEmpty()
                .jsonPath("$.source").isEqualTo("manual")
                .jsonPath("$.outcome").isEqualTo("pending");

            assertEquals(1, ledger.all().size());
        }

        @Test
        @DisplayName("an unknown action type answers 400")
        void invalidAction() {
            client.post().uri("/api/v1/interventions")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"userId\": \"u-7\", \"actionType\": \"refund\"}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request");

            assertTrue(ledger.all().isEmpty());
        }

        @Test
        @DisplayName("recent lists records newest first")
        void recent() {
            ledger.seed(InterventionRecord.completed("old", InterventionAction.NUDGE, InterventionSource.MANUAL,
                NOW.minusSeconds(60), null, null));
            ledger.seed(InterventionRecord.completed("new", InterventionAction.NUDGE, InterventionSource.API,
                NOW, null, null));

            client.get().uri("/api/v1/interventions?limit=100")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].userId").isEqualTo("new")
                .jsonPath("$[1].userId").isEqualTo("old");
        }
    }

    @Nested
    @DisplayName("/api/v1/optimizer")
    class Optimizer {

        @Test
        @DisplayName("efficacy reports success rate per action type")
        void efficacy() {
            ledger.seed(new InterventionRecord(null, "u-1", InterventionAction.SUPPORT, InterventionSource.SENTINEL,
                InterventionStatus.COMPLETED, NOW, NOW, 0.9, InterventionOutcome.SUCCESS, -0.3, 0.6, NOW, null));
            ledger.seed(new InterventionRecord(null, "u-2", InterventionAction.SUPPORT, InterventionSource.SENTINEL,
                InterventionStatus.COMPLETED, NOW, NOW, 0.9, InterventionOutcome.FAILURE, 0.05, 0.95, NOW, null));
            ledger.seed(InterventionRecord.completed("u-3", InterventionAction.SUPPORT, InterventionSource.SENTINEL,
                NOW, 0.9, null));

            client.get().uri("/api/v1/optimizer/efficacy")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].action").isEqualTo("support")
                .jsonPath("$[0].total").isEqualTo(2)
                .jsonPath("$[0].successRate").isEqualTo(50);
        }

        @Test
        @DisplayName("manual run with nothing in the window reports zero processed")
        void run() {
            client.post().uri("/api/v1/optimizer/run")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.aborted").isEqualTo(false)
                .jsonPath("$.processed").isEqualTo(0);
        }
    }
}
