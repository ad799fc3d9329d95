package com.churnguard.intervention.client;

import com.churnguard.common.model.UserRiskSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class ScoringServiceRiskClientTest {

    private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();

    private ScoringServiceRiskClient clientReturning(HttpStatus status, String json) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://scoring.local")
            .exchangeFunction(request -> {
                lastRequest.set(request);
                ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
                return Mono.just(json == null ? response.build() : response.body(json).build());
            })
            .build();
        return new ScoringServiceRiskClient(webClient);
    }

    @Test
    @DisplayName("batch fetch maps the snake_case payload and passes the limit")
    void fetchBatch() {
        String json = """
            {
              "users": [
                {"user_id": "u-1", "churn_probability": 0.93, "is_churned": false, "risk_level": "high"},
                {"user_id": "u-2", "churn_probability": 0.41, "is_churned": true}
              ],
              "total_count": 2,
              "high_risk_count": 1
            }
            """;
        ScoringServiceRiskClient client = clientReturning(HttpStatus.OK, json);

        StepVerifier.create(client.fetchRiskBatch(100))
            .assertNext(users -> {
                assertEquals(2, users.size());
                assertEquals(new UserRiskSnapshot("u-1", 0.93, false), users.get(0));
                assertTrue(users.get(1).isChurned());
            })
            .verifyComplete();

        assertEquals("/users/risk", lastRequest.get().url().getPath());
        assertEquals("limit=100", lastRequest.get().url().getQuery());
    }

    @Test
    @DisplayName("empty payload yields an empty batch")
    void emptyBatch() {
        ScoringServiceRiskClient client = clientReturning(HttpStatus.OK, "{\"users\": []}");

        StepVerifier.create(client.fetchRiskBatch(10))
            .assertNext(users -> assertTrue(users.isEmpty()))
            .verifyComplete();
    }

    @Test
    @DisplayName("server error propagates so the cycle can flag the fetch as failed")
    void batchServerError() {
        ScoringServiceRiskClient client = clientReturning(HttpStatus.SERVICE_UNAVAILABLE, null);

        StepVerifier.create(client.fetchRiskBatch(10))
            .expectError(WebClientResponseException.class)
            .verify();
    }

    @Test
    @DisplayName("single user lookup hits /users/{id}/risk")
    void fetchSingle() {
        ScoringServiceRiskClient client = clientReturning(HttpStatus.OK,
            "{\"user_id\": \"u-9\", \"churn_probability\": 0.55, \"is_churned\": false}");

        StepVerifier.create(client.fetchRisk("u-9"))
            .assertNext(user -> assertEquals(0.55, user.churnProbability(), 1e-9))
            .verifyComplete();

        assertEquals("/users/u-9/risk", lastRequest.get().url().getPath());
    }

    @Test
    @DisplayName("unknown user completes empty instead of failing")
    void unknownUserIsEmpty() {
        ScoringServiceRiskClient client = clientReturning(HttpStatus.NOT_FOUND, null);

        StepVerifier.create(client.fetchRisk("ghost")).verifyComplete();
    }
}
