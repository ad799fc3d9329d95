package com.churnguard.intervention.client;

import com.churnguard.common.model.UserRiskSnapshot;
import com.churnguard.intervention.client.dto.RiskBatchResponse;
import com.churnguard.intervention.client.dto.UserRiskPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * {@link RiskSourceClient} backed by the scoring service's HTTP API:
 * <pre>
 *   GET /users/risk?limit=N        -> {"users": [...]}, highest risk first
 *   GET /users/{userId}/risk       -> single user, 404 when unknown
 * </pre>
 * Errors other than 404 are propagated; retry policy belongs to the caller's next tick.
 */
@Component
public class ScoringServiceRiskClient implements RiskSourceClient {

    private static final Logger log = LoggerFactory.getLogger(ScoringServiceRiskClient.class);

    private final WebClient riskModelWebClient;

    public ScoringServiceRiskClient(WebClient riskModelWebClient) {
        this.riskModelWebClient = riskModelWebClient;
    }

    @Override
    public Mono<List<UserRiskSnapshot>> fetchRiskBatch(int limit) {
        return riskModelWebClient.get()
            .uri(uri -> uri.path("/users/risk").queryParam("limit", limit).build())
            .retrieve()
            .bodyToMono(RiskBatchResponse.class)
            .map(response -> response.users() == null
                ? List.<UserRiskSnapshot>of()
                : response.users().stream().map(UserRiskPayload::toSnapshot).toList())
            .doOnSuccess(users -> log.debug("Risk batch fetched. limit={} users={}",
                                            limit, users == null ? 0 : users.size()))
            .doOnError(e -> log.warn("Risk batch fetch failed. limit={} error={}", limit, e.getMessage()));
    }

    @Override
    public Mono<UserRiskSnapshot> fetchRisk(String userId) {
        return riskModelWebClient.get()
            .uri("/users/{userId}/risk", userId)
            .retrieve()
            .bodyToMono(UserRiskPayload.class)
            .map(UserRiskPayload::toSnapshot)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> {
                log.debug("User not known to scoring service. userId={}", userId);
                return Mono.empty();
            });
    }
}
