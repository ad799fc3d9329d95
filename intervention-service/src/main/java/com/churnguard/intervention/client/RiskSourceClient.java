package com.churnguard.intervention.client;

import com.churnguard.common.model.UserRiskSnapshot;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Read-only view of the churn scoring service.
 */
public interface RiskSourceClient {

    /**
     * @param limit maximum number of users to return
     * @return up to {@code limit} users; errors when the scoring service is unavailable
     */
    Mono<List<UserRiskSnapshot>> fetchRiskBatch(int limit);

    /**
     * @return the user's current risk, or empty when the scoring service does not know the user
     */
    Mono<UserRiskSnapshot> fetchRisk(String userId);
}
