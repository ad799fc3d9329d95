package com.churnguard.intervention.repository;

import com.churnguard.intervention.model.InterventionEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface InterventionRepository extends ReactiveCrudRepository<InterventionEntity, Long> {

    Flux<InterventionEntity> findByUserIdAndCreatedAtGreaterThanEqual(String userId, LocalDateTime since);

    Flux<InterventionEntity> findByUserIdAndSourceAndCreatedAtGreaterThanEqual(String userId,
                                                                               String source,
                                                                               LocalDateTime since);

    /**
     * Unattributed interventions created inside {@code [start, end]}, oldest first.
     */
    @Query("""
        SELECT * FROM interventions
        WHERE outcome = 'pending'
          AND attributed_at IS NULL
          AND created_at >= :start
          AND created_at <= :end
        ORDER BY created_at ASC
        LIMIT :limit
        """)
    Flux<InterventionEntity> findPendingInWindow(LocalDateTime start, LocalDateTime end, int limit);

    /**
     * Writes the attribution fields in one statement, only if the row is still pending.
     * Returns the number of rows updated: {@code 0} means another run got there first.
     */
    @Modifying
    @Query("""
        UPDATE interventions
        SET outcome = :outcome,
            risk_delta = :riskDelta,
            current_risk = :currentRisk,
            attributed_at = :attributedAt
        WHERE id = :id
          AND outcome = 'pending'
          AND attributed_at IS NULL
        """)
    Mono<Integer> attributeOutcome(Long id, String outcome, Double riskDelta, Double currentRisk,
                                   LocalDateTime attributedAt);

    @Query("""
        SELECT * FROM interventions
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<InterventionEntity> findRecent(int limit);

    @Query("""
        SELECT * FROM interventions
        WHERE source = :source
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<InterventionEntity> findRecentBySource(String source, int limit);

    Flux<InterventionEntity> findByOutcomeNot(String outcome);
}
