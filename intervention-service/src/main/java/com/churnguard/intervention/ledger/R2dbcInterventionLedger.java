package com.churnguard.intervention.ledger;

import com.churnguard.common.exception.InterventionEngineException;
import com.churnguard.common.model.InterventionAction;
import com.churnguard.common.model.InterventionOutcome;
import com.churnguard.common.model.InterventionRecord;
import com.churnguard.common.model.InterventionSource;
import com.churnguard.common.model.InterventionStatus;
import com.churnguard.intervention.model.InterventionEntity;
import com.churnguard.intervention.repository.InterventionRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;

/**
 * {@link InterventionLedger} over the {@code interventions} table via Spring Data R2DBC.
 * Instants are stored as UTC {@link LocalDateTime}; metadata as a JSON string.
 */
@Component
public class R2dbcInterventionLedger implements InterventionLedger {

    private static final Logger log = LoggerFactory.getLogger(R2dbcInterventionLedger.class);

    private static final TypeReference<Map<String, Object>> METADATA_TYPE = new TypeReference<>() {};

    private final InterventionRepository repository;
    private final ObjectMapper objectMapper;

    public R2dbcInterventionLedger(InterventionRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<InterventionRecord> insert(InterventionRecord record) {
        return Mono.fromCallable(() -> toEntity(record))
            .flatMap(repository::save)
            .map(this::toRecord)
            .doOnSuccess(saved -> log.debug("Intervention persisted. id={} userId={} action={} source={}",
                                            saved.id(), saved.userId(), saved.actionType(), saved.source()));
    }

    @Override
    public Flux<InterventionRecord> queryByUser(String userId, Instant since, InterventionSource sourceFilter) {
        LocalDateTime from = toDb(since);
        Flux<InterventionEntity> rows = sourceFilter == null
            ? repository.findByUserIdAndCreatedAtGreaterThanEqual(userId, from)
            : repository.findByUserIdAndSourceAndCreatedAtGreaterThanEqual(userId, sourceFilter.dbValue(), from);
        return rows.map(this::toRecord);
    }

    @Override
    public Flux<InterventionRecord> queryPendingInWindow(Instant start, Instant end, int limit) {
        return repository.findPendingInWindow(toDb(start), toDb(end), limit)
            .map(this::toRecord);
    }

    @Override
    public Mono<Boolean> updateOutcome(Long id, OutcomeAttribution attribution) {
        return repository.attributeOutcome(id,
                attribution.outcome().dbValue(),
                attribution.riskDelta(),
                attribution.currentRisk(),
                toDb(attribution.attributedAt()))
            .map(updated -> updated > 0)
            .doOnNext(updated -> {
                if (!updated) {
                    log.info("Attribution skipped, row no longer pending. id={}", id);
                }
            });
    }

    @Override
    public Flux<InterventionRecord> recent(int limit) {
        return repository.findRecent(limit).map(this::toRecord);
    }

    @Override
    public Flux<InterventionRecord> recentBySource(InterventionSource source, int limit) {
        return repository.findRecentBySource(source.dbValue(), limit).map(this::toRecord);
    }

    @Override
    public Flux<InterventionRecord> attributed() {
        return repository.findByOutcomeNot(InterventionOutcome.PENDING.dbValue()).map(this::toRecord);
    }

    // ── mapping ───────────────────────────────────────────────────────────────

    private InterventionEntity toEntity(InterventionRecord record) {
        InterventionEntity entity = new InterventionEntity();
        entity.setId(record.id());
        entity.setUserId(record.userId());
        entity.setActionType(record.actionType().dbValue());
        entity.setStatus(record.status().dbValue());
        entity.setSource(record.source().dbValue());
        entity.setCreatedAt(toDb(record.createdAt()));
        entity.setCompletedAt(toDb(record.completedAt()));
        entity.setRiskAtIntervention(record.riskAtIntervention());
        entity.setOutcome(record.outcome().dbValue());
        entity.setRiskDelta(record.riskDelta());
        entity.setCurrentRisk(record.currentRisk());
        entity.setAttributedAt(toDb(record.attributedAt()));
        try {
            entity.setMetadata(record.metadata().isEmpty()
                ? null : objectMapper.writeValueAsString(record.metadata()));
        } catch (Exception e) {
            throw new InterventionEngineException("ledger",
                "failed to serialize metadata for userId=" + record.userId(), e);
        }
        return entity;
    }

    private InterventionRecord toRecord(InterventionEntity entity) {
        return new InterventionRecord(
            entity.getId(),
            entity.getUserId(),
            InterventionAction.fromValue(entity.getActionType()),
            InterventionSource.fromValue(entity.getSource()),
            InterventionStatus.fromValue(entity.getStatus()),
            fromDb(entity.getCreatedAt()),
            fromDb(entity.getCompletedAt()),
            entity.getRiskAtIntervention(),
            InterventionOutcome.fromValue(entity.getOutcome()),
            entity.getRiskDelta(),
            entity.getCurrentRisk(),
            fromDb(entity.getAttributedAt()),
            readMetadata(entity));
    }

    private Map<String, Object> readMetadata(InterventionEntity entity) {
        if (entity.getMetadata() == null || entity.getMetadata().isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(entity.getMetadata(), METADATA_TYPE);
        } catch (Exception e) {
            log.warn("Unreadable intervention metadata, returning empty. id={}", entity.getId(), e);
            return Map.of();
        }
    }

    private static LocalDateTime toDb(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static Instant fromDb(LocalDateTime value) {
        return value == null ? null : value.toInstant(ZoneOffset.UTC);
    }
}
