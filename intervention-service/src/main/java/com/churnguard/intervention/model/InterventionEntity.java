package com.churnguard.intervention.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Row of the {@code interventions} table.
 *
 * Column mapping (R2DBC snake_case convention):
 *   userId             → user_id
 *   actionType         → action_type
 *   riskAtIntervention → risk_at_intervention
 *   riskDelta          → risk_delta
 *   currentRisk        → current_risk
 *   attributedAt       → attributed_at
 *
 * Timestamps are stored as UTC wall-clock values.
 * metadata: JSON-serialised Map<String, Object>
 */
@Data
@NoArgsConstructor
@Table("interventions")
public class InterventionEntity {

    @Id
    private Long id;

    private String userId;

    /** nudge | support | offer */
    private String actionType;

    /** pending | completed | failed */
    private String status;

    /** manual | sentinel | api */
    private String source;

    /** JSON-serialised {@code Map<String, Object>} */
    private String metadata;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;

    private Double riskAtIntervention;

    // ── attribution (written once, together, by the optimizer) ──

    /** pending | success | failure */
    private String outcome;

    private Double riskDelta;

    private Double currentRisk;

    private LocalDateTime attributedAt;
}
