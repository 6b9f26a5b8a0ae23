package com.purchasingpower.ptcaudit.model.run;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * JPA Entity for one versioned agent result (a run).
 * Maps to the action_results table; the schema comes from
 * {@code hibernate.default_schema}.
 *
 * <p>Read-only: the optional {@code ptc_enabled} column is not mapped because
 * older databases do not have it. It is probed through JDBC instead.
 */
@Entity
@Table(name = "action_results")
@IdClass(ActionResultId.class)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionResultEntity {

    @Id
    @Column(name = "result_id", nullable = false, length = 100)
    private String resultId;

    @Id
    @Column(name = "version", nullable = false)
    private Integer version;

    @Column(name = "type", length = 50)
    private String type;

    @Column(name = "model_name", length = 200)
    private String modelName;

    @Column(name = "status", length = 50)
    private String status;

    @Column(name = "title", length = 4000)
    private String title;

    @Column(name = "input", length = 8000)
    private String input;

    /**
     * Canvas the result belongs to (c-...).
     */
    @Column(name = "target_id", length = 100)
    private String targetId;

    /**
     * Owner of the run.
     */
    @Column(name = "uid", length = 100)
    private String uid;

    @Column(name = "created_at")
    private LocalDateTime createdAt;
}
