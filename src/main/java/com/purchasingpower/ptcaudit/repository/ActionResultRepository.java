package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.model.run.ActionResultEntity;
import com.purchasingpower.ptcaudit.model.run.ActionResultId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for versioned agent results (runs).
 */
@Repository
public interface ActionResultRepository extends JpaRepository<ActionResultEntity, ActionResultId> {

    /**
     * Latest version of a result id
     */
    Optional<ActionResultEntity> findFirstByResultIdOrderByVersionDesc(String resultId);

    /**
     * Most recent run on a canvas
     */
    Optional<ActionResultEntity> findFirstByTargetIdOrderByCreatedAtDesc(String targetId);

    /**
     * Most recent run on a canvas with exactly this title
     */
    Optional<ActionResultEntity> findFirstByTargetIdAndTitleOrderByCreatedAtDesc(String targetId, String title);
}
