package com.purchasingpower.ptcaudit.service;

import com.purchasingpower.ptcaudit.exception.InvalidRunIdentifierException;
import com.purchasingpower.ptcaudit.exception.RunNotFoundException;
import com.purchasingpower.ptcaudit.model.run.ActionResultEntity;
import com.purchasingpower.ptcaudit.repository.ActionResultRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Maps a user-supplied identifier to one run.
 *
 * <ul>
 *   <li>{@code c-...} with title: latest run on the canvas with exactly that title</li>
 *   <li>{@code c-...}: latest run on the canvas</li>
 *   <li>{@code ar-...} / {@code sk-...}: latest version of the result</li>
 * </ul>
 * The title is ignored for result ids.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunResolver {

    static final String CANVAS_PREFIX = "c-";
    static final String ACTION_RESULT_PREFIX = "ar-";
    static final String SKILL_RESULT_PREFIX = "sk-";

    private final ActionResultRepository actionResultRepository;

    /**
     * @throws InvalidRunIdentifierException unknown prefix
     * @throws RunNotFoundException          nothing matched
     */
    public ActionResultEntity resolve(String identifier, String title) {
        if (identifier == null) {
            throw new InvalidRunIdentifierException(null);
        }
        boolean canvas = identifier.startsWith(CANVAS_PREFIX);
        boolean result = identifier.startsWith(ACTION_RESULT_PREFIX) || identifier.startsWith(SKILL_RESULT_PREFIX);
        if (!canvas && !result) {
            throw new InvalidRunIdentifierException(identifier);
        }

        String effectiveTitle = canvas && title != null && !title.isEmpty() ? title : null;
        Optional<ActionResultEntity> found;
        if (canvas && effectiveTitle != null) {
            found = actionResultRepository.findFirstByTargetIdAndTitleOrderByCreatedAtDesc(identifier, effectiveTitle);
        } else if (canvas) {
            found = actionResultRepository.findFirstByTargetIdOrderByCreatedAtDesc(identifier);
        } else {
            found = actionResultRepository.findFirstByResultIdOrderByVersionDesc(identifier);
        }

        ActionResultEntity run = found.orElseThrow(() -> new RunNotFoundException(identifier, effectiveTitle));
        log.info("Resolved {} to {} v{}", identifier, run.getResultId(), run.getVersion());
        return run;
    }
}
