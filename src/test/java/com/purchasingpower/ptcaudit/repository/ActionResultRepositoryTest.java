package com.purchasingpower.ptcaudit.repository;

import com.purchasingpower.ptcaudit.model.run.ActionResultEntity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Run lookups against an in-memory H2 database in PostgreSQL mode.
 */
@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("Action Result Repository Tests")
class ActionResultRepositoryTest {

    private static final LocalDateTime T0 = LocalDateTime.of(2025, 3, 1, 10, 0);

    @Autowired
    private ActionResultRepository repository;

    @BeforeEach
    void setUp() {
        repository.save(run("ar-1", 0, "c-1", "Daily digest", T0));
        repository.save(run("ar-1", 1, "c-1", "Daily digest", T0.plusMinutes(5)));
        repository.save(run("ar-2", 0, "c-1", "Weekly digest", T0.plusMinutes(10)));
        repository.save(run("ar-3", 0, "c-2", "Daily digest", T0.plusMinutes(20)));
    }

    @Test
    @DisplayName("Latest version of a result id")
    void findLatestVersion() {
        Optional<ActionResultEntity> found = repository.findFirstByResultIdOrderByVersionDesc("ar-1");

        assertThat(found).hasValueSatisfying(r -> assertThat(r.getVersion()).isEqualTo(1));
    }

    @Test
    @DisplayName("Latest run on a canvas")
    void findLatestOnCanvas() {
        Optional<ActionResultEntity> found = repository.findFirstByTargetIdOrderByCreatedAtDesc("c-1");

        assertThat(found).hasValueSatisfying(r -> assertThat(r.getResultId()).isEqualTo("ar-2"));
    }

    @Test
    @DisplayName("Latest run on a canvas with an exact title")
    void findLatestOnCanvasByTitle() {
        Optional<ActionResultEntity> found =
                repository.findFirstByTargetIdAndTitleOrderByCreatedAtDesc("c-1", "Daily digest");

        assertThat(found).hasValueSatisfying(r -> {
            assertThat(r.getResultId()).isEqualTo("ar-1");
            assertThat(r.getVersion()).isEqualTo(1);
        });
        assertThat(repository.findFirstByTargetIdAndTitleOrderByCreatedAtDesc("c-1", "Daily")).isEmpty();
    }

    private static ActionResultEntity run(String resultId, int version, String canvasId, String title,
                                          LocalDateTime createdAt) {
        return ActionResultEntity.builder()
                .resultId(resultId)
                .version(version)
                .type("skill")
                .status("finish")
                .targetId(canvasId)
                .title(title)
                .uid("u-1")
                .createdAt(createdAt)
                .build();
    }
}
